package com.llmbridge.gateway.exception;

import lombok.Getter;

/**
 * 后端返回非 2xx 状态
 */
@Getter
public class BackendApiException extends GatewayException {

    private final String responseBody;

    public BackendApiException(String backend, int statusCode, String responseBody) {
        super("后端 " + backend + " 错误: " + statusCode + " - " + responseBody, statusCode);
        this.responseBody = responseBody;
    }

    public boolean isRateLimit() {
        return getStatusCode() == 429;
    }

    /**
     * 429 与 5xx 可重试，认证错误及其他 4xx 不重试
     */
    public boolean isRetryable() {
        return isRateLimit() || getStatusCode() >= 500;
    }

    @Override
    public String errorType() {
        return switch (getStatusCode()) {
            case 401, 403 -> "authentication_error";
            case 429 -> "rate_limit_error";
            case 529, 503 -> "overloaded_error";
            default -> getStatusCode() < 500 ? "invalid_request_error" : "api_error";
        };
    }
}
