package com.llmbridge.gateway.exception;

/**
 * 客户端请求格式错误，在联系后端之前拒绝
 */
public class InvalidRequestException extends GatewayException {

    public InvalidRequestException(String message) {
        super(message, 400);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(message, 400, cause);
    }

    @Override
    public String errorType() {
        return "invalid_request_error";
    }
}
