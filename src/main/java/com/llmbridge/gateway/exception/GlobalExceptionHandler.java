package com.llmbridge.gateway.exception;

import com.alibaba.fastjson2.JSONObject;
import com.llmbridge.gateway.config.Protocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;

/**
 * 全局异常处理器
 * <p>
 * 按请求路径判断客户端协议，错误体使用该协议的格式
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<String> handleInvalid(InvalidRequestException e, ServerWebExchange exchange) {
        log.warn("请求无效: {}", e.getMessage());
        return buildErrorResponse(exchange, e.getStatusCode(), e.errorType(), e.getMessage());
    }

    @ExceptionHandler(UnsupportedCapabilityException.class)
    public ResponseEntity<String> handleUnsupported(UnsupportedCapabilityException e, ServerWebExchange exchange) {
        log.warn("能力不支持: {}", e.getMessage());
        return buildErrorResponse(exchange, e.getStatusCode(), e.errorType(), e.getMessage());
    }

    @ExceptionHandler(BackendApiException.class)
    public ResponseEntity<String> handleBackendApi(BackendApiException e, ServerWebExchange exchange) {
        log.error("后端 API 异常: status={}, body={}", e.getStatusCode(), e.getResponseBody());
        return buildErrorResponse(exchange, e.getStatusCode(), e.errorType(), e.getMessage());
    }

    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<String> handleGateway(GatewayException e, ServerWebExchange exchange) {
        log.error("网关异常: {}", e.getMessage(), e);
        return buildErrorResponse(exchange, e.getStatusCode(), e.errorType(), e.getMessage());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<String> handleResponseStatus(ResponseStatusException e, ServerWebExchange exchange) {
        int statusCode = e.getStatusCode().value();
        if (statusCode == 404) {
            log.warn("路由未找到: {}", e.getReason());
            return buildErrorResponse(exchange, statusCode, "not_found_error", e.getReason());
        }
        log.warn("HTTP 状态异常: {} {}", statusCode, e.getReason());
        return buildErrorResponse(exchange, statusCode, statusCode < 500 ? "invalid_request_error" : "api_error", e.getReason());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<String> handleUnexpected(Exception e, ServerWebExchange exchange) {
        log.error("未预期异常: {}", e.getMessage(), e);
        return buildErrorResponse(exchange, 500, "api_error", "服务器内部错误");
    }

    private ResponseEntity<String> buildErrorResponse(ServerWebExchange exchange, int statusCode, String errorType, String message) {
        Protocol protocol = protocolOf(exchange.getRequest().getPath().value());
        return ResponseEntity
                .status(Math.min(Math.max(statusCode, 400), 599))
                .contentType(MediaType.APPLICATION_JSON)
                .body(errorBody(protocol, statusCode, errorType, message).toJSONString());
    }

    /**
     * 由请求路径推断客户端协议，无法判断时用 Anthropic 格式
     */
    static Protocol protocolOf(String path) {
        if (path.startsWith("/v1beta/")) {
            return Protocol.GEMINI;
        }
        if (path.startsWith("/v1/chat/") || path.equals("/v1/models")) {
            return Protocol.OPENAI;
        }
        return Protocol.ANTHROPIC;
    }

    public static JSONObject errorBody(Protocol protocol, int statusCode, String errorType, String message) {
        String msg = message != null ? message : "";
        return switch (protocol) {
            case OPENAI -> JSONObject.of("error", JSONObject.of( //
                    "message", msg, //
                    "type", errorType, //
                    "code", statusCode //
            ));
            case GEMINI -> JSONObject.of("error", JSONObject.of( //
                    "code", statusCode, //
                    "message", msg, //
                    "status", googleStatus(statusCode) //
            ));
            case ANTHROPIC -> JSONObject.of(
                    "type", "error", //
                    "error", JSONObject.of( //
                            "type", errorType, //
                            "message", msg //
                    ) //
            );
        };
    }

    private static String googleStatus(int statusCode) {
        return switch (statusCode) {
            case 400 -> "INVALID_ARGUMENT";
            case 401 -> "UNAUTHENTICATED";
            case 403 -> "PERMISSION_DENIED";
            case 404 -> "NOT_FOUND";
            case 429 -> "RESOURCE_EXHAUSTED";
            case 503 -> "UNAVAILABLE";
            default -> statusCode < 500 ? "FAILED_PRECONDITION" : "INTERNAL";
        };
    }
}
