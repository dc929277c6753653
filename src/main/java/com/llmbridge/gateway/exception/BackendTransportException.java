package com.llmbridge.gateway.exception;

/**
 * 后端连接层错误
 */
public class BackendTransportException extends GatewayException {

    public BackendTransportException(String message) {
        super(message, 502);
    }

    public BackendTransportException(String message, Throwable cause) {
        super(message, 502, cause);
    }
}
