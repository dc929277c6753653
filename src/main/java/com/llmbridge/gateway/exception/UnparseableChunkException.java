package com.llmbridge.gateway.exception;

/**
 * 单条后端记录无法解析，跳过该记录继续
 */
public class UnparseableChunkException extends GatewayException {

    public UnparseableChunkException(String message) {
        super(message, 502);
    }

    public UnparseableChunkException(String message, Throwable cause) {
        super(message, 502, cause);
    }
}
