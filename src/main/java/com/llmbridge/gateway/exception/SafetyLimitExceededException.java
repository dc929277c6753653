package com.llmbridge.gateway.exception;

/**
 * 推理文本长度或内容块数量超过上限
 */
public class SafetyLimitExceededException extends GatewayException {

    public SafetyLimitExceededException(String message) {
        super(message, 500);
    }
}
