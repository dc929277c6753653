package com.llmbridge.gateway.dto.canonical;

/**
 * 会话结束原因
 */
public enum FinishReason {
    STOP("stop"),
    LENGTH("length"),
    TOOL_USE("tool_use"),
    CONTENT_FILTER("content_filter"),
    /** 推理长度或块数超过上限 */
    SAFETY_LIMIT("safety_limit"),
    ERROR("error");

    private final String value;

    FinishReason(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
