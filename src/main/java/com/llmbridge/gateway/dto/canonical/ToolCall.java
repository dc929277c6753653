package com.llmbridge.gateway.dto.canonical;

/**
 * 工具调用
 * <p>
 * argumentsJsonText 在流式阶段按到达顺序拼接，调用结束后才保证是合法 JSON
 */
public record ToolCall(String id, String name, String argumentsJsonText) {

    public ToolCall {
        if (argumentsJsonText == null || argumentsJsonText.isEmpty()) {
            argumentsJsonText = "{}";
        }
    }
}
