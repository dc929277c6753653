package com.llmbridge.gateway.dto.canonical;

/**
 * 消息内容片段
 */
public sealed interface ContentPart {

    record Text(String text) implements ContentPart {
    }

    /**
     * signature 可为 null（来源协议未携带）
     */
    record Thinking(String thinking, String signature) implements ContentPart {
    }

    record ToolUse(ToolCall call) implements ContentPart {
    }

    record ToolResult(String toolCallId, String content, boolean isError) implements ContentPart {
    }
}
