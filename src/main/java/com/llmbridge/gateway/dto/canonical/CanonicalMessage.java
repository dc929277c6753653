package com.llmbridge.gateway.dto.canonical;

import java.util.List;

/**
 * 规范化消息
 * <p>
 * content 保持作者原始顺序；工具调用以 {@link ContentPart.ToolUse} 形式内嵌，
 * {@link #toolCalls()} 按顺序取出
 */
public record CanonicalMessage(Role role, List<ContentPart> content, String toolCallId) {

    public CanonicalMessage {
        content = content == null ? List.of() : List.copyOf(content);
    }

    public static CanonicalMessage of(Role role, List<ContentPart> content) {
        return new CanonicalMessage(role, content, null);
    }

    public static CanonicalMessage text(Role role, String text) {
        return new CanonicalMessage(role, List.of(new ContentPart.Text(text)), null);
    }

    public List<ToolCall> toolCalls() {
        return content.stream()
                .filter(ContentPart.ToolUse.class::isInstance)
                .map(p -> ((ContentPart.ToolUse) p).call())
                .toList();
    }

    /**
     * 拼接全部文本片段
     */
    public String textContent() {
        StringBuilder sb = new StringBuilder();
        for (ContentPart part : content) {
            if (part instanceof ContentPart.Text t) {
                sb.append(t.text());
            }
        }
        return sb.toString();
    }
}
