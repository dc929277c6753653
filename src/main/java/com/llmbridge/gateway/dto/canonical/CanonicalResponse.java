package com.llmbridge.gateway.dto.canonical;

import java.util.List;

/**
 * 非流式最终响应，由流式事件聚合而来
 */
public record CanonicalResponse(
        String id,
        String model,
        List<ContentPart> content,
        FinishReason finishReason,
        Usage usage
) {

    public CanonicalResponse {
        content = content == null ? List.of() : List.copyOf(content);
        usage = usage == null ? Usage.EMPTY : usage;
    }

    public List<ToolCall> toolCalls() {
        return content.stream()
                .filter(ContentPart.ToolUse.class::isInstance)
                .map(p -> ((ContentPart.ToolUse) p).call())
                .toList();
    }

    public String text() {
        StringBuilder sb = new StringBuilder();
        for (ContentPart part : content) {
            if (part instanceof ContentPart.Text t) {
                sb.append(t.text());
            }
        }
        return sb.toString();
    }

    public String thinking() {
        StringBuilder sb = new StringBuilder();
        for (ContentPart part : content) {
            if (part instanceof ContentPart.Thinking t) {
                sb.append(t.thinking());
            }
        }
        return sb.toString();
    }
}
