package com.llmbridge.gateway.encoder;

import com.llmbridge.gateway.dto.canonical.BlockKind;
import com.llmbridge.gateway.dto.canonical.CanonicalResponse;
import com.llmbridge.gateway.dto.canonical.ContentPart;
import com.llmbridge.gateway.dto.canonical.FinishReason;
import com.llmbridge.gateway.dto.canonical.StreamEvent;
import com.llmbridge.gateway.dto.canonical.ToolCall;
import com.llmbridge.gateway.dto.canonical.Usage;

import java.util.ArrayList;
import java.util.List;

/**
 * 非流式请求：把规范化事件累积成一个完整响应
 */
public class ResponseAggregator {

    private final List<ContentPart> content = new ArrayList<>();
    private Block current;
    private StreamEvent.MessageFinish finish;

    public void accept(StreamEvent event) {
        if (event instanceof StreamEvent.BlockStart start) {
            current = new Block(start.kind(), start.toolCallId(), start.toolName());
        } else if (event instanceof StreamEvent.TextDelta d && current != null) {
            current.text.append(d.text());
        } else if (event instanceof StreamEvent.ThinkingDelta d && current != null) {
            current.text.append(d.text());
        } else if (event instanceof StreamEvent.ThinkingSignature sig && current != null) {
            current.signature = sig.signature();
        } else if (event instanceof StreamEvent.ToolArgumentDelta d && current != null) {
            current.text.append(d.fragment());
        } else if (event instanceof StreamEvent.BlockStop && current != null) {
            content.add(current.toPart());
            current = null;
        } else if (event instanceof StreamEvent.MessageFinish f) {
            finish = f;
        }
    }

    public boolean isFinished() {
        return finish != null;
    }

    /**
     * 结束事件，会话未结束时为 null
     */
    public StreamEvent.MessageFinish finish() {
        return finish;
    }

    public CanonicalResponse toResponse(String id, String model) {
        FinishReason reason = finish != null ? finish.reason() : FinishReason.STOP;
        Usage usage = finish != null ? finish.usage() : Usage.EMPTY;
        return new CanonicalResponse(id, model, content, reason, usage);
    }

    private static final class Block {
        private final BlockKind kind;
        private final String toolCallId;
        private final String toolName;
        private final StringBuilder text = new StringBuilder();
        private String signature;

        Block(BlockKind kind, String toolCallId, String toolName) {
            this.kind = kind;
            this.toolCallId = toolCallId;
            this.toolName = toolName;
        }

        ContentPart toPart() {
            return switch (kind) {
                case TEXT -> new ContentPart.Text(text.toString());
                case THINKING -> new ContentPart.Thinking(text.toString(), signature);
                case TOOL_USE -> new ContentPart.ToolUse(new ToolCall(toolCallId, toolName, text.toString()));
            };
        }
    }
}
