package com.llmbridge.gateway.dto.canonical;

/**
 * 规范化流式事件
 * <p>
 * index 为所属内容块序号；块序号严格递增，BlockStart 先于所有 delta，delta 先于唯一的 BlockStop，
 * MessageFinish 恰好一次且位于最后
 */
public sealed interface StreamEvent {

    /**
     * toolCallId / toolName 仅工具块有值
     */
    record BlockStart(int index, BlockKind kind, String toolCallId, String toolName) implements StreamEvent {

        public static BlockStart of(int index, BlockKind kind) {
            return new BlockStart(index, kind, null, null);
        }
    }

    record TextDelta(int index, String text) implements StreamEvent {
    }

    record ThinkingDelta(int index, String text) implements StreamEvent {
    }

    record ThinkingSignature(int index, String signature) implements StreamEvent {
    }

    record ToolArgumentDelta(int index, String toolCallId, String fragment) implements StreamEvent {
    }

    record BlockStop(int index) implements StreamEvent {
    }

    /**
     * errorMessage 仅 reason 为 ERROR / SAFETY_LIMIT 时有值
     */
    record MessageFinish(FinishReason reason, Usage usage, String errorMessage) implements StreamEvent {

        public static MessageFinish of(FinishReason reason, Usage usage) {
            return new MessageFinish(reason, usage, null);
        }

        public boolean isError() {
            return reason == FinishReason.ERROR;
        }
    }
}
