package com.llmbridge.gateway.stream;

import com.llmbridge.gateway.dto.canonical.FinishReason;
import com.llmbridge.gateway.dto.canonical.Usage;

/**
 * 后端记录解释后的增量片段，是状态机的输入
 */
public sealed interface UpstreamFragment {

    record Text(String text) implements UpstreamFragment {
    }

    record Reasoning(String text) implements UpstreamFragment {
    }

    /**
     * 工具调用片段；ref 为后端内部引用（序号或块 index），id / name 仅首个片段必带
     */
    record ToolCallDelta(String ref, String id, String name, String arguments) implements UpstreamFragment {
    }

    /**
     * 后端明确声明某个工具调用已结束
     */
    record ToolCallEnd(String ref) implements UpstreamFragment {
    }

    record UsageUpdate(Usage usage) implements UpstreamFragment {
    }

    /**
     * 后端给出的结束原因，不代表流已结束
     */
    record FinishSignal(FinishReason reason) implements UpstreamFragment {
    }

    record EndOfMessage() implements UpstreamFragment {
    }

    record ErrorSignal(String message) implements UpstreamFragment {
    }
}
