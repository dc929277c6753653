package com.llmbridge.gateway.stream;

import com.llmbridge.gateway.dto.canonical.BlockKind;
import com.llmbridge.gateway.dto.canonical.FinishReason;
import com.llmbridge.gateway.dto.canonical.Usage;
import com.llmbridge.gateway.exception.SafetyLimitExceededException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 单次请求的流式会话状态
 * <p>
 * 由一个 {@link StreamReconciler} 独占，随后端流创建、随流结束或客户端断开销毁，不跨请求共享
 */
public class StreamSession {

    public enum State {
        IDLE,
        ACTIVE,
        DONE
    }

    /**
     * 当前打开的内容块；toolRef 仅工具块有值
     */
    public record OpenBlock(int index, BlockKind kind, String toolRef) {
    }

    private final String sessionId;
    private final int maxThinkingChars;
    private final int maxBlocks;

    private State state = State.IDLE;
    private int nextBlockIndex;
    private OpenBlock openBlock;
    private final StringBuilder thinkingAccumulator = new StringBuilder();
    private boolean thinkingClosed;
    private final Map<String, ToolCallAccumulator> toolAccumulators = new LinkedHashMap<>();
    private final Deque<ToolCallAccumulator> pendingTools = new ArrayDeque<>();
    private boolean producedAnyContent;
    private boolean producedToolCall;
    private Usage usage = Usage.EMPTY;
    private FinishReason backendReason;

    public StreamSession(String sessionId, int maxThinkingChars, int maxBlocks) {
        this.sessionId = sessionId;
        this.maxThinkingChars = maxThinkingChars;
        this.maxBlocks = maxBlocks;
    }

    public String sessionId() {
        return sessionId;
    }

    public State state() {
        return state;
    }

    public boolean isFinished() {
        return state == State.DONE;
    }

    void activate() {
        if (state == State.IDLE) {
            state = State.ACTIVE;
        }
    }

    void markDone() {
        state = State.DONE;
    }

    /**
     * 分配下一个块序号
     *
     * @param enforceLimit 收尾阶段为 false，保证能合法结束
     */
    int allocateIndex(boolean enforceLimit) {
        if (enforceLimit && nextBlockIndex >= maxBlocks) {
            throw new SafetyLimitExceededException("内容块数量超过上限 " + maxBlocks);
        }
        return nextBlockIndex++;
    }

    OpenBlock openBlock() {
        return openBlock;
    }

    void setOpenBlock(OpenBlock block) {
        this.openBlock = block;
    }

    void appendThinking(String text, boolean enforceLimit) {
        if (enforceLimit && thinkingAccumulator.length() + text.length() > maxThinkingChars) {
            throw new SafetyLimitExceededException("推理内容超过上限 " + maxThinkingChars + " 字符");
        }
        thinkingAccumulator.append(text);
    }

    String thinkingText() {
        return thinkingAccumulator.toString();
    }

    boolean isThinkingClosed() {
        return thinkingClosed;
    }

    void closeThinking() {
        thinkingClosed = true;
    }

    ToolCallAccumulator tool(String ref) {
        return toolAccumulators.get(ref);
    }

    void putTool(ToolCallAccumulator accumulator) {
        toolAccumulators.put(accumulator.ref(), accumulator);
    }

    void enqueue(ToolCallAccumulator accumulator) {
        if (!accumulator.isQueued()) {
            accumulator.setQueued(true);
            pendingTools.addLast(accumulator);
        }
    }

    ToolCallAccumulator pollPending() {
        ToolCallAccumulator next = pendingTools.pollFirst();
        if (next != null) {
            next.setQueued(false);
        }
        return next;
    }

    boolean hasPendingTools() {
        return !pendingTools.isEmpty();
    }

    boolean producedAnyContent() {
        return producedAnyContent;
    }

    void markContent() {
        producedAnyContent = true;
    }

    boolean producedToolCall() {
        return producedToolCall;
    }

    void markToolCall() {
        producedToolCall = true;
        producedAnyContent = true;
    }

    public Usage usage() {
        return usage;
    }

    void mergeUsage(Usage update) {
        usage = usage.merge(update);
    }

    FinishReason backendReason() {
        return backendReason;
    }

    void setBackendReason(FinishReason reason) {
        this.backendReason = reason;
    }
}
