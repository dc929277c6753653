package com.llmbridge.gateway.stream;

import com.llmbridge.gateway.dto.canonical.BlockKind;
import com.llmbridge.gateway.dto.canonical.FinishReason;
import com.llmbridge.gateway.dto.canonical.StreamEvent;
import com.llmbridge.gateway.exception.SafetyLimitExceededException;
import com.llmbridge.gateway.exception.UnparseableChunkException;
import com.llmbridge.gateway.util.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.UUID;

/**
 * 流式状态机
 * <p>
 * 消费后端原生记录，维护 {@link StreamSession}，输出顺序合法的规范化事件：
 * <ul>
 *   <li>块序号只增不减，同一时刻最多一个块处于打开状态</li>
 *   <li>推理块必须在正文和工具块之前全部结束，之后到达的推理片段并入当前正文</li>
 *   <li>交错到达的多个工具调用各自累积，当前调用参数完整后才开始下一个</li>
 *   <li>没有任何内容时补一个空文本块；MessageFinish 恰好一次且位于最后</li>
 * </ul>
 */
public class StreamReconciler {

    private static final Logger log = LoggerFactory.getLogger(StreamReconciler.class);

    private final StreamSession session;
    private final StreamInterpreter interpreter;
    private final ThinkingTagParser tagParser;

    // 收尾阶段不再检查上限，保证会话能合法结束
    private boolean finalizing;

    /**
     * @param tagParser 后端以内嵌标签输出推理时传入，否则为 null
     */
    public StreamReconciler(StreamSession session, StreamInterpreter interpreter, ThinkingTagParser tagParser) {
        this.session = session;
        this.interpreter = interpreter;
        this.tagParser = tagParser;
    }

    public StreamSession session() {
        return session;
    }

    /**
     * 处理一条后端记录
     */
    public List<StreamEvent> accept(StreamRecord record) {
        if (session.isFinished()) {
            log.debug("[{}] 会话已结束，丢弃记录: {}", session.sessionId(), record.event());
            return List.of();
        }
        List<UpstreamFragment> fragments;
        try {
            fragments = interpreter.interpret(record);
        } catch (UnparseableChunkException e) {
            log.warn("[{}] 跳过无法解析的记录: {}", session.sessionId(), e.getMessage());
            Metrics.instance().recordSkippedRecord();
            return List.of();
        }
        return apply(fragments);
    }

    /**
     * 处理已解释的片段
     */
    public List<StreamEvent> apply(List<UpstreamFragment> fragments) {
        List<StreamEvent> out = new ArrayList<>();
        try {
            for (UpstreamFragment fragment : fragments) {
                if (session.isFinished()) {
                    log.debug("[{}] 会话已结束，丢弃片段: {}", session.sessionId(), fragment);
                    break;
                }
                applyFragment(fragment, out);
            }
        } catch (SafetyLimitExceededException e) {
            log.warn("[{}] {}，提前结束会话", session.sessionId(), e.getMessage());
            Metrics.instance().recordSafetyLimit();
            finish(out, FinishReason.SAFETY_LIMIT, e.getMessage());
        }
        return out;
    }

    /**
     * 后端流正常结束（传输层 EOS）
     */
    public List<StreamEvent> complete() {
        List<StreamEvent> out = new ArrayList<>();
        if (!session.isFinished()) {
            finish(out, resolveBackendReason(), null);
        }
        return out;
    }

    /**
     * 后端连接异常，以错误事件结束会话
     */
    public List<StreamEvent> fail(Throwable error) {
        List<StreamEvent> out = new ArrayList<>();
        if (session.isFinished()) {
            log.debug("[{}] 会话已结束，忽略传输错误: {}", session.sessionId(), error.getMessage());
            return out;
        }
        log.error("[{}] 后端连接中断: {}", session.sessionId(), error.getMessage());
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        finish(out, FinishReason.ERROR, message);
        return out;
    }

    private void applyFragment(UpstreamFragment fragment, List<StreamEvent> out) {
        session.activate();
        if (fragment instanceof UpstreamFragment.Text text) {
            onText(text.text(), out);
        } else if (fragment instanceof UpstreamFragment.Reasoning reasoning) {
            onReasoning(reasoning.text(), out);
        } else if (fragment instanceof UpstreamFragment.ToolCallDelta delta) {
            onToolCall(delta, out);
        } else if (fragment instanceof UpstreamFragment.ToolCallEnd end) {
            onToolCallEnd(end.ref(), out);
        } else if (fragment instanceof UpstreamFragment.UsageUpdate usage) {
            session.mergeUsage(usage.usage());
        } else if (fragment instanceof UpstreamFragment.FinishSignal signal) {
            session.setBackendReason(signal.reason());
        } else if (fragment instanceof UpstreamFragment.EndOfMessage) {
            finish(out, resolveBackendReason(), null);
        } else if (fragment instanceof UpstreamFragment.ErrorSignal error) {
            log.warn("[{}] 后端返回错误事件: {}", session.sessionId(), error.message());
            finish(out, FinishReason.ERROR, error.message() != null ? error.message() : "backend error");
        }
    }

    // ==================== 正文 / 推理 ====================

    private void onText(String text, List<StreamEvent> out) {
        if (tagParser == null) {
            emitText(text, out);
            return;
        }
        ThinkingTagParser.ParseResult result = tagParser.feed(text);
        if (result.hasThinking()) {
            onReasoning(result.thinkingDelta(), out);
        }
        if (result.hasContent()) {
            emitText(result.contentDelta(), out);
        }
    }

    private void emitText(String text, List<StreamEvent> out) {
        if (text == null || text.isEmpty()) {
            return;
        }
        StreamSession.OpenBlock open = session.openBlock();
        if (open == null || open.kind() != BlockKind.TEXT) {
            closeOpenBlock(out);
            flushPendingTools(out);
            open = openBlock(BlockKind.TEXT, null, out);
        }
        out.add(new StreamEvent.TextDelta(open.index(), text));
        session.markContent();
    }

    private void onReasoning(String text, List<StreamEvent> out) {
        if (text == null || text.isEmpty()) {
            return;
        }
        StreamSession.OpenBlock open = session.openBlock();
        if (open != null && open.kind() == BlockKind.THINKING) {
            appendThinking(open.index(), text, out);
            return;
        }
        if (session.isThinkingClosed()) {
            // 推理块不能重新打开，并入正文
            log.warn("[{}] 正文开始后又收到推理片段，按正文输出", session.sessionId());
            Metrics.instance().recordLateReasoning();
            emitText(text, out);
            return;
        }
        closeOpenBlock(out);
        open = openBlock(BlockKind.THINKING, null, out);
        appendThinking(open.index(), text, out);
    }

    private void appendThinking(int index, String text, List<StreamEvent> out) {
        session.appendThinking(text, !finalizing);
        out.add(new StreamEvent.ThinkingDelta(index, text));
    }

    // ==================== 工具调用 ====================

    private void onToolCall(UpstreamFragment.ToolCallDelta delta, List<StreamEvent> out) {
        ToolCallAccumulator acc = session.tool(delta.ref());
        if (acc == null) {
            String id = delta.id() != null && !delta.id().isEmpty() ? delta.id() : generateToolCallId();
            acc = new ToolCallAccumulator(delta.ref(), id, delta.name());
            session.putTool(acc);
        } else {
            acc.fillIdentity(delta.id(), delta.name());
        }
        String fragment = delta.arguments() == null ? "" : delta.arguments();

        switch (acc.state()) {
            case CLOSED -> {
                if (!fragment.isEmpty()) {
                    log.warn("[{}] 工具调用 {} 已结束后又收到参数片段，丢弃", session.sessionId(), acc.id());
                }
            }
            case OPEN -> {
                if (!fragment.isEmpty()) {
                    acc.append(fragment);
                    out.add(new StreamEvent.ToolArgumentDelta(acc.blockIndex(), acc.id(), fragment));
                }
                if (acc.isComplete() && session.hasPendingTools()) {
                    startPendingTools(out);
                }
            }
            case PENDING -> {
                acc.buffer(fragment);
                session.enqueue(acc);
                if (!openToolIncomplete()) {
                    startPendingTools(out);
                }
            }
        }
    }

    private void onToolCallEnd(String ref, List<StreamEvent> out) {
        ToolCallAccumulator acc = session.tool(ref);
        if (acc == null) {
            return;
        }
        acc.markEnded();
        if (acc.state() == ToolCallAccumulator.State.OPEN) {
            closeOpenBlock(out);
            if (session.hasPendingTools()) {
                startPendingTools(out);
            }
        }
    }

    /**
     * 依次开始排队的工具调用，遇到参数尚不完整的调用时停下保持打开
     */
    private void startPendingTools(List<StreamEvent> out) {
        while (session.hasPendingTools()) {
            closeOpenBlock(out);
            ToolCallAccumulator next = session.pollPending();
            startTool(next, out);
            if (!next.isComplete()) {
                break;
            }
        }
    }

    /**
     * 打开文本或推理块之前，把排队的工具调用全部输出并关闭
     */
    private void flushPendingTools(List<StreamEvent> out) {
        if (!session.hasPendingTools()) {
            return;
        }
        while (session.hasPendingTools()) {
            closeOpenBlock(out);
            startTool(session.pollPending(), out);
        }
        closeOpenBlock(out);
    }

    private void startTool(ToolCallAccumulator acc, List<StreamEvent> out) {
        openBlock(BlockKind.TOOL_USE, acc, out);
        for (String fragment : acc.drainBuffered()) {
            out.add(new StreamEvent.ToolArgumentDelta(acc.blockIndex(), acc.id(), fragment));
        }
        session.markToolCall();
    }

    private boolean openToolIncomplete() {
        StreamSession.OpenBlock open = session.openBlock();
        if (open == null || open.kind() != BlockKind.TOOL_USE) {
            return false;
        }
        ToolCallAccumulator current = session.tool(open.toolRef());
        return current != null && !current.isComplete();
    }

    // ==================== 块开关 ====================

    private StreamSession.OpenBlock openBlock(BlockKind kind, ToolCallAccumulator acc, List<StreamEvent> out) {
        int index = session.allocateIndex(!finalizing);
        if (kind != BlockKind.THINKING) {
            session.closeThinking();
        }
        StreamSession.OpenBlock block;
        if (kind == BlockKind.TOOL_USE) {
            acc.open(index);
            out.add(new StreamEvent.BlockStart(index, kind, acc.id(), acc.name()));
            block = new StreamSession.OpenBlock(index, kind, acc.ref());
        } else {
            out.add(StreamEvent.BlockStart.of(index, kind));
            block = new StreamSession.OpenBlock(index, kind, null);
        }
        session.setOpenBlock(block);
        return block;
    }

    private void closeOpenBlock(List<StreamEvent> out) {
        StreamSession.OpenBlock open = session.openBlock();
        if (open == null) {
            return;
        }
        if (open.kind() == BlockKind.THINKING) {
            out.add(new StreamEvent.ThinkingSignature(open.index(), signature(session.thinkingText())));
            session.closeThinking();
        } else if (open.kind() == BlockKind.TOOL_USE) {
            ToolCallAccumulator acc = session.tool(open.toolRef());
            if (acc != null) {
                acc.close();
            }
        }
        out.add(new StreamEvent.BlockStop(open.index()));
        session.setOpenBlock(null);
    }

    // ==================== 收尾 ====================

    private void finish(List<StreamEvent> out, FinishReason reason, String errorMessage) {
        if (session.isFinished()) {
            return;
        }
        finalizing = true;

        if (tagParser != null && reason != FinishReason.ERROR) {
            ThinkingTagParser.ParseResult rest = tagParser.finish();
            if (rest.hasThinking()) {
                onReasoning(rest.thinkingDelta(), out);
            }
            if (rest.hasContent()) {
                emitText(rest.contentDelta(), out);
            }
        }

        closeOpenBlock(out);
        flushPendingTools(out);

        if (!session.producedAnyContent()) {
            int index = session.allocateIndex(false);
            out.add(StreamEvent.BlockStart.of(index, BlockKind.TEXT));
            out.add(new StreamEvent.BlockStop(index));
            session.markContent();
        }

        FinishReason resolved = reason;
        if (reason == FinishReason.STOP && session.producedToolCall()) {
            resolved = FinishReason.TOOL_USE;
        }
        out.add(new StreamEvent.MessageFinish(resolved, session.usage(), errorMessage));
        session.markDone();
        log.debug("[{}] 会话结束: reason={}, usage={}", session.sessionId(), resolved.value(), session.usage());
    }

    private FinishReason resolveBackendReason() {
        return session.backendReason() != null ? session.backendReason() : FinishReason.STOP;
    }

    /**
     * 推理块签名：对推理全文做 SHA-256，相同内容得到相同签名
     */
    static String signature(String thinking) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(thinking.getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 不可用", e);
        }
    }

    private static String generateToolCallId() {
        return "call_" + UUID.randomUUID().toString().replace("-", "").substring(0, 24);
    }
}
