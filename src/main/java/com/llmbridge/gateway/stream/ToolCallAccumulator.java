package com.llmbridge.gateway.stream;

import java.util.ArrayList;
import java.util.List;

/**
 * 单个工具调用的参数累积器
 * <p>
 * 参数片段按到达顺序拼接；块尚未开始时片段先缓存，开始后一次性补发
 */
class ToolCallAccumulator {

    enum State {
        PENDING,
        OPEN,
        CLOSED
    }

    private final String ref;
    private String id;
    private String name;
    private final StringBuilder arguments = new StringBuilder();
    private final JsonBracketTracker tracker = new JsonBracketTracker();
    private final List<String> buffered = new ArrayList<>();
    private State state = State.PENDING;
    private int blockIndex = -1;
    private boolean ended;
    private boolean queued;

    ToolCallAccumulator(String ref, String id, String name) {
        this.ref = ref;
        this.id = id;
        this.name = name;
    }

    /**
     * 后续片段补全 id / name，块开始后不再变化
     */
    void fillIdentity(String newId, String newName) {
        if (state != State.PENDING) {
            return;
        }
        if ((id == null || id.isEmpty()) && newId != null && !newId.isEmpty()) {
            id = newId;
        }
        if ((name == null || name.isEmpty()) && newName != null && !newName.isEmpty()) {
            name = newName;
        }
    }

    void append(String fragment) {
        arguments.append(fragment);
        tracker.accept(fragment);
    }

    void buffer(String fragment) {
        if (fragment == null || fragment.isEmpty()) {
            return;
        }
        append(fragment);
        buffered.add(fragment);
    }

    List<String> drainBuffered() {
        List<String> drained = List.copyOf(buffered);
        buffered.clear();
        return drained;
    }

    /**
     * 后端已声明结束，或参数已构成完整 JSON
     */
    boolean isComplete() {
        return ended || tracker.isComplete();
    }

    void markEnded() {
        ended = true;
    }

    void open(int index) {
        state = State.OPEN;
        blockIndex = index;
    }

    void close() {
        state = State.CLOSED;
    }

    String ref() { return ref; }
    String id() { return id; }
    String name() { return name == null ? "" : name; }
    State state() { return state; }
    int blockIndex() { return blockIndex; }
    boolean isQueued() { return queued; }
    void setQueued(boolean queued) { this.queued = queued; }
}
