package com.llmbridge.gateway.stream;

/**
 * 后端原生事件记录
 *
 * @param event SSE 事件名，无则为 null
 * @param data  记录内容（通常为 JSON 文本）
 */
public record StreamRecord(String event, String data) {

    public static StreamRecord data(String data) {
        return new StreamRecord(null, data);
    }
}
