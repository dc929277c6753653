package com.llmbridge.gateway.stream;

import java.util.List;

/**
 * 字节流分帧器
 * <p>
 * 每次 decode 输入任意切分的字节块，返回其中已完整的记录；不完整部分（含被切开的多字节字符）留在缓冲区。
 * 实例只服务一次响应，不可复用
 */
public interface StreamDecoder {

    List<StreamRecord> decode(byte[] chunk);

    /**
     * 流结束，输出缓冲区中剩余的完整记录
     */
    List<StreamRecord> finish();

    /**
     * 按响应 Content-Type 选择分帧方式
     */
    static StreamDecoder forContentType(String contentType) {
        if (contentType != null && contentType.toLowerCase().contains("text/event-stream")) {
            return new SseStreamDecoder();
        }
        if (contentType != null && contentType.toLowerCase().contains("json")) {
            return new JsonObjectStreamDecoder();
        }
        return new SseStreamDecoder();
    }
}
