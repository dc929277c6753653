package com.llmbridge.gateway.stream;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * 无分隔符 JSON 对象流分帧
 * <p>
 * 用于 Gemini 非 SSE 流式响应（形如 [{...},{...}] 的 JSON 数组逐步到达）。
 * 顶层对象之外的 '[' ',' ']' 与空白全部跳过；括号、引号、反斜杠均为 ASCII，
 * 按字节扫描不会被多字节字符干扰
 */
public class JsonObjectStreamDecoder implements StreamDecoder {

    private final JsonBracketTracker tracker = new JsonBracketTracker();
    private final ByteArrayOutputStream current = new ByteArrayOutputStream();

    @Override
    public List<StreamRecord> decode(byte[] chunk) {
        List<StreamRecord> records = new ArrayList<>();
        if (chunk == null) {
            return records;
        }
        for (byte b : chunk) {
            if (!tracker.isInside() && b != '{') {
                continue;
            }
            current.write(b);
            if (tracker.accept(b)) {
                records.add(StreamRecord.data(current.toString(StandardCharsets.UTF_8)));
                current.reset();
            }
        }
        return records;
    }

    @Override
    public List<StreamRecord> finish() {
        List<StreamRecord> records = new ArrayList<>();
        if (current.size() > 0) {
            // 截断的对象交给解释器判定为不可解析
            records.add(StreamRecord.data(current.toString(StandardCharsets.UTF_8)));
            current.reset();
        }
        return records;
    }
}
