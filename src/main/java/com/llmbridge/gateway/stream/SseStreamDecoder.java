package com.llmbridge.gateway.stream;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * SSE 分帧
 * <p>
 * 以空行结束一条记录；按字节查找换行，完整行才解码为 UTF-8，因此被切开的多字节字符不会损坏。
 * ':' 开头的注释行（keep-alive）丢弃
 */
public class SseStreamDecoder implements StreamDecoder {

    // 未遇到换行的半行字节，只保留当前行
    private final ByteArrayOutputStream partialLine = new ByteArrayOutputStream();
    private String eventName;
    private StringBuilder data;

    @Override
    public List<StreamRecord> decode(byte[] chunk) {
        List<StreamRecord> records = new ArrayList<>();
        if (chunk == null || chunk.length == 0) {
            return records;
        }

        int segmentStart = 0;
        for (int i = 0; i < chunk.length; i++) {
            if (chunk[i] == '\n') {
                partialLine.write(chunk, segmentStart, i - segmentStart);
                flushLine(records);
                segmentStart = i + 1;
            }
        }
        partialLine.write(chunk, segmentStart, chunk.length - segmentStart);
        return records;
    }

    @Override
    public List<StreamRecord> finish() {
        List<StreamRecord> records = new ArrayList<>();
        if (partialLine.size() > 0) {
            flushLine(records);
        }
        dispatch(records);
        return records;
    }

    private void flushLine(List<StreamRecord> records) {
        byte[] bytes = partialLine.toByteArray();
        partialLine.reset();
        int end = bytes.length;
        if (end > 0 && bytes[end - 1] == '\r') {
            end--;
        }
        processLine(new String(bytes, 0, end, StandardCharsets.UTF_8), records);
    }

    private void processLine(String line, List<StreamRecord> records) {
        if (line.isEmpty()) {
            dispatch(records);
            return;
        }
        if (line.startsWith(":")) {
            return;
        }

        int colon = line.indexOf(':');
        String field = colon < 0 ? line : line.substring(0, colon);
        String value = colon < 0 ? "" : line.substring(colon + 1);
        if (value.startsWith(" ")) {
            value = value.substring(1);
        }

        switch (field) {
            case "event" -> eventName = value;
            case "data" -> {
                if (data == null) {
                    data = new StringBuilder(value);
                } else {
                    data.append('\n').append(value);
                }
            }
            // id / retry 及未知字段忽略
            default -> {
            }
        }
    }

    private void dispatch(List<StreamRecord> records) {
        if (data != null) {
            records.add(new StreamRecord(eventName, data.toString()));
        }
        eventName = null;
        data = null;
    }
}
