package com.llmbridge.gateway.stream;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SseStreamDecoderTest {

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void shouldParseEventAndData() {
        SseStreamDecoder decoder = new SseStreamDecoder();

        List<StreamRecord> records = decoder.decode(bytes("event: message_start\ndata: {\"a\":1}\n\ndata: {\"b\":2}\n\n"));

        assertThat(records).containsExactly(
                new StreamRecord("message_start", "{\"a\":1}"),
                new StreamRecord(null, "{\"b\":2}"));
    }

    @Test
    void shouldHandleCrlfAndComments() {
        SseStreamDecoder decoder = new SseStreamDecoder();

        List<StreamRecord> records = decoder.decode(bytes(": keep-alive\r\n\r\ndata: hello\r\n\r\n"));

        assertThat(records).containsExactly(StreamRecord.data("hello"));
    }

    @Test
    void shouldJoinMultiLineData() {
        SseStreamDecoder decoder = new SseStreamDecoder();

        List<StreamRecord> records = decoder.decode(bytes("data: line1\ndata: line2\n\n"));

        assertThat(records).containsExactly(StreamRecord.data("line1\nline2"));
    }

    @Test
    void shouldKeepMultiByteCharacterSplitAcrossChunks() {
        SseStreamDecoder decoder = new SseStreamDecoder();
        byte[] all = bytes("data: 你好\n\n");
        // "你" 占 3 个字节，从中间切开
        int cut = "data: ".length() + 1;

        List<StreamRecord> records = new ArrayList<>(decoder.decode(Arrays.copyOfRange(all, 0, cut)));
        records.addAll(decoder.decode(Arrays.copyOfRange(all, cut, all.length)));

        assertThat(records).containsExactly(StreamRecord.data("你好"));
    }

    @Test
    void shouldDeliverRecordOnlyAfterBlankLine() {
        SseStreamDecoder decoder = new SseStreamDecoder();

        assertThat(decoder.decode(bytes("data: {\"x\":"))).isEmpty();
        assertThat(decoder.decode(bytes("1}\n"))).isEmpty();
        assertThat(decoder.decode(bytes("\n"))).containsExactly(StreamRecord.data("{\"x\":1}"));
    }

    @Test
    void shouldFlushUnterminatedRecordOnFinish() {
        SseStreamDecoder decoder = new SseStreamDecoder();

        assertThat(decoder.decode(bytes("data: [DONE]"))).isEmpty();
        assertThat(decoder.finish()).containsExactly(StreamRecord.data("[DONE]"));
        assertThat(decoder.finish()).isEmpty();
    }

    @Test
    void shouldAssembleLongSingleLineEventFromSmallChunks() {
        SseStreamDecoder decoder = new SseStreamDecoder();
        String payload = "思考".repeat(50_000);
        byte[] all = ("data: " + payload + "\r\n\r\n").getBytes(StandardCharsets.UTF_8);

        List<StreamRecord> records = new ArrayList<>();
        for (int offset = 0; offset < all.length; offset += 1000) {
            records.addAll(decoder.decode(Arrays.copyOfRange(all, offset, Math.min(all.length, offset + 1000))));
        }
        records.addAll(decoder.finish());

        assertThat(records).singleElement().satisfies(r -> assertThat(r.data()).isEqualTo(payload));
    }

    @Test
    void shouldStripCarriageReturnSplitFromNewline() {
        SseStreamDecoder decoder = new SseStreamDecoder();

        List<StreamRecord> first = decoder.decode(bytes("data: a\r"));
        List<StreamRecord> second = decoder.decode(bytes("\n\r\n"));

        assertThat(first).isEmpty();
        assertThat(second).singleElement().satisfies(r -> assertThat(r.data()).isEqualTo("a"));
    }
}
