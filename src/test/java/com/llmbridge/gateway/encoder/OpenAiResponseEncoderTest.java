package com.llmbridge.gateway.encoder;

import com.alibaba.fastjson2.JSONObject;
import com.llmbridge.gateway.dto.canonical.BlockKind;
import com.llmbridge.gateway.dto.canonical.CanonicalResponse;
import com.llmbridge.gateway.dto.canonical.ContentPart;
import com.llmbridge.gateway.dto.canonical.FinishReason;
import com.llmbridge.gateway.dto.canonical.StreamEvent;
import com.llmbridge.gateway.dto.canonical.ToolCall;
import com.llmbridge.gateway.dto.canonical.Usage;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class OpenAiResponseEncoderTest {

    private static List<String> encodeAll(ResponseEncoder encoder, StreamEvent... events) {
        List<String> frames = new ArrayList<>();
        for (StreamEvent event : events) {
            frames.addAll(encoder.encode(event));
        }
        return frames;
    }

    private static JSONObject delta(String frame) {
        return chunk(frame).getJSONArray("choices").getJSONObject(0).getJSONObject("delta");
    }

    private static JSONObject chunk(String frame) {
        return JSONObject.parseObject(frame.substring("data: ".length()).trim());
    }

    @Test
    void shouldStreamReasoningAndContent() {
        ResponseEncoder encoder = new OpenAiResponseEncoder("chatcmpl-1", "deepseek-reasoner");

        List<String> frames = encodeAll(encoder,
                StreamEvent.BlockStart.of(0, BlockKind.THINKING),
                new StreamEvent.ThinkingDelta(0, "plan"),
                new StreamEvent.ThinkingSignature(0, "sig"),
                new StreamEvent.BlockStop(0),
                StreamEvent.BlockStart.of(1, BlockKind.TEXT),
                new StreamEvent.TextDelta(1, "done"),
                new StreamEvent.BlockStop(1),
                StreamEvent.MessageFinish.of(FinishReason.STOP, new Usage(4, 2)));

        assertThat(frames).hasSize(4);
        assertThat(delta(frames.get(0))).containsEntry("reasoning_content", "plan").containsEntry("role", "assistant");
        assertThat(delta(frames.get(1))).containsEntry("content", "done").doesNotContainKey("role");

        JSONObject last = chunk(frames.get(2));
        assertThat(last.getString("object")).isEqualTo("chat.completion.chunk");
        assertThat(last.getJSONArray("choices").getJSONObject(0).getString("finish_reason")).isEqualTo("stop");
        assertThat(last.getJSONObject("usage").getIntValue("total_tokens")).isEqualTo(6);
        assertThat(frames.get(3)).isEqualTo("data: [DONE]\n\n");
    }

    @Test
    void shouldNumberToolCallsByAppearance() {
        ResponseEncoder encoder = new OpenAiResponseEncoder("chatcmpl-2", "m");

        List<String> frames = encodeAll(encoder,
                new StreamEvent.BlockStart(0, BlockKind.TOOL_USE, "A", "fa"),
                new StreamEvent.ToolArgumentDelta(0, "A", "{\"x\":1}"),
                new StreamEvent.BlockStop(0),
                new StreamEvent.BlockStart(1, BlockKind.TOOL_USE, "B", "fb"),
                new StreamEvent.ToolArgumentDelta(1, "B", "{\"y\":2}"),
                new StreamEvent.BlockStop(1),
                StreamEvent.MessageFinish.of(FinishReason.TOOL_USE, Usage.EMPTY));

        JSONObject first = delta(frames.get(0)).getJSONArray("tool_calls").getJSONObject(0);
        assertThat(first.getIntValue("index")).isZero();
        assertThat(first.getString("id")).isEqualTo("A");
        assertThat(first.getJSONObject("function").getString("arguments")).isEmpty();
        assertThat(delta(frames.get(1)).getJSONArray("tool_calls").getJSONObject(0).getJSONObject("function").getString("arguments"))
                .isEqualTo("{\"x\":1}");
        JSONObject second = delta(frames.get(2)).getJSONArray("tool_calls").getJSONObject(0);
        assertThat(second.getIntValue("index")).isEqualTo(1);
        assertThat(second.getJSONObject("function").getString("name")).isEqualTo("fb");
        assertThat(chunk(frames.get(4)).getJSONArray("choices").getJSONObject(0).getString("finish_reason"))
                .isEqualTo("tool_calls");
    }

    @Test
    void shouldSendRoleChunkForEmptyResponse() {
        ResponseEncoder encoder = new OpenAiResponseEncoder("chatcmpl-3", "m");

        List<String> frames = encodeAll(encoder,
                StreamEvent.BlockStart.of(0, BlockKind.TEXT),
                new StreamEvent.BlockStop(0),
                StreamEvent.MessageFinish.of(FinishReason.STOP, Usage.EMPTY));

        assertThat(frames).hasSize(3);
        assertThat(delta(frames.get(0))).containsEntry("role", "assistant").containsEntry("content", "");
    }

    @Test
    void shouldEmitErrorRecordBeforeDone() {
        ResponseEncoder encoder = new OpenAiResponseEncoder("chatcmpl-4", "m");

        List<String> frames = encoder.encode(new StreamEvent.MessageFinish(FinishReason.ERROR, Usage.EMPTY, "boom"));

        assertThat(frames).hasSize(2);
        assertThat(chunk(frames.get(0)).getJSONObject("error").getString("message")).isEqualTo("boom");
        assertThat(frames.get(1)).isEqualTo("data: [DONE]\n\n");
    }

    @Test
    void shouldEncodeNonStreamingCompletion() {
        ResponseEncoder encoder = new OpenAiResponseEncoder("chatcmpl-5", "m");
        CanonicalResponse response = new CanonicalResponse("chatcmpl-5", "m", List.of(
                new ContentPart.Thinking("r", null),
                new ContentPart.ToolUse(new ToolCall("c1", "f", "{}"))),
                FinishReason.TOOL_USE, new Usage(1, 2));

        JSONObject body = JSONObject.parseObject(encoder.encodeResponse(response));
        JSONObject message = body.getJSONArray("choices").getJSONObject(0).getJSONObject("message");

        assertThat(body.getString("object")).isEqualTo("chat.completion");
        assertThat(message.get("content")).isNull();
        assertThat(message.getString("reasoning_content")).isEqualTo("r");
        assertThat(message.getJSONArray("tool_calls").getJSONObject(0).getString("id")).isEqualTo("c1");
        assertThat(body.getJSONArray("choices").getJSONObject(0).getString("finish_reason")).isEqualTo("tool_calls");
    }
}
