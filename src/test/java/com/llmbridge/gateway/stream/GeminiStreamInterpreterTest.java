package com.llmbridge.gateway.stream;

import com.llmbridge.gateway.dto.canonical.FinishReason;
import com.llmbridge.gateway.dto.canonical.Usage;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GeminiStreamInterpreterTest {

    private final GeminiStreamInterpreter interpreter = new GeminiStreamInterpreter();

    @Test
    void shouldSplitThoughtAndTextParts() {
        assertThat(interpreter.interpret(StreamRecord.data("""
                {"candidates":[{"content":{"role":"model","parts":[{"text":"plan","thought":true},{"text":"Hello"}]}}]}""")))
                .containsExactly(new UpstreamFragment.Reasoning("plan"), new UpstreamFragment.Text("Hello"));
    }

    @Test
    void shouldEmitCompleteFunctionCall() {
        List<UpstreamFragment> fragments = interpreter.interpret(StreamRecord.data("""
                {"candidates":[{"content":{"parts":[{"functionCall":{"id":"fc_1","name":"search","args":{"q":"java"}}}]}}]}"""));

        assertThat(fragments).containsExactly(
                new UpstreamFragment.ToolCallDelta("call:0", "fc_1", "search", "{\"q\":\"java\"}"),
                new UpstreamFragment.ToolCallEnd("call:0"));
    }

    @Test
    void shouldGenerateIdForFunctionCallWithoutOne() {
        List<UpstreamFragment> fragments = interpreter.interpret(StreamRecord.data("""
                {"candidates":[{"content":{"parts":[{"functionCall":{"name":"a"}},{"functionCall":{"name":"b"}}]}}]}"""));

        UpstreamFragment.ToolCallDelta first = (UpstreamFragment.ToolCallDelta) fragments.get(0);
        UpstreamFragment.ToolCallDelta second = (UpstreamFragment.ToolCallDelta) fragments.get(2);
        assertThat(first.id()).startsWith("call_");
        assertThat(first.arguments()).isEqualTo("{}");
        assertThat(second.ref()).isEqualTo("call:1");
        assertThat(second.id()).isNotEqualTo(first.id());
    }

    @Test
    void shouldReadFinishReasonAndUsage() {
        assertThat(interpreter.interpret(StreamRecord.data("""
                {"candidates":[{"content":{"parts":[]},"finishReason":"MAX_TOKENS"}],
                 "usageMetadata":{"promptTokenCount":4,"candidatesTokenCount":6,"thoughtsTokenCount":2}}""")))
                .containsExactly(
                        new UpstreamFragment.FinishSignal(FinishReason.LENGTH),
                        new UpstreamFragment.UsageUpdate(new Usage(4, 8)));
    }

    @Test
    void shouldTreatMalformedFunctionCallAsError() {
        List<UpstreamFragment> fragments = interpreter.interpret(StreamRecord.data("""
                {"candidates":[{"finishReason":"MALFORMED_FUNCTION_CALL","finishMessage":"bad call"}]}"""));

        assertThat(fragments).hasSize(1);
        assertThat(fragments.get(0)).isInstanceOf(UpstreamFragment.ErrorSignal.class);
        assertThat(((UpstreamFragment.ErrorSignal) fragments.get(0)).message()).contains("bad call");
    }

    @Test
    void shouldMapSafetyToContentFilter() {
        assertThat(GeminiStreamInterpreter.mapFinishReason("SAFETY")).isEqualTo(FinishReason.CONTENT_FILTER);
        assertThat(GeminiStreamInterpreter.mapFinishReason("STOP")).isEqualTo(FinishReason.STOP);
    }
}
