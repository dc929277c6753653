package com.llmbridge.gateway.translator;

import com.alibaba.fastjson2.JSONObject;
import com.llmbridge.gateway.dto.canonical.CanonicalMessage;
import com.llmbridge.gateway.dto.canonical.CanonicalRequest;
import com.llmbridge.gateway.dto.canonical.ContentPart;
import com.llmbridge.gateway.dto.canonical.ReasoningConfig;
import com.llmbridge.gateway.dto.canonical.Role;
import com.llmbridge.gateway.dto.canonical.ToolCall;
import com.llmbridge.gateway.dto.canonical.ToolChoice;
import com.llmbridge.gateway.exception.InvalidRequestException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenAiRequestDecoderTest {

    private final OpenAiRequestDecoder decoder = new OpenAiRequestDecoder();

    @Test
    void shouldDecodeConversationWithToolRoundTrip() {
        CanonicalRequest request = decoder.decode(JSONObject.parseObject("""
                {
                  "model": "gpt-4o",
                  "stream": true,
                  "max_tokens": 100,
                  "temperature": 0.5,
                  "stop": "END",
                  "messages": [
                    {"role": "system", "content": "be brief"},
                    {"role": "user", "content": [{"type": "text", "text": "weather?"}, {"type": "image_url", "image_url": {"url": "x"}}]},
                    {"role": "assistant", "content": null, "tool_calls": [
                      {"id": "call_1", "type": "function", "function": {"name": "get_weather", "arguments": "{\\"city\\":\\"Paris\\"}"}}
                    ]},
                    {"role": "tool", "tool_call_id": "call_1", "content": "sunny"}
                  ],
                  "tools": [{"type": "function", "function": {"name": "get_weather", "description": "lookup", "parameters": {"type": "object"}}}],
                  "tool_choice": "required"
                }
                """));

        assertThat(request.model()).isEqualTo("gpt-4o");
        assertThat(request.stream()).isTrue();
        assertThat(request.maxTokens()).isEqualTo(100);
        assertThat(request.temperature()).isEqualTo(0.5);
        assertThat(request.stopSequences()).containsExactly("END");
        assertThat(request.messages()).extracting(CanonicalMessage::role)
                .containsExactly(Role.SYSTEM, Role.USER, Role.ASSISTANT, Role.TOOL);
        assertThat(request.messages().get(1).content())
                .containsExactly(new ContentPart.Text("weather?"), new ContentPart.Text("[image]"));
        assertThat(request.messages().get(2).toolCalls())
                .containsExactly(new ToolCall("call_1", "get_weather", "{\"city\":\"Paris\"}"));
        assertThat(request.messages().get(3).content())
                .containsExactly(new ContentPart.ToolResult("call_1", "sunny", false));
        assertThat(request.tools()).singleElement().satisfies(tool -> {
            assertThat(tool.name()).isEqualTo("get_weather");
            assertThat(tool.description()).isEqualTo("lookup");
        });
        assertThat(request.toolChoice()).isEqualTo(ToolChoice.of(ToolChoice.Mode.ANY));
        assertThat(request.reasoning()).isEqualTo(ReasoningConfig.DISABLED);
    }

    @Test
    void shouldPreferMaxCompletionTokensAndReadEffort() {
        CanonicalRequest request = decoder.decode(JSONObject.parseObject("""
                {"model":"o3","max_tokens":10,"max_completion_tokens":20,"reasoning_effort":"high",
                 "messages":[{"role":"developer","content":"rules"},{"role":"user","content":"hi"}]}
                """));

        assertThat(request.maxTokens()).isEqualTo(20);
        assertThat(request.reasoning()).isEqualTo(ReasoningConfig.effort("high"));
        assertThat(request.messages().get(0)).isEqualTo(CanonicalMessage.text(Role.SYSTEM, "rules"));
    }

    @Test
    void shouldKeepReasoningContentOfAssistantTurn() {
        CanonicalRequest request = decoder.decode(JSONObject.parseObject("""
                {"messages":[{"role":"user","content":"q"},
                             {"role":"assistant","reasoning_content":"because","content":"a"}]}
                """));

        assertThat(request.messages().get(1).content())
                .containsExactly(new ContentPart.Thinking("because", null), new ContentPart.Text("a"));
    }

    @Test
    void shouldDecodeNamedToolChoice() {
        CanonicalRequest request = decoder.decode(JSONObject.parseObject("""
                {"messages":[{"role":"user","content":"q"}],
                 "tool_choice":{"type":"function","function":{"name":"f"}}}
                """));

        assertThat(request.toolChoice()).isEqualTo(ToolChoice.tool("f"));
    }

    @Test
    void shouldRejectMissingMessages() {
        assertThatThrownBy(() -> decoder.decode(JSONObject.of("model", "x")))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("messages");
    }

    @Test
    void shouldRejectUnknownRole() {
        assertThatThrownBy(() -> decoder.decode(JSONObject.parseObject("""
                {"messages":[{"role":"narrator","content":"x"}]}
                """)))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("narrator");
    }

    @Test
    void shouldRejectToolMessageWithoutCallId() {
        assertThatThrownBy(() -> decoder.decode(JSONObject.parseObject("""
                {"messages":[{"role":"tool","content":"x"}]}
                """)))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("tool_call_id");
    }

    @Test
    void shouldAcceptArgumentsGivenAsObject() {
        CanonicalRequest request = decoder.decode(JSONObject.parseObject("""
                {"messages":[{"role":"assistant","tool_calls":[{"id":"c","function":{"name":"f","arguments":{"a":1}}}]}]}
                """));

        List<ToolCall> calls = request.messages().get(0).toolCalls();
        assertThat(calls).containsExactly(new ToolCall("c", "f", "{\"a\":1}"));
    }
}
