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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnthropicRequestDecoderTest {

    private final AnthropicRequestDecoder decoder = new AnthropicRequestDecoder();

    @Test
    void shouldDecodeMessagesRequest() {
        CanonicalRequest request = decoder.decode(JSONObject.parseObject("""
                {
                  "model": "claude-sonnet-4",
                  "max_tokens": 2048,
                  "stream": true,
                  "system": [{"type": "text", "text": "You are helpful"}],
                  "thinking": {"type": "enabled", "budget_tokens": 4000},
                  "stop_sequences": ["\\n\\nHuman:"],
                  "messages": [
                    {"role": "user", "content": "Weather in Paris?"},
                    {"role": "assistant", "content": [
                      {"type": "thinking", "thinking": "need tool", "signature": "sig"},
                      {"type": "tool_use", "id": "toolu_1", "name": "get_weather", "input": {"city": "Paris"}}
                    ]},
                    {"role": "user", "content": [
                      {"type": "tool_result", "tool_use_id": "toolu_1", "content": [{"type": "text", "text": "18C"}], "is_error": false},
                      {"type": "text", "text": "thanks"}
                    ]}
                  ],
                  "tools": [{"name": "get_weather", "input_schema": {"type": "object", "properties": {"city": {"type": "string"}}}}],
                  "tool_choice": {"type": "tool", "name": "get_weather"}
                }
                """));

        assertThat(request.model()).isEqualTo("claude-sonnet-4");
        assertThat(request.maxTokens()).isEqualTo(2048);
        assertThat(request.stream()).isTrue();
        assertThat(request.reasoning()).isEqualTo(ReasoningConfig.budget(4000));
        assertThat(request.stopSequences()).containsExactly("\n\nHuman:");
        assertThat(request.messages().get(0)).isEqualTo(CanonicalMessage.text(Role.SYSTEM, "You are helpful"));
        assertThat(request.messages().get(2).content()).containsExactly(
                new ContentPart.Thinking("need tool", "sig"),
                new ContentPart.ToolUse(new ToolCall("toolu_1", "get_weather", "{\"city\":\"Paris\"}")));
        assertThat(request.messages().get(3).content()).containsExactly(
                new ContentPart.ToolResult("toolu_1", "18C", false),
                new ContentPart.Text("thanks"));
        assertThat(request.toolChoice()).isEqualTo(ToolChoice.tool("get_weather"));
        assertThat(request.tools().get(0).parametersSchema().getJSONObject("properties")).containsKey("city");
    }

    @Test
    void shouldSkipServerTools() {
        CanonicalRequest request = decoder.decode(JSONObject.parseObject("""
                {"messages":[{"role":"user","content":"hi"}],
                 "tools":[{"type":"web_search_20250305","name":"web_search"},{"name":"calc","input_schema":{"type":"object"}}]}
                """));

        assertThat(request.tools()).extracting(t -> t.name()).containsExactly("calc");
    }

    @Test
    void shouldTreatAdaptiveThinkingAsMediumEffort() {
        CanonicalRequest request = decoder.decode(JSONObject.parseObject("""
                {"messages":[{"role":"user","content":"hi"}],"thinking":{"type":"adaptive"}}
                """));

        assertThat(request.reasoning()).isEqualTo(ReasoningConfig.effort("medium"));
    }

    @Test
    void shouldReplaceImagesWithPlaceholder() {
        CanonicalRequest request = decoder.decode(JSONObject.parseObject("""
                {"messages":[{"role":"user","content":[{"type":"image","source":{"type":"base64","data":"AAA"}},{"type":"text","text":"what is it"}]}]}
                """));

        assertThat(request.messages().get(0).content())
                .containsExactly(new ContentPart.Text("[image]"), new ContentPart.Text("what is it"));
    }

    @Test
    void shouldRejectSystemRoleInsideMessages() {
        assertThatThrownBy(() -> decoder.decode(JSONObject.parseObject("""
                {"messages":[{"role":"system","content":"x"}]}
                """)))
                .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void shouldRejectToolUseWithoutId() {
        assertThatThrownBy(() -> decoder.decode(JSONObject.parseObject("""
                {"messages":[{"role":"assistant","content":[{"type":"tool_use","name":"f","input":{}}]}]}
                """)))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("id");
    }
}
