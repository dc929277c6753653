package com.llmbridge.gateway.translator;

import com.alibaba.fastjson2.JSONObject;
import com.llmbridge.gateway.config.BackendCapabilities;
import com.llmbridge.gateway.config.BackendConfig;
import com.llmbridge.gateway.config.Protocol;
import com.llmbridge.gateway.dto.canonical.CanonicalMessage;
import com.llmbridge.gateway.dto.canonical.CanonicalRequest;
import com.llmbridge.gateway.dto.canonical.ReasoningConfig;
import com.llmbridge.gateway.dto.canonical.Role;
import com.llmbridge.gateway.dto.canonical.ToolChoice;
import com.llmbridge.gateway.dto.canonical.ToolDefinition;
import com.llmbridge.gateway.exception.UnsupportedCapabilityException;
import com.llmbridge.gateway.schema.SchemaDialect;
import com.llmbridge.gateway.schema.SchemaSanitizer;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CapabilityGuardTest {

    private final CapabilityGuard guard = new CapabilityGuard(new SchemaSanitizer());

    private static final ToolDefinition TOOL = new ToolDefinition("f", null,
            JSONObject.of("type", "object", "properties", JSONObject.of("a", JSONObject.of("type", "string"))));

    private static CanonicalRequest request(ReasoningConfig reasoning, List<ToolDefinition> tools, ToolChoice choice) {
        return new CanonicalRequest("m", List.of(CanonicalMessage.text(Role.USER, "hi")), tools, choice, reasoning,
                null, null, null, null, true);
    }

    private static BackendConfig backend(BackendCapabilities caps) {
        return new BackendConfig("test", Protocol.OPENAI, "http://localhost", null, null, Map.of(), caps);
    }

    @Test
    void shouldRejectReasoningOnBackendWithoutIt() {
        BackendCapabilities caps = new BackendCapabilities(false, true, EnumSet.allOf(ToolChoice.Mode.class),
                EnumSet.allOf(ToolChoice.Mode.class), SchemaDialect.OPENAI, true, false);

        assertThatThrownBy(() -> guard.prepare(request(ReasoningConfig.budget(1000), List.of(), null), backend(caps)))
                .isInstanceOf(UnsupportedCapabilityException.class)
                .hasMessageContaining("reasoning");
    }

    @Test
    void shouldRejectToolsOnBackendWithoutThem() {
        BackendCapabilities caps = new BackendCapabilities(true, false, EnumSet.allOf(ToolChoice.Mode.class),
                EnumSet.allOf(ToolChoice.Mode.class), SchemaDialect.OPENAI, true, false);

        assertThatThrownBy(() -> guard.prepare(request(ReasoningConfig.DISABLED, List.of(TOOL), null), backend(caps)))
                .isInstanceOf(UnsupportedCapabilityException.class)
                .hasMessageContaining("tools");
    }

    @Test
    void shouldRejectUnsupportedToolChoiceMode() {
        BackendCapabilities caps = new BackendCapabilities(true, true, EnumSet.of(ToolChoice.Mode.AUTO, ToolChoice.Mode.NONE),
                EnumSet.allOf(ToolChoice.Mode.class), SchemaDialect.OPENAI_COMPAT, true, false);

        assertThatThrownBy(() -> guard.prepare(request(ReasoningConfig.DISABLED, List.of(TOOL), ToolChoice.tool("f")), backend(caps)))
                .isInstanceOf(UnsupportedCapabilityException.class)
                .hasMessageContaining("tool_choice=tool");
    }

    @Test
    void shouldRewriteForcedChoiceToAutoWhenReasoning() {
        BackendCapabilities caps = BackendCapabilities.defaults(Protocol.ANTHROPIC);

        CapabilityGuard.Prepared prepared = guard.prepare(
                request(ReasoningConfig.budget(2000), List.of(TOOL), ToolChoice.of(ToolChoice.Mode.ANY)), backend(caps));

        assertThat(prepared.toolChoice()).isEqualTo(ToolChoice.AUTO);
        assertThat(prepared.reasoning()).isTrue();
    }

    @Test
    void shouldKeepChoiceWhenReasoningIsOff() {
        CapabilityGuard.Prepared prepared = guard.prepare(
                request(ReasoningConfig.DISABLED, List.of(TOOL), ToolChoice.tool("f")),
                backend(BackendCapabilities.defaults(Protocol.ANTHROPIC)));

        assertThat(prepared.toolChoice()).isEqualTo(ToolChoice.tool("f"));
        assertThat(prepared.tools()).extracting(ToolDefinition::name).containsExactly("f");
    }
}
