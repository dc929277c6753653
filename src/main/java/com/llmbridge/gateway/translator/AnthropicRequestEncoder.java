package com.llmbridge.gateway.translator;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.llmbridge.gateway.config.BackendConfig;
import com.llmbridge.gateway.config.Protocol;
import com.llmbridge.gateway.dto.canonical.CanonicalMessage;
import com.llmbridge.gateway.dto.canonical.CanonicalRequest;
import com.llmbridge.gateway.dto.canonical.ContentPart;
import com.llmbridge.gateway.dto.canonical.Role;
import com.llmbridge.gateway.dto.canonical.ToolChoice;
import com.llmbridge.gateway.dto.canonical.ToolDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Anthropic Messages 请求编码
 * <p>
 * 历史中的 thinking 块不回传：签名由网关生成，Anthropic 校验不通过
 */
@Component
public class AnthropicRequestEncoder implements RequestEncoder {

    private static final Logger log = LoggerFactory.getLogger(AnthropicRequestEncoder.class);

    static final String API_VERSION = "2023-06-01";
    private static final int DEFAULT_MAX_TOKENS = 8192;
    private static final int MIN_THINKING_BUDGET = 1024;

    private final CapabilityGuard guard;

    public AnthropicRequestEncoder(CapabilityGuard guard) {
        this.guard = guard;
    }

    @Override
    public Protocol protocol() {
        return Protocol.ANTHROPIC;
    }

    @Override
    public WireRequest encode(CanonicalRequest request, BackendConfig backend) {
        CapabilityGuard.Prepared prepared = guard.prepare(request, backend);
        List<CanonicalMessage> messages = backend.capabilities().systemInstruction()
                ? request.messages()
                : TranslatorSupport.inlineSystem(request.messages());

        JSONObject body = new JSONObject();
        body.put("model", request.model());
        body.put("stream", true);

        String system = TranslatorSupport.systemText(messages);
        if (!system.isEmpty()) {
            body.put("system", system);
        }
        body.put("messages", encodeMessages(messages));

        if (!prepared.tools().isEmpty()) {
            body.put("tools", encodeTools(prepared.tools()));
        }
        if (prepared.toolChoice() != null && !prepared.tools().isEmpty()) {
            body.put("tool_choice", encodeToolChoice(prepared.toolChoice()));
        }

        int maxTokens = request.maxTokens() != null ? request.maxTokens() : DEFAULT_MAX_TOKENS;
        if (prepared.reasoning()) {
            int budget = Math.max(MIN_THINKING_BUDGET, request.reasoning().resolveBudget(MIN_THINKING_BUDGET * 8));
            if (maxTokens <= budget) {
                log.debug("max_tokens={} 不大于 thinking 预算 {}，已上调", maxTokens, budget);
                maxTokens = budget + DEFAULT_MAX_TOKENS;
            }
            body.put("thinking", JSONObject.of("type", "enabled", "budget_tokens", budget));
            // 开启 thinking 时 temperature / top_p 不可自定义
        } else {
            putIfNotNull(body, "temperature", request.temperature());
            putIfNotNull(body, "top_p", request.topP());
        }
        body.put("max_tokens", maxTokens);
        if (!request.stopSequences().isEmpty()) {
            body.put("stop_sequences", request.stopSequences());
        }

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Content-Type", "application/json");
        headers.put("anthropic-version", API_VERSION);
        if (backend.credential() != null && !backend.credential().isEmpty()) {
            headers.put("x-api-key", backend.credential());
        }
        headers.putAll(backend.headers());

        return new WireRequest(backend.baseUrl() + "/messages", headers, body);
    }

    private JSONArray encodeMessages(List<CanonicalMessage> messages) {
        JSONArray wire = new JSONArray();
        for (CanonicalMessage message : messages) {
            if (message.role() == Role.SYSTEM) continue;

            JSONArray content = new JSONArray();
            for (ContentPart part : message.content()) {
                if (part instanceof ContentPart.Text t) {
                    if (t.text() != null && !t.text().isEmpty()) {
                        content.add(JSONObject.of("type", "text", "text", t.text()));
                    }
                } else if (part instanceof ContentPart.ToolUse u) {
                    content.add(JSONObject.of(
                            "type", "tool_use", //
                            "id", u.call().id(), //
                            "name", u.call().name(), //
                            "input", TranslatorSupport.parseArguments(u.call().argumentsJsonText()) //
                    ));
                } else if (part instanceof ContentPart.ToolResult r) {
                    JSONObject block = JSONObject.of(
                            "type", "tool_result", //
                            "tool_use_id", r.toolCallId(), //
                            "content", r.content() == null ? "" : r.content() //
                    );
                    if (r.isError()) {
                        block.put("is_error", true);
                    }
                    content.add(block);
                }
            }

            String role = message.role() == Role.ASSISTANT ? "assistant" : "user";
            TranslatorSupport.appendMerged(wire, role, content, "role", "content");
        }
        return wire;
    }

    private JSONArray encodeTools(List<ToolDefinition> tools) {
        JSONArray wire = new JSONArray();
        for (ToolDefinition tool : tools) {
            JSONObject item = JSONObject.of("name", tool.name(), "input_schema", TranslatorSupport.defaultSchema(tool.parametersSchema()));
            if (tool.description() != null) {
                item.put("description", tool.description());
            }
            wire.add(item);
        }
        return wire;
    }

    private JSONObject encodeToolChoice(ToolChoice choice) {
        return switch (choice.mode()) {
            case AUTO -> JSONObject.of("type", "auto");
            case NONE -> JSONObject.of("type", "none");
            case ANY -> JSONObject.of("type", "any");
            case TOOL -> JSONObject.of("type", "tool", "name", choice.toolName());
        };
    }

    private static void putIfNotNull(JSONObject body, String key, Object value) {
        if (value != null) {
            body.put(key, value);
        }
    }
}
