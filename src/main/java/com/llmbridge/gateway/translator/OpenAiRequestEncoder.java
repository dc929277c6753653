package com.llmbridge.gateway.translator;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.llmbridge.gateway.config.BackendConfig;
import com.llmbridge.gateway.config.Protocol;
import com.llmbridge.gateway.dto.canonical.CanonicalMessage;
import com.llmbridge.gateway.dto.canonical.CanonicalRequest;
import com.llmbridge.gateway.dto.canonical.ContentPart;
import com.llmbridge.gateway.dto.canonical.Role;
import com.llmbridge.gateway.dto.canonical.ToolCall;
import com.llmbridge.gateway.dto.canonical.ToolChoice;
import com.llmbridge.gateway.dto.canonical.ToolDefinition;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI Chat Completions 请求编码
 * <p>
 * 用户消息中的 tool_result 拆成独立的 tool 消息，顺序不变；历史推理内容不回传
 */
@Component
public class OpenAiRequestEncoder implements RequestEncoder {

    private final CapabilityGuard guard;

    public OpenAiRequestEncoder(CapabilityGuard guard) {
        this.guard = guard;
    }

    @Override
    public Protocol protocol() {
        return Protocol.OPENAI;
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
        body.put("stream_options", JSONObject.of("include_usage", true));
        body.put("messages", encodeMessages(messages));

        if (!prepared.tools().isEmpty()) {
            body.put("tools", encodeTools(prepared.tools()));
            if (prepared.toolChoice() != null) {
                body.put("tool_choice", encodeToolChoice(prepared.toolChoice()));
            }
        }

        if (prepared.reasoning()) {
            // 推理模型不接受 temperature / top_p，max_tokens 改用 max_completion_tokens
            body.put("reasoning_effort", request.reasoning().resolveEffort());
            if (request.maxTokens() != null) {
                body.put("max_completion_tokens", request.maxTokens());
            }
        } else {
            if (request.maxTokens() != null) body.put("max_tokens", request.maxTokens());
            if (request.temperature() != null) body.put("temperature", request.temperature());
            if (request.topP() != null) body.put("top_p", request.topP());
        }
        if (!request.stopSequences().isEmpty()) {
            body.put("stop", request.stopSequences());
        }

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Content-Type", "application/json");
        if (backend.credential() != null && !backend.credential().isEmpty()) {
            headers.put("Authorization", "Bearer " + backend.credential());
        }
        headers.putAll(backend.headers());

        return new WireRequest(backend.baseUrl() + "/chat/completions", headers, body);
    }

    private JSONArray encodeMessages(List<CanonicalMessage> messages) {
        JSONArray wire = new JSONArray();
        for (CanonicalMessage message : messages) {
            switch (message.role()) {
                case SYSTEM -> wire.add(JSONObject.of("role", "system", "content", message.textContent()));
                case ASSISTANT -> wire.add(encodeAssistant(message));
                case USER, TOOL -> encodeUserOrTool(message, wire);
            }
        }
        return wire;
    }

    private JSONObject encodeAssistant(CanonicalMessage message) {
        JSONObject msg = new JSONObject();
        msg.put("role", "assistant");
        String text = message.textContent();
        List<ToolCall> toolCalls = message.toolCalls();
        msg.put("content", text.isEmpty() && !toolCalls.isEmpty() ? null : text);
        if (!toolCalls.isEmpty()) {
            JSONArray calls = new JSONArray();
            for (ToolCall call : toolCalls) {
                calls.add(JSONObject.of(
                        "id", call.id(), //
                        "type", "function", //
                        "function", JSONObject.of("name", call.name(), "arguments", call.argumentsJsonText()) //
                ));
            }
            msg.put("tool_calls", calls);
        }
        return msg;
    }

    /**
     * 文本累积为 user 消息，遇到 tool_result 时先输出已累积的文本
     */
    private void encodeUserOrTool(CanonicalMessage message, JSONArray wire) {
        StringBuilder text = new StringBuilder();
        boolean hasText = false;
        for (ContentPart part : message.content()) {
            if (part instanceof ContentPart.ToolResult r) {
                if (hasText) {
                    wire.add(JSONObject.of("role", "user", "content", text.toString()));
                    text.setLength(0);
                    hasText = false;
                }
                String toolCallId = r.toolCallId() != null ? r.toolCallId() : message.toolCallId();
                wire.add(JSONObject.of("role", "tool", "tool_call_id", toolCallId, "content", r.content() == null ? "" : r.content()));
            } else if (part instanceof ContentPart.Text t) {
                if (hasText) text.append("\n");
                text.append(t.text());
                hasText = true;
            }
        }
        if (hasText) {
            wire.add(JSONObject.of("role", "user", "content", text.toString()));
        }
    }

    private JSONArray encodeTools(List<ToolDefinition> tools) {
        JSONArray wire = new JSONArray();
        for (ToolDefinition tool : tools) {
            JSONObject function = JSONObject.of("name", tool.name(), "parameters", TranslatorSupport.defaultSchema(tool.parametersSchema()));
            if (tool.description() != null) {
                function.put("description", tool.description());
            }
            wire.add(JSONObject.of("type", "function", "function", function));
        }
        return wire;
    }

    private Object encodeToolChoice(ToolChoice choice) {
        return switch (choice.mode()) {
            case AUTO -> "auto";
            case NONE -> "none";
            case ANY -> "required";
            case TOOL -> JSONObject.of("type", "function", "function", JSONObject.of("name", choice.toolName()));
        };
    }
}
