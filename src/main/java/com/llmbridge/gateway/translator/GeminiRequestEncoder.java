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
 * Gemini streamGenerateContent 请求编码
 * <p>
 * functionResponse 需要函数名，按 tool_call_id 往前查找对应调用；找不到时降级为文本
 */
@Component
public class GeminiRequestEncoder implements RequestEncoder {

    private static final Logger log = LoggerFactory.getLogger(GeminiRequestEncoder.class);

    private static final int DEFAULT_THINKING_BUDGET = 8192;

    private final CapabilityGuard guard;

    public GeminiRequestEncoder(CapabilityGuard guard) {
        this.guard = guard;
    }

    @Override
    public Protocol protocol() {
        return Protocol.GEMINI;
    }

    @Override
    public WireRequest encode(CanonicalRequest request, BackendConfig backend) {
        CapabilityGuard.Prepared prepared = guard.prepare(request, backend);
        boolean systemSlot = backend.capabilities().systemInstruction();
        List<CanonicalMessage> messages = systemSlot
                ? request.messages()
                : TranslatorSupport.inlineSystem(request.messages());

        JSONObject body = new JSONObject();
        body.put("contents", encodeContents(messages));

        String system = TranslatorSupport.systemText(messages);
        if (!system.isEmpty()) {
            body.put("systemInstruction", JSONObject.of("parts", JSONArray.of(JSONObject.of("text", system))));
        }

        if (!prepared.tools().isEmpty()) {
            body.put("tools", JSONArray.of(JSONObject.of("functionDeclarations", encodeTools(prepared.tools()))));
            if (prepared.toolChoice() != null) {
                body.put("toolConfig", JSONObject.of("functionCallingConfig", encodeToolChoice(prepared.toolChoice())));
            }
        }

        JSONObject generation = new JSONObject();
        if (request.temperature() != null) generation.put("temperature", request.temperature());
        if (request.topP() != null) generation.put("topP", request.topP());
        if (request.maxTokens() != null) generation.put("maxOutputTokens", request.maxTokens());
        if (!request.stopSequences().isEmpty()) generation.put("stopSequences", request.stopSequences());
        if (prepared.reasoning()) {
            generation.put("thinkingConfig", JSONObject.of(
                    "includeThoughts", true, //
                    "thinkingBudget", request.reasoning().resolveBudget(DEFAULT_THINKING_BUDGET) //
            ));
        }
        if (!generation.isEmpty()) {
            body.put("generationConfig", generation);
        }

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Content-Type", "application/json");
        if (backend.credential() != null && !backend.credential().isEmpty()) {
            headers.put("x-goog-api-key", backend.credential());
        }
        headers.putAll(backend.headers());

        String url = backend.baseUrl() + "/models/" + request.model() + ":streamGenerateContent?alt=sse";
        return new WireRequest(url, headers, body);
    }

    private JSONArray encodeContents(List<CanonicalMessage> messages) {
        JSONArray contents = new JSONArray();
        for (int i = 0; i < messages.size(); i++) {
            CanonicalMessage message = messages.get(i);
            if (message.role() == Role.SYSTEM) {
                continue;
            }
            JSONArray parts = new JSONArray();
            for (ContentPart part : message.content()) {
                if (part instanceof ContentPart.Text t) {
                    if (t.text() != null && !t.text().isEmpty()) {
                        parts.add(JSONObject.of("text", t.text()));
                    }
                } else if (part instanceof ContentPart.ToolUse u) {
                    parts.add(JSONObject.of("functionCall", JSONObject.of(
                            "name", u.call().name(), //
                            "args", TranslatorSupport.parseArguments(u.call().argumentsJsonText()) //
                    )));
                } else if (part instanceof ContentPart.ToolResult r) {
                    parts.add(encodeToolResult(messages, i, r));
                }
                // 推理内容不回传
            }
            String role = message.role() == Role.ASSISTANT ? "model" : "user";
            TranslatorSupport.appendMerged(contents, role, parts, "role", "parts");
        }
        return contents;
    }

    private JSONObject encodeToolResult(List<CanonicalMessage> messages, int index, ContentPart.ToolResult result) {
        String content = result.content() == null ? "" : result.content();
        String name = TranslatorSupport.findToolName(messages, index, result.toolCallId());
        if (name == null) {
            log.warn("找不到 tool_call_id={} 对应的调用，工具结果降级为文本", result.toolCallId());
            return JSONObject.of("text", "[tool result " + result.toolCallId() + "] " + content);
        }
        return JSONObject.of("functionResponse", JSONObject.of(
                "name", name, //
                "response", JSONObject.of("name", name, "content", content) //
        ));
    }

    private JSONArray encodeTools(List<ToolDefinition> tools) {
        JSONArray declarations = new JSONArray();
        for (ToolDefinition tool : tools) {
            JSONObject decl = JSONObject.of("name", tool.name(), "parameters", TranslatorSupport.defaultSchema(tool.parametersSchema()));
            if (tool.description() != null) {
                decl.put("description", tool.description());
            }
            declarations.add(decl);
        }
        return declarations;
    }

    private JSONObject encodeToolChoice(ToolChoice choice) {
        return switch (choice.mode()) {
            case AUTO -> JSONObject.of("mode", "AUTO");
            case NONE -> JSONObject.of("mode", "NONE");
            case ANY -> JSONObject.of("mode", "ANY");
            case TOOL -> JSONObject.of("mode", "ANY", "allowedFunctionNames", JSONArray.of(choice.toolName()));
        };
    }
}
