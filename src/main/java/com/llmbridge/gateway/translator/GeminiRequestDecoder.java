package com.llmbridge.gateway.translator;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.llmbridge.gateway.config.Protocol;
import com.llmbridge.gateway.dto.canonical.CanonicalMessage;
import com.llmbridge.gateway.dto.canonical.CanonicalRequest;
import com.llmbridge.gateway.dto.canonical.ContentPart;
import com.llmbridge.gateway.dto.canonical.ReasoningConfig;
import com.llmbridge.gateway.dto.canonical.Role;
import com.llmbridge.gateway.dto.canonical.ToolCall;
import com.llmbridge.gateway.dto.canonical.ToolChoice;
import com.llmbridge.gateway.dto.canonical.ToolDefinition;
import com.llmbridge.gateway.exception.InvalidRequestException;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Gemini generateContent 请求解码
 * <p>
 * 模型名和是否流式来自 URL 路径，由调用方补上。
 * functionCall 没有 id 时按出现顺序生成，functionResponse 按名字配对最近一个未应答的调用
 */
@Component
public class GeminiRequestDecoder implements RequestDecoder {

    @Override
    public Protocol protocol() {
        return Protocol.GEMINI;
    }

    @Override
    public CanonicalRequest decode(JSONObject request) {
        JSONArray contents = TranslatorSupport.requireMessages(request, "contents");
        List<CanonicalMessage> messages = new ArrayList<>();

        String system = decodeSystem(request.get("systemInstruction"));
        if (!system.isEmpty()) {
            messages.add(CanonicalMessage.text(Role.SYSTEM, system));
        }

        Map<String, Deque<String>> unanswered = new HashMap<>();
        int generated = 0;
        for (int i = 0; i < contents.size(); i++) {
            JSONObject content = TranslatorSupport.requireObject(contents.get(i), "contents[" + i + "]");
            String roleValue = content.getString("role");
            Role role;
            if (roleValue == null || "user".equals(roleValue)) {
                role = Role.USER;
            } else if ("model".equals(roleValue)) {
                role = Role.ASSISTANT;
            } else {
                throw new InvalidRequestException("contents[" + i + "] 角色无效: " + roleValue);
            }

            List<ContentPart> parts = new ArrayList<>();
            JSONArray wireParts = content.getJSONArray("parts");
            if (wireParts != null) {
                for (Object item : wireParts) {
                    if (!(item instanceof JSONObject part)) continue;
                    if (part.get("functionCall") instanceof JSONObject fc) {
                        String name = TranslatorSupport.requireText(fc, "name", "functionCall");
                        String id = fc.getString("id");
                        if (id == null || id.isEmpty()) {
                            id = "call_" + (++generated);
                        }
                        unanswered.computeIfAbsent(name, k -> new ArrayDeque<>()).addLast(id);
                        parts.add(new ContentPart.ToolUse(new ToolCall(id, name,
                                TranslatorSupport.normalizeJsonObject(fc.get("args")).toJSONString())));
                    } else if (part.get("functionResponse") instanceof JSONObject fr) {
                        String name = TranslatorSupport.requireText(fr, "name", "functionResponse");
                        String id = fr.getString("id");
                        Deque<String> pending = unanswered.get(name);
                        if (id == null || id.isEmpty()) {
                            id = pending != null && !pending.isEmpty() ? pending.pollFirst() : "call_" + (++generated);
                        } else if (pending != null) {
                            pending.remove(id);
                        }
                        parts.add(new ContentPart.ToolResult(id, responseText(fr.get("response")), false));
                    } else if (part.getBooleanValue("thought", false)) {
                        parts.add(new ContentPart.Thinking(part.getString("text"), part.getString("thoughtSignature")));
                    } else if (part.containsKey("text")) {
                        parts.add(new ContentPart.Text(part.getString("text")));
                    } else if (part.containsKey("inlineData") || part.containsKey("fileData")) {
                        parts.add(new ContentPart.Text(TranslatorSupport.IMAGE_PLACEHOLDER));
                    }
                }
            }
            messages.add(CanonicalMessage.of(role, parts));
        }

        JSONObject generation = request.getJSONObject("generationConfig");
        if (generation == null) {
            generation = new JSONObject();
        }

        return new CanonicalRequest(
                null,
                messages,
                decodeTools(request.get("tools")),
                decodeToolChoice(request.getJSONObject("toolConfig")),
                decodeReasoning(generation.getJSONObject("thinkingConfig")),
                generation.getInteger("maxOutputTokens"),
                generation.getDouble("temperature"),
                generation.getDouble("topP"),
                decodeStops(generation.getJSONArray("stopSequences")),
                false);
    }

    // ==================== 辅助方法 ====================

    private String decodeSystem(Object value) {
        if (value instanceof String s) return s;
        if (value instanceof JSONObject obj) return TranslatorSupport.extractText(obj.get("parts"));
        return "";
    }

    /**
     * response 中常见的 {content: ...} / {result: ...} 取出文本，其余整体序列化
     */
    private String responseText(Object response) {
        if (response == null) return "";
        if (response instanceof JSONObject obj) {
            Object inner = obj.containsKey("content") ? obj.get("content") : obj.get("result");
            if (inner instanceof String s) return s;
            return obj.toJSONString();
        }
        return response.toString();
    }

    private List<ToolDefinition> decodeTools(Object value) {
        List<ToolDefinition> tools = new ArrayList<>();
        if (!(value instanceof JSONArray arr)) return tools;
        for (Object item : arr) {
            if (!(item instanceof JSONObject tool)) continue;
            JSONArray declarations = tool.getJSONArray("functionDeclarations");
            if (declarations == null) continue;
            for (Object d : declarations) {
                JSONObject decl = TranslatorSupport.requireObject(d, "functionDeclarations[]");
                Object schema = decl.containsKey("parameters") ? decl.get("parameters") : decl.get("parametersJsonSchema");
                tools.add(new ToolDefinition(
                        TranslatorSupport.requireText(decl, "name", "functionDeclarations[]"),
                        decl.getString("description"),
                        TranslatorSupport.defaultSchema(schema)));
            }
        }
        return tools;
    }

    private ToolChoice decodeToolChoice(JSONObject toolConfig) {
        if (toolConfig == null || !(toolConfig.get("functionCallingConfig") instanceof JSONObject config)) {
            return null;
        }
        String mode = config.getString("mode");
        if (mode == null) return null;
        return switch (mode.toUpperCase()) {
            case "NONE" -> ToolChoice.of(ToolChoice.Mode.NONE);
            case "ANY" -> {
                JSONArray allowed = config.getJSONArray("allowedFunctionNames");
                yield allowed != null && allowed.size() == 1
                        ? ToolChoice.tool(allowed.getString(0))
                        : ToolChoice.of(ToolChoice.Mode.ANY);
            }
            default -> ToolChoice.AUTO;
        };
    }

    private ReasoningConfig decodeReasoning(JSONObject thinking) {
        if (thinking == null) return ReasoningConfig.DISABLED;
        Integer budget = thinking.getInteger("thinkingBudget");
        boolean include = thinking.getBooleanValue("includeThoughts", false);
        if (budget != null && budget == 0) return ReasoningConfig.DISABLED;
        if (budget != null && budget > 0) return ReasoningConfig.budget(budget);
        String level = thinking.getString("thinkingLevel");
        if (level != null) return ReasoningConfig.effort(level.toLowerCase());
        return include ? new ReasoningConfig(true, null, null) : ReasoningConfig.DISABLED;
    }

    private List<String> decodeStops(JSONArray value) {
        List<String> stops = new ArrayList<>();
        if (value == null) return stops;
        for (Object item : value) {
            if (item != null) stops.add(item.toString());
        }
        return stops;
    }
}
