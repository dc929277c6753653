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

import java.util.ArrayList;
import java.util.List;

/**
 * OpenAI Chat Completions 请求解码
 */
@Component
public class OpenAiRequestDecoder implements RequestDecoder {

    @Override
    public Protocol protocol() {
        return Protocol.OPENAI;
    }

    @Override
    public CanonicalRequest decode(JSONObject request) {
        JSONArray wireMessages = TranslatorSupport.requireMessages(request, "messages");
        List<CanonicalMessage> messages = new ArrayList<>();

        for (int i = 0; i < wireMessages.size(); i++) {
            JSONObject msg = TranslatorSupport.requireObject(wireMessages.get(i), "messages[" + i + "]");
            String role = String.valueOf(msg.getString("role"));
            switch (role) {
                case "system", "developer" -> messages.add(CanonicalMessage.text(Role.SYSTEM, TranslatorSupport.extractText(msg.get("content"))));
                case "user" -> messages.add(CanonicalMessage.of(Role.USER, decodeUserContent(msg.get("content"))));
                case "assistant" -> messages.add(CanonicalMessage.of(Role.ASSISTANT, decodeAssistant(msg, i)));
                case "tool" -> {
                    String toolCallId = TranslatorSupport.requireText(msg, "tool_call_id", "messages[" + i + "]");
                    messages.add(new CanonicalMessage(Role.TOOL,
                            List.of(new ContentPart.ToolResult(toolCallId, TranslatorSupport.extractText(msg.get("content")), false)),
                            toolCallId));
                }
                default -> throw new InvalidRequestException("messages[" + i + "] 角色无效: " + role);
            }
        }

        Integer maxTokens = request.getInteger("max_completion_tokens");
        if (maxTokens == null) {
            maxTokens = request.getInteger("max_tokens");
        }

        return new CanonicalRequest(
                request.getString("model"),
                messages,
                decodeTools(request.get("tools")),
                decodeToolChoice(request.get("tool_choice")),
                decodeReasoning(request),
                maxTokens,
                request.getDouble("temperature"),
                request.getDouble("top_p"),
                decodeStop(request.get("stop")),
                request.getBooleanValue("stream", false));
    }

    // ==================== 辅助方法 ====================

    private List<ContentPart> decodeUserContent(Object content) {
        List<ContentPart> parts = new ArrayList<>();
        if (content == null) return parts;
        if (content instanceof String s) {
            parts.add(new ContentPart.Text(s));
            return parts;
        }
        if (content instanceof JSONArray arr) {
            for (Object item : arr) {
                if (!(item instanceof JSONObject block)) continue;
                String type = block.getString("type");
                if ("text".equals(type)) {
                    parts.add(new ContentPart.Text(block.getString("text")));
                } else if ("image_url".equals(type) || "input_audio".equals(type) || "file".equals(type)) {
                    parts.add(new ContentPart.Text(TranslatorSupport.IMAGE_PLACEHOLDER));
                }
            }
        }
        return parts;
    }

    private List<ContentPart> decodeAssistant(JSONObject msg, int index) {
        List<ContentPart> parts = new ArrayList<>();
        String reasoning = msg.getString("reasoning_content");
        if (reasoning != null && !reasoning.isEmpty()) {
            parts.add(new ContentPart.Thinking(reasoning, null));
        }
        String text = TranslatorSupport.extractText(msg.get("content"));
        if (!text.isEmpty()) {
            parts.add(new ContentPart.Text(text));
        }
        if (msg.get("tool_calls") instanceof JSONArray toolCalls) {
            for (Object item : toolCalls) {
                JSONObject call = TranslatorSupport.requireObject(item, "messages[" + index + "].tool_calls[]");
                JSONObject function = TranslatorSupport.requireObject(call.get("function"), "tool_calls[].function");
                Object arguments = function.get("arguments");
                String argumentsText = arguments instanceof JSONObject obj ? obj.toJSONString()
                        : arguments == null ? "{}" : arguments.toString();
                parts.add(new ContentPart.ToolUse(new ToolCall(
                        TranslatorSupport.requireText(call, "id", "tool_calls[]"),
                        TranslatorSupport.requireText(function, "name", "tool_calls[].function"),
                        argumentsText)));
            }
        }
        return parts;
    }

    private List<ToolDefinition> decodeTools(Object value) {
        List<ToolDefinition> tools = new ArrayList<>();
        if (!(value instanceof JSONArray arr)) return tools;
        for (Object item : arr) {
            if (!(item instanceof JSONObject tool)) continue;
            JSONObject function = tool.get("function") instanceof JSONObject f ? f : tool;
            tools.add(new ToolDefinition(
                    TranslatorSupport.requireText(function, "name", "tools[].function"),
                    function.getString("description"),
                    TranslatorSupport.defaultSchema(function.get("parameters"))));
        }
        return tools;
    }

    private ToolChoice decodeToolChoice(Object value) {
        if (value == null) return null;
        if (value instanceof String s) {
            return switch (s) {
                case "none" -> ToolChoice.of(ToolChoice.Mode.NONE);
                case "required" -> ToolChoice.of(ToolChoice.Mode.ANY);
                default -> ToolChoice.AUTO;
            };
        }
        if (value instanceof JSONObject choice && choice.get("function") instanceof JSONObject function) {
            return ToolChoice.tool(TranslatorSupport.requireText(function, "name", "tool_choice.function"));
        }
        return ToolChoice.AUTO;
    }

    private ReasoningConfig decodeReasoning(JSONObject request) {
        String effort = request.getString("reasoning_effort");
        if (effort == null && request.get("reasoning") instanceof JSONObject reasoning) {
            effort = reasoning.getString("effort");
        }
        if (effort == null || effort.isEmpty() || "none".equals(effort)) {
            return ReasoningConfig.DISABLED;
        }
        return ReasoningConfig.effort(effort);
    }

    private List<String> decodeStop(Object value) {
        List<String> stops = new ArrayList<>();
        if (value instanceof String s) {
            stops.add(s);
        } else if (value instanceof JSONArray arr) {
            for (Object item : arr) {
                if (item != null) stops.add(item.toString());
            }
        }
        return stops;
    }
}
