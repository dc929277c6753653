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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Anthropic Messages 请求解码
 */
@Component
public class AnthropicRequestDecoder implements RequestDecoder {

    private static final Logger log = LoggerFactory.getLogger(AnthropicRequestDecoder.class);

    @Override
    public Protocol protocol() {
        return Protocol.ANTHROPIC;
    }

    @Override
    public CanonicalRequest decode(JSONObject request) {
        JSONArray wireMessages = TranslatorSupport.requireMessages(request, "messages");
        List<CanonicalMessage> messages = new ArrayList<>();

        String system = extractSystemPrompt(request);
        if (!system.isEmpty()) {
            messages.add(CanonicalMessage.text(Role.SYSTEM, system));
        }

        for (int i = 0; i < wireMessages.size(); i++) {
            JSONObject msg = TranslatorSupport.requireObject(wireMessages.get(i), "messages[" + i + "]");
            String role = msg.getString("role");
            Role canonicalRole = switch (String.valueOf(role)) {
                case "user" -> Role.USER;
                case "assistant" -> Role.ASSISTANT;
                default -> throw new InvalidRequestException("messages[" + i + "] 角色无效: " + role);
            };
            messages.add(CanonicalMessage.of(canonicalRole, decodeContent(msg.get("content"), i)));
        }

        return new CanonicalRequest(
                request.getString("model"),
                messages,
                decodeTools(request.get("tools")),
                decodeToolChoice(request.get("tool_choice")),
                decodeThinking(request.get("thinking")),
                request.getInteger("max_tokens"),
                request.getDouble("temperature"),
                request.getDouble("top_p"),
                decodeStopSequences(request.get("stop_sequences")),
                request.getBooleanValue("stream", false));
    }

    // ==================== 辅助方法 ====================

    private String extractSystemPrompt(JSONObject request) {
        Object system = request.get("system");
        if (system == null) return "";
        return TranslatorSupport.extractText(system);
    }

    private List<ContentPart> decodeContent(Object content, int messageIndex) {
        List<ContentPart> parts = new ArrayList<>();
        if (content == null) return parts;
        if (content instanceof String s) {
            parts.add(new ContentPart.Text(s));
            return parts;
        }
        if (!(content instanceof JSONArray blocks)) {
            throw new InvalidRequestException("messages[" + messageIndex + "].content 格式无效");
        }

        for (Object item : blocks) {
            if (!(item instanceof JSONObject block)) continue;
            String type = String.valueOf(block.getString("type"));
            switch (type) {
                case "text" -> parts.add(new ContentPart.Text(block.getString("text")));
                case "thinking" -> parts.add(new ContentPart.Thinking(block.getString("thinking"), block.getString("signature")));
                case "tool_use" -> parts.add(new ContentPart.ToolUse(new ToolCall(
                        TranslatorSupport.requireText(block, "id", "tool_use"),
                        TranslatorSupport.requireText(block, "name", "tool_use"),
                        TranslatorSupport.normalizeJsonObject(block.get("input")).toJSONString())));
                case "tool_result" -> parts.add(new ContentPart.ToolResult(
                        TranslatorSupport.requireText(block, "tool_use_id", "tool_result"),
                        TranslatorSupport.extractText(block.get("content")),
                        block.getBooleanValue("is_error", false)));
                case "image", "document" -> parts.add(new ContentPart.Text(TranslatorSupport.IMAGE_PLACEHOLDER));
                case "redacted_thinking" -> {
                }
                default -> log.debug("忽略内容块类型: {}", type);
            }
        }
        return parts;
    }

    private List<ToolDefinition> decodeTools(Object value) {
        List<ToolDefinition> tools = new ArrayList<>();
        if (!(value instanceof JSONArray arr)) return tools;
        for (Object item : arr) {
            if (!(item instanceof JSONObject tool)) continue;
            String type = tool.getString("type");
            // 服务端工具（web_search 等）没有 input_schema，无法转发
            if (type != null && !"custom".equals(type)) {
                log.debug("跳过服务端工具: {}", type);
                continue;
            }
            tools.add(new ToolDefinition(
                    TranslatorSupport.requireText(tool, "name", "tools[]"),
                    tool.getString("description"),
                    TranslatorSupport.defaultSchema(tool.get("input_schema"))));
        }
        return tools;
    }

    private ToolChoice decodeToolChoice(Object value) {
        if (!(value instanceof JSONObject choice)) return null;
        return switch (String.valueOf(choice.getString("type"))) {
            case "any" -> ToolChoice.of(ToolChoice.Mode.ANY);
            case "none" -> ToolChoice.of(ToolChoice.Mode.NONE);
            case "tool" -> ToolChoice.tool(TranslatorSupport.requireText(choice, "name", "tool_choice"));
            default -> ToolChoice.AUTO;
        };
    }

    private ReasoningConfig decodeThinking(Object value) {
        if (!(value instanceof JSONObject thinking)) return ReasoningConfig.DISABLED;
        String type = thinking.getString("type");
        if ("enabled".equals(type)) {
            Integer budget = thinking.getInteger("budget_tokens");
            return new ReasoningConfig(true, budget, null);
        }
        if ("adaptive".equals(type)) {
            return ReasoningConfig.effort("medium");
        }
        return ReasoningConfig.DISABLED;
    }

    private List<String> decodeStopSequences(Object value) {
        List<String> stops = new ArrayList<>();
        if (value instanceof JSONArray arr) {
            for (Object item : arr) {
                if (item != null) stops.add(item.toString());
            }
        }
        return stops;
    }
}
