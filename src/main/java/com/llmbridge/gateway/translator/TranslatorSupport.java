package com.llmbridge.gateway.translator;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.llmbridge.gateway.dto.canonical.CanonicalMessage;
import com.llmbridge.gateway.dto.canonical.ContentPart;
import com.llmbridge.gateway.dto.canonical.Role;
import com.llmbridge.gateway.dto.canonical.ToolCall;
import com.llmbridge.gateway.exception.InvalidRequestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 各协议转换共用的辅助方法
 */
final class TranslatorSupport {

    private static final Logger log = LoggerFactory.getLogger(TranslatorSupport.class);

    static final String IMAGE_PLACEHOLDER = "[image]";

    private TranslatorSupport() {
    }

    static JSONArray requireMessages(JSONObject request, String field) {
        if (!(request.get(field) instanceof JSONArray messages) || messages.isEmpty()) {
            throw new InvalidRequestException(field + " 不能为空");
        }
        return messages;
    }

    static JSONObject requireObject(Object value, String what) {
        if (value instanceof JSONObject obj) {
            return obj;
        }
        throw new InvalidRequestException(what + " 必须是 JSON 对象");
    }

    static String requireText(JSONObject obj, String field, String what) {
        String value = obj.getString(field);
        if (value == null || value.isEmpty()) {
            throw new InvalidRequestException(what + " 缺少 " + field);
        }
        return value;
    }

    /**
     * 字符串或 [{type:text, text}] 数组 → 纯文本
     */
    static String extractText(Object content) {
        if (content == null) return "";
        if (content instanceof String s) return s;
        if (content instanceof JSONArray arr) {
            StringBuilder sb = new StringBuilder();
            for (Object item : arr) {
                if (item instanceof JSONObject block && block.containsKey("text")) {
                    if (!sb.isEmpty()) sb.append("\n");
                    sb.append(block.getString("text"));
                } else if (item instanceof String s) {
                    if (!sb.isEmpty()) sb.append("\n");
                    sb.append(s);
                }
            }
            return sb.toString();
        }
        return String.valueOf(content);
    }

    static JSONObject normalizeJsonObject(Object value) {
        if (value == null) return new JSONObject();
        if (value instanceof JSONObject jo) return jo;
        if (value instanceof String s) return parseArguments(s);
        return new JSONObject();
    }

    /**
     * 工具参数文本 → JSON 对象；非法时降级为空对象
     */
    static JSONObject parseArguments(String argumentsJsonText) {
        if (argumentsJsonText == null || argumentsJsonText.isBlank()) {
            return new JSONObject();
        }
        try {
            JSONObject parsed = JSONObject.parseObject(argumentsJsonText);
            return parsed != null ? parsed : new JSONObject();
        } catch (JSONException e) {
            log.warn("工具参数不是合法 JSON，按空对象处理: {}", argumentsJsonText);
            return new JSONObject();
        }
    }

    static JSONObject defaultSchema(Object schema) {
        if (schema instanceof JSONObject obj && !obj.isEmpty()) {
            return obj;
        }
        return JSONObject.of("type", "object", "properties", new JSONObject());
    }

    /**
     * 所有 system 消息的文本，按出现顺序以空行连接
     */
    static String systemText(List<CanonicalMessage> messages) {
        List<String> parts = new ArrayList<>();
        for (CanonicalMessage message : messages) {
            if (message.role() == Role.SYSTEM) {
                String text = message.textContent();
                if (!text.isEmpty()) {
                    parts.add(text);
                }
            }
        }
        return String.join("\n\n", parts);
    }

    /**
     * 后端没有独立系统提示字段时，把 system 文本并入第一个用户轮次开头
     */
    static List<CanonicalMessage> inlineSystem(List<CanonicalMessage> messages) {
        String system = systemText(messages);
        List<CanonicalMessage> result = new ArrayList<>();
        boolean inlined = system.isEmpty();
        for (CanonicalMessage message : messages) {
            if (message.role() == Role.SYSTEM) {
                continue;
            }
            if (!inlined && message.role() == Role.USER) {
                List<ContentPart> content = new ArrayList<>();
                content.add(new ContentPart.Text(system));
                content.addAll(message.content());
                result.add(CanonicalMessage.of(Role.USER, content));
                inlined = true;
                continue;
            }
            result.add(message);
        }
        if (!inlined) {
            result.add(0, CanonicalMessage.text(Role.USER, system));
        }
        return result;
    }

    /**
     * 从第 beforeIndex 条消息往前查找 id 对应的工具名，找不到返回 null
     */
    static String findToolName(List<CanonicalMessage> messages, int beforeIndex, String toolCallId) {
        if (toolCallId == null) {
            return null;
        }
        for (int i = Math.min(beforeIndex, messages.size()) - 1; i >= 0; i--) {
            for (ToolCall call : messages.get(i).toolCalls()) {
                if (toolCallId.equals(call.id())) {
                    return call.name();
                }
            }
        }
        return null;
    }

    /**
     * 角色相同的相邻消息合并为一条（content 数组拼接）
     */
    static void appendMerged(JSONArray wireMessages, String role, JSONArray content, String roleKey, String contentKey) {
        if (content.isEmpty()) {
            return;
        }
        if (!wireMessages.isEmpty() && wireMessages.get(wireMessages.size() - 1) instanceof JSONObject last
                && role.equals(last.getString(roleKey))) {
            last.getJSONArray(contentKey).addAll(content);
            return;
        }
        wireMessages.add(JSONObject.of(roleKey, role, contentKey, content));
    }
}
