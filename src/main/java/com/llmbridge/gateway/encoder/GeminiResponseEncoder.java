package com.llmbridge.gateway.encoder;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.llmbridge.gateway.config.Protocol;
import com.llmbridge.gateway.dto.canonical.BlockKind;
import com.llmbridge.gateway.dto.canonical.CanonicalResponse;
import com.llmbridge.gateway.dto.canonical.ContentPart;
import com.llmbridge.gateway.dto.canonical.FinishReason;
import com.llmbridge.gateway.dto.canonical.StreamEvent;
import com.llmbridge.gateway.dto.canonical.Usage;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Gemini generateContent 响应编码
 * <p>
 * 文本和推理逐片输出为 parts；functionCall 必须是完整参数，工具块结束时一次性输出。
 * alt=sse 时每个 chunk 一条 data 记录，否则整体是一个逐步写出的 JSON 数组
 */
public class GeminiResponseEncoder implements ResponseEncoder {

    private final String responseId;
    private final String model;
    private final boolean sse;

    private boolean firstWritten;
    // 尚未输出任何文本的文本块
    private final Set<Integer> emptyTextBlocks = new HashSet<>();
    private final Map<Integer, PendingCall> pendingCalls = new HashMap<>();

    public GeminiResponseEncoder(String responseId, String model, boolean sse) {
        this.responseId = responseId;
        this.model = model;
        this.sse = sse;
    }

    @Override
    public Protocol protocol() {
        return Protocol.GEMINI;
    }

    @Override
    public String contentType() {
        return sse ? "text/event-stream" : "application/json";
    }

    @Override
    public List<String> encode(StreamEvent event) {
        List<String> out = new ArrayList<>();

        if (event instanceof StreamEvent.BlockStart start && start.kind() == BlockKind.TEXT) {
            emptyTextBlocks.add(start.index());
        } else if (event instanceof StreamEvent.TextDelta d) {
            emptyTextBlocks.remove(d.index());
            out.add(frame(chunk(JSONObject.of("text", d.text()))));
        } else if (event instanceof StreamEvent.ThinkingDelta d) {
            out.add(frame(chunk(JSONObject.of("text", d.text(), "thought", true))));
        } else if (event instanceof StreamEvent.BlockStart start && start.kind() == BlockKind.TOOL_USE) {
            pendingCalls.put(start.index(), new PendingCall(start.toolCallId(), start.toolName(), new StringBuilder()));
        } else if (event instanceof StreamEvent.ToolArgumentDelta d) {
            PendingCall call = pendingCalls.get(d.index());
            if (call != null) {
                call.arguments().append(d.fragment());
            }
        } else if (event instanceof StreamEvent.BlockStop stop) {
            // 空文本块也要输出一个 part，保证响应至少有一段内容
            if (emptyTextBlocks.remove(stop.index())) {
                out.add(frame(chunk(JSONObject.of("text", ""))));
            }
            PendingCall call = pendingCalls.remove(stop.index());
            if (call != null) {
                out.add(frame(chunk(functionCall(call.id(), call.name(), call.arguments().toString()))));
            }
        } else if (event instanceof StreamEvent.MessageFinish finish) {
            if (finish.isError()) {
                out.add(frame(JSONObject.of("error", JSONObject.of( //
                        "code", 500, //
                        "message", finish.errorMessage(), //
                        "status", "INTERNAL"))));
            } else {
                JSONObject candidate = JSONObject.of("finishReason", finishReason(finish.reason()), "index", 0);
                JSONObject last = JSONObject.of("candidates", JSONArray.of(candidate), //
                        "usageMetadata", usage(finish.usage()), //
                        "modelVersion", model, //
                        "responseId", responseId);
                out.add(frame(last));
            }
            if (!sse) {
                out.add("]");
            }
        }
        return out;
    }

    @Override
    public String encodeResponse(CanonicalResponse response) {
        JSONArray parts = new JSONArray();
        for (ContentPart part : response.content()) {
            if (part instanceof ContentPart.Thinking t) {
                parts.add(JSONObject.of("text", t.thinking(), "thought", true));
            } else if (part instanceof ContentPart.Text t) {
                parts.add(JSONObject.of("text", t.text()));
            } else if (part instanceof ContentPart.ToolUse u) {
                parts.add(functionCall(u.call().id(), u.call().name(), u.call().argumentsJsonText()));
            }
        }
        JSONObject candidate = JSONObject.of("content", JSONObject.of("role", "model", "parts", parts), //
                "finishReason", finishReason(response.finishReason()), //
                "index", 0);
        return JSONObject.of("candidates", JSONArray.of(candidate), //
                "usageMetadata", usage(response.usage()), //
                "modelVersion", response.model(), //
                "responseId", response.id()).toJSONString();
    }

    public static String finishReason(FinishReason reason) {
        return switch (reason) {
            case LENGTH, SAFETY_LIMIT -> "MAX_TOKENS";
            case CONTENT_FILTER -> "SAFETY";
            case STOP, TOOL_USE, ERROR -> "STOP";
        };
    }

    // ==================== 辅助方法 ====================

    private JSONObject functionCall(String id, String name, String arguments) {
        return JSONObject.of("functionCall", JSONObject.of( //
                "id", id, //
                "name", name, //
                "args", EncoderSupport.parseArguments(arguments)));
    }

    private JSONObject chunk(JSONObject part) {
        JSONObject candidate = JSONObject.of("content", JSONObject.of("role", "model", "parts", JSONArray.of(part)), "index", 0);
        return JSONObject.of("candidates", JSONArray.of(candidate), "modelVersion", model, "responseId", responseId);
    }

    private JSONObject usage(Usage usage) {
        Usage u = usage != null ? usage : Usage.EMPTY;
        return JSONObject.of("promptTokenCount", u.inputTokens(), //
                "candidatesTokenCount", u.outputTokens(), //
                "totalTokenCount", u.totalTokens());
    }

    private String frame(JSONObject obj) {
        if (sse) {
            return "data: " + obj.toJSONString() + "\r\n\r\n";
        }
        String prefix = firstWritten ? ",\r\n" : "[";
        firstWritten = true;
        return prefix + obj.toJSONString();
    }

    private record PendingCall(String id, String name, StringBuilder arguments) {
    }
}
