package com.llmbridge.gateway.encoder;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.alibaba.fastjson2.JSONWriter;
import com.llmbridge.gateway.config.Protocol;
import com.llmbridge.gateway.dto.canonical.BlockKind;
import com.llmbridge.gateway.dto.canonical.CanonicalResponse;
import com.llmbridge.gateway.dto.canonical.FinishReason;
import com.llmbridge.gateway.dto.canonical.StreamEvent;
import com.llmbridge.gateway.dto.canonical.ToolCall;
import com.llmbridge.gateway.dto.canonical.Usage;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI Chat Completions 响应编码
 * <p>
 * 块边界不需要成帧；工具调用按出现顺序编号，参数片段以 tool_calls[index] 追加。
 * 结束时先发带 finish_reason 和 usage 的末尾 chunk，再发 [DONE]
 */
public class OpenAiResponseEncoder implements ResponseEncoder {

    private static final String DONE = "data: [DONE]\n\n";

    private final String id;
    private final String model;
    private final long created = System.currentTimeMillis() / 1000;

    private boolean roleSent;
    // 块序号 → tool_calls 数组下标
    private final Map<Integer, Integer> toolPositions = new HashMap<>();

    public OpenAiResponseEncoder(String id, String model) {
        this.id = id;
        this.model = model;
    }

    @Override
    public Protocol protocol() {
        return Protocol.OPENAI;
    }

    @Override
    public String contentType() {
        return "text/event-stream";
    }

    @Override
    public List<String> encode(StreamEvent event) {
        List<String> out = new ArrayList<>();

        if (event instanceof StreamEvent.MessageFinish finish) {
            if (finish.isError()) {
                out.add(data(JSONObject.of("error", JSONObject.of( //
                        "message", finish.errorMessage(), //
                        "type", "api_error"))));
                out.add(DONE);
                return out;
            }
            if (!roleSent) {
                out.add(data(chunk(roleDelta(), null)));
                roleSent = true;
            }
            JSONObject last = chunk(new JSONObject(), finishReason(finish.reason()));
            last.put("usage", usage(finish.usage()));
            out.add(data(last));
            out.add(DONE);
            return out;
        }

        JSONObject delta = delta(event);
        if (delta == null) {
            return out;
        }
        if (!roleSent) {
            delta.put("role", "assistant");
            roleSent = true;
        }
        out.add(data(chunk(delta, null)));
        return out;
    }

    @Override
    public String encodeResponse(CanonicalResponse response) {
        JSONObject message = new JSONObject();
        message.put("role", "assistant");
        String text = response.text();
        List<ToolCall> toolCalls = response.toolCalls();
        message.put("content", text.isEmpty() && !toolCalls.isEmpty() ? null : text);
        String thinking = response.thinking();
        if (!thinking.isEmpty()) {
            message.put("reasoning_content", thinking);
        }
        if (!toolCalls.isEmpty()) {
            JSONArray calls = new JSONArray();
            for (ToolCall call : toolCalls) {
                calls.add(JSONObject.of("id", call.id(), //
                        "type", "function", //
                        "function", JSONObject.of("name", call.name(), "arguments", call.argumentsJsonText())));
            }
            message.put("tool_calls", calls);
        }

        JSONObject choice = JSONObject.of("index", 0, "message", message, "finish_reason", finishReason(response.finishReason()));
        JSONObject body = JSONObject.of("id", response.id(), //
                "object", "chat.completion", //
                "created", created, //
                "model", response.model());
        body.put("choices", JSONArray.of(choice));
        body.put("usage", usage(response.usage()));
        return body.toJSONString(JSONWriter.Feature.WriteMapNullValue);
    }

    public static String finishReason(FinishReason reason) {
        return switch (reason) {
            case LENGTH, SAFETY_LIMIT -> "length";
            case TOOL_USE -> "tool_calls";
            case CONTENT_FILTER -> "content_filter";
            case STOP, ERROR -> "stop";
        };
    }

    // ==================== 辅助方法 ====================

    /**
     * 事件 → choices[0].delta，无需输出时返回 null
     */
    private JSONObject delta(StreamEvent event) {
        if (event instanceof StreamEvent.TextDelta d) {
            return JSONObject.of("content", d.text());
        }
        if (event instanceof StreamEvent.ThinkingDelta d) {
            return JSONObject.of("reasoning_content", d.text());
        }
        if (event instanceof StreamEvent.BlockStart start && start.kind() == BlockKind.TOOL_USE) {
            int position = toolPositions.size();
            toolPositions.put(start.index(), position);
            JSONObject call = JSONObject.of("index", position, //
                    "id", start.toolCallId(), //
                    "type", "function", //
                    "function", JSONObject.of("name", start.toolName(), "arguments", ""));
            return JSONObject.of("tool_calls", JSONArray.of(call));
        }
        if (event instanceof StreamEvent.ToolArgumentDelta d) {
            Integer position = toolPositions.get(d.index());
            if (position == null) {
                return null;
            }
            JSONObject call = JSONObject.of("index", position, "function", JSONObject.of("arguments", d.fragment()));
            return JSONObject.of("tool_calls", JSONArray.of(call));
        }
        // 块开始/结束、签名在该协议中没有对应帧
        return null;
    }

    private JSONObject roleDelta() {
        return JSONObject.of("role", "assistant", "content", "");
    }

    private JSONObject chunk(JSONObject delta, String finishReason) {
        JSONObject choice = new JSONObject();
        choice.put("index", 0);
        choice.put("delta", delta);
        choice.put("finish_reason", finishReason);
        JSONObject chunk = JSONObject.of("id", id, //
                "object", "chat.completion.chunk", //
                "created", created, //
                "model", model);
        chunk.put("choices", JSONArray.of(choice));
        return chunk;
    }

    private JSONObject usage(Usage usage) {
        Usage u = usage != null ? usage : Usage.EMPTY;
        return JSONObject.of("prompt_tokens", u.inputTokens(), //
                "completion_tokens", u.outputTokens(), //
                "total_tokens", u.totalTokens());
    }

    private String data(JSONObject obj) {
        return "data: " + obj.toJSONString(JSONWriter.Feature.WriteMapNullValue) + "\n\n";
    }
}
