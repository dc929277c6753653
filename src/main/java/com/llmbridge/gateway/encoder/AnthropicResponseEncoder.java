package com.llmbridge.gateway.encoder;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.alibaba.fastjson2.JSONWriter;
import com.llmbridge.gateway.config.Protocol;
import com.llmbridge.gateway.dto.canonical.BlockKind;
import com.llmbridge.gateway.dto.canonical.CanonicalResponse;
import com.llmbridge.gateway.dto.canonical.ContentPart;
import com.llmbridge.gateway.dto.canonical.FinishReason;
import com.llmbridge.gateway.dto.canonical.StreamEvent;
import com.llmbridge.gateway.dto.canonical.Usage;

import java.util.ArrayList;
import java.util.List;

/**
 * Anthropic Messages 响应编码
 * <p>
 * 事件序列：message_start → (content_block_start → content_block_delta* → content_block_stop)* →
 * message_delta → message_stop；会话出错时以 error 事件结束
 */
public class AnthropicResponseEncoder implements ResponseEncoder {

    private final String messageId;
    private final String model;
    private boolean started;

    public AnthropicResponseEncoder(String messageId, String model) {
        this.messageId = messageId;
        this.model = model;
    }

    @Override
    public Protocol protocol() {
        return Protocol.ANTHROPIC;
    }

    @Override
    public String contentType() {
        return "text/event-stream";
    }

    @Override
    public List<String> encode(StreamEvent event) {
        List<String> out = new ArrayList<>();
        if (!started) {
            started = true;
            out.add(frame("message_start", JSONObject.of("type", "message_start", "message", messageStart())));
        }

        if (event instanceof StreamEvent.BlockStart start) {
            out.add(frame("content_block_start", JSONObject.of("type", "content_block_start", //
                    "index", start.index(), //
                    "content_block", blockStart(start))));
        } else if (event instanceof StreamEvent.TextDelta delta) {
            out.add(blockDelta(delta.index(), JSONObject.of("type", "text_delta", "text", delta.text())));
        } else if (event instanceof StreamEvent.ThinkingDelta delta) {
            out.add(blockDelta(delta.index(), JSONObject.of("type", "thinking_delta", "thinking", delta.text())));
        } else if (event instanceof StreamEvent.ThinkingSignature sig) {
            out.add(blockDelta(sig.index(), JSONObject.of("type", "signature_delta", "signature", sig.signature())));
        } else if (event instanceof StreamEvent.ToolArgumentDelta delta) {
            out.add(blockDelta(delta.index(), JSONObject.of("type", "input_json_delta", "partial_json", delta.fragment())));
        } else if (event instanceof StreamEvent.BlockStop stop) {
            out.add(frame("content_block_stop", JSONObject.of("type", "content_block_stop", "index", stop.index())));
        } else if (event instanceof StreamEvent.MessageFinish finish) {
            if (finish.isError()) {
                out.add(frame("error", JSONObject.of("type", "error", //
                        "error", JSONObject.of("type", "api_error", "message", finish.errorMessage()))));
                return out;
            }
            JSONObject delta = new JSONObject();
            delta.put("stop_reason", stopReason(finish.reason()));
            delta.put("stop_sequence", null);
            out.add(frame("message_delta", JSONObject.of("type", "message_delta", //
                    "delta", delta, //
                    "usage", usage(finish.usage()))));
            out.add(frame("message_stop", JSONObject.of("type", "message_stop")));
        }
        return out;
    }

    @Override
    public String encodeResponse(CanonicalResponse response) {
        JSONArray content = new JSONArray();
        for (ContentPart part : response.content()) {
            if (part instanceof ContentPart.Thinking t) {
                content.add(JSONObject.of("type", "thinking", "thinking", t.thinking(), "signature", t.signature()));
            } else if (part instanceof ContentPart.Text t) {
                content.add(JSONObject.of("type", "text", "text", t.text()));
            } else if (part instanceof ContentPart.ToolUse u) {
                content.add(JSONObject.of("type", "tool_use", //
                        "id", u.call().id(), //
                        "name", u.call().name(), //
                        "input", EncoderSupport.parseArguments(u.call().argumentsJsonText())));
            }
        }

        JSONObject body = new JSONObject();
        body.put("id", response.id());
        body.put("type", "message");
        body.put("role", "assistant");
        body.put("model", response.model());
        body.put("content", content);
        body.put("stop_reason", stopReason(response.finishReason()));
        body.put("stop_sequence", null);
        body.put("usage", usage(response.usage()));
        return body.toJSONString(JSONWriter.Feature.WriteMapNullValue);
    }

    public static String stopReason(FinishReason reason) {
        return switch (reason) {
            case LENGTH, SAFETY_LIMIT -> "max_tokens";
            case TOOL_USE -> "tool_use";
            case CONTENT_FILTER -> "refusal";
            case STOP, ERROR -> "end_turn";
        };
    }

    // ==================== 辅助方法 ====================

    private JSONObject messageStart() {
        JSONObject message = new JSONObject();
        message.put("id", messageId);
        message.put("type", "message");
        message.put("role", "assistant");
        message.put("model", model);
        message.put("content", new JSONArray());
        message.put("stop_reason", null);
        message.put("stop_sequence", null);
        message.put("usage", usage(Usage.EMPTY));
        return message;
    }

    private JSONObject blockStart(StreamEvent.BlockStart start) {
        if (start.kind() == BlockKind.THINKING) {
            return JSONObject.of("type", "thinking", "thinking", "");
        }
        if (start.kind() == BlockKind.TOOL_USE) {
            return JSONObject.of("type", "tool_use", //
                    "id", start.toolCallId(), //
                    "name", start.toolName(), //
                    "input", new JSONObject());
        }
        return JSONObject.of("type", "text", "text", "");
    }

    private String blockDelta(int index, JSONObject delta) {
        return frame("content_block_delta", JSONObject.of("type", "content_block_delta", "index", index, "delta", delta));
    }

    private JSONObject usage(Usage usage) {
        Usage u = usage != null ? usage : Usage.EMPTY;
        return JSONObject.of("input_tokens", u.inputTokens(), "output_tokens", u.outputTokens());
    }

    private String frame(String eventType, JSONObject data) {
        return "event: " + eventType + "\ndata: " + data.toJSONString(JSONWriter.Feature.WriteMapNullValue) + "\n\n";
    }
}
