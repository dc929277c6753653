package com.llmbridge.gateway.stream;

import com.alibaba.fastjson2.JSONObject;
import com.llmbridge.gateway.dto.canonical.FinishReason;
import com.llmbridge.gateway.dto.canonical.Usage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Anthropic Messages 流事件解释
 * <p>
 * 后端自带的 signature_delta 不透传，thinking 块的签名在关闭时重新生成
 */
public class AnthropicStreamInterpreter implements StreamInterpreter {

    private static final Logger log = LoggerFactory.getLogger(AnthropicStreamInterpreter.class);

    // 当前响应中属于 tool_use 的块 index
    private final Set<Integer> toolBlocks = new HashSet<>();

    @Override
    public List<UpstreamFragment> interpret(StreamRecord record) {
        String data = record.data() == null ? "" : record.data().trim();
        if (data.isEmpty()) {
            return List.of();
        }
        JSONObject json = StreamInterpreter.parseJson(data);
        String type = json.getString("type");
        if (type == null) {
            type = record.event();
        }
        if (type == null) {
            return List.of();
        }

        List<UpstreamFragment> fragments = new ArrayList<>();
        switch (type) {
            case "message_start" -> {
                JSONObject message = json.getJSONObject("message");
                if (message != null && message.get("usage") instanceof JSONObject usage) {
                    fragments.add(new UpstreamFragment.UsageUpdate(readUsage(usage)));
                }
            }
            case "content_block_start" -> onBlockStart(json, fragments);
            case "content_block_delta" -> onBlockDelta(json, fragments);
            case "content_block_stop" -> {
                int index = json.getIntValue("index", 0);
                if (toolBlocks.remove(index)) {
                    fragments.add(new UpstreamFragment.ToolCallEnd(ref(index)));
                }
            }
            case "message_delta" -> {
                JSONObject delta = json.getJSONObject("delta");
                if (delta != null && delta.getString("stop_reason") != null) {
                    fragments.add(new UpstreamFragment.FinishSignal(mapStopReason(delta.getString("stop_reason"))));
                }
                if (json.get("usage") instanceof JSONObject usage) {
                    fragments.add(new UpstreamFragment.UsageUpdate(readUsage(usage)));
                }
            }
            case "message_stop" -> fragments.add(new UpstreamFragment.EndOfMessage());
            case "error" -> {
                JSONObject error = json.get("error") instanceof JSONObject e ? e : new JSONObject();
                fragments.add(new UpstreamFragment.ErrorSignal(error.getString("message")));
            }
            case "ping" -> {
            }
            default -> log.debug("未知事件类型: {}", type);
        }
        return fragments;
    }

    private void onBlockStart(JSONObject json, List<UpstreamFragment> fragments) {
        int index = json.getIntValue("index", 0);
        JSONObject block = json.getJSONObject("content_block");
        if (block == null) {
            return;
        }
        switch (String.valueOf(block.getString("type"))) {
            case "text" -> {
                String text = block.getString("text");
                if (text != null && !text.isEmpty()) {
                    fragments.add(new UpstreamFragment.Text(text));
                }
            }
            case "thinking" -> {
                String thinking = block.getString("thinking");
                if (thinking != null && !thinking.isEmpty()) {
                    fragments.add(new UpstreamFragment.Reasoning(thinking));
                }
            }
            case "tool_use", "server_tool_use" -> {
                toolBlocks.add(index);
                JSONObject input = block.get("input") instanceof JSONObject i ? i : null;
                String initial = input != null && !input.isEmpty() ? input.toJSONString() : "";
                fragments.add(new UpstreamFragment.ToolCallDelta(ref(index), block.getString("id"), block.getString("name"), initial));
            }
            default -> log.debug("忽略内容块类型: {}", block.getString("type"));
        }
    }

    private void onBlockDelta(JSONObject json, List<UpstreamFragment> fragments) {
        int index = json.getIntValue("index", 0);
        JSONObject delta = json.getJSONObject("delta");
        if (delta == null) {
            return;
        }
        switch (String.valueOf(delta.getString("type"))) {
            case "text_delta" -> fragments.add(new UpstreamFragment.Text(delta.getString("text")));
            case "thinking_delta" -> fragments.add(new UpstreamFragment.Reasoning(delta.getString("thinking")));
            case "input_json_delta" -> fragments.add(new UpstreamFragment.ToolCallDelta(ref(index), null, null, delta.getString("partial_json")));
            case "signature_delta" -> {
            }
            default -> log.debug("忽略 delta 类型: {}", delta.getString("type"));
        }
    }

    private static String ref(int index) {
        return "block:" + index;
    }

    private static Usage readUsage(JSONObject usage) {
        return new Usage(usage.getIntValue("input_tokens", 0), usage.getIntValue("output_tokens", 0));
    }

    static FinishReason mapStopReason(String stopReason) {
        return switch (stopReason) {
            case "max_tokens", "model_context_window_exceeded" -> FinishReason.LENGTH;
            case "tool_use" -> FinishReason.TOOL_USE;
            case "refusal" -> FinishReason.CONTENT_FILTER;
            default -> FinishReason.STOP;
        };
    }
}
