package com.llmbridge.gateway.stream;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.llmbridge.gateway.dto.canonical.FinishReason;
import com.llmbridge.gateway.dto.canonical.Usage;

import java.util.ArrayList;
import java.util.List;

/**
 * OpenAI chat.completion.chunk 记录解释
 * <p>
 * 推理内容兼容 reasoning_content / reasoning / thinking.content 三种写法；
 * 工具调用以 tool_calls[].index 区分，[DONE] 表示结束
 */
public class OpenAiStreamInterpreter implements StreamInterpreter {

    @Override
    public List<UpstreamFragment> interpret(StreamRecord record) {
        String data = record.data() == null ? "" : record.data().trim();
        if (data.isEmpty()) {
            return List.of();
        }
        if ("[DONE]".equals(data)) {
            return List.of(new UpstreamFragment.EndOfMessage());
        }

        JSONObject json = StreamInterpreter.parseJson(data);
        List<UpstreamFragment> fragments = new ArrayList<>();

        if (json.get("error") instanceof JSONObject error) {
            fragments.add(new UpstreamFragment.ErrorSignal(error.getString("message")));
            return fragments;
        }

        JSONArray choices = json.get("choices") instanceof JSONArray arr ? arr : null;
        if (choices != null && !choices.isEmpty() && choices.get(0) instanceof JSONObject choice) {
            JSONObject delta = choice.get("delta") instanceof JSONObject d ? d
                    : choice.get("message") instanceof JSONObject m ? m : null;
            if (delta != null) {
                readDelta(delta, fragments);
            }
            String finishReason = choice.getString("finish_reason");
            if (finishReason != null && !finishReason.isEmpty()) {
                fragments.add(new UpstreamFragment.FinishSignal(mapFinishReason(finishReason)));
            }
        }

        if (json.get("usage") instanceof JSONObject usage) {
            fragments.add(new UpstreamFragment.UsageUpdate(new Usage(
                    usage.getIntValue("prompt_tokens", 0),
                    usage.getIntValue("completion_tokens", 0))));
        }
        return fragments;
    }

    private void readDelta(JSONObject delta, List<UpstreamFragment> fragments) {
        String reasoning = delta.getString("reasoning_content");
        if (reasoning == null && delta.get("reasoning") instanceof String r) {
            reasoning = r;
        }
        if (reasoning == null && delta.get("thinking") instanceof JSONObject thinking) {
            reasoning = thinking.getString("content");
        }
        if (reasoning != null && !reasoning.isEmpty()) {
            fragments.add(new UpstreamFragment.Reasoning(reasoning));
        }

        if (delta.get("content") instanceof String content && !content.isEmpty()) {
            fragments.add(new UpstreamFragment.Text(content));
        }

        if (delta.get("tool_calls") instanceof JSONArray toolCalls) {
            for (int i = 0; i < toolCalls.size(); i++) {
                if (!(toolCalls.get(i) instanceof JSONObject call)) {
                    continue;
                }
                int index = call.getIntValue("index", i);
                JSONObject function = call.get("function") instanceof JSONObject f ? f : new JSONObject();
                fragments.add(new UpstreamFragment.ToolCallDelta(
                        "tool:" + index,
                        call.getString("id"),
                        function.getString("name"),
                        function.getString("arguments")));
            }
        }
    }

    static FinishReason mapFinishReason(String reason) {
        return switch (reason) {
            case "length" -> FinishReason.LENGTH;
            case "tool_calls", "function_call" -> FinishReason.TOOL_USE;
            case "content_filter" -> FinishReason.CONTENT_FILTER;
            default -> FinishReason.STOP;
        };
    }
}
