package com.llmbridge.gateway.stream;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.llmbridge.gateway.dto.canonical.FinishReason;
import com.llmbridge.gateway.dto.canonical.Usage;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Gemini generateContent 流记录解释
 * <p>
 * candidates[0].content.parts[]：text 为正文，thought=true 为推理，
 * functionCall 一次性给出完整调用（参数序列化后立即结束该调用）
 */
public class GeminiStreamInterpreter implements StreamInterpreter {

    private int callCounter;

    @Override
    public List<UpstreamFragment> interpret(StreamRecord record) {
        String data = record.data() == null ? "" : record.data().trim();
        if (data.isEmpty()) {
            return List.of();
        }
        JSONObject json = StreamInterpreter.parseJson(data);
        List<UpstreamFragment> fragments = new ArrayList<>();

        if (json.get("error") instanceof JSONObject error) {
            fragments.add(new UpstreamFragment.ErrorSignal(error.getString("message")));
            return fragments;
        }

        if (json.get("candidates") instanceof JSONArray candidates && !candidates.isEmpty()
                && candidates.get(0) instanceof JSONObject candidate) {
            JSONObject content = candidate.getJSONObject("content");
            if (content != null && content.get("parts") instanceof JSONArray parts) {
                for (Object p : parts) {
                    if (p instanceof JSONObject part) {
                        readPart(part, fragments);
                    }
                }
            }
            String finishReason = candidate.getString("finishReason");
            if ("MALFORMED_FUNCTION_CALL".equals(finishReason)) {
                fragments.add(new UpstreamFragment.ErrorSignal("后端生成了格式错误的函数调用: "
                        + candidate.getString("finishMessage")));
            } else if (finishReason != null && !finishReason.isEmpty() && !"FINISH_REASON_UNSPECIFIED".equals(finishReason)) {
                fragments.add(new UpstreamFragment.FinishSignal(mapFinishReason(finishReason)));
            }
        }

        if (json.get("usageMetadata") instanceof JSONObject usage) {
            fragments.add(new UpstreamFragment.UsageUpdate(new Usage(
                    usage.getIntValue("promptTokenCount", 0),
                    usage.getIntValue("candidatesTokenCount", 0) + usage.getIntValue("thoughtsTokenCount", 0))));
        }
        return fragments;
    }

    private void readPart(JSONObject part, List<UpstreamFragment> fragments) {
        if (part.get("functionCall") instanceof JSONObject call) {
            String ref = "call:" + callCounter++;
            String id = call.getString("id");
            if (id == null || id.isEmpty()) {
                id = "call_" + UUID.randomUUID().toString().replace("-", "").substring(0, 24);
            }
            JSONObject args = call.get("args") instanceof JSONObject a ? a : new JSONObject();
            fragments.add(new UpstreamFragment.ToolCallDelta(ref, id, call.getString("name"), args.toJSONString()));
            fragments.add(new UpstreamFragment.ToolCallEnd(ref));
            return;
        }
        String text = part.getString("text");
        if (text == null || text.isEmpty()) {
            return;
        }
        if (part.getBooleanValue("thought", false)) {
            fragments.add(new UpstreamFragment.Reasoning(text));
        } else {
            fragments.add(new UpstreamFragment.Text(text));
        }
    }

    static FinishReason mapFinishReason(String reason) {
        return switch (reason) {
            case "MAX_TOKENS" -> FinishReason.LENGTH;
            case "SAFETY", "RECITATION", "BLOCKLIST", "PROHIBITED_CONTENT", "SPII", "IMAGE_SAFETY" -> FinishReason.CONTENT_FILTER;
            default -> FinishReason.STOP;
        };
    }
}
