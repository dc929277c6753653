package com.llmbridge.gateway.stream;

import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.llmbridge.gateway.config.Protocol;
import com.llmbridge.gateway.exception.UnparseableChunkException;

import java.util.List;

/**
 * 把某个后端协议的原生记录翻译为 {@link UpstreamFragment}
 * <p>
 * 实例带有单次响应内的状态，不可跨请求共享
 */
public interface StreamInterpreter {

    /**
     * @throws UnparseableChunkException 该记录无法解析，调用方跳过并继续
     */
    List<UpstreamFragment> interpret(StreamRecord record);

    static StreamInterpreter forProtocol(Protocol protocol) {
        return switch (protocol) {
            case ANTHROPIC -> new AnthropicStreamInterpreter();
            case OPENAI -> new OpenAiStreamInterpreter();
            case GEMINI -> new GeminiStreamInterpreter();
        };
    }

    static JSONObject parseJson(String data) {
        try {
            JSONObject json = JSONObject.parseObject(data);
            if (json == null) {
                throw new UnparseableChunkException("空记录");
            }
            return json;
        } catch (JSONException e) {
            String preview = data.length() > 200 ? data.substring(0, 200) + "..." : data;
            throw new UnparseableChunkException("JSON 解析失败: " + preview, e);
        }
    }
}
