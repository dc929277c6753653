package com.llmbridge.gateway.encoder;

import com.llmbridge.gateway.config.Protocol;
import com.llmbridge.gateway.dto.canonical.CanonicalResponse;
import com.llmbridge.gateway.dto.canonical.StreamEvent;

import java.util.List;

/**
 * 规范化事件 → 客户端协议的线上格式
 * <p>
 * 实例有状态，每个请求创建一个；{@link #encode} 返回已成帧的文本记录，可直接写给客户端
 */
public interface ResponseEncoder {

    Protocol protocol();

    /**
     * 流式响应的 Content-Type
     */
    String contentType();

    List<String> encode(StreamEvent event);

    /**
     * 非流式响应体
     */
    String encodeResponse(CanonicalResponse response);

    /**
     * @param sessionId 会话 id，各协议按惯例加前缀作为消息 id
     * @param model     回显给客户端的模型名
     * @param sse       仅 Gemini 有意义：true 为 SSE，false 为流式 JSON 数组
     */
    static ResponseEncoder create(Protocol protocol, String sessionId, String model, boolean sse) {
        String id = messageId(protocol, sessionId);
        return switch (protocol) {
            case ANTHROPIC -> new AnthropicResponseEncoder(id, model);
            case OPENAI -> new OpenAiResponseEncoder(id, model);
            case GEMINI -> new GeminiResponseEncoder(id, model, sse);
        };
    }

    static String messageId(Protocol protocol, String sessionId) {
        return switch (protocol) {
            case ANTHROPIC -> "msg_" + sessionId;
            case OPENAI -> "chatcmpl-" + sessionId;
            case GEMINI -> sessionId;
        };
    }
}
