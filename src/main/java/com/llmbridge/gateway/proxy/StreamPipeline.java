package com.llmbridge.gateway.proxy;

import com.llmbridge.gateway.config.AppProperties;
import com.llmbridge.gateway.config.Protocol;
import com.llmbridge.gateway.dto.canonical.StreamEvent;
import com.llmbridge.gateway.stream.StreamDecoder;
import com.llmbridge.gateway.stream.StreamInterpreter;
import com.llmbridge.gateway.stream.StreamReconciler;
import com.llmbridge.gateway.stream.StreamSession;
import com.llmbridge.gateway.stream.ThinkingTagParser;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

/**
 * 后端字节流 → 规范化事件流
 * <p>
 * 分帧 → 协议解释 → 状态机，每次订阅新建一套状态。
 * 传输错误转为错误结束事件；输出 MessageFinish 后取消上游，释放后端连接
 */
@Component
public class StreamPipeline {

    private final AppProperties properties;

    public StreamPipeline(AppProperties properties) {
        this.properties = properties;
    }

    /**
     * @param body            后端响应体
     * @param contentType     后端响应 Content-Type，决定分帧方式
     * @param backendProtocol 后端协议
     * @param inlineThinking  推理以 &lt;think&gt; 标签内嵌在正文中
     * @param sessionId       日志用会话 id
     */
    public Flux<StreamEvent> events(Flux<byte[]> body, String contentType, Protocol backendProtocol,
                                    boolean inlineThinking, String sessionId) {
        return Flux.defer(() -> {
            StreamDecoder decoder = StreamDecoder.forContentType(contentType);
            StreamSession session = new StreamSession(sessionId,
                    properties.getLimits().getMaxThinkingChars(), properties.getLimits().getMaxBlocks());
            StreamReconciler reconciler = new StreamReconciler(session,
                    StreamInterpreter.forProtocol(backendProtocol),
                    inlineThinking ? new ThinkingTagParser() : null);

            return body.concatMapIterable(decoder::decode)
                    .concatWith(Flux.defer(() -> Flux.fromIterable(decoder.finish())))
                    .concatMapIterable(reconciler::accept)
                    .concatWith(Flux.defer(() -> Flux.fromIterable(reconciler.complete())))
                    .onErrorResume(e -> Flux.fromIterable(reconciler.fail(e)))
                    .takeUntil(event -> event instanceof StreamEvent.MessageFinish);
        });
    }
}
