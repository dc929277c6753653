package com.llmbridge.gateway.proxy;

import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.llmbridge.gateway.config.AppProperties;
import com.llmbridge.gateway.config.BackendConfig;
import com.llmbridge.gateway.config.Protocol;
import com.llmbridge.gateway.dto.canonical.CanonicalRequest;
import com.llmbridge.gateway.dto.canonical.ReasoningConfig;
import com.llmbridge.gateway.dto.canonical.StreamEvent;
import com.llmbridge.gateway.encoder.ResponseAggregator;
import com.llmbridge.gateway.encoder.ResponseEncoder;
import com.llmbridge.gateway.exception.BackendTransportException;
import com.llmbridge.gateway.exception.InvalidRequestException;
import com.llmbridge.gateway.model.ModelResolver;
import com.llmbridge.gateway.translator.RequestDecoder;
import com.llmbridge.gateway.translator.RequestEncoder;
import com.llmbridge.gateway.translator.WireRequest;
import com.llmbridge.gateway.util.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferFactory;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 请求转发主流程
 * <p>
 * 客户端请求解码 → 模型路由 → 后端请求编码 → 发送 → 流式状态机 → 按客户端协议编码写回。
 * 后端始终以流式调用，非流式请求在网关内聚合
 */
@Service
public class ProxyService {

    private static final Logger log = LoggerFactory.getLogger(ProxyService.class);

    private final Map<Protocol, RequestDecoder> decoders = new EnumMap<>(Protocol.class);
    private final Map<Protocol, RequestEncoder> encoders = new EnumMap<>(Protocol.class);
    private final ModelResolver modelResolver;
    private final BackendClient backendClient;
    private final StreamPipeline pipeline;
    private final AppProperties properties;

    public ProxyService(List<RequestDecoder> decoders, List<RequestEncoder> encoders,
                        ModelResolver modelResolver, BackendClient backendClient,
                        StreamPipeline pipeline, AppProperties properties) {
        decoders.forEach(d -> this.decoders.put(d.protocol(), d));
        encoders.forEach(e -> this.encoders.put(e.protocol(), e));
        this.modelResolver = modelResolver;
        this.backendClient = backendClient;
        this.pipeline = pipeline;
        this.properties = properties;
    }

    /**
     * 处理一次客户端请求
     *
     * @param clientProtocol 客户端协议
     * @param body           原始请求体
     * @param pathModel      Gemini 模型名来自路径，其余协议为 null
     * @param pathStream     Gemini 是否流式来自路径，其余协议为 null
     * @param sse            流式输出是否用 SSE（仅 Gemini 可能为 false）
     */
    public Mono<Void> handle(Protocol clientProtocol, String body, String pathModel, Boolean pathStream,
                             boolean sse, ServerWebExchange exchange) {
        Dispatch dispatch = prepare(clientProtocol, body, pathModel, pathStream);
        long startTime = System.currentTimeMillis();
        BackendConfig backend = dispatch.route().backend();

        log.info("[{}] {} → {}({}) model={} → {} stream={} reasoning={}", dispatch.sessionId(),
                clientProtocol.value(), backend.name(), backend.protocol().value(),
                dispatch.route().requestedModel(), dispatch.route().upstreamModel(),
                dispatch.request().stream(), dispatch.request().reasoning().enabled());

        final StreamEvent.MessageFinish[] finish = {null};
        return backendClient.open(backend, dispatch.wireRequest())
                .flatMap(response -> {
                    Flux<StreamEvent> events = pipeline.events(response.body(), response.contentType(),
                                    backend.protocol(), backend.capabilities().inlineThinkingTags(), dispatch.sessionId())
                            .doOnNext(event -> {
                                if (event instanceof StreamEvent.MessageFinish f) {
                                    finish[0] = f;
                                }
                            });
                    ResponseEncoder encoder = ResponseEncoder.create(clientProtocol, dispatch.sessionId(), dispatch.echoModel(), sse);
                    return dispatch.request().stream()
                            ? writeStream(exchange, events, encoder, dispatch.sessionId())
                            : writeJson(exchange, events, encoder, dispatch);
                })
                .doFinally(signal -> {
                    long latency = System.currentTimeMillis() - startTime;
                    boolean success = finish[0] != null && !finish[0].isError();
                    int in = finish[0] != null ? finish[0].usage().inputTokens() : 0;
                    int out = finish[0] != null ? finish[0].usage().outputTokens() : 0;
                    String reason = finish[0] != null ? finish[0].reason().value() : "none";
                    Metrics.instance().recordRequest(clientProtocol.value(), backend.name(), reason, success, latency, in, out);
                    log.info("[{}] 请求结束: signal={}, finish={}, 耗时 {}ms, tokens in={} out={}", dispatch.sessionId(), signal,
                            reason, latency, in, out);
                });
    }

    /**
     * 解码、路由、编码，不发网络请求
     */
    Dispatch prepare(Protocol clientProtocol, String body, String pathModel, Boolean pathStream) {
        JSONObject json = parseBody(body);
        CanonicalRequest request = decoders.get(clientProtocol).decode(json);
        if (pathModel != null) {
            request = request.withModel(pathModel);
        }
        if (pathStream != null) {
            request = request.withStream(pathStream);
        }

        ModelResolver.Route route = modelResolver.resolve(request.model());
        if (route.thinking() && !request.reasoning().enabled()) {
            request = request.withReasoning(ReasoningConfig.budget(properties.getThinking().getDefaultBudgetTokens()));
        }
        CanonicalRequest upstream = request.withModel(route.upstreamModel());
        BackendConfig backend = route.backend();
        WireRequest wire = encoders.get(backend.protocol()).encode(upstream, backend);

        String sessionId = UUID.randomUUID().toString().replace("-", "").substring(0, 24);
        String echoModel = request.model() != null && !request.model().isEmpty() ? request.model() : route.upstreamModel();
        return new Dispatch(sessionId, route, upstream, wire, echoModel);
    }

    // ==================== 流式响应 ====================

    private Mono<Void> writeStream(ServerWebExchange exchange, Flux<StreamEvent> events,
                                   ResponseEncoder encoder, String sessionId) {
        ServerHttpResponse response = exchange.getResponse();
        response.getHeaders().setContentType(MediaType.parseMediaType(encoder.contentType()));
        response.getHeaders().setCacheControl("no-cache");
        DataBufferFactory bufferFactory = response.bufferFactory();

        Flux<String> records = events.concatMapIterable(encoder::encode)
                .doOnCancel(() -> log.info("[{}] 客户端断开，已取消后端读取", sessionId));
        return response.writeAndFlushWith(
                records.map(s -> Mono.just(bufferFactory.wrap(s.getBytes(StandardCharsets.UTF_8))))
        );
    }

    // ==================== 非流式响应 ====================

    private Mono<Void> writeJson(ServerWebExchange exchange, Flux<StreamEvent> events,
                                 ResponseEncoder encoder, Dispatch dispatch) {
        ResponseAggregator aggregator = new ResponseAggregator();
        return events.doOnNext(aggregator::accept)
                .then(Mono.fromCallable(() -> {
                    StreamEvent.MessageFinish finish = aggregator.finish();
                    if (finish == null || finish.isError()) {
                        String message = finish != null ? finish.errorMessage() : "后端流未正常结束";
                        throw new BackendTransportException(message);
                    }
                    String id = ResponseEncoder.messageId(encoder.protocol(), dispatch.sessionId());
                    return encoder.encodeResponse(aggregator.toResponse(id, dispatch.echoModel()));
                }))
                .flatMap(json -> {
                    // 直接写 JSON 字节，避免 Jackson 二次序列化
                    ServerHttpResponse response = exchange.getResponse();
                    response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
                    byte[] bytes = json.getBytes(StandardCharsets.UTF_8);
                    response.getHeaders().setContentLength(bytes.length);
                    DataBuffer buffer = response.bufferFactory().wrap(bytes);
                    return response.writeWith(Mono.just(buffer));
                });
    }

    private JSONObject parseBody(String body) {
        if (body == null || body.isBlank()) {
            throw new InvalidRequestException("请求体不能为空");
        }
        try {
            JSONObject json = JSONObject.parseObject(body);
            if (json == null) {
                throw new InvalidRequestException("请求体必须是 JSON 对象");
            }
            return json;
        } catch (JSONException e) {
            throw new InvalidRequestException("请求体不是合法 JSON: " + e.getMessage(), e);
        }
    }

    /**
     * 一次转发的全部上下文
     *
     * @param echoModel 回显给客户端的模型名
     */
    record Dispatch(String sessionId, ModelResolver.Route route, CanonicalRequest request,
                    WireRequest wireRequest, String echoModel) {
    }
}
