package com.llmbridge.gateway.proxy;

import com.llmbridge.gateway.config.BackendConfig;
import com.llmbridge.gateway.exception.BackendApiException;
import com.llmbridge.gateway.exception.BackendTransportException;
import com.llmbridge.gateway.exception.GatewayException;
import com.llmbridge.gateway.translator.WireRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.adapter.JdkFlowAdapter;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.Flow;

/**
 * 后端 HTTP 客户端
 * <p>
 * 响应体以 Flow.Publisher 方式按需拉取，下游取消时连接随之释放。
 * 非 2xx 状态读完错误体后抛 {@link BackendApiException}；连接失败抛 {@link BackendTransportException}
 */
@Component
public class BackendClient {

    private static final Logger log = LoggerFactory.getLogger(BackendClient.class);

    private static final int MAX_ERROR_BODY_CHARS = 2000;

    private final HttpClient httpClient;
    private final RetryHandler retryHandler;

    public BackendClient(HttpClient backendHttpClient, RetryHandler retryHandler) {
        this.httpClient = backendHttpClient;
        this.retryHandler = retryHandler;
    }

    /**
     * 发送请求，响应头到达且状态为 2xx 时完成
     * <p>
     * 该阶段的 429/5xx/连接错误按 {@link RetryHandler} 重试
     */
    public Mono<BackendResponse> open(BackendConfig backend, WireRequest request) {
        return Mono.defer(() -> send(backend, request))
                .retryWhen(retryHandler.retrySpec(backend.name()));
    }

    private Mono<BackendResponse> send(BackendConfig backend, WireRequest request) {
        HttpRequest httpRequest = buildRequest(request);
        log.debug("请求后端 {}: {}", backend.name(), request.url());

        return Mono.fromFuture(() -> httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofPublisher()))
                .onErrorMap(e -> !(e instanceof GatewayException),
                        e -> new BackendTransportException("连接后端 " + backend.name() + " 失败: " + describe(e), e))
                .flatMap(response -> {
                    int statusCode = response.statusCode();
                    String contentType = response.headers().firstValue("content-type").orElse("");
                    Flux<byte[]> body = toBytes(response.body());

                    if (statusCode / 100 != 2) {
                        return readBody(body).flatMap(text -> {
                            log.warn("后端 {} 返回 {}: {}", backend.name(), statusCode, text);
                            return Mono.error(new BackendApiException(backend.name(), statusCode, text));
                        });
                    }
                    return Mono.just(new BackendResponse(statusCode, contentType, body));
                });
    }

    private HttpRequest buildRequest(WireRequest request) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(request.url()))
                .POST(HttpRequest.BodyPublishers.ofString(request.bodyText()));
        request.headers().forEach(builder::header);
        return builder.build();
    }

    private Flux<byte[]> toBytes(Flow.Publisher<List<ByteBuffer>> publisher) {
        return JdkFlowAdapter.flowPublisherToFlux(publisher)
                .concatMapIterable(buffers -> buffers)
                .map(buffer -> {
                    byte[] bytes = new byte[buffer.remaining()];
                    buffer.get(bytes);
                    return bytes;
                });
    }

    private Mono<String> readBody(Flux<byte[]> body) {
        return body.collect(ByteArrayOutputStream::new, (out, bytes) -> out.write(bytes, 0, bytes.length))
                .map(out -> {
                    String text = out.toString(StandardCharsets.UTF_8);
                    return text.length() > MAX_ERROR_BODY_CHARS ? text.substring(0, MAX_ERROR_BODY_CHARS) + "..." : text;
                })
                .onErrorResume(e -> Mono.just("读取响应体失败: " + describe(e)));
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
