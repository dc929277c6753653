package com.llmbridge.gateway.proxy;

import reactor.core.publisher.Flux;

/**
 * 后端 2xx 响应：状态、Content-Type 和尚未读取的响应体
 * <p>
 * body 只能订阅一次；取消订阅即释放后端连接
 */
public record BackendResponse(int statusCode, String contentType, Flux<byte[]> body) {
}
