package com.llmbridge.gateway.controller;

import com.llmbridge.gateway.config.Protocol;
import com.llmbridge.gateway.proxy.ProxyService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * Anthropic Messages 兼容端点
 * <p>
 * POST /v1/messages：流式 + 非流式
 */
@RestController
@RequestMapping("/v1")
public class AnthropicController {

    private final ProxyService proxyService;

    public AnthropicController(ProxyService proxyService) {
        this.proxyService = proxyService;
    }

    @PostMapping(value = "/messages")
    public Mono<Void> messages(@RequestBody String body, ServerWebExchange exchange) {
        return proxyService.handle(Protocol.ANTHROPIC, body, null, null, true, exchange);
    }
}
