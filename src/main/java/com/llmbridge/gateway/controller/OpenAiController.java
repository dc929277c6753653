package com.llmbridge.gateway.controller;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.llmbridge.gateway.config.Protocol;
import com.llmbridge.gateway.model.ModelResolver;
import com.llmbridge.gateway.proxy.ProxyService;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * OpenAI Chat Completions 兼容端点
 * <p>
 * POST /v1/chat/completions：流式 + 非流式
 * GET  /v1/models
 */
@RestController
@RequestMapping("/v1")
public class OpenAiController {

    private final ProxyService proxyService;
    private final ModelResolver modelResolver;

    public OpenAiController(ProxyService proxyService, ModelResolver modelResolver) {
        this.proxyService = proxyService;
        this.modelResolver = modelResolver;
    }

    @PostMapping(value = "/chat/completions")
    public Mono<Void> chatCompletions(@RequestBody String body, ServerWebExchange exchange) {
        return proxyService.handle(Protocol.OPENAI, body, null, null, true, exchange);
    }

    @GetMapping(value = "/models", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<String> models() {
        JSONArray data = new JSONArray();
        long created = System.currentTimeMillis() / 1000;
        for (ModelResolver.ModelInfo model : modelResolver.listModels()) {
            data.add(JSONObject.of( //
                    "id", model.id(), //
                    "object", "model", //
                    "created", created, //
                    "owned_by", model.ownedBy() //
            ));
        }
        return Mono.just(JSONObject.of("object", "list", "data", data).toJSONString());
    }
}
