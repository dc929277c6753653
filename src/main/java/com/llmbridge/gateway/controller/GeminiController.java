package com.llmbridge.gateway.controller;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.llmbridge.gateway.config.Protocol;
import com.llmbridge.gateway.exception.InvalidRequestException;
import com.llmbridge.gateway.model.ModelResolver;
import com.llmbridge.gateway.proxy.ProxyService;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * Gemini 兼容端点
 * <p>
 * POST /v1beta/models/{model}:generateContent
 * POST /v1beta/models/{model}:streamGenerateContent[?alt=sse]
 * GET  /v1beta/models
 */
@RestController
@RequestMapping("/v1beta")
public class GeminiController {

    private final ProxyService proxyService;
    private final ModelResolver modelResolver;

    public GeminiController(ProxyService proxyService, ModelResolver modelResolver) {
        this.proxyService = proxyService;
        this.modelResolver = modelResolver;
    }

    /**
     * 路径最后一段形如 {model}:{method}，整体作为一个变量取出再拆分
     */
    @PostMapping(value = "/models/{target}")
    public Mono<Void> generate(@PathVariable("target") String target,
                               @RequestParam(value = "alt", required = false) String alt,
                               @RequestBody String body, ServerWebExchange exchange) {
        int colon = target.lastIndexOf(':');
        if (colon <= 0) {
            throw new InvalidRequestException("路径缺少方法名: " + target);
        }
        String model = target.substring(0, colon);
        String method = target.substring(colon + 1);
        boolean stream = switch (method) {
            case "generateContent" -> false;
            case "streamGenerateContent" -> true;
            default -> throw new InvalidRequestException("不支持的方法: " + method);
        };
        return proxyService.handle(Protocol.GEMINI, body, model, stream, "sse".equalsIgnoreCase(alt), exchange);
    }

    @GetMapping(value = "/models", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<String> models() {
        JSONArray models = new JSONArray();
        for (ModelResolver.ModelInfo model : modelResolver.listModels()) {
            models.add(JSONObject.of( //
                    "name", "models/" + model.id(), //
                    "displayName", model.id(), //
                    "supportedGenerationMethods", JSONArray.of("generateContent", "streamGenerateContent") //
            ));
        }
        return Mono.just(JSONObject.of("models", models).toJSONString());
    }
}
