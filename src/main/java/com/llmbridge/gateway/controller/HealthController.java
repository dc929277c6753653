package com.llmbridge.gateway.controller;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.llmbridge.gateway.config.BackendConfig;
import com.llmbridge.gateway.model.ModelResolver;
import com.llmbridge.gateway.util.Metrics;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * 健康检查与 Prometheus 指标端点
 */
@RestController
public class HealthController {

    private final ModelResolver modelResolver;

    public HealthController(ModelResolver modelResolver) {
        this.modelResolver = modelResolver;
    }

    @GetMapping(value = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<String> health() {
        JSONArray backends = new JSONArray();
        for (BackendConfig backend : modelResolver.backends()) {
            backends.add(JSONObject.of( //
                    "name", backend.name(), //
                    "protocol", backend.protocol().value(), //
                    "baseUrl", backend.baseUrl() //
            ));
        }
        JSONObject result = new JSONObject();
        result.put("status", backends.isEmpty() ? "degraded" : "ok");
        result.put("version", "1.0.0");
        result.put("backends", backends);
        result.put("totalRequests", Metrics.instance().totalRequests());
        return Mono.just(result.toJSONString());
    }

    @GetMapping(value = "/metrics", produces = MediaType.TEXT_PLAIN_VALUE)
    public Mono<String> metrics() {
        return Mono.just(Metrics.instance().toPrometheusFormat());
    }
}
