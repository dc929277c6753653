package com.llmbridge.gateway.config;

import java.util.Map;

/**
 * 单个后端的不可变配置
 */
public record BackendConfig(
        String name,
        Protocol protocol,
        String baseUrl,
        String credential,
        String defaultModel,
        Map<String, String> headers,
        BackendCapabilities capabilities
) {

    public BackendConfig {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static BackendConfig from(String name, AppProperties.BackendProperties props) {
        Protocol protocol = Protocol.fromValue(props.getProtocol());
        String baseUrl = props.getBaseUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalStateException("后端 " + name + " 未配置 base-url");
        }
        // 去掉末尾斜杠，拼接路径时统一加
        while (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        return new BackendConfig(name, protocol, baseUrl, props.getApiKey(), props.getDefaultModel(),
                props.getHeaders(), BackendCapabilities.from(protocol, props.getCapabilities()));
    }
}
