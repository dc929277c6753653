package com.llmbridge.gateway.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 应用配置属性绑定
 */
@Data
@Component
@ConfigurationProperties(prefix = "bridge")
public class AppProperties {

    private String defaultBackend;
    private Map<String, BackendProperties> backends = new LinkedHashMap<>();
    private List<RouteRule> routes = new ArrayList<>();
    private ThinkingConfig thinking = new ThinkingConfig();
    private LimitsConfig limits = new LimitsConfig();
    private RetryConfig retry = new RetryConfig();
    private HttpConfig http = new HttpConfig();
    private ProxyConfig proxy = new ProxyConfig();

    // --- 嵌套配置类 ---

    @Data
    public static class BackendProperties {
        private String protocol = "openai";
        private String baseUrl;
        private String apiKey = "";
        private String defaultModel;
        private Map<String, String> headers = new LinkedHashMap<>();
        private CapabilityProperties capabilities = new CapabilityProperties();
    }

    /**
     * 未配置的项使用协议默认值
     */
    @Data
    public static class CapabilityProperties {
        private Boolean supportsReasoning;
        private Boolean supportsTools;
        private List<String> toolChoiceModes;
        private List<String> reasoningToolChoiceModes;
        private String schemaDialect;
        private Boolean systemInstruction;
        private Boolean inlineThinkingTags;
    }

    @Data
    public static class RouteRule {
        private String pattern;
        // exact / prefix / contains / regex
        private String matchType = "exact";
        private String backend;
        private String model;
    }

    @Data
    public static class ThinkingConfig {
        private String suffix = "-thinking";
        private int defaultBudgetTokens = 10000;
    }

    @Data
    public static class LimitsConfig {
        private int maxThinkingChars = 200_000;
        private int maxBlocks = 512;
    }

    @Data
    public static class RetryConfig {
        private int maxRetries = 2;
        private long baseDelayMs = 500;
    }

    @Data
    public static class HttpConfig {
        private int connectTimeoutSeconds = 30;
    }

    @Data
    public static class ProxyConfig {
        private boolean enabled = false;
        private String url = "";
    }
}
