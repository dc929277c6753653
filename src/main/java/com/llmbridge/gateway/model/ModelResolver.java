package com.llmbridge.gateway.model;

import com.llmbridge.gateway.config.AppProperties;
import com.llmbridge.gateway.config.BackendConfig;
import com.llmbridge.gateway.exception.InvalidRequestException;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 模型解析器
 * <p>
 * 将客户端传入的模型名解析为 (后端, 上游模型名, 是否开启推理)。优先级：
 * 推理后缀 → 显式 "backend,model" → 路由规则 → 默认后端
 */
@Component
public class ModelResolver {

    private static final Logger log = LoggerFactory.getLogger(ModelResolver.class);

    private final AppProperties properties;

    private final Map<String, BackendConfig> backends = new LinkedHashMap<>();
    // 路由规则（按配置顺序）
    private final List<AppProperties.RouteRule> routes = new ArrayList<>();
    // regex 路由预编译
    private final Map<AppProperties.RouteRule, Pattern> regexRoutes = new IdentityHashMap<>();

    public ModelResolver(AppProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        backends.clear();
        properties.getBackends().forEach((name, props) -> backends.put(name, BackendConfig.from(name, props)));
        routes.clear();
        regexRoutes.clear();
        for (AppProperties.RouteRule rule : properties.getRoutes()) {
            if (!backends.containsKey(rule.getBackend())) {
                throw new IllegalStateException("路由 " + rule.getPattern() + " 指向未配置的后端 " + rule.getBackend());
            }
            if ("regex".equalsIgnoreCase(rule.getMatchType()) && rule.getPattern() != null) {
                try {
                    regexRoutes.put(rule, Pattern.compile(rule.getPattern()));
                } catch (PatternSyntaxException e) {
                    throw new IllegalStateException("路由正则无效: " + rule.getPattern(), e);
                }
            }
            routes.add(rule);
        }
        String defaultBackend = properties.getDefaultBackend();
        if (defaultBackend != null && !backends.containsKey(defaultBackend)) {
            throw new IllegalStateException("default-backend 未配置: " + defaultBackend);
        }
        if (backends.isEmpty()) {
            log.warn("未配置任何后端，所有请求将被拒绝");
        }
        log.info("模型解析器初始化完成: {} 个后端, {} 条路由规则", backends.size(), routes.size());
    }

    /**
     * 解析客户端模型名
     * <p>
     * 模型名来自客户端，不做缓存
     *
     * @param requestedModel 客户端传入的模型名，可为 null
     * @return 解析结果
     */
    public Route resolve(String requestedModel) {
        // 检查是否启用 thinking 模式
        boolean thinking = false;
        String cleanModel = requestedModel == null ? "" : requestedModel;
        String suffix = properties.getThinking().getSuffix();
        if (suffix != null && !suffix.isEmpty() && cleanModel.endsWith(suffix) && cleanModel.length() > suffix.length()) {
            thinking = true;
            cleanModel = cleanModel.substring(0, cleanModel.length() - suffix.length());
        }

        // 显式指定后端: backend,model
        int comma = cleanModel.indexOf(',');
        if (comma > 0) {
            String backendName = cleanModel.substring(0, comma).trim();
            String model = cleanModel.substring(comma + 1).trim();
            BackendConfig backend = backends.get(backendName);
            if (backend == null) {
                throw new InvalidRequestException("未知后端: " + backendName);
            }
            return new Route(backend, model.isEmpty() ? requireDefaultModel(backend) : model, requestedModel, thinking);
        }

        // 路由规则匹配
        for (AppProperties.RouteRule rule : routes) {
            if (matches(rule, cleanModel)) {
                BackendConfig backend = backends.get(rule.getBackend());
                String model = rule.getModel() != null && !rule.getModel().isEmpty() ? rule.getModel() : cleanModel;
                log.debug("模型 '{}' 命中路由 {} → {}/{}", requestedModel, rule.getPattern(), backend.name(), model);
                return new Route(backend, model, requestedModel, thinking);
            }
        }

        // 未匹配，使用默认后端
        BackendConfig backend = defaultBackend();
        String model = !cleanModel.isEmpty() ? cleanModel : requireDefaultModel(backend);
        log.debug("模型 '{}' 未命中路由，使用默认后端 {}", requestedModel, backend.name());
        return new Route(backend, model, requestedModel, thinking);
    }

    /**
     * 获取所有可用模型列表（用于 /v1/models 端点）
     */
    public List<ModelInfo> listModels() {
        Map<String, ModelInfo> models = new LinkedHashMap<>();
        for (AppProperties.RouteRule rule : routes) {
            if ("exact".equalsIgnoreCase(rule.getMatchType())) {
                models.putIfAbsent(rule.getPattern(), new ModelInfo(rule.getPattern(), rule.getBackend()));
            }
        }
        for (BackendConfig backend : backends.values()) {
            if (backend.defaultModel() != null && !backend.defaultModel().isEmpty()) {
                models.putIfAbsent(backend.defaultModel(), new ModelInfo(backend.defaultModel(), backend.name()));
            }
        }
        return List.copyOf(models.values());
    }

    public Collection<BackendConfig> backends() {
        return backends.values();
    }

    private boolean matches(AppProperties.RouteRule rule, String model) {
        String pattern = rule.getPattern();
        if (pattern == null) return false;
        String type = rule.getMatchType() == null ? "exact" : rule.getMatchType().toLowerCase(Locale.ROOT);
        return switch (type) {
            case "exact" -> model.equalsIgnoreCase(pattern);
            case "prefix" -> model.toLowerCase(Locale.ROOT).startsWith(pattern.toLowerCase(Locale.ROOT));
            case "contains" -> model.toLowerCase(Locale.ROOT).contains(pattern.toLowerCase(Locale.ROOT));
            case "regex" -> regexRoutes.get(rule).matcher(model).matches();
            default -> false;
        };
    }

    private BackendConfig defaultBackend() {
        if (backends.isEmpty()) {
            throw new InvalidRequestException("网关未配置任何后端");
        }
        String name = properties.getDefaultBackend();
        return name != null ? backends.get(name) : backends.values().iterator().next();
    }

    private String requireDefaultModel(BackendConfig backend) {
        if (backend.defaultModel() == null || backend.defaultModel().isEmpty()) {
            throw new InvalidRequestException("后端 " + backend.name() + " 未配置默认模型，需显式指定模型名");
        }
        return backend.defaultModel();
    }

    // ==================== 数据类 ====================

    /**
     * @param backend        目标后端
     * @param upstreamModel  发往后端的模型名
     * @param requestedModel 客户端原始模型名，回显用
     * @param thinking       模型名带推理后缀
     */
    public record Route(BackendConfig backend, String upstreamModel, String requestedModel, boolean thinking) {}

    public record ModelInfo(String id, String ownedBy) {}
}
