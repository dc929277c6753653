package com.llmbridge.gateway.model;

import com.llmbridge.gateway.config.AppProperties;
import com.llmbridge.gateway.config.Protocol;
import com.llmbridge.gateway.exception.InvalidRequestException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelResolverTest {

    private AppProperties properties;

    @BeforeEach
    void setUp() {
        properties = new AppProperties();
        properties.setDefaultBackend("openai");
        properties.getBackends().put("openai", backend("openai", "gpt-4o"));
        properties.getBackends().put("anthropic", backend("anthropic", "claude-sonnet-4-20250514"));
        properties.getBackends().put("gemini", backend("gemini", null));
        properties.getRoutes().add(route("sonnet", "exact", "anthropic", "claude-sonnet-4-20250514"));
        properties.getRoutes().add(route("claude-", "prefix", "anthropic", null));
        properties.getRoutes().add(route("^gemini-[0-9.]+-(pro|flash)$", "regex", "gemini", null));
    }

    private static AppProperties.BackendProperties backend(String protocol, String defaultModel) {
        AppProperties.BackendProperties props = new AppProperties.BackendProperties();
        props.setProtocol(protocol);
        props.setBaseUrl("https://" + protocol + ".example.com/v1/");
        props.setDefaultModel(defaultModel);
        return props;
    }

    private static AppProperties.RouteRule route(String pattern, String matchType, String backend, String model) {
        AppProperties.RouteRule rule = new AppProperties.RouteRule();
        rule.setPattern(pattern);
        rule.setMatchType(matchType);
        rule.setBackend(backend);
        rule.setModel(model);
        return rule;
    }

    private ModelResolver resolver() {
        ModelResolver resolver = new ModelResolver(properties);
        resolver.init();
        return resolver;
    }

    @Test
    void shouldRouteExactAliasToConfiguredModel() {
        ModelResolver.Route route = resolver().resolve("sonnet");

        assertThat(route.backend().name()).isEqualTo("anthropic");
        assertThat(route.backend().protocol()).isEqualTo(Protocol.ANTHROPIC);
        assertThat(route.backend().baseUrl()).isEqualTo("https://anthropic.example.com/v1");
        assertThat(route.upstreamModel()).isEqualTo("claude-sonnet-4-20250514");
        assertThat(route.requestedModel()).isEqualTo("sonnet");
        assertThat(route.thinking()).isFalse();
    }

    @Test
    void shouldRouteByPrefixAndRegexKeepingModelName() {
        ModelResolver resolver = resolver();

        assertThat(resolver.resolve("Claude-Opus-4").backend().name()).isEqualTo("anthropic");
        assertThat(resolver.resolve("Claude-Opus-4").upstreamModel()).isEqualTo("Claude-Opus-4");
        assertThat(resolver.resolve("gemini-2.5-pro").backend().name()).isEqualTo("gemini");
        assertThat(resolver.resolve("gemini-2.5-pro-latest").backend().name()).isEqualTo("openai");
    }

    @Test
    void shouldStripThinkingSuffixBeforeRouting() {
        ModelResolver.Route route = resolver().resolve("claude-sonnet-4-thinking");

        assertThat(route.thinking()).isTrue();
        assertThat(route.backend().name()).isEqualTo("anthropic");
        assertThat(route.upstreamModel()).isEqualTo("claude-sonnet-4");
        assertThat(route.requestedModel()).isEqualTo("claude-sonnet-4-thinking");
    }

    @Test
    void shouldNotTreatBareSuffixAsThinking() {
        ModelResolver.Route route = resolver().resolve("-thinking");

        assertThat(route.thinking()).isFalse();
        assertThat(route.upstreamModel()).isEqualTo("-thinking");
    }

    @Test
    void shouldHonourExplicitBackendPrefix() {
        ModelResolver resolver = resolver();

        ModelResolver.Route route = resolver.resolve("gemini,gemini-exp-1206");
        assertThat(route.backend().name()).isEqualTo("gemini");
        assertThat(route.upstreamModel()).isEqualTo("gemini-exp-1206");

        assertThat(resolver.resolve("anthropic,").upstreamModel()).isEqualTo("claude-sonnet-4-20250514");
        assertThatThrownBy(() -> resolver.resolve("nope,model"))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("nope");
        assertThatThrownBy(() -> resolver.resolve("gemini,"))
                .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void shouldPassUnmatchedModelToDefaultBackend() {
        ModelResolver resolver = resolver();

        ModelResolver.Route route = resolver.resolve("deepseek-chat");
        assertThat(route.backend().name()).isEqualTo("openai");
        assertThat(route.upstreamModel()).isEqualTo("deepseek-chat");

        assertThat(resolver.resolve(null).upstreamModel()).isEqualTo("gpt-4o");
        assertThat(resolver.resolve("").upstreamModel()).isEqualTo("gpt-4o");
    }

    @Test
    void shouldRejectMissingModelWhenDefaultBackendHasNone() {
        properties.setDefaultBackend("gemini");

        assertThatThrownBy(() -> resolver().resolve(null))
                .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void shouldListExactRoutesAndDefaultModels() {
        assertThat(resolver().listModels()).containsExactly(
                new ModelResolver.ModelInfo("sonnet", "anthropic"),
                new ModelResolver.ModelInfo("gpt-4o", "openai"),
                new ModelResolver.ModelInfo("claude-sonnet-4-20250514", "anthropic"));
    }

    @Test
    void shouldFailFastOnRouteToUnknownBackend() {
        properties.getRoutes().add(route("x", "exact", "missing", null));

        assertThatThrownBy(() -> new ModelResolver(properties).init())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("missing");
    }

    @Test
    void shouldFailFastOnUnknownDefaultBackend() {
        properties.setDefaultBackend("missing");

        assertThatThrownBy(() -> new ModelResolver(properties).init())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldFailFastOnInvalidRouteRegex() {
        properties.getRoutes().add(route("gpt-(4", "regex", "openai", null));

        assertThatThrownBy(() -> new ModelResolver(properties).init())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("gpt-(4");
    }

    @Test
    void shouldResolveClientSuppliedNamesIndependently() {
        ModelResolver resolver = resolver();

        for (int i = 0; i < 100; i++) {
            assertThat(resolver.resolve("custom-model-" + i).upstreamModel()).isEqualTo("custom-model-" + i);
        }
        assertThat(resolver.resolve("gemini-2.5-flash").backend().name()).isEqualTo("gemini");
        assertThat(resolver.resolve(null).requestedModel()).isNull();
    }
}
