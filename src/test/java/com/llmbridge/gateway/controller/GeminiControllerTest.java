package com.llmbridge.gateway.controller;

import com.alibaba.fastjson2.JSONObject;
import com.llmbridge.gateway.config.Protocol;
import com.llmbridge.gateway.exception.InvalidRequestException;
import com.llmbridge.gateway.model.ModelResolver;
import com.llmbridge.gateway.proxy.ProxyService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GeminiControllerTest {

    private ProxyService proxyService;
    private ModelResolver modelResolver;
    private GeminiController controller;

    @BeforeEach
    void setUp() {
        proxyService = mock(ProxyService.class);
        modelResolver = mock(ModelResolver.class);
        when(proxyService.handle(any(), any(), any(), any(), anyBoolean(), any())).thenReturn(Mono.empty());
        controller = new GeminiController(proxyService, modelResolver);
    }

    private static MockServerWebExchange exchange() {
        return MockServerWebExchange.from(MockServerHttpRequest.post("/v1beta/models/x:generateContent"));
    }

    @Test
    void shouldSplitModelAndMethodAtLastColon() {
        MockServerWebExchange exchange = exchange();

        controller.generate("tunedModels/a:b-1:streamGenerateContent", "sse", "{}", exchange).block();

        verify(proxyService).handle(eq(Protocol.GEMINI), eq("{}"), eq("tunedModels/a:b-1"), eq(true), eq(true), eq(exchange));
    }

    @Test
    void shouldUseJsonArrayStreamWithoutAltSse() {
        MockServerWebExchange exchange = exchange();

        controller.generate("gemini-2.5-pro:streamGenerateContent", null, "{}", exchange).block();

        verify(proxyService).handle(eq(Protocol.GEMINI), eq("{}"), eq("gemini-2.5-pro"), eq(true), eq(false), eq(exchange));
    }

    @Test
    void shouldTreatGenerateContentAsNonStreaming() {
        MockServerWebExchange exchange = exchange();

        controller.generate("gemini-2.5-flash:generateContent", null, "{}", exchange).block();

        verify(proxyService).handle(eq(Protocol.GEMINI), eq("{}"), eq("gemini-2.5-flash"), eq(false), eq(false), eq(exchange));
    }

    @Test
    void shouldRejectUnknownMethodOrMissingColon() {
        assertThatThrownBy(() -> controller.generate("gemini-2.5-pro:countTokens", null, "{}", exchange()))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("countTokens");
        assertThatThrownBy(() -> controller.generate("gemini-2.5-pro", null, "{}", exchange()))
                .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void shouldListModelsInGeminiShape() {
        when(modelResolver.listModels()).thenReturn(List.of(new ModelResolver.ModelInfo("gemini-2.5-pro", "gemini")));

        JSONObject body = JSONObject.parseObject(controller.models().block());

        JSONObject model = body.getJSONArray("models").getJSONObject(0);
        assertThat(model.getString("name")).isEqualTo("models/gemini-2.5-pro");
        assertThat(model.getJSONArray("supportedGenerationMethods")).containsExactly("generateContent", "streamGenerateContent");
    }
}
