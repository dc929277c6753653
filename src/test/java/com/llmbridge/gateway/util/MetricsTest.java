package com.llmbridge.gateway.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsTest {

    private final Metrics metrics = new Metrics();

    @Test
    void shouldCountRequestsPerClientAndBackend() {
        metrics.recordRequest("openai", "anthropic", "stop", true, 120, 10, 5);
        metrics.recordRequest("openai", "anthropic", "error", false, 80, 3, 0);
        metrics.recordRequest("gemini", "openai", "tool_use", true, 40, 1, 1);

        assertThat(metrics.totalRequests()).isEqualTo(3);
        assertThat(metrics.get("requests_total{client=\"openai\",backend=\"anthropic\"}")).isEqualTo(2);
        assertThat(metrics.get("request_errors_total{client=\"openai\",backend=\"anthropic\"}")).isEqualTo(1);
        assertThat(metrics.get("finish_total{backend=\"anthropic\",reason=\"error\"}")).isEqualTo(1);
        assertThat(metrics.get("tokens_total{backend=\"anthropic\",direction=\"input\"}")).isEqualTo(13);
    }

    @Test
    void shouldCountStreamAnomalies() {
        metrics.recordSkippedRecord();
        metrics.recordSkippedRecord();
        metrics.recordSafetyLimit();
        metrics.recordLateReasoning();

        assertThat(metrics.get("stream_records_skipped_total")).isEqualTo(2);
        assertThat(metrics.get("stream_safety_limit_total")).isEqualTo(1);
        assertThat(metrics.get("stream_late_reasoning_total")).isEqualTo(1);
        assertThat(metrics.totalRequests()).isZero();
    }

    @Test
    void shouldRenderPrometheusTextWithOneTypeLinePerMetric() {
        metrics.recordRequest("openai", "anthropic", "stop", true, 120, 10, 5);
        metrics.recordRequest("anthropic", "gemini", "stop", true, 60000, 1, 1);

        String text = metrics.toPrometheusFormat();

        assertThat(text).containsOnlyOnce("# TYPE bridge_requests_total counter\n");
        assertThat(text).contains(
                "bridge_requests_total{client=\"anthropic\",backend=\"gemini\"} 1\n",
                "bridge_requests_total{client=\"openai\",backend=\"anthropic\"} 1\n",
                "# TYPE bridge_request_latency_ms histogram\n",
                "bridge_request_latency_ms_bucket{backend=\"anthropic\",le=\"250\"} 1\n",
                "bridge_request_latency_ms_bucket{backend=\"gemini\",le=\"30000\"} 0\n",
                "bridge_request_latency_ms_bucket{backend=\"gemini\",le=\"120000\"} 1\n",
                "bridge_request_latency_ms_count{backend=\"gemini\"} 1\n");
        assertThat(text).doesNotContain("request_errors_total");
    }
}
