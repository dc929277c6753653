package com.llmbridge.gateway.util;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 网关指标收集器，输出 Prometheus 文本格式
 * <p>
 * 转发请求按 客户端协议 × 后端 计数，结束原因按后端计数；
 * 流处理中的跳过记录、安全上限截断、迟到推理单独计数
 */
public class Metrics {

    private static final Metrics INSTANCE = new Metrics();

    private static final String PREFIX = "bridge_";

    // 序列名 → 值，序列名形如 requests_total{client="openai",backend="anthropic"}
    private final ConcurrentHashMap<String, AtomicLong> counters = new ConcurrentHashMap<>();
    // 延迟直方图桶（毫秒）
    private final long[] bucketBounds = {50, 100, 250, 500, 1000, 2500, 5000, 10000, 30000, 120000};
    private final ConcurrentHashMap<String, long[]> latencyByBackend = new ConcurrentHashMap<>();

    public static Metrics instance() {
        return INSTANCE;
    }

    // ==================== 请求 ====================

    /**
     * 记录一次转发请求
     *
     * @param clientProtocol 客户端协议
     * @param backend        后端名
     * @param finishReason   结束原因，流未正常结束时为 "none"
     * @param success        是否以非错误的结束事件完成
     */
    public void recordRequest(String clientProtocol, String backend, String finishReason, boolean success,
                              long latencyMs, int inputTokens, int outputTokens) {
        String route = "client=\"" + clientProtocol + "\",backend=\"" + backend + "\"";
        increment("requests_total{" + route + "}");
        if (!success) {
            increment("request_errors_total{" + route + "}");
        }
        increment("finish_total{backend=\"" + backend + "\",reason=\"" + finishReason + "\"}");
        add("tokens_total{backend=\"" + backend + "\",direction=\"input\"}", inputTokens);
        add("tokens_total{backend=\"" + backend + "\",direction=\"output\"}", outputTokens);
        recordLatency(backend, latencyMs);
    }

    /**
     * 转发请求总数（所有客户端协议与后端之和）
     */
    public long totalRequests() {
        long total = 0;
        for (Map.Entry<String, AtomicLong> e : counters.entrySet()) {
            if (e.getKey().startsWith("requests_total{")) {
                total += e.getValue().get();
            }
        }
        return total;
    }

    // ==================== 流处理 ====================

    public void recordSkippedRecord() {
        increment("stream_records_skipped_total");
    }

    public void recordSafetyLimit() {
        increment("stream_safety_limit_total");
    }

    public void recordLateReasoning() {
        increment("stream_late_reasoning_total");
    }

    /**
     * 获取单个序列的当前值，不存在时为 0
     */
    public long get(String series) {
        AtomicLong counter = counters.get(series);
        return counter != null ? counter.get() : 0;
    }

    // ==================== 输出 ====================

    /**
     * 输出 Prometheus 文本格式，同名序列归在一个 TYPE 行下
     */
    public String toPrometheusFormat() {
        StringBuilder sb = new StringBuilder();

        String lastName = null;
        for (Map.Entry<String, AtomicLong> e : new TreeMap<>(counters).entrySet()) {
            String series = e.getKey();
            int brace = series.indexOf('{');
            String name = brace >= 0 ? series.substring(0, brace) : series;
            if (!name.equals(lastName)) {
                sb.append("# TYPE ").append(PREFIX).append(name).append(" counter\n");
                lastName = name;
            }
            sb.append(PREFIX).append(series).append(' ').append(e.getValue().get()).append('\n');
        }

        if (!latencyByBackend.isEmpty()) {
            sb.append("# TYPE ").append(PREFIX).append("request_latency_ms histogram\n");
        }
        new TreeMap<>(latencyByBackend).forEach((backend, buckets) -> {
            String label = "backend=\"" + backend + "\"";
            long cumulative = 0;
            synchronized (buckets) {
                for (int i = 0; i < bucketBounds.length; i++) {
                    cumulative += buckets[i];
                    sb.append(PREFIX).append("request_latency_ms_bucket{").append(label)
                            .append(",le=\"").append(bucketBounds[i]).append("\"} ").append(cumulative).append('\n');
                }
                cumulative += buckets[bucketBounds.length];
                sb.append(PREFIX).append("request_latency_ms_bucket{").append(label)
                        .append(",le=\"+Inf\"} ").append(cumulative).append('\n');
                sb.append(PREFIX).append("request_latency_ms_count{").append(label).append("} ")
                        .append(cumulative).append('\n');
            }
        });

        return sb.toString();
    }

    // ==================== 内部 ====================

    private void increment(String series) {
        counters.computeIfAbsent(series, k -> new AtomicLong(0)).incrementAndGet();
    }

    private void add(String series, long value) {
        counters.computeIfAbsent(series, k -> new AtomicLong(0)).addAndGet(value);
    }

    private void recordLatency(String backend, long latencyMs) {
        long[] buckets = latencyByBackend.computeIfAbsent(backend, k -> new long[bucketBounds.length + 1]);
        synchronized (buckets) {
            for (int i = 0; i < bucketBounds.length; i++) {
                if (latencyMs <= bucketBounds[i]) {
                    buckets[i]++;
                    return;
                }
            }
            buckets[bucketBounds.length]++;
        }
    }
}
