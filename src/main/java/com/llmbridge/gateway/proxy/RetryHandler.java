package com.llmbridge.gateway.proxy;

import com.llmbridge.gateway.config.AppProperties;
import com.llmbridge.gateway.exception.BackendApiException;
import com.llmbridge.gateway.exception.BackendTransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

import java.time.Duration;

/**
 * 自动重试 + 指数退避
 * <p>
 * 只作用于建立连接和读取响应头阶段：429/5xx/连接错误重试，delay × 2^attempt；
 * 响应体开始读取后不再重试
 */
@Component
public class RetryHandler {

    private static final Logger log = LoggerFactory.getLogger(RetryHandler.class);

    private final int maxRetries;
    private final long baseDelayMs;

    public RetryHandler(AppProperties properties) {
        this.maxRetries = properties.getRetry().getMaxRetries();
        this.baseDelayMs = properties.getRetry().getBaseDelayMs();
    }

    /**
     * 判断是否应该重试
     */
    public boolean shouldRetry(Throwable error) {
        // 401/403 及其他 4xx 不重试
        if (error instanceof BackendApiException api) {
            return api.isRetryable();
        }
        return error instanceof BackendTransportException;
    }

    /**
     * 计算重试延迟（毫秒）
     */
    public long getDelay(int attempt) {
        return (long) (baseDelayMs * Math.pow(2, attempt));
    }

    /**
     * 给后端请求 Mono 使用的重试策略，耗尽后抛出最后一次的原始异常
     */
    public RetryBackoffSpec retrySpec(String backend) {
        return Retry.backoff(maxRetries, Duration.ofMillis(Math.max(1, baseDelayMs)))
                .jitter(0)
                .filter(this::shouldRetry)
                .doBeforeRetry(signal -> log.warn("后端 {} 请求失败({}), 第{}次重试, 等待{}ms",
                        backend, signal.failure().getMessage(), signal.totalRetries() + 1, getDelay((int) signal.totalRetries())))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    public int maxRetries() {
        return maxRetries;
    }
}
