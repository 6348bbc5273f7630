package com.ryuqq.resilience.core.protection;

import com.ryuqq.resilience.core.error.ConfigurationException;

/**
 * Bulkhead 설정.
 *
 * <p>레지스트리에서 이름으로 Bulkhead를 만들 때 사용하는 설정 정보입니다.</p>
 *
 * @param maxConcurrent 최대 동시 실행 수 (예: 10)
 * @param maxQueueSize 최대 대기열 길이 (-1이면 무제한, 0이면 대기 없이 즉시 거부)
 * @param timeoutMs 진입 대기 시간 (밀리초, -1이면 무기한)
 * @param asyncPool true면 비동기 Pool, false면 블로킹 Pool
 * @author Resilience Team
 * @since 1.0.0
 */
public record BulkheadConfig(int maxConcurrent, int maxQueueSize, long timeoutMs, boolean asyncPool) {

    public static final int UNBOUNDED = -1;
    public static final long NO_TIMEOUT = -1L;

    /**
     * Compact constructor with validation.
     *
     * @throws ConfigurationException if maxConcurrent is not positive
     * @throws ConfigurationException if maxQueueSize or timeoutMs is negative (other than -1)
     */
    public BulkheadConfig {
        if (maxConcurrent <= 0) {
            throw new ConfigurationException(
                "maxConcurrent must be positive (current: " + maxConcurrent + ")"
            );
        }
        if (maxQueueSize < UNBOUNDED) {
            throw new ConfigurationException(
                "maxQueueSize cannot be negative (current: " + maxQueueSize + ")"
            );
        }
        if (timeoutMs < NO_TIMEOUT) {
            throw new ConfigurationException(
                "timeoutMs cannot be negative (current: " + timeoutMs + ")"
            );
        }
    }

    /**
     * 기본 설정 (maxConcurrent=10, maxQueueSize=100, timeout=30초, 블로킹 Pool).
     */
    public BulkheadConfig() {
        this(10, 100, 30_000L, false);
    }

    public BulkheadConfig withMaxConcurrent(int maxConcurrent) {
        return new BulkheadConfig(maxConcurrent, maxQueueSize, timeoutMs, asyncPool);
    }

    public BulkheadConfig withMaxQueueSize(int maxQueueSize) {
        return new BulkheadConfig(maxConcurrent, maxQueueSize, timeoutMs, asyncPool);
    }

    public BulkheadConfig withTimeoutMs(long timeoutMs) {
        return new BulkheadConfig(maxConcurrent, maxQueueSize, timeoutMs, asyncPool);
    }

    public BulkheadConfig withAsyncPool(boolean asyncPool) {
        return new BulkheadConfig(maxConcurrent, maxQueueSize, timeoutMs, asyncPool);
    }
}
