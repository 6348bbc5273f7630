package com.ryuqq.resilience.core.protection;

import com.ryuqq.resilience.core.error.ConfigurationException;

import java.util.Set;

/**
 * Circuit Breaker 설정.
 *
 * @param failureThreshold OPEN 전이까지의 실패 횟수 (1 이상)
 * @param recoveryTimeoutMs OPEN 상태 유지 시간 (밀리초, 0 이상)
 * @param recordedExceptions 실패로 집계할 예외 타입 (null이면 모든 예외)
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public record CircuitBreakerConfig(
    int failureThreshold,
    long recoveryTimeoutMs,
    Set<Class<? extends Throwable>> recordedExceptions
) {

    /**
     * Compact Constructor.
     *
     * @throws ConfigurationException 파라미터 검증 실패 시
     */
    public CircuitBreakerConfig {
        if (failureThreshold < 1) {
            throw new ConfigurationException(
                "failureThreshold must be at least 1 (current: " + failureThreshold + ")"
            );
        }
        if (recoveryTimeoutMs < 0) {
            throw new ConfigurationException(
                "recoveryTimeoutMs cannot be negative (current: " + recoveryTimeoutMs + ")"
            );
        }
        recordedExceptions = recordedExceptions == null ? null : Set.copyOf(recordedExceptions);
    }

    /**
     * 기본 설정 (failureThreshold=5, recoveryTimeout=60초, 모든 예외 집계).
     */
    public CircuitBreakerConfig() {
        this(5, 60_000L, null);
    }

    /**
     * 예외 필터 없이 생성.
     *
     * @param failureThreshold OPEN 전이까지의 실패 횟수
     * @param recoveryTimeoutMs OPEN 상태 유지 시간 (밀리초)
     */
    public CircuitBreakerConfig(int failureThreshold, long recoveryTimeoutMs) {
        this(failureThreshold, recoveryTimeoutMs, null);
    }

    /**
     * 실패로 집계할 예외인지 판단.
     *
     * @param error 발생한 예외
     * @return 집계 대상이면 true
     */
    public boolean records(Throwable error) {
        if (recordedExceptions == null) {
            return true;
        }
        for (Class<? extends Throwable> type : recordedExceptions) {
            if (type.isInstance(error)) {
                return true;
            }
        }
        return false;
    }

    public CircuitBreakerConfig withFailureThreshold(int failureThreshold) {
        return new CircuitBreakerConfig(failureThreshold, recoveryTimeoutMs, recordedExceptions);
    }

    public CircuitBreakerConfig withRecoveryTimeoutMs(long recoveryTimeoutMs) {
        return new CircuitBreakerConfig(failureThreshold, recoveryTimeoutMs, recordedExceptions);
    }

    public CircuitBreakerConfig withRecordedExceptions(Set<Class<? extends Throwable>> recordedExceptions) {
        return new CircuitBreakerConfig(failureThreshold, recoveryTimeoutMs, recordedExceptions);
    }
}
