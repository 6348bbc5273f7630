package com.ryuqq.resilience.core.protection.noop;

import com.ryuqq.resilience.core.protection.CallPermission;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;

import java.util.Optional;

/**
 * Circuit Breaker NoOp 구현.
 *
 * <p>모든 요청을 항상 허용하며, 상태 추적을 하지 않습니다.
 * Circuit Breaker 없이 파이프라인을 구성할 때 기본값으로 사용됩니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>tryAcquirePermission(): 항상 {@link CallPermission#UNTRACKED} 반환</li>
 *   <li>onSuccess(CallPermission) / onError(CallPermission, Throwable): 아무 동작 안 함</li>
 *   <li>getState(): 항상 CLOSED 반환</li>
 *   <li>getFailureCount(): 항상 0 반환</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class NoOpCircuitBreaker implements CircuitBreaker {

    private static final NoOpCircuitBreaker INSTANCE = new NoOpCircuitBreaker();

    /**
     * 공유 인스턴스.
     *
     * @return NoOpCircuitBreaker
     */
    public static NoOpCircuitBreaker instance() {
        return INSTANCE;
    }

    @Override
    public String getName() {
        return "noop";
    }

    @Override
    public Optional<CallPermission> tryAcquirePermission() {
        return Optional.of(CallPermission.UNTRACKED);
    }

    @Override
    public void onSuccess(CallPermission permission) {
        // NoOp
    }

    @Override
    public void onError(CallPermission permission, Throwable error) {
        // NoOp
    }

    @Override
    public CircuitBreakerState getState() {
        return CircuitBreakerState.CLOSED;
    }

    @Override
    public int getFailureCount() {
        return 0;
    }

    @Override
    public void reset() {
        // NoOp
    }
}
