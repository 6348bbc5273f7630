package com.ryuqq.resilience.core.protection;

/**
 * Circuit Breaker 호출 허가 토큰.
 *
 * <p>{@link CircuitBreaker#tryAcquirePermission()}이 발급하고, 호출자는 같은 토큰으로
 * {@link CircuitBreaker#onSuccess(CallPermission)} / {@link CircuitBreaker#onError(CallPermission, Throwable)}
 * 중 하나를 정확히 한 번 보고합니다.</p>
 *
 * <p>{@code epoch}는 허가 시점의 상태 세대입니다. 상태가 바뀔 때마다 세대가 올라가므로,
 * 이전 세대에 허가된 호출의 결과는 HALF_OPEN 시험 요청의 결과로 취급되지 않습니다.</p>
 *
 * @param epoch 허가 시점의 상태 세대
 * @author Resilience Team
 * @since 1.0.0
 */
public record CallPermission(long epoch) {

    /** 세대를 추적하지 않는 구현에서 사용하는 토큰. */
    public static final CallPermission UNTRACKED = new CallPermission(0L);
}
