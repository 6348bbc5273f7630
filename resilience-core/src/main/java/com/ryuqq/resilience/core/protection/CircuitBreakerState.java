package com.ryuqq.resilience.core.protection;

/**
 * Circuit Breaker 상태.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED (정상)
 *   │
 *   ▼ (연속 실패 수 ≥ failureThreshold)
 * OPEN (차단)
 *   │
 *   ▼ (recoveryTimeout 경과, 다음 요청 또는 상태 조회 시점에 판단)
 * HALF_OPEN (반개방, 시험 요청 1건)
 *   │
 *   ├─► 성공 → CLOSED
 *   └─► 실패 → OPEN
 * </pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public enum CircuitBreakerState {

    /**
     * 정상 상태.
     *
     * <p>모든 요청을 통과시키고 실패 횟수를 집계합니다.</p>
     */
    CLOSED,

    /**
     * 차단 상태.
     *
     * <p>보호 대상 작업을 호출하지 않고 즉시 거부합니다.</p>
     */
    OPEN,

    /**
     * 반개방 상태.
     *
     * <p>시험 요청 한 건만 통과시킵니다. 시험 요청이 끝나기 전에 들어온 요청은 거부됩니다.</p>
     */
    HALF_OPEN
}
