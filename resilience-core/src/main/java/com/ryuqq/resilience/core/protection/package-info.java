/**
 * Protection SPI 패키지.
 *
 * <p>보호 대상 작업의 장애를 격리하기 위한 Circuit Breaker 계약과 설정 레코드를 정의합니다.
 * 실행 구현은 runner 모듈에 있습니다.</p>
 *
 * <h2>보호 적용 순서</h2>
 *
 * <pre>
 * 1. Bulkhead        → 동시 실행 수 제한 (Permit 획득)
 * 2. CircuitBreaker  → OPEN 상태 시 즉시 실패
 * 3. RetryExecutor   → 재시도 루프
 * 4. Operation       → 실제 작업 실행
 * </pre>
 *
 * <ul>
 *   <li><strong>Bulkhead First:</strong> 재시도 루프 전체가 Permit 하나를 점유</li>
 *   <li><strong>Circuit Breaker:</strong> 재시도가 모두 소진된 호출 하나를 실패 1회로 집계</li>
 *   <li><strong>Retry:</strong> 개별 시도를 반복</li>
 * </ul>
 *
 * <h2>NoOp 구현</h2>
 *
 * <p>{@code noop} 하위 패키지의 {@link com.ryuqq.resilience.core.protection.noop.NoOpCircuitBreaker}는
 * 모든 요청을 허용하고 상태를 추적하지 않습니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 * @see com.ryuqq.resilience.core.protection.CircuitBreaker
 * @see com.ryuqq.resilience.core.protection.noop
 */
package com.ryuqq.resilience.core.protection;
