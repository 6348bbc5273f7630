/**
 * Bulkhead와 Resource Pool.
 *
 * <p>Pool은 실행 모델별로 분리되어 있습니다.</p>
 * <ul>
 *   <li>{@link com.ryuqq.resilience.runner.bulkhead.SyncResourcePool}: 스레드가 락 밖의 래치에서 대기</li>
 *   <li>{@link com.ryuqq.resilience.runner.bulkhead.AsyncResourcePool}: 대기자는 미완료 Future</li>
 * </ul>
 *
 * <p>{@link com.ryuqq.resilience.runner.bulkhead.Bulkhead}는 두 Pool 중 실행 방식에 맞는 것만 받아들이며,
 * 맞지 않으면 작업 실행 전에 설정 오류로 실패합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.runner.bulkhead;
