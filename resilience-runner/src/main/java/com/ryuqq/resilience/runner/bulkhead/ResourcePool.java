package com.ryuqq.resilience.runner.bulkhead;

import java.util.OptionalInt;

/**
 * 동시 실행 수를 제한하는 Permit Pool.
 *
 * <p>블로킹 스레드용 {@link SyncResourcePool}과 비동기용 {@link AsyncResourcePool} 두 가지만 존재하며,
 * 서로 바꿔 쓸 수 없습니다. 이 인터페이스는 두 구현이 공유하는 조회 기능만 정의합니다.
 * 획득/반납은 각 구현의 실행 모델에 맞는 시그니처로 제공됩니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>0 ≤ activeCount ≤ maxConcurrent</li>
 *   <li>대기열이 비어 있지 않으면 activeCount == maxConcurrent</li>
 *   <li>대기열 길이는 maxQueueSize를 넘지 않음</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public sealed interface ResourcePool permits SyncResourcePool, AsyncResourcePool {

    /**
     * Pool 이름 (로그, 이벤트용).
     *
     * @return 이름
     */
    String name();

    /**
     * 최대 동시 실행 수.
     *
     * @return maxConcurrent
     */
    int maxConcurrent();

    /**
     * 최대 대기열 길이.
     *
     * @return 제한이 없으면 empty
     */
    OptionalInt maxQueueSize();

    /**
     * 현재 사용 중인 Permit 수.
     *
     * @return activeCount
     */
    int activeCount();

    /**
     * 현재 대기 중인 요청 수.
     *
     * @return 대기열 길이
     */
    int queueSize();

    /**
     * 통계 스냅샷.
     *
     * @return PoolStats
     */
    PoolStats getStats();

    /**
     * 남은 Permit 수.
     *
     * @return maxConcurrent - activeCount
     */
    default int availableCapacity() {
        return maxConcurrent() - activeCount();
    }
}
