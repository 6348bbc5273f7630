package com.ryuqq.resilience.runner.bulkhead;

/**
 * Resource Pool 통계 스냅샷.
 *
 * @param activeCount 사용 중인 Permit 수
 * @param availableCapacity 남은 Permit 수
 * @param queueSize 대기 중인 요청 수
 * @param maxConcurrent 최대 동시 실행 수
 * @param maxQueueSize 최대 대기열 길이 (-1이면 무제한)
 * @param utilization activeCount / maxConcurrent (0.0 ~ 1.0)
 * @param totalAcquired 누적 Permit 획득 수
 * @param totalRejected 누적 대기열 포화 거부 수
 * @param totalTimedOut 누적 대기 시간 초과 수
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public record PoolStats(
    int activeCount,
    int availableCapacity,
    int queueSize,
    int maxConcurrent,
    int maxQueueSize,
    double utilization,
    long totalAcquired,
    long totalRejected,
    long totalTimedOut
) {

    static PoolStats of(
        int activeCount,
        int queueSize,
        int maxConcurrent,
        int maxQueueSize,
        long totalAcquired,
        long totalRejected,
        long totalTimedOut
    ) {
        return new PoolStats(
            activeCount,
            maxConcurrent - activeCount,
            queueSize,
            maxConcurrent,
            maxQueueSize,
            (double) activeCount / maxConcurrent,
            totalAcquired,
            totalRejected,
            totalTimedOut
        );
    }
}
