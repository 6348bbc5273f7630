package com.ryuqq.resilience.runner.bulkhead;

/**
 * Bulkhead 상태 스냅샷.
 *
 * @param name Bulkhead 이름
 * @param asyncPool 비동기 Pool 사용 여부
 * @param stats Pool 통계
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public record BulkheadStatus(String name, boolean asyncPool, PoolStats stats) {
}
