package com.ryuqq.resilience.core.event;

import java.util.Map;

/**
 * 구조화된 진단 이벤트.
 *
 * <p>재시도 시도, Circuit 상태 전이, Pool 진입/거부 등을 key/value 속성과 함께 전달합니다.</p>
 *
 * @param source 이벤트를 발생시킨 컴포넌트 이름 (예: Bulkhead 이름, Circuit 이름)
 * @param type 이벤트 종류 (예: {@code retry.attempt}, {@code circuit.transition})
 * @param attributes 이벤트 속성 (불변)
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public record ResilienceEvent(
    String source,
    String type,
    Map<String, Object> attributes
) {

    public static final String RETRY_ATTEMPT = "retry.attempt";
    public static final String RETRY_EXHAUSTED = "retry.exhausted";
    public static final String RETRY_OBSERVER_FAILED = "retry.observer_failed";
    public static final String CIRCUIT_TRANSITION = "circuit.transition";
    public static final String CIRCUIT_REJECTED = "circuit.rejected";
    public static final String POOL_ADMITTED = "pool.admitted";
    public static final String POOL_QUEUED = "pool.queued";
    public static final String POOL_REJECTED = "pool.rejected";
    public static final String POOL_TIMEOUT = "pool.timeout";
    public static final String BULKHEAD_REJECTED = "bulkhead.rejected";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException source 또는 type이 비어 있는 경우
     */
    public ResilienceEvent {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("source cannot be null or blank");
        }
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type cannot be null or blank");
        }
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    /**
     * 속성 조회.
     *
     * @param key 속성 키
     * @return 속성 값, 없으면 null
     */
    public Object attribute(String key) {
        return attributes.get(key);
    }
}
