package com.ryuqq.resilience.core.policy;

/**
 * 상태 코드를 노출하는 응답.
 *
 * <p>{@link RetryPolicy#shouldRetryResponse(Object, int)}는 이 인터페이스를 구현한 응답만
 * 상태 코드 기반 재시도 대상으로 판단합니다. 구현하지 않은 응답은 재시도하지 않습니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface HasStatus {

    /**
     * 응답 상태 코드 (예: HTTP 503).
     *
     * @return 상태 코드
     */
    int statusCode();
}
