/**
 * 재시도 정책.
 *
 * <p>{@link com.ryuqq.resilience.core.policy.RetryPolicy}는 순수 값 객체이며 스레드, 시계,
 * 로깅에 의존하지 않습니다. 실제 재시도 루프는 runner 모듈의 RetryExecutor가 담당합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.policy;
