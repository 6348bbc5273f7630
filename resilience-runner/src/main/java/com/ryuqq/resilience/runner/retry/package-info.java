/**
 * 재시도 실행.
 *
 * <ul>
 *   <li>{@link com.ryuqq.resilience.runner.retry.RetryExecutor} - 블로킹/비동기 재시도 루프</li>
 *   <li>{@link com.ryuqq.resilience.runner.retry.RetryDecorator} - 정책 또는 개별 파라미터로 작업을 감싸는 진입점</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.runner.retry;
