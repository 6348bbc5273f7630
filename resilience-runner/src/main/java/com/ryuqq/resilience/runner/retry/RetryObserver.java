package com.ryuqq.resilience.runner.retry;

/**
 * 재시도 직전 알림.
 *
 * <p>재시도가 결정된 직후, 대기(backoff) 전에 호출됩니다. 여기서 던진 예외는
 * 로그만 남고 재시도 흐름에는 영향을 주지 않습니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RetryObserver {

    /**
     * 재시도 알림.
     *
     * @param attempt 방금 실패한 시도 번호 (1부터 시작)
     * @param error 실패 원인 (상태 코드 재시도인 경우 {@link RetryableResponseException})
     */
    void onRetry(int attempt, Throwable error);
}
