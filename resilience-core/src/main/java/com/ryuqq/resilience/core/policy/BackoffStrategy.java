package com.ryuqq.resilience.core.policy;

/**
 * 재시도 지연 시간 증가 방식.
 *
 * <p>예시 (baseDelay=1000ms, jitter 비활성화):</p>
 * <pre>
 * attempt      1     2     3     4     5
 * FIXED     1000  1000  1000  1000  1000
 * LINEAR    1000  2000  3000  4000  5000
 * EXPONENTIAL 1000 2000 4000  8000 16000
 * FIBONACCI 1000  1000  2000  3000  5000
 * </pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public enum BackoffStrategy {

    /** 항상 baseDelay. */
    FIXED,

    /** baseDelay × attempt. */
    LINEAR,

    /** baseDelay × 2^(attempt-1). */
    EXPONENTIAL,

    /** baseDelay × fib(attempt), fib(1) = fib(2) = 1. */
    FIBONACCI
}
