package com.ryuqq.resilience.core.policy;

import com.ryuqq.resilience.core.error.ConfigurationException;

import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 재시도 정책.
 *
 * <p>최대 시도 횟수, 지연 시간 계산 방식, 재시도 대상 예외/상태 코드를 정의하는 불변 값 객체입니다.
 * 여러 스레드가 동시에 공유해도 안전합니다.</p>
 *
 * <p><strong>지연 시간 계산:</strong></p>
 * <pre>
 * raw    = strategy(baseDelayMs, attempt)
 * capped = min(raw, maxDelayMs)
 * delay  = jitter ? capped × uniform(0.75, 1.25) : capped
 * </pre>
 *
 * <p>Jitter는 상한 적용 이후에 곱해지므로 결과가 maxDelayMs의 1.25배까지 커질 수 있습니다.</p>
 *
 * @param maxAttempts 최대 시도 횟수 (최초 호출 포함, 1 이상)
 * @param backoff 지연 시간 증가 방식
 * @param baseDelayMs 기본 지연 시간 (밀리초, 0 이상)
 * @param maxDelayMs 최대 지연 시간 (밀리초, baseDelayMs 이상)
 * @param jitter Jitter 적용 여부
 * @param retryableErrors 재시도 대상 예외 타입 (null이면 모든 Exception)
 * @param retryableStatusCodes 재시도 대상 상태 코드 (null이면 상태 코드로 재시도하지 않음)
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public record RetryPolicy(
    int maxAttempts,
    BackoffStrategy backoff,
    long baseDelayMs,
    long maxDelayMs,
    boolean jitter,
    Set<Class<? extends Throwable>> retryableErrors,
    Set<Integer> retryableStatusCodes
) {

    private static final double JITTER_MIN = 0.75;
    private static final double JITTER_MAX = 1.25;

    /**
     * Compact Constructor.
     *
     * @throws ConfigurationException 파라미터 검증 실패 시
     */
    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new ConfigurationException(
                "maxAttempts must be at least 1 (current: " + maxAttempts + ")"
            );
        }
        if (backoff == null) {
            throw new ConfigurationException("backoff cannot be null");
        }
        if (baseDelayMs < 0) {
            throw new ConfigurationException(
                "baseDelayMs cannot be negative (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < 0) {
            throw new ConfigurationException(
                "maxDelayMs cannot be negative (current: " + maxDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new ConfigurationException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        retryableErrors = retryableErrors == null ? null : Set.copyOf(retryableErrors);
        retryableStatusCodes = retryableStatusCodes == null ? null : Set.copyOf(retryableStatusCodes);
    }

    /**
     * 기본 정책.
     *
     * <p>3회 시도, EXPONENTIAL, baseDelay=1초, maxDelay=60초, Jitter 활성화,
     * 모든 Exception 재시도, 상태 코드 재시도 없음.</p>
     */
    public RetryPolicy() {
        this(3, BackoffStrategy.EXPONENTIAL, 1_000L, 60_000L, true, null, null);
    }

    /**
     * 재시도 없이 한 번만 시도하는 정책.
     *
     * @return maxAttempts=1 정책
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy().withMaxAttempts(1);
    }

    /**
     * 재시도 전 대기 시간 계산.
     *
     * @param attempt 방금 실패한 시도 번호 (1부터 시작, 0 이하이면 0 반환)
     * @return 대기 시간 (밀리초, 0 이상)
     */
    public long calculateDelayMs(int attempt) {
        if (attempt <= 0 || baseDelayMs == 0) {
            return 0L;
        }

        double raw = switch (backoff) {
            case FIXED -> baseDelayMs;
            case LINEAR -> (double) baseDelayMs * attempt;
            case EXPONENTIAL -> baseDelayMs * Math.pow(2, attempt - 1);
            case FIBONACCI -> baseDelayMs * fibonacci(attempt);
        };

        double capped = Math.min(raw, maxDelayMs);
        if (jitter) {
            capped = capped * ThreadLocalRandom.current().nextDouble(JITTER_MIN, JITTER_MAX);
        }
        return Math.round(capped);
    }

    /**
     * 예외 재시도 여부 판단.
     *
     * @param error 발생한 예외
     * @param attempt 방금 실패한 시도 번호 (1부터 시작)
     * @return 재시도 대상이고 시도 횟수가 남아 있으면 true
     */
    public boolean shouldRetry(Throwable error, int attempt) {
        if (attempt >= maxAttempts) {
            return false;
        }
        return isRetryable(error);
    }

    /**
     * 시도 횟수와 무관하게 예외 타입이 재시도 대상인지 판단.
     *
     * @param error 발생한 예외
     * @return retryableErrors가 null이거나 error가 그 중 하나의 인스턴스면 true
     */
    public boolean isRetryable(Throwable error) {
        if (retryableErrors == null) {
            return true;
        }
        if (error == null) {
            return false;
        }
        for (Class<? extends Throwable> type : retryableErrors) {
            if (type.isInstance(error)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 응답 상태 코드 재시도 여부 판단.
     *
     * <p>{@link HasStatus}를 구현하지 않은 응답은 재시도하지 않습니다.</p>
     *
     * @param response 성공적으로 반환된 응답
     * @param attempt 방금 완료된 시도 번호 (1부터 시작)
     * @return 상태 코드가 재시도 대상이고 시도 횟수가 남아 있으면 true
     */
    public boolean shouldRetryResponse(Object response, int attempt) {
        if (attempt >= maxAttempts) {
            return false;
        }
        if (retryableStatusCodes == null) {
            return false;
        }
        if (!(response instanceof HasStatus status)) {
            return false;
        }
        return retryableStatusCodes.contains(status.statusCode());
    }

    public RetryPolicy withMaxAttempts(int maxAttempts) {
        return new RetryPolicy(maxAttempts, backoff, baseDelayMs, maxDelayMs, jitter,
            retryableErrors, retryableStatusCodes);
    }

    public RetryPolicy withBackoff(BackoffStrategy backoff) {
        return new RetryPolicy(maxAttempts, backoff, baseDelayMs, maxDelayMs, jitter,
            retryableErrors, retryableStatusCodes);
    }

    public RetryPolicy withBaseDelayMs(long baseDelayMs) {
        return new RetryPolicy(maxAttempts, backoff, baseDelayMs, maxDelayMs, jitter,
            retryableErrors, retryableStatusCodes);
    }

    public RetryPolicy withMaxDelayMs(long maxDelayMs) {
        return new RetryPolicy(maxAttempts, backoff, baseDelayMs, maxDelayMs, jitter,
            retryableErrors, retryableStatusCodes);
    }

    public RetryPolicy withJitter(boolean jitter) {
        return new RetryPolicy(maxAttempts, backoff, baseDelayMs, maxDelayMs, jitter,
            retryableErrors, retryableStatusCodes);
    }

    public RetryPolicy withRetryableErrors(Set<Class<? extends Throwable>> retryableErrors) {
        return new RetryPolicy(maxAttempts, backoff, baseDelayMs, maxDelayMs, jitter,
            retryableErrors, retryableStatusCodes);
    }

    public RetryPolicy withRetryableStatusCodes(Set<Integer> retryableStatusCodes) {
        return new RetryPolicy(maxAttempts, backoff, baseDelayMs, maxDelayMs, jitter,
            retryableErrors, retryableStatusCodes);
    }

    // double 누적: attempt가 커지면 Infinity로 수렴하고 maxDelayMs 상한에 걸린다
    private static double fibonacci(int n) {
        double previous = 0;
        double current = 1;
        for (int i = 1; i < n && !Double.isInfinite(current); i++) {
            double next = previous + current;
            previous = current;
            current = next;
        }
        return current;
    }
}
