package com.ryuqq.resilience.runner.retry;

import com.ryuqq.resilience.core.error.Throwables;
import com.ryuqq.resilience.core.event.ResilienceEvent;
import com.ryuqq.resilience.core.event.ResilienceEventListener;
import com.ryuqq.resilience.core.policy.HasStatus;
import com.ryuqq.resilience.core.policy.RetryPolicy;
import com.ryuqq.resilience.core.time.AsyncSleeper;
import com.ryuqq.resilience.core.time.Sleeper;
import com.ryuqq.resilience.core.time.TimeSource;
import com.ryuqq.resilience.runner.support.EventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * RetryPolicy 기반 재시도 실행기.
 *
 * <p>블로킹 작업({@link #execute(Callable)})과 비동기 작업({@link #executeAsync(Supplier)})에
 * 같은 재시도 루프를 적용합니다. 두 경로는 대기 방식만 다릅니다.</p>
 *
 * <p><strong>재시도 루프:</strong></p>
 * <pre>
 * 1. attempt = 1
 * 2. 작업 호출
 * 3. 성공 → 반환 (재시도 대상 상태 코드 응답이면 실패로 취급, 마지막 시도면 그대로 반환)
 * 4. 재시도 불가 예외 → 즉시 전파 (대기 없음)
 * 5. 재시도 가능 + 시도 남음 → onRetry(attempt, error) → calculateDelayMs(attempt) 대기 → attempt++ → 2
 * 6. 시도 소진 → 마지막 예외를 그대로 전파
 * </pre>
 *
 * <p>{@link Exception}만 재시도 대상입니다. {@link Error}와 {@link InterruptedException}은
 * 즉시 전파됩니다. 호출 간에 공유되는 가변 상태가 없으므로 여러 스레드에서 동시에 사용해도 안전합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final String name;
    private final RetryPolicy policy;
    private final RetryObserver observer;
    private final TimeSource timeSource;
    private final Sleeper sleeper;
    private final AsyncSleeper asyncSleeper;
    private final EventPublisher events;

    /**
     * 기본 시간 구현으로 생성.
     *
     * @param policy 재시도 정책
     * @throws IllegalArgumentException policy가 null인 경우
     */
    public RetryExecutor(RetryPolicy policy) {
        this(builder(policy));
    }

    private RetryExecutor(Builder builder) {
        this.name = builder.name;
        this.policy = builder.policy;
        this.observer = builder.observer;
        this.timeSource = builder.timeSource;
        this.sleeper = builder.sleeper;
        this.asyncSleeper = builder.asyncSleeper;
        this.events = new EventPublisher(builder.name, builder.eventListener);
    }

    /**
     * Builder 생성.
     *
     * @param policy 재시도 정책
     * @return Builder
     * @throws IllegalArgumentException policy가 null인 경우
     */
    public static Builder builder(RetryPolicy policy) {
        return new Builder(policy);
    }

    /**
     * 블로킹 작업을 재시도 정책에 따라 실행.
     *
     * @param operation 실행할 작업
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws InterruptedException 대기 중 인터럽트된 경우
     * @throws Exception 재시도 불가 예외 또는 시도 소진 후 마지막 예외 (원본 그대로)
     */
    public <T> T execute(Callable<T> operation) throws Exception {
        long startedAt = timeSource.nanoTime();

        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            T result;
            try {
                result = operation.call();
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                if (!policy.shouldRetry(e, attempt)) {
                    logGiveUp(attempt, e, startedAt);
                    throw e;
                }
                sleeper.sleep(prepareRetry(attempt, e));
                continue;
            }

            if (policy.shouldRetryResponse(result, attempt)) {
                sleeper.sleep(prepareRetry(attempt, new RetryableResponseException((HasStatus) result)));
                continue;
            }
            return result;
        }

        throw new IllegalStateException(
            "No exception captured after " + policy.maxAttempts() + " attempts of " + name
        );
    }

    /**
     * 비동기 작업을 재시도 정책에 따라 실행.
     *
     * <p>대기는 {@link AsyncSleeper}로 이루어지며 호출 스레드를 막지 않습니다.
     * 반환된 Future의 실패 원인은 {@code CompletionException}으로 감싸지지 않은 원본 예외입니다.</p>
     *
     * @param operation 실행할 비동기 작업 (시도마다 새로 호출됨)
     * @param <T> 결과 타입
     * @return 최종 결과 Future
     */
    public <T> CompletableFuture<T> executeAsync(Supplier<? extends CompletionStage<T>> operation) {
        return attemptAsync(operation, 1, timeSource.nanoTime());
    }

    private <T> CompletableFuture<T> attemptAsync(
        Supplier<? extends CompletionStage<T>> operation,
        int attempt,
        long startedAt
    ) {
        CompletionStage<T> stage;
        try {
            stage = operation.get();
        } catch (RuntimeException e) {
            stage = CompletableFuture.failedFuture(e);
        }

        return stage
            .handle((result, failure) -> {
                if (failure == null) {
                    if (policy.shouldRetryResponse(result, attempt)) {
                        RetryableResponseException signal = new RetryableResponseException((HasStatus) result);
                        return retryAsync(operation, attempt, signal, startedAt);
                    }
                    return CompletableFuture.completedFuture(result);
                }

                Throwable cause = Throwables.unwrap(failure);
                if (!(cause instanceof Exception) || !policy.shouldRetry(cause, attempt)) {
                    logGiveUp(attempt, cause, startedAt);
                    return CompletableFuture.<T>failedFuture(cause);
                }
                return retryAsync(operation, attempt, cause, startedAt);
            })
            .thenCompose(next -> next)
            .toCompletableFuture();
    }

    private <T> CompletableFuture<T> retryAsync(
        Supplier<? extends CompletionStage<T>> operation,
        int attempt,
        Throwable error,
        long startedAt
    ) {
        long delayMs = prepareRetry(attempt, error);
        return asyncSleeper.sleep(delayMs)
            .thenCompose(ignored -> attemptAsync(operation, attempt + 1, startedAt));
    }

    /**
     * 재시도 로그, 이벤트, Observer 알림 후 대기 시간을 반환.
     */
    private long prepareRetry(int attempt, Throwable error) {
        long delayMs = policy.calculateDelayMs(attempt);
        log.info("Retry {}/{} for {} in {}ms after {}",
            attempt, policy.maxAttempts(), name, delayMs, error.toString());
        events.publish(ResilienceEvent.RETRY_ATTEMPT,
            "attempt", attempt,
            "maxAttempts", policy.maxAttempts(),
            "delayMs", delayMs,
            "error", error.getClass().getName());
        notifyObserver(attempt, error);
        return delayMs;
    }

    private void notifyObserver(int attempt, Throwable error) {
        if (observer == null) {
            return;
        }
        try {
            observer.onRetry(attempt, error);
        } catch (RuntimeException e) {
            log.warn("Retry observer failed on attempt {} of {}", attempt, name, e);
            events.publish(ResilienceEvent.RETRY_OBSERVER_FAILED,
                "attempt", attempt,
                "error", e.getClass().getName());
        }
    }

    private void logGiveUp(int attempt, Throwable error, long startedAt) {
        if (!(error instanceof Exception) || !policy.isRetryable(error)) {
            log.debug("{} failed with non-retryable {} on attempt {}", name, error.getClass().getName(), attempt);
            return;
        }
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(timeSource.nanoTime() - startedAt);
        log.error("All {} retry attempts failed for {} after {}ms", attempt, name, elapsedMs, error);
        events.publish(ResilienceEvent.RETRY_EXHAUSTED,
            "attempts", attempt,
            "elapsedMs", elapsedMs,
            "error", error.getClass().getName());
    }

    /**
     * 재시도 정책.
     *
     * @return 정책
     */
    public RetryPolicy getPolicy() {
        return policy;
    }

    /**
     * 실행기 이름.
     *
     * @return 이름
     */
    public String getName() {
        return name;
    }

    /**
     * RetryExecutor Builder.
     *
     * <p>지정하지 않은 시간 구현은 시스템 기본값을 사용합니다.</p>
     */
    public static final class Builder {

        private final RetryPolicy policy;
        private String name = "retry";
        private RetryObserver observer;
        private TimeSource timeSource = TimeSource.system();
        private Sleeper sleeper = Sleeper.system();
        private AsyncSleeper asyncSleeper = AsyncSleeper.system();
        private ResilienceEventListener eventListener = ResilienceEventListener.noop();

        private Builder(RetryPolicy policy) {
            if (policy == null) {
                throw new IllegalArgumentException("policy cannot be null");
            }
            this.policy = policy;
        }

        public Builder name(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name cannot be null or blank");
            }
            this.name = name;
            return this;
        }

        public Builder onRetry(RetryObserver observer) {
            this.observer = observer;
            return this;
        }

        public Builder timeSource(TimeSource timeSource) {
            this.timeSource = requireNonNull(timeSource, "timeSource");
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = requireNonNull(sleeper, "sleeper");
            return this;
        }

        public Builder asyncSleeper(AsyncSleeper asyncSleeper) {
            this.asyncSleeper = requireNonNull(asyncSleeper, "asyncSleeper");
            return this;
        }

        public Builder eventListener(ResilienceEventListener eventListener) {
            this.eventListener = requireNonNull(eventListener, "eventListener");
            return this;
        }

        public RetryExecutor build() {
            return new RetryExecutor(this);
        }

        private static <V> V requireNonNull(V value, String field) {
            if (value == null) {
                throw new IllegalArgumentException(field + " cannot be null");
            }
            return value;
        }
    }
}
