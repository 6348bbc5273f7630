package com.ryuqq.resilience.runner.retry;

import com.ryuqq.resilience.core.error.ConfigurationException;
import com.ryuqq.resilience.core.event.ResilienceEventListener;
import com.ryuqq.resilience.core.policy.BackoffStrategy;
import com.ryuqq.resilience.core.policy.RetryPolicy;
import com.ryuqq.resilience.core.time.AsyncSleeper;
import com.ryuqq.resilience.core.time.Sleeper;
import com.ryuqq.resilience.core.time.TimeSource;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * 작업에 재시도를 입히는 데코레이터.
 *
 * <p>완성된 {@link RetryPolicy}를 넘기거나, 개별 파라미터만 지정해 기본 정책을 덮어쓸 수 있습니다.
 * 두 방식을 함께 쓰면 {@link ConfigurationException}이 발생합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * RetryDecorator retry = RetryDecorator.builder()
 *     .maxAttempts(5)
 *     .backoff(BackoffStrategy.FIBONACCI)
 *     .retryOn(IOException.class)
 *     .onRetry((attempt, error) -> metrics.increment("retry"))
 *     .build();
 *
 * Callable<Quote> guarded = retry.decorate(() -> quoteApi.fetch(symbol));
 * }</pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class RetryDecorator {

    private final RetryExecutor executor;

    private RetryDecorator(RetryExecutor executor) {
        this.executor = executor;
    }

    /**
     * Builder 생성.
     *
     * @return Builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * 블로킹 작업을 감쌉니다.
     *
     * @param operation 작업
     * @param <T> 결과 타입
     * @return 호출할 때마다 재시도 루프를 거치는 Callable
     */
    public <T> Callable<T> decorate(Callable<T> operation) {
        return () -> executor.execute(operation);
    }

    /**
     * 비동기 작업을 감쌉니다.
     *
     * @param operation 비동기 작업
     * @param <T> 결과 타입
     * @return 호출할 때마다 재시도 루프를 거치는 Supplier
     */
    public <T> Supplier<CompletableFuture<T>> decorateAsync(Supplier<? extends CompletionStage<T>> operation) {
        return () -> executor.executeAsync(operation);
    }

    public <T> T execute(Callable<T> operation) throws Exception {
        return executor.execute(operation);
    }

    public <T> CompletableFuture<T> executeAsync(Supplier<? extends CompletionStage<T>> operation) {
        return executor.executeAsync(operation);
    }

    public RetryPolicy getPolicy() {
        return executor.getPolicy();
    }

    /**
     * RetryDecorator Builder.
     */
    public static final class Builder {

        private RetryPolicy policy;
        private Integer maxAttempts;
        private BackoffStrategy backoff;
        private Long baseDelayMs;
        private Long maxDelayMs;
        private Boolean jitter;
        private Set<Class<? extends Throwable>> retryableErrors;
        private Set<Integer> retryableStatusCodes;

        private String name = "retry";
        private RetryObserver observer;
        private TimeSource timeSource;
        private Sleeper sleeper;
        private AsyncSleeper asyncSleeper;
        private ResilienceEventListener eventListener;

        private Builder() {
        }

        public Builder policy(RetryPolicy policy) {
            this.policy = policy;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder backoff(BackoffStrategy backoff) {
            this.backoff = backoff;
            return this;
        }

        public Builder baseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
            return this;
        }

        public Builder maxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
            return this;
        }

        public Builder jitter(boolean jitter) {
            this.jitter = jitter;
            return this;
        }

        @SafeVarargs
        public final Builder retryOn(Class<? extends Throwable>... errorTypes) {
            this.retryableErrors = new LinkedHashSet<>(Arrays.asList(errorTypes));
            return this;
        }

        public Builder retryOnStatus(Integer... statusCodes) {
            this.retryableStatusCodes = new LinkedHashSet<>(Arrays.asList(statusCodes));
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder onRetry(RetryObserver observer) {
            this.observer = observer;
            return this;
        }

        public Builder timeSource(TimeSource timeSource) {
            this.timeSource = timeSource;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public Builder asyncSleeper(AsyncSleeper asyncSleeper) {
            this.asyncSleeper = asyncSleeper;
            return this;
        }

        public Builder eventListener(ResilienceEventListener eventListener) {
            this.eventListener = eventListener;
            return this;
        }

        /**
         * RetryDecorator 생성.
         *
         * @return RetryDecorator
         * @throws ConfigurationException 정책과 개별 파라미터를 함께 지정했거나 값이 잘못된 경우
         */
        public RetryDecorator build() {
            RetryExecutor.Builder executor = RetryExecutor.builder(resolvePolicy())
                .name(name)
                .onRetry(observer);
            if (timeSource != null) {
                executor.timeSource(timeSource);
            }
            if (sleeper != null) {
                executor.sleeper(sleeper);
            }
            if (asyncSleeper != null) {
                executor.asyncSleeper(asyncSleeper);
            }
            if (eventListener != null) {
                executor.eventListener(eventListener);
            }
            return new RetryDecorator(executor.build());
        }

        private RetryPolicy resolvePolicy() {
            boolean hasOverrides = maxAttempts != null || backoff != null || baseDelayMs != null
                || maxDelayMs != null || jitter != null || retryableErrors != null || retryableStatusCodes != null;

            if (policy != null) {
                if (hasOverrides) {
                    throw new ConfigurationException("Cannot specify both policy and individual retry parameters");
                }
                return policy;
            }

            RetryPolicy defaults = new RetryPolicy();
            return new RetryPolicy(
                maxAttempts != null ? maxAttempts : defaults.maxAttempts(),
                backoff != null ? backoff : defaults.backoff(),
                baseDelayMs != null ? baseDelayMs : defaults.baseDelayMs(),
                maxDelayMs != null ? maxDelayMs : defaults.maxDelayMs(),
                jitter != null ? jitter : defaults.jitter(),
                retryableErrors,
                retryableStatusCodes
            );
        }
    }
}
