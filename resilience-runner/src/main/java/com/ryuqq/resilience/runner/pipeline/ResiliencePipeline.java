package com.ryuqq.resilience.runner.pipeline;

import com.ryuqq.resilience.core.error.Throwables;
import com.ryuqq.resilience.core.outcome.Fail;
import com.ryuqq.resilience.core.outcome.Ok;
import com.ryuqq.resilience.core.outcome.Outcome;
import com.ryuqq.resilience.core.policy.RetryPolicy;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.noop.NoOpCircuitBreaker;
import com.ryuqq.resilience.runner.bulkhead.Bulkhead;
import com.ryuqq.resilience.runner.retry.RetryExecutor;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * Bulkhead, Circuit Breaker, Retry 조합.
 *
 * <p><strong>적용 순서:</strong></p>
 * <pre>
 * Bulkhead( CircuitBreaker( RetryExecutor( operation ) ) )
 * </pre>
 *
 * <ul>
 *   <li>재시도 루프 전체가 Bulkhead Permit 하나 안에서 실행됩니다.</li>
 *   <li>Circuit Breaker는 재시도가 모두 끝난 호출 하나를 성공/실패 1건으로 집계합니다.</li>
 *   <li>Circuit이 열려 있으면 재시도 루프를 시작하지 않습니다.</li>
 * </ul>
 *
 * <p>지정하지 않은 구성요소는 통과(pass-through)로 동작합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * ResiliencePipeline pipeline = ResiliencePipeline.builder()
 *     .bulkhead(new Bulkhead("payments", new SyncResourcePool(20, 100)))
 *     .circuitBreaker(CountingCircuitBreaker.of("payments", 5, 30_000))
 *     .retry(new RetryExecutor(new RetryPolicy().withRetryableErrors(Set.of(IOException.class))))
 *     .build();
 *
 * Outcome<Receipt> outcome = pipeline.attempt(() -> paymentApi.charge(order));
 * }</pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class ResiliencePipeline {

    private final Bulkhead bulkhead;
    private final CircuitBreaker circuitBreaker;
    private final RetryExecutor retry;

    private ResiliencePipeline(Builder builder) {
        this.bulkhead = builder.bulkhead;
        this.circuitBreaker = builder.circuitBreaker;
        this.retry = builder.retry;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 블로킹 작업 실행.
     *
     * @param operation 작업
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws Exception 원래 실패 또는 보호 계층의 실패
     */
    public <T> T execute(Callable<T> operation) throws Exception {
        Callable<T> guarded = circuitBreaker.decorate(() -> retry.execute(operation));
        return bulkhead == null ? guarded.call() : bulkhead.execute(guarded);
    }

    /**
     * 비동기 작업 실행.
     *
     * @param operation 비동기 작업 (재시도마다 새로 호출됨)
     * @param <T> 결과 타입
     * @return 결과 Future
     */
    public <T> CompletableFuture<T> executeAsync(Supplier<? extends CompletionStage<T>> operation) {
        Supplier<CompletableFuture<T>> guarded = circuitBreaker.decorateAsync(() -> retry.executeAsync(operation));
        return bulkhead == null ? guarded.get() : bulkhead.executeAsync(guarded);
    }

    /**
     * 블로킹 작업을 실행하고 결과를 {@link Outcome}으로 반환.
     *
     * @param operation 작업
     * @param <T> 결과 타입
     * @return Ok 또는 Fail(kind, error)
     */
    public <T> Outcome<T> attempt(Callable<T> operation) {
        return Outcome.of(() -> execute(operation));
    }

    /**
     * 비동기 작업을 실행하고 결과를 {@link Outcome}으로 반환.
     *
     * <p>반환된 Future는 예외로 완료되지 않습니다.</p>
     *
     * @param operation 비동기 작업
     * @param <T> 결과 타입
     * @return Ok 또는 Fail(kind, error)로 완료되는 Future
     */
    public <T> CompletableFuture<Outcome<T>> attemptAsync(Supplier<? extends CompletionStage<T>> operation) {
        CompletableFuture<T> execution;
        try {
            execution = executeAsync(operation);
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(Fail.of(e));
        }
        return execution.<Outcome<T>>handle((value, failure) -> {
            if (failure == null) {
                return Ok.of(value);
            }
            return Fail.of(Throwables.unwrap(failure));
        });
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public RetryExecutor getRetry() {
        return retry;
    }

    /**
     * ResiliencePipeline Builder.
     */
    public static final class Builder {

        private Bulkhead bulkhead;
        private CircuitBreaker circuitBreaker = NoOpCircuitBreaker.instance();
        private RetryExecutor retry = new RetryExecutor(RetryPolicy.noRetry());

        private Builder() {
        }

        public Builder bulkhead(Bulkhead bulkhead) {
            this.bulkhead = bulkhead;
            return this;
        }

        public Builder circuitBreaker(CircuitBreaker circuitBreaker) {
            if (circuitBreaker == null) {
                throw new IllegalArgumentException("circuitBreaker cannot be null");
            }
            this.circuitBreaker = circuitBreaker;
            return this;
        }

        public Builder retry(RetryExecutor retry) {
            if (retry == null) {
                throw new IllegalArgumentException("retry cannot be null");
            }
            this.retry = retry;
            return this;
        }

        public ResiliencePipeline build() {
            return new ResiliencePipeline(this);
        }
    }
}
