package com.ryuqq.resilience.core.protection;

import com.ryuqq.resilience.core.error.CircuitOpenException;
import com.ryuqq.resilience.core.error.Throwables;

import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * Circuit Breaker SPI.
 *
 * <p>보호 대상 작업의 실패를 추적하고, 임계값에 도달하면 작업을 호출하지 않고
 * 빠르게 실패(Fail-Fast)시켜 장애가 전파되는 것을 막습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CircuitBreaker cb = CountingCircuitBreaker.of("payment-api", new CircuitBreakerConfig(), TimeSource.system());
 *
 * // 블로킹 경로
 * Receipt receipt = cb.call(() -> paymentApi.charge(order));
 *
 * // 비동기 경로
 * CompletableFuture<Receipt> future = cb.callAsync(() -> paymentApi.chargeAsync(order));
 * }</pre>
 *
 * <p>직접 제어가 필요하면 {@link #tryAcquirePermission()}으로 받은 {@link CallPermission}을
 * {@link #onSuccess(CallPermission)} / {@link #onError(CallPermission, Throwable)}에 그대로 넘깁니다.</p>
 *
 * <pre>{@code
 * Optional<CallPermission> permission = cb.tryAcquirePermission();
 * if (permission.isEmpty()) {
 *     return cachedReceipt(order);
 * }
 * try {
 *     Receipt receipt = paymentApi.charge(order);
 *     cb.onSuccess(permission.get());
 *     return receipt;
 * } catch (IOException e) {
 *     cb.onError(permission.get(), e);
 *     throw e;
 * }
 * }</pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface CircuitBreaker {

    /**
     * Circuit 이름 (로그, 예외 메시지용).
     *
     * @return 이름
     */
    String getName();

    /**
     * 요청 통과 허용 여부 확인.
     *
     * <ul>
     *   <li>CLOSED: 항상 허용</li>
     *   <li>OPEN: 복구 대기 시간이 지났으면 HALF_OPEN으로 전이 후 시험 요청으로 허용, 아니면 차단</li>
     *   <li>HALF_OPEN: 진행 중인 시험 요청이 없을 때만 허용</li>
     * </ul>
     *
     * <p>허가를 받은 호출자는 받은 토큰으로 {@link #onSuccess(CallPermission)} 또는
     * {@link #onError(CallPermission, Throwable)} 중 하나를 호출해야 합니다.</p>
     *
     * @return 통과면 허가 토큰, 차단이면 empty
     */
    Optional<CallPermission> tryAcquirePermission();

    /**
     * 실행 성공 기록.
     *
     * @param permission {@link #tryAcquirePermission()}으로 받은 토큰
     */
    void onSuccess(CallPermission permission);

    /**
     * 실행 실패 기록.
     *
     * @param permission {@link #tryAcquirePermission()}으로 받은 토큰
     * @param error 발생한 예외
     */
    void onError(CallPermission permission, Throwable error);

    /**
     * 현재 상태 조회.
     *
     * @return CLOSED, OPEN, HALF_OPEN 중 하나
     */
    CircuitBreakerState getState();

    /**
     * 현재 집계된 실패 횟수.
     *
     * @return 실패 횟수
     */
    int getFailureCount();

    /**
     * CLOSED 상태로 강제 리셋 (실패 횟수 0).
     */
    void reset();

    /**
     * 블로킹 작업을 Circuit Breaker로 보호하여 실행.
     *
     * @param operation 보호 대상 작업
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws CircuitOpenException 차단 상태인 경우 (작업은 호출되지 않음)
     * @throws Exception 작업이 던진 예외 (그대로 전파)
     */
    default <T> T call(Callable<T> operation) throws Exception {
        Optional<CallPermission> permission = tryAcquirePermission();
        if (permission.isEmpty()) {
            throw new CircuitOpenException(getName());
        }
        T result;
        try {
            result = operation.call();
        } catch (Throwable error) {
            onError(permission.get(), error);
            throw error;
        }
        onSuccess(permission.get());
        return result;
    }

    /**
     * 비동기 작업을 Circuit Breaker로 보호하여 실행.
     *
     * <p>차단 상태이면 {@link CircuitOpenException}으로 실패한 Future를 반환하며 작업은 호출되지 않습니다.</p>
     *
     * @param operation 보호 대상 비동기 작업
     * @param <T> 결과 타입
     * @return 작업 결과 Future
     */
    default <T> CompletableFuture<T> callAsync(Supplier<? extends CompletionStage<T>> operation) {
        Optional<CallPermission> acquired = tryAcquirePermission();
        if (acquired.isEmpty()) {
            return CompletableFuture.failedFuture(new CircuitOpenException(getName()));
        }
        CallPermission permission = acquired.get();
        CompletionStage<T> stage;
        try {
            stage = operation.get();
        } catch (RuntimeException | Error error) {
            onError(permission, error);
            return CompletableFuture.failedFuture(error);
        }

        CompletableFuture<T> result = new CompletableFuture<>();
        stage.whenComplete((value, error) -> {
            if (error == null) {
                onSuccess(permission);
                result.complete(value);
            } else {
                Throwable cause = Throwables.unwrap(error);
                onError(permission, cause);
                result.completeExceptionally(cause);
            }
        });
        return result;
    }

    /**
     * 블로킹 작업을 보호된 Callable로 감쌉니다.
     *
     * @param operation 보호 대상 작업
     * @param <T> 결과 타입
     * @return 호출 시마다 {@link #call(Callable)}을 거치는 Callable
     */
    default <T> Callable<T> decorate(Callable<T> operation) {
        return () -> call(operation);
    }

    /**
     * 비동기 작업을 보호된 Supplier로 감쌉니다.
     *
     * @param operation 보호 대상 비동기 작업
     * @param <T> 결과 타입
     * @return 호출 시마다 {@link #callAsync(Supplier)}를 거치는 Supplier
     */
    default <T> Supplier<CompletableFuture<T>> decorateAsync(Supplier<? extends CompletionStage<T>> operation) {
        return () -> callAsync(operation);
    }
}
