package com.ryuqq.resilience.core.outcome;

import com.ryuqq.resilience.core.error.ErrorKind;

import java.util.concurrent.Callable;

/**
 * 보호된 작업의 실행 결과.
 *
 * <p>Outcome은 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 결과 값과 함께 성공</li>
 *   <li>{@link Fail}: 실패 종류({@link ErrorKind})와 원인 예외</li>
 * </ul>
 *
 * <p>예외를 던지는 대신 값으로 결과를 다루고 싶을 때 사용합니다.</p>
 *
 * <pre>{@code
 * Outcome<Receipt> outcome = pipeline.attempt(() -> paymentApi.charge(order));
 * if (outcome instanceof Fail<Receipt> fail && fail.kind() == ErrorKind.CIRCUIT_OPEN) {
 *     return Receipt.deferred(order);
 * }
 * }</pre>
 *
 * @param <T> 결과 값 타입
 * @author Resilience Team
 * @since 1.0.0
 */
public sealed interface Outcome<T> permits Ok, Fail {

    /**
     * 작업을 실행하고 결과를 Outcome으로 변환.
     *
     * <p>{@link Error}는 변환하지 않고 그대로 전파합니다. 인터럽트로 실패한 경우
     * 현재 스레드의 인터럽트 플래그를 복원합니다.</p>
     *
     * @param operation 실행할 작업
     * @param <T> 결과 타입
     * @return Ok 또는 Fail
     */
    static <T> Outcome<T> of(Callable<T> operation) {
        try {
            return Ok.of(operation.call());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Fail.of(e);
        } catch (Exception e) {
            return Fail.of(e);
        }
    }

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFail() {
        return this instanceof Fail;
    }
}
