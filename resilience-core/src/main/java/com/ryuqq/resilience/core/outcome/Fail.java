package com.ryuqq.resilience.core.outcome;

import com.ryuqq.resilience.core.error.ErrorKind;

/**
 * 실패 결과.
 *
 * <p>원래 작업의 실패인지, Circuit 차단이나 대기열 포화처럼 보호 계층이 만든 실패인지를
 * {@link ErrorKind}로 구분합니다.</p>
 *
 * @param kind 실패 종류
 * @param error 원인 예외
 * @param <T> 결과 값 타입
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public record Fail<T>(
    ErrorKind kind,
    Throwable error
) implements Outcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException kind 또는 error가 null인 경우
     */
    public Fail {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
    }

    /**
     * 예외로부터 Fail 생성 (종류는 {@link ErrorKind#of(Throwable)}로 판정).
     *
     * @param error 원인 예외
     * @param <T> 결과 값 타입
     * @return Fail 인스턴스
     * @throws IllegalArgumentException error가 null인 경우
     */
    public static <T> Fail<T> of(Throwable error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        return new Fail<>(ErrorKind.of(error), error);
    }
}
