package com.ryuqq.resilience.core.outcome;

/**
 * 성공 결과.
 *
 * @param value 결과 값 (null 허용)
 * @param <T> 결과 값 타입
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public record Ok<T>(T value) implements Outcome<T> {

    /**
     * Ok 생성.
     *
     * @param value 결과 값
     * @param <T> 결과 값 타입
     * @return Ok 인스턴스
     */
    public static <T> Ok<T> of(T value) {
        return new Ok<>(value);
    }
}
