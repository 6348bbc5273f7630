package com.ryuqq.resilience.core.error;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * 예외 유틸리티.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class Throwables {

    private Throwables() {
        throw new AssertionError("Utility class");
    }

    /**
     * 비동기 래퍼 예외를 벗겨 원래 실패를 반환.
     *
     * <p>{@link CompletionException}, {@link ExecutionException}은 원인이 있는 한 계속 벗겨냅니다.</p>
     *
     * @param error 비동기 경로에서 전달된 예외
     * @return 원래 실패
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
