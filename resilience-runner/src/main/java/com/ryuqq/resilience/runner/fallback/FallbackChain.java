package com.ryuqq.resilience.runner.fallback;

import com.ryuqq.resilience.core.error.ConfigurationException;
import com.ryuqq.resilience.core.error.Throwables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * 순차 Fallback 체인.
 *
 * <p>주 작업이 예상한 타입의 예외로 실패하면 등록 순서대로 Fallback을 시도하고, 처음 성공한 결과를
 * 반환합니다. 모든 Fallback이 실패하면 마지막 Fallback의 예외를 던집니다.</p>
 *
 * <ul>
 *   <li>주 작업 성공: 결과 반환, Fallback 호출 안 함</li>
 *   <li>예상하지 않은 예외: 그대로 전파, Fallback 호출 안 함</li>
 *   <li>Fallback 없음: 주 작업 예외 전파</li>
 * </ul>
 *
 * <p>블로킹 실행({@link #execute(Callable)})은 블로킹 Fallback만 허용합니다. 비동기 실행은 두 종류 모두 허용합니다.</p>
 *
 * @param <T> 결과 타입
 * @author Resilience Team
 * @since 1.0.0
 */
public final class FallbackChain<T> {

    private static final Logger log = LoggerFactory.getLogger(FallbackChain.class);

    private record Fallback<T>(Callable<T> blocking, Supplier<? extends CompletionStage<T>> async) {

        boolean isAsync() {
            return async != null;
        }
    }

    private final Set<Class<? extends Throwable>> expectedExceptions;
    private final List<Fallback<T>> fallbacks = new CopyOnWriteArrayList<>();

    /**
     * 모든 {@link Exception}을 대상으로 하는 체인 생성.
     */
    public FallbackChain() {
        this.expectedExceptions = null;
    }

    /**
     * 지정한 예외 타입만 대상으로 하는 체인 생성.
     *
     * @param expectedExceptions Fallback을 시도할 예외 타입 (하위 타입 포함)
     */
    @SafeVarargs
    public FallbackChain(Class<? extends Throwable>... expectedExceptions) {
        if (expectedExceptions == null || expectedExceptions.length == 0) {
            throw new IllegalArgumentException("expectedExceptions cannot be empty");
        }
        this.expectedExceptions = Set.copyOf(Arrays.asList(expectedExceptions));
    }

    /**
     * 블로킹 Fallback 추가.
     *
     * @param fallback Fallback 작업
     * @return this
     */
    public FallbackChain<T> addFallback(Callable<T> fallback) {
        if (fallback == null) {
            throw new IllegalArgumentException("fallback cannot be null");
        }
        fallbacks.add(new Fallback<>(fallback, null));
        return this;
    }

    /**
     * 비동기 Fallback 추가.
     *
     * @param fallback 비동기 Fallback 작업
     * @return this
     */
    public FallbackChain<T> addAsyncFallback(Supplier<? extends CompletionStage<T>> fallback) {
        if (fallback == null) {
            throw new IllegalArgumentException("fallback cannot be null");
        }
        fallbacks.add(new Fallback<>(null, fallback));
        return this;
    }

    /**
     * 등록된 Fallback 수.
     *
     * @return Fallback 수
     */
    public int size() {
        return fallbacks.size();
    }

    /**
     * 블로킹 실행.
     *
     * @param primary 주 작업
     * @return 주 작업 또는 처음 성공한 Fallback의 결과
     * @throws ConfigurationException 비동기 Fallback이 등록된 경우 (주 작업 호출 안 함)
     * @throws Exception 예상하지 않은 주 작업 예외, 또는 마지막 Fallback 예외
     */
    public T execute(Callable<T> primary) throws Exception {
        List<Fallback<T>> snapshot = List.copyOf(fallbacks);
        for (Fallback<T> fallback : snapshot) {
            if (fallback.isAsync()) {
                throw new ConfigurationException("Blocking execution cannot use async fallbacks");
            }
        }

        try {
            return primary.call();
        } catch (Exception e) {
            if (!isExpected(e) || snapshot.isEmpty()) {
                throw e;
            }
            log.warn("Primary operation failed with {}, trying {} fallback(s)", e.toString(), snapshot.size());

            Exception last = e;
            for (int i = 0; i < snapshot.size(); i++) {
                try {
                    return snapshot.get(i).blocking().call();
                } catch (Exception fallbackError) {
                    log.debug("Fallback {}/{} failed: {}", i + 1, snapshot.size(), fallbackError.toString());
                    last = fallbackError;
                }
            }
            throw last;
        }
    }

    /**
     * 비동기 실행.
     *
     * @param primary 주 비동기 작업
     * @return 주 작업 또는 처음 성공한 Fallback의 결과 Future
     */
    public CompletableFuture<T> executeAsync(Supplier<? extends CompletionStage<T>> primary) {
        List<Fallback<T>> snapshot = List.copyOf(fallbacks);
        return invoke(primary)
            .handle((value, failure) -> {
                if (failure == null) {
                    return CompletableFuture.completedFuture(value);
                }
                Throwable cause = Throwables.unwrap(failure);
                if (!(cause instanceof Exception) || !isExpected(cause) || snapshot.isEmpty()) {
                    return CompletableFuture.<T>failedFuture(cause);
                }
                log.warn("Primary operation failed with {}, trying {} fallback(s)", cause.toString(), snapshot.size());
                return tryFallback(snapshot, 0);
            })
            .thenCompose(next -> next);
    }

    private CompletableFuture<T> tryFallback(List<Fallback<T>> snapshot, int index) {
        Fallback<T> fallback = snapshot.get(index);
        CompletableFuture<T> attempt = fallback.isAsync() ? invoke(fallback.async()) : callBlocking(fallback.blocking());
        return attempt
            .handle((value, failure) -> {
                if (failure == null) {
                    return CompletableFuture.completedFuture(value);
                }
                Throwable cause = Throwables.unwrap(failure);
                log.debug("Fallback {}/{} failed: {}", index + 1, snapshot.size(), cause.toString());
                if (index + 1 >= snapshot.size()) {
                    return CompletableFuture.<T>failedFuture(cause);
                }
                return tryFallback(snapshot, index + 1);
            })
            .thenCompose(next -> next);
    }

    private static <V> CompletableFuture<V> invoke(Supplier<? extends CompletionStage<V>> operation) {
        try {
            return operation.get().toCompletableFuture();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static <V> CompletableFuture<V> callBlocking(Callable<V> operation) {
        try {
            return CompletableFuture.completedFuture(operation.call());
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private boolean isExpected(Throwable error) {
        if (expectedExceptions == null) {
            return error instanceof Exception;
        }
        for (Class<? extends Throwable> type : expectedExceptions) {
            if (type.isInstance(error)) {
                return true;
            }
        }
        return false;
    }
}
