package com.ryuqq.resilience.core.time;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * 비블로킹(cooperative) 대기.
 *
 * <p>현재 작업만 지연시키고 스레드는 점유하지 않습니다. 반환된 Future가 완료되는 시점이
 * 대기 종료 시점입니다. 비동기 실행 경로와 비동기 Resource Pool의 타임아웃에 사용됩니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface AsyncSleeper {

    /**
     * 대기 예약.
     *
     * <p>호출자는 더 이상 필요 없는 대기를 {@link CompletableFuture#cancel(boolean)}로 취소할 수 있고,
     * 취소된 대기에 연결된 후속 작업은 실행되지 않습니다.</p>
     *
     * @param millis 대기 시간 (밀리초)
     * @return 대기 시간이 지나면 완료되는 Future
     */
    CompletableFuture<Void> sleep(long millis);

    /**
     * {@link CompletableFuture#delayedExecutor(long, TimeUnit)} 기반 AsyncSleeper.
     *
     * @return 시스템 AsyncSleeper
     */
    static AsyncSleeper system() {
        return millis -> {
            if (millis <= 0) {
                return CompletableFuture.completedFuture(null);
            }
            return CompletableFuture.runAsync(() -> { },
                CompletableFuture.delayedExecutor(millis, TimeUnit.MILLISECONDS));
        };
    }
}
