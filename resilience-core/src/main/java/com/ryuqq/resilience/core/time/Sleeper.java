package com.ryuqq.resilience.core.time;

/**
 * 블로킹 대기.
 *
 * <p>호출한 스레드를 지정된 시간 동안 멈춥니다. 동기(blocking) 실행 경로에서만 사용됩니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * 대기.
     *
     * @param millis 대기 시간 (밀리초, 0 이하이면 즉시 반환)
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    void sleep(long millis) throws InterruptedException;

    /**
     * {@link Thread#sleep(long)} 기반 Sleeper.
     *
     * @return 시스템 Sleeper
     */
    static Sleeper system() {
        return millis -> {
            if (millis > 0) {
                Thread.sleep(millis);
            }
        };
    }
}
