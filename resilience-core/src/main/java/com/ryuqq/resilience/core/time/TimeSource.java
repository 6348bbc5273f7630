package com.ryuqq.resilience.core.time;

/**
 * 단조 증가(monotonic) 시간 소스.
 *
 * <p>Circuit Breaker의 복구 대기 시간, RetryExecutor의 경과 시간 측정에 사용됩니다.
 * 테스트에서는 가상 시간을 주입하여 실제 대기 없이 시간을 진행시킬 수 있습니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TimeSource {

    /**
     * 현재 시각 (나노초, 임의의 기준점).
     *
     * @return 단조 증가하는 나노초 값
     */
    long nanoTime();

    /**
     * 시스템 시간 소스 ({@link System#nanoTime()}).
     *
     * @return 시스템 TimeSource
     */
    static TimeSource system() {
        return System::nanoTime;
    }
}
