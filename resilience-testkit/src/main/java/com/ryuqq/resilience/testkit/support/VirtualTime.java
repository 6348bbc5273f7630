package com.ryuqq.resilience.testkit.support;

import com.ryuqq.resilience.core.time.AsyncSleeper;
import com.ryuqq.resilience.core.time.Sleeper;
import com.ryuqq.resilience.core.time.TimeSource;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Deterministic clock that also acts as a blocking and cooperative sleeper.
 *
 * <p>Sleeping never waits: it records the requested delay and advances the clock by it,
 * so retry back-offs and circuit recovery timeouts can be tested instantly. The
 * cooperative view returned by {@link #asyncSleeper()} shares the same clock and recording.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * VirtualTime time = new VirtualTime();
 * RetryExecutor executor = RetryExecutor.builder(policy)
 *     .timeSource(time).sleeper(time).asyncSleeper(time.asyncSleeper())
 *     .build();
 *
 * executor.execute(flakyCall);
 * assertThat(time.sleeps()).containsExactly(1000L, 2000L);
 * </pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class VirtualTime implements TimeSource, Sleeper {

    private final AtomicLong nanos;
    private final List<Long> sleeps = new ArrayList<>();

    /**
     * Creates a clock starting at an arbitrary non-zero instant.
     */
    public VirtualTime() {
        this(TimeUnit.SECONDS.toNanos(1_000));
    }

    /**
     * Creates a clock starting at the given instant.
     *
     * @param startNanos initial reading of {@link #nanoTime()}
     */
    public VirtualTime(long startNanos) {
        this.nanos = new AtomicLong(startNanos);
    }

    @Override
    public long nanoTime() {
        return nanos.get();
    }

    @Override
    public void sleep(long millis) {
        record(millis);
    }

    /**
     * Returns a cooperative sleeper backed by this clock.
     *
     * <p>Each sleep is recorded, advances the clock and completes immediately.</p>
     *
     * @return async view of this clock
     */
    public AsyncSleeper asyncSleeper() {
        return millis -> {
            record(millis);
            return CompletableFuture.completedFuture(null);
        };
    }

    /**
     * Moves the clock forward without recording a sleep.
     *
     * @param millis milliseconds to advance
     */
    public void advance(long millis) {
        nanos.addAndGet(TimeUnit.MILLISECONDS.toNanos(millis));
    }

    /**
     * Returns every delay requested so far, in call order.
     *
     * @return snapshot of recorded sleeps in milliseconds
     */
    public synchronized List<Long> sleeps() {
        return List.copyOf(sleeps);
    }

    /**
     * Returns the sum of all recorded sleeps.
     *
     * @return total slept milliseconds
     */
    public synchronized long totalSleptMillis() {
        long total = 0;
        for (Long sleep : sleeps) {
            total += sleep;
        }
        return total;
    }

    private synchronized void record(long millis) {
        sleeps.add(millis);
        if (millis > 0) {
            advance(millis);
        }
    }
}
