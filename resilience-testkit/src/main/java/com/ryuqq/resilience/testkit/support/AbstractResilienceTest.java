package com.ryuqq.resilience.testkit.support;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Abstract base class for resilience component tests.
 *
 * <p>This class provides fresh virtual time, a manual async sleeper, an event recorder and a
 * worker pool for concurrency scenarios before each test.</p>
 *
 * <p><strong>Test Infrastructure:</strong></p>
 * <ul>
 *   <li>VirtualTime: clock plus blocking sleeper plus instant async sleeper</li>
 *   <li>ManualAsyncSleeper: async delays fired on demand</li>
 *   <li>RecordingEventListener: captured diagnostic events</li>
 *   <li>workers: cached thread pool, shut down after each test</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyBreakerTest extends AbstractResilienceTest {
 *     {@literal @}Test
 *     void opensAfterThreshold() {
 *         CircuitBreaker cb = CountingCircuitBreaker.of("svc", config, time, events);
 *         // ... test logic ...
 *         assertEquals(1, events.count(ResilienceEvent.CIRCUIT_TRANSITION));
 *     }
 * }
 * </pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public abstract class AbstractResilienceTest {

    protected VirtualTime time;
    protected ManualAsyncSleeper manualSleeper;
    protected RecordingEventListener events;
    protected ExecutorService workers;

    /**
     * Sets up test fixtures before each test.
     */
    @BeforeEach
    protected void setUpResilienceFixtures() {
        time = new VirtualTime();
        manualSleeper = new ManualAsyncSleeper();
        events = new RecordingEventListener();
        workers = Executors.newCachedThreadPool();
    }

    /**
     * Stops worker threads after each test.
     *
     * @throws InterruptedException if interrupted while waiting for workers
     */
    @AfterEach
    protected void tearDownResilienceFixtures() throws InterruptedException {
        if (workers != null) {
            workers.shutdownNow();
            assertTrue(workers.awaitTermination(5, TimeUnit.SECONDS), "workers did not terminate");
        }
    }

    /**
     * Starts {@code count} copies of a task that all begin at the same moment.
     *
     * @param count number of concurrent tasks
     * @param task task to run
     * @param <T> task result type
     * @return futures of the submitted tasks
     */
    protected <T> List<Future<T>> startTogether(int count, Callable<T> task) {
        CountDownLatch start = new CountDownLatch(1);
        List<Future<T>> futures = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            futures.add(workers.submit(() -> {
                start.await();
                return task.call();
            }));
        }
        start.countDown();
        return futures;
    }

    /**
     * Waits for all futures and returns their results.
     *
     * @param futures futures to wait for
     * @param <T> result type
     * @return results in submission order
     * @throws Exception if any task failed
     */
    protected <T> List<T> awaitAll(List<Future<T>> futures) throws Exception {
        List<T> results = new ArrayList<>();
        for (Future<T> future : futures) {
            results.add(future.get(10, TimeUnit.SECONDS));
        }
        return results;
    }

    /**
     * Polls a condition until it holds or the timeout elapses.
     *
     * @param condition condition to wait for
     * @param timeoutMs maximum wait in milliseconds
     * @param message failure message
     * @throws InterruptedException if interrupted while polling
     */
    protected void awaitCondition(BooleanSupplier condition, long timeoutMs, String message)
        throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail(message);
            }
            Thread.sleep(5);
        }
    }
}
