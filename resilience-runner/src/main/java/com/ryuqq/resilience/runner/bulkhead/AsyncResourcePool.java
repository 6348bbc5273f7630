package com.ryuqq.resilience.runner.bulkhead;

import com.ryuqq.resilience.core.error.ConfigurationException;
import com.ryuqq.resilience.core.error.QueueFullException;
import com.ryuqq.resilience.core.event.ResilienceEvent;
import com.ryuqq.resilience.core.event.ResilienceEventListener;
import com.ryuqq.resilience.core.time.AsyncSleeper;
import com.ryuqq.resilience.runner.support.EventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.OptionalInt;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 비동기(cooperative) Resource Pool.
 *
 * <p>Permit이 없으면 스레드를 막지 않고 미완료 Future를 대기열에 넣어 반환합니다.
 * 반납된 Permit은 대기열 맨 앞 Future를 {@code true}로 완료시키며 넘겨집니다.</p>
 *
 * <p><strong>대기 종료 처리:</strong></p>
 * <ul>
 *   <li>시간 초과: {@link AsyncSleeper}로 예약된 시점에 대기열에서 제거 후 {@code false}로 완료.
 *       대기가 먼저 끝나면 예약은 취소됩니다</li>
 *   <li>취소: 호출자가 대기 중인 Future를 취소하면 대기열에서 제거</li>
 *   <li>반납 시 이미 취소/완료된 대기자는 건너뛰고 다음 대기자에게 Permit을 넘김</li>
 * </ul>
 *
 * <p>락은 상태 검사/변경에만 사용하며 대기 중에는 잡지 않습니다. Future 완료는 락 밖에서 수행하므로
 * 호출자의 후속 작업이 락 안에서 실행되지 않습니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class AsyncResourcePool implements ResourcePool {

    private static final Logger log = LoggerFactory.getLogger(AsyncResourcePool.class);

    private static final long NO_TIMEOUT = -1L;

    private final String name;
    private final int maxConcurrent;
    private final int maxQueueSize;
    private final AsyncSleeper asyncSleeper;
    private final EventPublisher events;
    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<CompletableFuture<Boolean>> waiters = new ArrayDeque<>();
    private final ThreadLocal<Deque<CompletableFuture<Boolean>>> handoffs = new ThreadLocal<>();

    private int active;
    private final AtomicLong totalAcquired = new AtomicLong();
    private final AtomicLong totalRejected = new AtomicLong();
    private final AtomicLong totalTimedOut = new AtomicLong();

    /**
     * 대기열 제한 없이 생성.
     *
     * @param maxConcurrent 최대 동시 실행 수
     */
    public AsyncResourcePool(int maxConcurrent) {
        this("pool", maxConcurrent, -1, AsyncSleeper.system(), ResilienceEventListener.noop());
    }

    /**
     * 생성자.
     *
     * @param maxConcurrent 최대 동시 실행 수
     * @param maxQueueSize 최대 대기열 길이 (-1이면 무제한, 0이면 대기 없이 거부)
     */
    public AsyncResourcePool(int maxConcurrent, int maxQueueSize) {
        this("pool", maxConcurrent, maxQueueSize, AsyncSleeper.system(), ResilienceEventListener.noop());
    }

    /**
     * 생성자.
     *
     * @param name Pool 이름
     * @param maxConcurrent 최대 동시 실행 수 (양수)
     * @param maxQueueSize 최대 대기열 길이 (-1이면 무제한, 0이면 대기 없이 거부)
     * @param asyncSleeper 시간 초과 예약에 사용할 비동기 Sleeper
     * @param eventListener 이벤트 수신자
     * @throws ConfigurationException maxConcurrent가 양수가 아니거나 maxQueueSize가 -1 미만인 경우
     */
    public AsyncResourcePool(
        String name,
        int maxConcurrent,
        int maxQueueSize,
        AsyncSleeper asyncSleeper,
        ResilienceEventListener eventListener
    ) {
        if (maxConcurrent <= 0) {
            throw new ConfigurationException("maxConcurrent must be positive (current: " + maxConcurrent + ")");
        }
        if (maxQueueSize < -1) {
            throw new ConfigurationException("maxQueueSize cannot be negative (current: " + maxQueueSize + ")");
        }
        if (asyncSleeper == null) {
            throw new IllegalArgumentException("asyncSleeper cannot be null");
        }
        this.name = name;
        this.maxConcurrent = maxConcurrent;
        this.maxQueueSize = maxQueueSize;
        this.asyncSleeper = asyncSleeper;
        this.events = new EventPublisher(name, eventListener);
    }

    /**
     * Permit을 얻을 때까지 기한 없이 대기.
     *
     * @return Permit을 얻으면 {@code true}로 완료되는 Future.
     *         대기열이 가득 차면 {@link QueueFullException}으로 즉시 실패
     */
    public CompletableFuture<Boolean> acquire() {
        return doAcquire(NO_TIMEOUT);
    }

    /**
     * 제한 시간 안에 Permit 획득 시도.
     *
     * @param timeoutMs 최대 대기 시간 (밀리초, 0 이상)
     * @return 획득하면 {@code true}, 시간 초과면 {@code false}로 완료되는 Future.
     *         대기열이 가득 차면 {@link QueueFullException}으로 즉시 실패
     */
    public CompletableFuture<Boolean> acquire(long timeoutMs) {
        if (timeoutMs < 0) {
            throw new IllegalArgumentException("timeoutMs cannot be negative (current: " + timeoutMs + ")");
        }
        return doAcquire(timeoutMs);
    }

    private CompletableFuture<Boolean> doAcquire(long timeoutMs) {
        CompletableFuture<Boolean> waiter = null;
        boolean admitted = false;
        int queued;
        lock.lock();
        try {
            if (active < maxConcurrent && waiters.isEmpty()) {
                active++;
                admitted = true;
            } else if (maxQueueSize < 0 || waiters.size() < maxQueueSize) {
                waiter = new CompletableFuture<>();
                waiters.addLast(waiter);
            }
            queued = waiters.size();
        } finally {
            lock.unlock();
        }

        if (admitted) {
            totalAcquired.incrementAndGet();
            events.publish(ResilienceEvent.POOL_ADMITTED, "waited", false);
            return CompletableFuture.completedFuture(true);
        }
        if (waiter == null) {
            totalRejected.incrementAndGet();
            log.debug("Pool {} rejected acquire: queue is full ({})", name, maxQueueSize);
            events.publish(ResilienceEvent.POOL_REJECTED, "maxQueueSize", maxQueueSize);
            return CompletableFuture.failedFuture(new QueueFullException(maxQueueSize));
        }

        events.publish(ResilienceEvent.POOL_QUEUED, "queueSize", queued);
        CompletableFuture<Boolean> queuedWaiter = waiter;
        CompletableFuture<Void> timer = timeoutMs == NO_TIMEOUT
            ? null
            : asyncSleeper.sleep(timeoutMs);
        queuedWaiter.whenComplete((granted, error) -> {
            if (error != null) {
                dequeue(queuedWaiter);
            }
            if (timer != null) {
                timer.cancel(false);
            }
        });
        if (timer != null) {
            timer.thenRun(() -> expire(queuedWaiter, timeoutMs));
        }
        return queuedWaiter;
    }

    private void expire(CompletableFuture<Boolean> waiter, long timeoutMs) {
        if (!dequeue(waiter)) {
            return;
        }
        if (waiter.complete(false)) {
            totalTimedOut.incrementAndGet();
            log.debug("Pool {} acquire timed out after {}ms", name, timeoutMs);
            events.publish(ResilienceEvent.POOL_TIMEOUT, "timeoutMs", timeoutMs);
        }
    }

    private boolean dequeue(CompletableFuture<Boolean> waiter) {
        lock.lock();
        try {
            return waiters.remove(waiter);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Permit 반납.
     *
     * <p>대기 중인 Future가 있으면 맨 앞 Future를 {@code true}로 완료시켜 Permit을 넘기고,
     * 없으면 activeCount를 줄입니다. 이미 취소된 대기자는 건너뜁니다.</p>
     *
     * <p>대기자의 후속 작업은 반납한 스레드에서 실행될 수 있고, 그 작업이 다시 {@code release()}를
     * 호출할 수 있습니다. 이 경우 Permit은 즉시 다음 대기자에게 예약되지만 Future 완료는 바깥
     * {@code release()}가 이어서 처리하므로, 대기자 수와 관계없이 호출 스택이 쌓이지 않습니다.
     * 따라서 중첩 호출이 반환된 시점에는 인계가 아직 끝나지 않았을 수 있습니다.</p>
     *
     * @return 반납이 끝나면 완료된 Future
     * @throws IllegalStateException 사용 중인 Permit이 없는 경우
     */
    public CompletableFuture<Void> release() {
        CompletableFuture<Boolean> next;
        lock.lock();
        try {
            if (active == 0) {
                throw new IllegalStateException("release() called on pool " + name + " with no active permits");
            }
            next = waiters.pollFirst();
            if (next == null) {
                active--;
            }
        } finally {
            lock.unlock();
        }
        if (next == null) {
            return CompletableFuture.completedFuture(null);
        }

        // Permit은 next에게 예약된 상태 (activeCount 유지)
        Deque<CompletableFuture<Boolean>> pending = handoffs.get();
        if (pending != null) {
            pending.addLast(next);
            return CompletableFuture.completedFuture(null);
        }
        pending = new ArrayDeque<>();
        handoffs.set(pending);
        try {
            pending.addLast(next);
            CompletableFuture<Boolean> handoff;
            while ((handoff = pending.pollFirst()) != null) {
                handOver(handoff);
            }
        } finally {
            handoffs.remove();
        }
        return CompletableFuture.completedFuture(null);
    }

    private void handOver(CompletableFuture<Boolean> waiter) {
        if (waiter.complete(true)) {
            totalAcquired.incrementAndGet();
            events.publish(ResilienceEvent.POOL_ADMITTED, "waited", true);
            return;
        }
        // 이미 취소된 대기자에게 예약된 Permit은 다음 대기자에게 넘기거나 반납
        release();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public int maxConcurrent() {
        return maxConcurrent;
    }

    @Override
    public OptionalInt maxQueueSize() {
        return maxQueueSize < 0 ? OptionalInt.empty() : OptionalInt.of(maxQueueSize);
    }

    @Override
    public int activeCount() {
        lock.lock();
        try {
            return active;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int queueSize() {
        lock.lock();
        try {
            return waiters.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public PoolStats getStats() {
        lock.lock();
        try {
            return PoolStats.of(active, waiters.size(), maxConcurrent, maxQueueSize,
                totalAcquired.get(), totalRejected.get(), totalTimedOut.get());
        } finally {
            lock.unlock();
        }
    }
}
