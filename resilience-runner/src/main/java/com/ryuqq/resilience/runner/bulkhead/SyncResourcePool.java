package com.ryuqq.resilience.runner.bulkhead;

import com.ryuqq.resilience.core.error.ConfigurationException;
import com.ryuqq.resilience.core.error.QueueFullException;
import com.ryuqq.resilience.core.event.ResilienceEvent;
import com.ryuqq.resilience.core.event.ResilienceEventListener;
import com.ryuqq.resilience.runner.support.EventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.OptionalInt;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 블로킹 스레드용 Resource Pool.
 *
 * <p>Permit이 없으면 호출 스레드가 FIFO 대기열에서 기다립니다. 반납된 Permit은
 * activeCount를 줄이지 않고 대기열 맨 앞 요청에 바로 넘겨집니다.</p>
 *
 * <p><strong>락 범위:</strong> 검사/대기열 추가/제거만 락 안에서 수행하고, 실제 대기는
 * 요청별 {@link CountDownLatch} 위에서 락 없이 이루어집니다.</p>
 *
 * <p><strong>대기 종료 처리:</strong></p>
 * <ul>
 *   <li>시간 초과: 대기열에서 제거 후 false. 시간 초과와 동시에 Permit을 받았다면 true (Permit 유실 없음)</li>
 *   <li>인터럽트: 대기열에서 제거 (이미 받은 Permit은 반납) 후 {@link InterruptedException} 전파</li>
 * </ul>
 *
 * <p><strong>시간 기준:</strong> 대기 시간 초과는 실제 시간({@link CountDownLatch#await(long, TimeUnit)})으로
 * 측정되며, 주입된 {@code TimeSource}나 가상 시계의 영향을 받지 않습니다. 가상 시간으로 시간 초과를
 * 제어해야 한다면 {@code AsyncSleeper}를 주입받는 {@link AsyncResourcePool}을 사용하세요.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class SyncResourcePool implements ResourcePool {

    private static final Logger log = LoggerFactory.getLogger(SyncResourcePool.class);

    private static final long NO_TIMEOUT = -1L;

    /** 대기 요청. granted는 lock 아래에서만 읽고 쓴다. */
    private static final class Waiter {
        private final CountDownLatch latch = new CountDownLatch(1);
        private boolean granted;
    }

    private final String name;
    private final int maxConcurrent;
    private final int maxQueueSize;
    private final EventPublisher events;
    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<Waiter> waiters = new ArrayDeque<>();

    private int active;
    private long totalAcquired;
    private long totalRejected;
    private long totalTimedOut;

    /**
     * 대기열 제한 없이 생성.
     *
     * @param maxConcurrent 최대 동시 실행 수
     */
    public SyncResourcePool(int maxConcurrent) {
        this("pool", maxConcurrent, -1, ResilienceEventListener.noop());
    }

    /**
     * 생성자.
     *
     * @param maxConcurrent 최대 동시 실행 수
     * @param maxQueueSize 최대 대기열 길이 (-1이면 무제한, 0이면 대기 없이 거부)
     */
    public SyncResourcePool(int maxConcurrent, int maxQueueSize) {
        this("pool", maxConcurrent, maxQueueSize, ResilienceEventListener.noop());
    }

    /**
     * 생성자.
     *
     * @param name Pool 이름
     * @param maxConcurrent 최대 동시 실행 수 (양수)
     * @param maxQueueSize 최대 대기열 길이 (-1이면 무제한, 0이면 대기 없이 거부)
     * @param eventListener 이벤트 수신자
     * @throws ConfigurationException maxConcurrent가 양수가 아니거나 maxQueueSize가 -1 미만인 경우
     */
    public SyncResourcePool(String name, int maxConcurrent, int maxQueueSize, ResilienceEventListener eventListener) {
        if (maxConcurrent <= 0) {
            throw new ConfigurationException("maxConcurrent must be positive (current: " + maxConcurrent + ")");
        }
        if (maxQueueSize < -1) {
            throw new ConfigurationException("maxQueueSize cannot be negative (current: " + maxQueueSize + ")");
        }
        this.name = name;
        this.maxConcurrent = maxConcurrent;
        this.maxQueueSize = maxQueueSize;
        this.events = new EventPublisher(name, eventListener);
    }

    /**
     * Permit을 얻을 때까지 기한 없이 대기.
     *
     * @throws QueueFullException 대기열이 가득 찬 경우 (대기하지 않음)
     * @throws InterruptedException 대기 중 인터럽트된 경우
     */
    public void acquire() throws InterruptedException {
        doAcquire(NO_TIMEOUT);
    }

    /**
     * 제한 시간 안에 Permit 획득 시도.
     *
     * @param timeoutMs 최대 대기 시간 (밀리초, 0 이상)
     * @return 획득하면 true, 시간 초과면 false
     * @throws QueueFullException 대기열이 가득 찬 경우 (대기하지 않음)
     * @throws InterruptedException 대기 중 인터럽트된 경우
     */
    public boolean acquire(long timeoutMs) throws InterruptedException {
        if (timeoutMs < 0) {
            throw new IllegalArgumentException("timeoutMs cannot be negative (current: " + timeoutMs + ")");
        }
        return doAcquire(timeoutMs);
    }

    private boolean doAcquire(long timeoutMs) throws InterruptedException {
        Waiter waiter = null;
        boolean rejected = false;
        int queued;
        lock.lock();
        try {
            if (active < maxConcurrent && waiters.isEmpty()) {
                active++;
                totalAcquired++;
            } else if (maxQueueSize >= 0 && waiters.size() >= maxQueueSize) {
                totalRejected++;
                rejected = true;
            } else {
                waiter = new Waiter();
                waiters.addLast(waiter);
            }
            queued = waiters.size();
        } finally {
            lock.unlock();
        }

        if (rejected) {
            log.debug("Pool {} rejected acquire: queue is full ({})", name, maxQueueSize);
            events.publish(ResilienceEvent.POOL_REJECTED, "maxQueueSize", maxQueueSize);
            throw new QueueFullException(maxQueueSize);
        }
        if (waiter == null) {
            events.publish(ResilienceEvent.POOL_ADMITTED, "waited", false);
            return true;
        }

        events.publish(ResilienceEvent.POOL_QUEUED, "queueSize", queued);
        return awaitPermit(waiter, timeoutMs);
    }

    private boolean awaitPermit(Waiter waiter, long timeoutMs) throws InterruptedException {
        boolean signalled;
        try {
            if (timeoutMs == NO_TIMEOUT) {
                waiter.latch.await();
                signalled = true;
            } else {
                signalled = waiter.latch.await(timeoutMs, TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            abandon(waiter);
            throw e;
        }

        if (!signalled) {
            lock.lock();
            try {
                if (!waiter.granted) {
                    waiters.remove(waiter);
                    totalTimedOut++;
                }
                signalled = waiter.granted;
            } finally {
                lock.unlock();
            }
        }

        if (signalled) {
            events.publish(ResilienceEvent.POOL_ADMITTED, "waited", true);
        } else {
            log.debug("Pool {} acquire timed out after {}ms", name, timeoutMs);
            events.publish(ResilienceEvent.POOL_TIMEOUT, "timeoutMs", timeoutMs);
        }
        return signalled;
    }

    private void abandon(Waiter waiter) {
        lock.lock();
        try {
            if (waiter.granted) {
                releaseLocked();
            } else {
                waiters.remove(waiter);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Permit 반납.
     *
     * <p>대기 중인 요청이 있으면 맨 앞 요청에 Permit을 넘기고, 없으면 activeCount를 줄입니다.</p>
     *
     * @throws IllegalStateException 사용 중인 Permit이 없는 경우
     */
    public void release() {
        lock.lock();
        try {
            releaseLocked();
        } finally {
            lock.unlock();
        }
    }

    // lock 보유 상태에서만 호출
    private void releaseLocked() {
        if (active == 0) {
            throw new IllegalStateException("release() called on pool " + name + " with no active permits");
        }
        Waiter next = waiters.pollFirst();
        if (next == null) {
            active--;
            return;
        }
        next.granted = true;
        totalAcquired++;
        next.latch.countDown();
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
                totalAcquired, totalRejected, totalTimedOut);
        } finally {
            lock.unlock();
        }
    }
}
