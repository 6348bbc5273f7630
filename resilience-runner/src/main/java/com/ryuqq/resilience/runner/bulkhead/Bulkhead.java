package com.ryuqq.resilience.runner.bulkhead;

import com.ryuqq.resilience.core.error.BulkheadTimeoutException;
import com.ryuqq.resilience.core.error.ConfigurationException;
import com.ryuqq.resilience.core.error.QueueFullException;
import com.ryuqq.resilience.core.error.Throwables;
import com.ryuqq.resilience.core.event.ResilienceEvent;
import com.ryuqq.resilience.core.event.ResilienceEventListener;
import com.ryuqq.resilience.core.protection.BulkheadConfig;
import com.ryuqq.resilience.core.time.AsyncSleeper;
import com.ryuqq.resilience.runner.support.EventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Bulkhead.
 *
 * <p>작업 전후로 {@link ResourcePool}의 Permit을 획득/반납하여 동시 실행 수를 제한합니다.
 * 블로킹 실행은 {@link SyncResourcePool}, 비동기 실행은 {@link AsyncResourcePool}만 허용합니다.</p>
 *
 * <p><strong>진입 실패:</strong></p>
 * <ul>
 *   <li>대기열 포화: {@link QueueFullException} (작업 호출 안 함)</li>
 *   <li>대기 시간 초과: {@link BulkheadTimeoutException} (작업 호출 안 함)</li>
 * </ul>
 *
 * <p>Permit을 얻은 뒤에는 성공, 실패, 취소 어느 경로로 끝나든 정확히 한 번 반납합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * Bulkhead bulkhead = new Bulkhead("inventory-db", new SyncResourcePool(10, 50));
 * Stock stock = bulkhead.execute(() -> inventoryRepository.find(sku));
 * }</pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class Bulkhead {

    private static final Logger log = LoggerFactory.getLogger(Bulkhead.class);

    /** 진입 대기 시간 제한 없음. */
    public static final long NO_TIMEOUT = -1L;

    private final String name;
    private final ResourcePool pool;
    private final long timeoutMs;
    private final EventPublisher events;

    /**
     * 대기 시간 제한 없이 생성.
     *
     * @param name Bulkhead 이름
     * @param pool Resource Pool
     */
    public Bulkhead(String name, ResourcePool pool) {
        this(name, pool, NO_TIMEOUT, ResilienceEventListener.noop());
    }

    /**
     * 생성자.
     *
     * @param name Bulkhead 이름
     * @param pool Resource Pool
     * @param timeoutMs 진입 대기 시간 (밀리초, {@link #NO_TIMEOUT}이면 무기한)
     * @param eventListener 이벤트 수신자
     * @throws IllegalArgumentException name 또는 pool이 null이거나 timeoutMs가 -1 미만인 경우
     */
    public Bulkhead(String name, ResourcePool pool, long timeoutMs, ResilienceEventListener eventListener) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (pool == null) {
            throw new IllegalArgumentException("pool cannot be null");
        }
        if (timeoutMs < NO_TIMEOUT) {
            throw new IllegalArgumentException("timeoutMs cannot be negative (current: " + timeoutMs + ")");
        }
        this.name = name;
        this.pool = pool;
        this.timeoutMs = timeoutMs;
        this.events = new EventPublisher(name, eventListener);
    }

    /**
     * 설정으로부터 Bulkhead와 Pool을 함께 생성.
     *
     * @param name Bulkhead 이름
     * @param config 설정
     * @param asyncSleeper 비동기 Pool의 시간 초과 예약용 Sleeper
     * @param eventListener 이벤트 수신자
     * @return Bulkhead
     */
    public static Bulkhead of(
        String name,
        BulkheadConfig config,
        AsyncSleeper asyncSleeper,
        ResilienceEventListener eventListener
    ) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        ResourcePool pool = config.asyncPool()
            ? new AsyncResourcePool(name, config.maxConcurrent(), config.maxQueueSize(), asyncSleeper, eventListener)
            : new SyncResourcePool(name, config.maxConcurrent(), config.maxQueueSize(), eventListener);
        return new Bulkhead(name, pool, config.timeoutMs(), eventListener);
    }

    /**
     * 블로킹 작업을 Permit 안에서 실행.
     *
     * @param operation 작업
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws ConfigurationException Pool이 {@link SyncResourcePool}이 아닌 경우 (작업 호출 안 함)
     * @throws QueueFullException 대기열이 가득 찬 경우
     * @throws BulkheadTimeoutException 대기 시간 안에 Permit을 얻지 못한 경우
     * @throws InterruptedException 대기 중 인터럽트된 경우
     * @throws Exception 작업이 던진 예외
     */
    public <T> T execute(Callable<T> operation) throws Exception {
        if (!(pool instanceof SyncResourcePool syncPool)) {
            throw new ConfigurationException("Sync execution requires SyncResourcePool");
        }

        admitSync(syncPool);
        try {
            return operation.call();
        } finally {
            syncPool.release();
        }
    }

    private void admitSync(SyncResourcePool syncPool) throws InterruptedException {
        try {
            if (timeoutMs == NO_TIMEOUT) {
                syncPool.acquire();
                return;
            }
            if (syncPool.acquire(timeoutMs)) {
                return;
            }
        } catch (QueueFullException e) {
            rejected(e);
            throw e;
        }
        BulkheadTimeoutException timeout = new BulkheadTimeoutException(name, timeoutMs);
        rejected(timeout);
        throw timeout;
    }

    /**
     * 비동기 작업을 Permit 안에서 실행.
     *
     * <p>반환된 Future를 진입 대기 중에 취소하면 대기열에서 빠지며 작업은 호출되지 않습니다.</p>
     *
     * @param operation 비동기 작업
     * @param <T> 결과 타입
     * @return 작업 결과 Future ({@link QueueFullException}, {@link BulkheadTimeoutException}으로 실패할 수 있음)
     * @throws ConfigurationException Pool이 {@link AsyncResourcePool}이 아닌 경우 (작업 호출 안 함)
     */
    public <T> CompletableFuture<T> executeAsync(Supplier<? extends CompletionStage<T>> operation) {
        if (!(pool instanceof AsyncResourcePool asyncPool)) {
            throw new ConfigurationException("Async execution requires AsyncResourcePool");
        }

        CompletableFuture<Boolean> admission = timeoutMs == NO_TIMEOUT
            ? asyncPool.acquire()
            : asyncPool.acquire(timeoutMs);
        CompletableFuture<T> result = new CompletableFuture<>();

        admission.whenComplete((granted, error) -> {
            if (error != null) {
                Throwable cause = Throwables.unwrap(error);
                if (cause instanceof QueueFullException queueFull) {
                    rejected(queueFull);
                }
                result.completeExceptionally(cause);
                return;
            }
            if (!granted) {
                BulkheadTimeoutException timeout = new BulkheadTimeoutException(name, timeoutMs);
                rejected(timeout);
                result.completeExceptionally(timeout);
                return;
            }
            if (result.isDone()) {
                asyncPool.release();
                return;
            }
            runAdmitted(asyncPool, operation, result);
        });
        result.whenComplete((value, error) -> {
            if (result.isCancelled()) {
                admission.cancel(false);
            }
        });
        return result;
    }

    private <T> void runAdmitted(
        AsyncResourcePool asyncPool,
        Supplier<? extends CompletionStage<T>> operation,
        CompletableFuture<T> result
    ) {
        AtomicBoolean released = new AtomicBoolean();
        Runnable releaseOnce = () -> {
            if (released.compareAndSet(false, true)) {
                asyncPool.release();
            }
        };
        try {
            CompletionStage<T> stage = operation.get();
            if (stage == null) {
                throw new IllegalStateException("Async operation returned null instead of a CompletionStage");
            }
            stage.whenComplete((value, error) -> {
                releaseOnce.run();
                if (error == null) {
                    result.complete(value);
                } else {
                    result.completeExceptionally(Throwables.unwrap(error));
                }
            });
        } catch (Throwable e) {
            releaseOnce.run();
            result.completeExceptionally(e);
        }
    }

    private void rejected(RuntimeException reason) {
        log.warn("Bulkhead {} rejected call: {}", name, reason.getMessage());
        events.publish(ResilienceEvent.BULKHEAD_REJECTED, "reason", reason.getClass().getSimpleName());
    }

    /**
     * 현재 상태 조회.
     *
     * @return 이름과 Pool 통계
     */
    public BulkheadStatus getStatus() {
        return new BulkheadStatus(name, pool instanceof AsyncResourcePool, pool.getStats());
    }

    public String getName() {
        return name;
    }

    public ResourcePool getPool() {
        return pool;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
