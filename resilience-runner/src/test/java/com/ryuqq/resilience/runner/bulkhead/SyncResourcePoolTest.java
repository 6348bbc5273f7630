package com.ryuqq.resilience.runner.bulkhead;

import com.ryuqq.resilience.core.error.ConfigurationException;
import com.ryuqq.resilience.core.error.QueueFullException;
import com.ryuqq.resilience.core.event.ResilienceEvent;
import com.ryuqq.resilience.testkit.support.AbstractResilienceTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * SyncResourcePool 테스트.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
@DisplayName("SyncResourcePool 테스트")
class SyncResourcePoolTest extends AbstractResilienceTest {

    @Test
    @DisplayName("20개 스레드가 Permit 5개를 경쟁해도 동시 실행은 5를 넘지 않고 모두 완료된다")
    void 동시_실행_상한() throws Exception {
        // given
        SyncResourcePool pool = new SyncResourcePool(5);
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();

        // when
        List<Future<Boolean>> futures = startTogether(20, () -> {
            pool.acquire();
            try {
                int now = running.incrementAndGet();
                peak.accumulateAndGet(now, Math::max);
                Thread.sleep(10);
                running.decrementAndGet();
                return true;
            } finally {
                pool.release();
            }
        });
        List<Boolean> results = awaitAll(futures);

        // then
        assertThat(results).hasSize(20).containsOnly(true);
        assertThat(peak.get()).isLessThanOrEqualTo(5).isPositive();
        assertThat(pool.activeCount()).isZero();
        assertThat(pool.queueSize()).isZero();
        assertThat(pool.getStats().totalAcquired()).isEqualTo(20);
    }

    @Test
    @DisplayName("maxQueueSize=0이면 Permit이 없을 때 대기 없이 QueueFullException")
    void 대기열_없음() throws Exception {
        // given
        SyncResourcePool pool = new SyncResourcePool("db", 1, 0, events);
        pool.acquire();

        // when & then
        assertThatThrownBy(() -> pool.acquire(10_000))
            .isInstanceOf(QueueFullException.class)
            .hasMessageContaining("Queue is full");
        assertThat(pool.getStats().totalRejected()).isEqualTo(1);
        assertThat(events.count(ResilienceEvent.POOL_REJECTED)).isEqualTo(1);
    }

    @Test
    @DisplayName("대기열이 가득 차면 추가 요청은 즉시 거부된다")
    void 대기열_포화() throws Exception {
        // given
        SyncResourcePool pool = new SyncResourcePool(1, 1);
        pool.acquire();
        Future<Boolean> waiting = workers.submit(() -> pool.acquire(5_000));
        awaitCondition(() -> pool.queueSize() == 1, 2_000, "waiter was not queued");

        // when & then
        assertThatThrownBy(pool::acquire).isInstanceOf(QueueFullException.class);

        pool.release();
        assertThat(waiting.get(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("시간 초과 시 false를 반환하고 대기열에서 빠진다")
    void 시간_초과() throws Exception {
        // given
        SyncResourcePool pool = new SyncResourcePool("db", 1, 10, events);
        pool.acquire();

        // when
        boolean acquired = pool.acquire(30);

        // then
        assertThat(acquired).isFalse();
        assertThat(pool.queueSize()).isZero();
        assertThat(pool.activeCount()).isEqualTo(1);
        assertThat(pool.getStats().totalTimedOut()).isEqualTo(1);
        assertThat(events.count(ResilienceEvent.POOL_TIMEOUT)).isEqualTo(1);

        // 반납 후 다시 시도하면 성공
        pool.release();
        assertThat(pool.acquire(30)).isTrue();
    }

    @Test
    @DisplayName("반납된 Permit은 가장 먼저 대기한 요청에 넘겨진다")
    void FIFO_인계() throws Exception {
        // given
        SyncResourcePool pool = new SyncResourcePool(1);
        pool.acquire();
        ConcurrentLinkedQueue<String> order = new ConcurrentLinkedQueue<>();

        Future<?> first = workers.submit(() -> {
            pool.acquire();
            order.add("first");
            pool.release();
            return null;
        });
        awaitCondition(() -> pool.queueSize() == 1, 2_000, "first waiter was not queued");
        Future<?> second = workers.submit(() -> {
            pool.acquire();
            order.add("second");
            pool.release();
            return null;
        });
        awaitCondition(() -> pool.queueSize() == 2, 2_000, "second waiter was not queued");

        // when
        pool.release();
        first.get(5, TimeUnit.SECONDS);
        second.get(5, TimeUnit.SECONDS);

        // then
        assertThat(order).containsExactly("first", "second");
        assertThat(pool.activeCount()).isZero();
    }

    @Test
    @DisplayName("대기 중 인터럽트되면 대기열에서 빠지고 InterruptedException이 전파된다")
    void 인터럽트() throws Exception {
        // given
        SyncResourcePool pool = new SyncResourcePool(1);
        pool.acquire();
        Future<Boolean> waiting = workers.submit(() -> {
            try {
                pool.acquire();
                return false;
            } catch (InterruptedException e) {
                return true;
            }
        });
        awaitCondition(() -> pool.queueSize() == 1, 2_000, "waiter was not queued");

        // when
        waiting.cancel(true);

        // then
        awaitCondition(() -> pool.queueSize() == 0, 2_000, "interrupted waiter stayed queued");
        pool.release();
        assertThat(pool.activeCount()).isZero();
    }

    @Test
    @DisplayName("사용 중인 Permit 없이 release하면 IllegalStateException")
    void 잘못된_반납() {
        SyncResourcePool pool = new SyncResourcePool(2);

        assertThatThrownBy(pool::release).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("통계: utilization = active / maxConcurrent")
    void 통계() throws Exception {
        // given
        SyncResourcePool pool = new SyncResourcePool(4, 10);
        pool.acquire();

        // when
        PoolStats stats = pool.getStats();

        // then
        assertThat(stats.activeCount()).isEqualTo(1);
        assertThat(stats.availableCapacity()).isEqualTo(3);
        assertThat(stats.maxConcurrent()).isEqualTo(4);
        assertThat(stats.maxQueueSize()).isEqualTo(10);
        assertThat(stats.utilization()).isEqualTo(0.25);
        assertThat(pool.availableCapacity()).isEqualTo(3);
        assertThat(pool.maxQueueSize()).hasValue(10);
        assertThat(new SyncResourcePool(1).maxQueueSize()).isEmpty();
    }

    @Test
    @DisplayName("maxConcurrent가 양수가 아니면 ConfigurationException")
    void 설정_검증() {
        assertThatThrownBy(() -> new SyncResourcePool(0)).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> new SyncResourcePool(1, -2)).isInstanceOf(ConfigurationException.class);
    }
}
