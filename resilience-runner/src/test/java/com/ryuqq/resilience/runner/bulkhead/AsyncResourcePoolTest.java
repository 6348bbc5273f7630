package com.ryuqq.resilience.runner.bulkhead;

import com.ryuqq.resilience.core.error.QueueFullException;
import com.ryuqq.resilience.core.event.ResilienceEvent;
import com.ryuqq.resilience.testkit.support.AbstractResilienceTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * AsyncResourcePool 테스트.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
@DisplayName("AsyncResourcePool 테스트")
class AsyncResourcePoolTest extends AbstractResilienceTest {

    private AsyncResourcePool pool;

    @BeforeEach
    void setUp() {
        pool = new AsyncResourcePool("api", 2, 3, manualSleeper, events);
    }

    @Test
    @DisplayName("Permit이 남아 있으면 즉시 true로 완료된다")
    void 즉시_획득() {
        CompletableFuture<Boolean> first = pool.acquire();
        CompletableFuture<Boolean> second = pool.acquire(100);

        assertThat(first).isCompletedWithValue(true);
        assertThat(second).isCompletedWithValue(true);
        assertThat(pool.activeCount()).isEqualTo(2);
        assertThat(manualSleeper.pendingCount()).isZero();
    }

    @Test
    @DisplayName("Permit이 없으면 대기하고, 반납 시 FIFO 순서로 넘겨받는다")
    void FIFO_대기() {
        // given
        pool.acquire();
        pool.acquire();
        CompletableFuture<Boolean> first = pool.acquire();
        CompletableFuture<Boolean> second = pool.acquire();

        // when & then
        assertThat(first).isNotDone();
        assertThat(second).isNotDone();
        assertThat(pool.queueSize()).isEqualTo(2);

        pool.release();
        assertThat(first).isCompletedWithValue(true);
        assertThat(second).isNotDone();
        assertThat(pool.activeCount()).isEqualTo(2);

        pool.release();
        assertThat(second).isCompletedWithValue(true);

        pool.release();
        pool.release();
        assertThat(pool.activeCount()).isZero();
    }

    @Test
    @DisplayName("대기열이 가득 차면 QueueFullException으로 즉시 실패한다")
    void 대기열_포화() {
        // given
        for (int i = 0; i < 5; i++) {
            pool.acquire();
        }

        // when
        CompletableFuture<Boolean> rejected = pool.acquire();

        // then
        assertThat(rejected).isCompletedExceptionally();
        assertThatThrownBy(rejected::join).hasCauseInstanceOf(QueueFullException.class);
        assertThat(pool.getStats().totalRejected()).isEqualTo(1);
        assertThat(events.count(ResilienceEvent.POOL_REJECTED)).isEqualTo(1);
    }

    @Test
    @DisplayName("maxQueueSize=0이면 Permit이 없을 때 대기 없이 거부된다")
    void 대기열_없음() {
        AsyncResourcePool noQueue = new AsyncResourcePool("api", 1, 0, manualSleeper, events);
        noQueue.acquire();

        assertThatThrownBy(() -> noQueue.acquire().join()).hasCauseInstanceOf(QueueFullException.class);
    }

    @Test
    @DisplayName("시간 초과 시 false로 완료되고 대기열에서 빠진다")
    void 시간_초과() {
        // given
        pool.acquire();
        pool.acquire();
        CompletableFuture<Boolean> waiting = pool.acquire(250);

        // when
        manualSleeper.advance(249);
        assertThat(waiting).isNotDone();
        manualSleeper.advance(1);

        // then
        assertThat(waiting).isCompletedWithValue(false);
        assertThat(pool.queueSize()).isZero();
        assertThat(pool.activeCount()).isEqualTo(2);
        assertThat(pool.getStats().totalTimedOut()).isEqualTo(1);
    }

    @Test
    @DisplayName("Permit을 받은 뒤의 시간 초과 예약은 아무 영향이 없다")
    void 획득_후_시간_초과() {
        // given
        pool.acquire();
        pool.acquire();
        CompletableFuture<Boolean> waiting = pool.acquire(250);
        pool.release();

        // when
        manualSleeper.advance(250);

        // then
        assertThat(waiting).isCompletedWithValue(true);
        assertThat(pool.activeCount()).isEqualTo(2);
        assertThat(pool.getStats().totalTimedOut()).isZero();
    }

    @Test
    @DisplayName("대기 중인 Future를 취소하면 대기열에서 빠지고 Permit은 다음 대기자에게 간다")
    void 취소() {
        // given
        pool.acquire();
        pool.acquire();
        CompletableFuture<Boolean> cancelled = pool.acquire();
        CompletableFuture<Boolean> next = pool.acquire();

        // when
        cancelled.cancel(false);
        pool.release();

        // then
        assertThat(pool.queueSize()).isZero();
        assertThat(next).isCompletedWithValue(true);
        assertThat(pool.activeCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("대기 중에 스레드를 점유하지 않고 많은 요청이 순서대로 처리된다")
    void 많은_대기자() {
        // given
        AsyncResourcePool unbounded = new AsyncResourcePool("bulk", 1, -1, manualSleeper, events);
        AtomicInteger completed = new AtomicInteger();
        List<CompletableFuture<Void>> chains = new ArrayList<>();

        // when
        for (int i = 0; i < 100; i++) {
            chains.add(unbounded.acquire()
                .thenCompose(granted -> {
                    completed.incrementAndGet();
                    return unbounded.release();
                }));
        }

        // then
        CompletableFuture.allOf(chains.toArray(new CompletableFuture[0])).join();
        assertThat(completed).hasValue(100);
        assertThat(unbounded.activeCount()).isZero();
        assertThat(unbounded.getStats().totalAcquired()).isEqualTo(100);
    }

    @Test
    @DisplayName("대기자의 후속 작업이 곧바로 반납해도 1만 개의 대기자가 모두 Permit을 받고 반납된다")
    void 연쇄_반납() {
        // given
        AsyncResourcePool single = new AsyncResourcePool("chain", 1, -1, manualSleeper, events);
        single.acquire();
        int waiters = 10_000;
        AtomicInteger granted = new AtomicInteger();
        List<CompletableFuture<Void>> chains = new ArrayList<>();
        for (int i = 0; i < waiters; i++) {
            chains.add(single.acquire()
                .thenCompose(admitted -> {
                    granted.incrementAndGet();
                    return single.release();
                }));
        }
        assertThat(single.queueSize()).isEqualTo(waiters);

        // when
        single.release();

        // then
        assertThat(CompletableFuture.allOf(chains.toArray(new CompletableFuture[0]))).isCompleted();
        assertThat(granted).hasValue(waiters);
        assertThat(single.activeCount()).isZero();
        assertThat(single.queueSize()).isZero();
        assertThat(single.getStats().totalAcquired()).isEqualTo(waiters + 1L);
    }

    @Test
    @DisplayName("연쇄 반납 중 취소된 대기자는 건너뛰고 Permit 수는 어긋나지 않는다")
    void 연쇄_반납_중_취소() {
        // given
        AsyncResourcePool single = new AsyncResourcePool("chain", 1, -1, manualSleeper, events);
        single.acquire();
        List<CompletableFuture<Boolean>> waiting = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            CompletableFuture<Boolean> waiter = single.acquire();
            waiter.thenAccept(admitted -> {
                if (admitted) {
                    single.release();
                }
            });
            waiting.add(waiter);
        }
        // 대기열에 남아 있는 채로 이미 끝난 대기자
        waiting.get(2).complete(false);

        // when
        single.release();

        // then
        assertThat(waiting.get(0)).isCompletedWithValue(true);
        assertThat(waiting.get(2)).isCompletedWithValue(false);
        assertThat(waiting.get(5)).isCompletedWithValue(true);
        assertThat(single.activeCount()).isZero();
        assertThat(single.queueSize()).isZero();
    }

    @Test
    @DisplayName("Permit을 받으면 시간 초과 예약이 취소된다")
    void 획득_시_예약_취소() {
        // given
        pool.acquire();
        pool.acquire();
        CompletableFuture<Boolean> waiting = pool.acquire(250);
        assertThat(manualSleeper.pendingCount()).isEqualTo(1);

        // when
        pool.release();

        // then
        assertThat(waiting).isCompletedWithValue(true);
        assertThat(manualSleeper.pendingCount()).isZero();
    }

    @Test
    @DisplayName("대기를 취소하면 시간 초과 예약도 취소된다")
    void 취소_시_예약_취소() {
        // given
        pool.acquire();
        pool.acquire();
        CompletableFuture<Boolean> waiting = pool.acquire(250);

        // when
        waiting.cancel(false);

        // then
        assertThat(manualSleeper.pendingCount()).isZero();
        assertThat(manualSleeper.advance(250)).isZero();
        assertThat(pool.queueSize()).isZero();
        assertThat(pool.getStats().totalTimedOut()).isZero();
    }

    @Test
    @DisplayName("사용 중인 Permit 없이 release하면 IllegalStateException")
    void 잘못된_반납() {
        assertThatThrownBy(() -> pool.release()).isInstanceOf(IllegalStateException.class);
    }
}
