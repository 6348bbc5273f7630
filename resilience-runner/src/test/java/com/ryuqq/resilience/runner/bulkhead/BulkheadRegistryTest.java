package com.ryuqq.resilience.runner.bulkhead;

import com.ryuqq.resilience.core.protection.BulkheadConfig;
import com.ryuqq.resilience.testkit.support.AbstractResilienceTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BulkheadRegistry 테스트.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
@DisplayName("BulkheadRegistry 테스트")
class BulkheadRegistryTest extends AbstractResilienceTest {

    private BulkheadRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new BulkheadRegistry(new BulkheadConfig(2, 5, 1_000, false), manualSleeper, events);
    }

    @Test
    @DisplayName("같은 이름으로 다시 생성하면 기존 인스턴스를 반환하고 새 설정은 무시된다")
    void 같은_이름() {
        // given
        Bulkhead first = registry.create("orders");

        // when
        Bulkhead second = registry.create("orders", new BulkheadConfig(50, 0, 10, true));

        // then
        assertThat(second).isSameAs(first);
        assertThat(second.getPool()).isInstanceOf(SyncResourcePool.class);
        assertThat(second.getPool().maxConcurrent()).isEqualTo(2);
        assertThat(second.getTimeoutMs()).isEqualTo(1_000);
    }

    @Test
    @DisplayName("설정의 asyncPool에 따라 Pool 종류가 정해진다")
    void 비동기_설정() {
        Bulkhead async = registry.create("api", new BulkheadConfig().withAsyncPool(true));

        assertThat(async.getPool()).isInstanceOf(AsyncResourcePool.class);
        assertThat(async.getStatus().asyncPool()).isTrue();
    }

    @Test
    @DisplayName("get/list/remove")
    void 조회와_해제() {
        // given
        registry.create("b");
        registry.create("a");

        // when & then
        assertThat(registry.list()).containsExactly("a", "b");
        assertThat(registry.get("a")).isPresent();
        assertThat(registry.get("missing")).isEmpty();
        assertThat(registry.get(null)).isEmpty();

        assertThat(registry.remove("a")).isTrue();
        assertThat(registry.remove("a")).isFalse();
        assertThat(registry.list()).containsExactly("b");
    }

    @Test
    @DisplayName("getAllStatus는 이름 순으로 모든 상태를 반환한다")
    void 전체_상태() throws Exception {
        // given
        registry.create("payments").execute(() -> "warm-up");
        registry.create("inventory");

        // when
        Map<String, BulkheadStatus> statuses = registry.getAllStatus();

        // then
        assertThat(statuses.keySet()).containsExactly("inventory", "payments");
        assertThat(statuses.get("payments").stats().totalAcquired()).isEqualTo(1);
        assertThat(statuses.get("inventory").stats().maxConcurrent()).isEqualTo(2);
    }

    @Test
    @DisplayName("여러 스레드가 동시에 생성해도 인스턴스는 하나다")
    void 동시_생성() throws Exception {
        List<Future<Bulkhead>> futures = startTogether(16, () -> registry.create("shared"));

        List<Bulkhead> created = awaitAll(futures);

        assertThat(created).allSatisfy(bulkhead -> assertThat(bulkhead).isSameAs(created.get(0)));
        assertThat(registry.list()).containsExactly("shared");
    }

    @Test
    @DisplayName("getDefault는 항상 같은 인스턴스")
    void 기본_레지스트리() {
        assertThat(BulkheadRegistry.getDefault()).isSameAs(BulkheadRegistry.getDefault());
    }

    @Test
    @DisplayName("이름이 비어 있으면 IllegalArgumentException")
    void 이름_검증() {
        assertThatThrownBy(() -> registry.create(""))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
