package com.ryuqq.resilience.core.protection;

import com.ryuqq.resilience.core.error.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BulkheadConfig / CircuitBreakerConfig 테스트.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
@DisplayName("설정 레코드 테스트")
class ConfigRecordsTest {

    @Test
    @DisplayName("BulkheadConfig 기본값")
    void bulkheadDefaults() {
        BulkheadConfig config = new BulkheadConfig();

        assertThat(config.maxConcurrent()).isEqualTo(10);
        assertThat(config.maxQueueSize()).isEqualTo(100);
        assertThat(config.timeoutMs()).isEqualTo(30_000L);
        assertThat(config.asyncPool()).isFalse();
    }

    @Test
    @DisplayName("BulkheadConfig는 0 이하의 동시 실행 수를 거부한다")
    void bulkheadValidation() {
        assertThatThrownBy(() -> new BulkheadConfig().withMaxConcurrent(0))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("maxConcurrent must be positive");
        assertThatThrownBy(() -> new BulkheadConfig().withMaxQueueSize(-2))
            .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> new BulkheadConfig().withTimeoutMs(-5))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("BulkheadConfig는 무제한 대기열과 무기한 대기를 -1로 표현한다")
    void bulkheadUnbounded() {
        BulkheadConfig config = new BulkheadConfig()
            .withMaxQueueSize(BulkheadConfig.UNBOUNDED)
            .withTimeoutMs(BulkheadConfig.NO_TIMEOUT)
            .withAsyncPool(true);

        assertThat(config.maxQueueSize()).isEqualTo(-1);
        assertThat(config.timeoutMs()).isEqualTo(-1L);
        assertThat(config.asyncPool()).isTrue();
    }

    @Test
    @DisplayName("CircuitBreakerConfig 기본값")
    void circuitDefaults() {
        CircuitBreakerConfig config = new CircuitBreakerConfig();

        assertThat(config.failureThreshold()).isEqualTo(5);
        assertThat(config.recoveryTimeoutMs()).isEqualTo(60_000L);
        assertThat(config.recordedExceptions()).isNull();
    }

    @Test
    @DisplayName("CircuitBreakerConfig 검증")
    void circuitValidation() {
        assertThatThrownBy(() -> new CircuitBreakerConfig(0, 1_000))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("failureThreshold");
        assertThatThrownBy(() -> new CircuitBreakerConfig(3, -1))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("recordedExceptions 필터는 하위 타입을 포함한다")
    void recordsFilter() {
        CircuitBreakerConfig all = new CircuitBreakerConfig();
        CircuitBreakerConfig ioOnly = all.withRecordedExceptions(Set.of(IOException.class));

        assertThat(all.records(new IllegalStateException())).isTrue();
        assertThat(ioOnly.records(new ConnectException())).isTrue();
        assertThat(ioOnly.records(new IllegalStateException())).isFalse();
    }
}
