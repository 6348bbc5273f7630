package com.ryuqq.resilience.core.protection.noop;

import com.ryuqq.resilience.core.protection.CallPermission;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NoOpCircuitBreaker 유닛 테스트.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
@DisplayName("NoOpCircuitBreaker 테스트")
class NoOpCircuitBreakerTest {

    @Test
    @DisplayName("tryAcquirePermission() 은 항상 허가 토큰을 반환한다")
    void tryAcquirePermission_항상_허가() {
        CircuitBreaker cb = NoOpCircuitBreaker.instance();

        assertEquals(CallPermission.UNTRACKED, cb.tryAcquirePermission().orElseThrow());
    }

    @Test
    @DisplayName("실패를 아무리 기록해도 CLOSED를 유지한다")
    void 실패_기록해도_CLOSED() {
        // given
        CircuitBreaker cb = new NoOpCircuitBreaker();

        // when
        for (int i = 0; i < 100; i++) {
            cb.onError(CallPermission.UNTRACKED, new RuntimeException("test error"));
        }

        // then
        assertEquals(CircuitBreakerState.CLOSED, cb.getState());
        assertEquals(0, cb.getFailureCount());
        assertTrue(cb.tryAcquirePermission().isPresent());
    }

    @Test
    @DisplayName("call() 은 작업 결과를 그대로 반환한다")
    void call_결과_반환() throws Exception {
        CircuitBreaker cb = new NoOpCircuitBreaker();

        assertEquals("ok", cb.call(() -> "ok"));
    }

    @Test
    @DisplayName("call() 은 작업 예외를 그대로 전파한다")
    void call_예외_전파() {
        CircuitBreaker cb = new NoOpCircuitBreaker();
        IOException error = new IOException("boom");

        IOException thrown = assertThrows(IOException.class, () -> cb.call(() -> {
            throw error;
        }));
        assertSame(error, thrown);
    }

    @Test
    @DisplayName("reset() 은 예외 없이 실행된다")
    void reset_예외_없이_실행() {
        CircuitBreaker cb = new NoOpCircuitBreaker();

        assertDoesNotThrow(cb::reset);
    }
}
