package com.ryuqq.resilience.core.outcome;

import com.ryuqq.resilience.core.error.CircuitOpenException;
import com.ryuqq.resilience.core.error.ErrorKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outcome 테스트.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
@DisplayName("Outcome 테스트")
class OutcomeTest {

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    @DisplayName("성공한 작업은 Ok가 된다")
    void 성공_Ok() {
        // when
        Outcome<String> outcome = Outcome.of(() -> "done");

        // then
        assertTrue(outcome.isOk());
        assertFalse(outcome.isFail());
        assertEquals("done", ((Ok<String>) outcome).value());
    }

    @Test
    @DisplayName("null 결과도 Ok로 표현된다")
    void null_결과_Ok() {
        Outcome<Object> outcome = Outcome.of(() -> null);

        assertTrue(outcome.isOk());
        assertNull(((Ok<Object>) outcome).value());
    }

    @Test
    @DisplayName("원래 실패는 ORIGINAL_FAILURE 종류의 Fail이 된다")
    void 원래_실패_Fail() {
        // given
        IOException error = new IOException("boom");

        // when
        Outcome<String> outcome = Outcome.of(() -> {
            throw error;
        });

        // then
        assertTrue(outcome.isFail());
        Fail<String> fail = (Fail<String>) outcome;
        assertEquals(ErrorKind.ORIGINAL_FAILURE, fail.kind());
        assertSame(error, fail.error());
    }

    @Test
    @DisplayName("Circuit 차단은 CIRCUIT_OPEN 종류의 Fail이 된다")
    void 차단_Fail() {
        Outcome<String> outcome = Outcome.of(() -> {
            throw new CircuitOpenException("payments");
        });

        assertEquals(ErrorKind.CIRCUIT_OPEN, ((Fail<String>) outcome).kind());
    }

    @Test
    @DisplayName("인터럽트 실패는 인터럽트 플래그를 복원한다")
    void 인터럽트_플래그_복원() {
        Outcome<String> outcome = Outcome.of(() -> {
            throw new InterruptedException();
        });

        assertTrue(outcome.isFail());
        assertTrue(Thread.currentThread().isInterrupted());
    }

    @Test
    @DisplayName("Fail은 null 원인을 거부한다")
    void Fail_null_거부() {
        assertThrows(IllegalArgumentException.class, () -> Fail.of(null));
        assertThrows(IllegalArgumentException.class, () -> new Fail<>(null, new IOException()));
    }
}
