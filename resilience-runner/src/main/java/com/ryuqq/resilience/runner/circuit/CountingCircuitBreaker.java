package com.ryuqq.resilience.runner.circuit;

import com.ryuqq.resilience.core.event.ResilienceEvent;
import com.ryuqq.resilience.core.event.ResilienceEventListener;
import com.ryuqq.resilience.core.protection.CallPermission;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.CircuitBreakerConfig;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;
import com.ryuqq.resilience.core.time.TimeSource;
import com.ryuqq.resilience.runner.support.EventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 연속 실패 횟수 기반 Circuit Breaker.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>CLOSED: 실패마다 failureCount 증가, failureThreshold 도달 시 OPEN. 성공하면 failureCount = 0</li>
 *   <li>OPEN: 모든 요청 거부. 마지막 실패 이후 recoveryTimeout이 지나면 HALF_OPEN</li>
 *   <li>HALF_OPEN: 시험 요청 1건만 허용. 성공 → CLOSED, 실패 → OPEN (복구 대기 재시작)</li>
 * </ul>
 *
 * <p>OPEN → HALF_OPEN 전이는 타이머 없이 {@link #tryAcquirePermission()}이나 {@link #getState()}
 * 호출 시점에 판단합니다.</p>
 *
 * <p><strong>시험 요청 식별:</strong> 상태가 바뀔 때마다 세대(epoch)가 올라가고, 허가 토큰에는 허가 시점의
 * 세대가 담깁니다. HALF_OPEN에서는 현재 세대의 토큰(시험 요청)만 상태를 결정하며, CLOSED 시절에 허가되어
 * 늦게 끝난 호출의 결과는 무시됩니다.</p>
 *
 * <p><strong>스레드 안전성:</strong> 모든 상태는 하나의 {@link ReentrantLock} 아래에서만 바뀝니다.
 * 보호 대상 작업 실행 중에는 락을 잡지 않습니다. 이벤트는 락을 놓은 뒤 발행합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class CountingCircuitBreaker implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CountingCircuitBreaker.class);

    private record Transition(CircuitBreakerState from, CircuitBreakerState to, int failureCount) {
    }

    private final String name;
    private final CircuitBreakerConfig config;
    private final long recoveryTimeoutNanos;
    private final TimeSource timeSource;
    private final EventPublisher events;
    private final ReentrantLock lock = new ReentrantLock();

    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private int failureCount;
    private long lastFailureNanos;
    private boolean trialInFlight;
    private long epoch;

    /**
     * 생성자.
     *
     * @param name Circuit 이름
     * @param config 설정
     * @param timeSource 시간 소스
     * @param eventListener 이벤트 수신자
     * @throws IllegalArgumentException 인자가 null이거나 name이 비어 있는 경우
     */
    public CountingCircuitBreaker(
        String name,
        CircuitBreakerConfig config,
        TimeSource timeSource,
        ResilienceEventListener eventListener
    ) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (timeSource == null) {
            throw new IllegalArgumentException("timeSource cannot be null");
        }
        this.name = name;
        this.config = config;
        this.recoveryTimeoutNanos = TimeUnit.MILLISECONDS.toNanos(config.recoveryTimeoutMs());
        this.timeSource = timeSource;
        this.events = new EventPublisher(name, eventListener);
    }

    /**
     * 이벤트 수신자 없이 생성.
     *
     * @param name Circuit 이름
     * @param config 설정
     * @param timeSource 시간 소스
     * @return CountingCircuitBreaker
     */
    public static CountingCircuitBreaker of(String name, CircuitBreakerConfig config, TimeSource timeSource) {
        return new CountingCircuitBreaker(name, config, timeSource, ResilienceEventListener.noop());
    }

    /**
     * 임계값과 복구 대기 시간만으로 생성 (시스템 시간).
     *
     * @param name Circuit 이름
     * @param failureThreshold OPEN 전이까지의 실패 횟수
     * @param recoveryTimeoutMs OPEN 유지 시간 (밀리초)
     * @return CountingCircuitBreaker
     */
    public static CountingCircuitBreaker of(String name, int failureThreshold, long recoveryTimeoutMs) {
        return of(name, new CircuitBreakerConfig(failureThreshold, recoveryTimeoutMs), TimeSource.system());
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Optional<CallPermission> tryAcquirePermission() {
        Transition transition;
        CallPermission permission = null;
        CircuitBreakerState observed;
        lock.lock();
        try {
            transition = maybeHalfOpen();
            observed = state;
            if (state == CircuitBreakerState.CLOSED) {
                permission = new CallPermission(epoch);
            } else if (state == CircuitBreakerState.HALF_OPEN && !trialInFlight) {
                trialInFlight = true;
                permission = new CallPermission(epoch);
            }
        } finally {
            lock.unlock();
        }

        publish(transition);
        if (permission == null) {
            log.debug("Circuit {} rejected call in state {}", name, observed);
            events.publish(ResilienceEvent.CIRCUIT_REJECTED, "state", observed.name());
        }
        return Optional.ofNullable(permission);
    }

    @Override
    public void onSuccess(CallPermission permission) {
        Transition transition = null;
        lock.lock();
        try {
            if (state == CircuitBreakerState.HALF_OPEN) {
                if (!isTrial(permission)) {
                    logStale(permission);
                    return;
                }
                transition = moveTo(CircuitBreakerState.CLOSED);
                failureCount = 0;
                trialInFlight = false;
            } else if (state == CircuitBreakerState.CLOSED) {
                failureCount = 0;
            }
        } finally {
            lock.unlock();
        }
        publish(transition);
    }

    @Override
    public void onError(CallPermission permission, Throwable error) {
        Transition transition = null;
        lock.lock();
        try {
            if (state == CircuitBreakerState.HALF_OPEN && !isTrial(permission)) {
                logStale(permission);
                return;
            }
            if (!config.records(error)) {
                if (state == CircuitBreakerState.HALF_OPEN) {
                    trialInFlight = false;
                }
                return;
            }

            failureCount++;
            if (state == CircuitBreakerState.CLOSED) {
                lastFailureNanos = timeSource.nanoTime();
                if (failureCount >= config.failureThreshold()) {
                    transition = moveTo(CircuitBreakerState.OPEN);
                }
            } else if (state == CircuitBreakerState.HALF_OPEN) {
                lastFailureNanos = timeSource.nanoTime();
                trialInFlight = false;
                transition = moveTo(CircuitBreakerState.OPEN);
            }
        } finally {
            lock.unlock();
        }
        publish(transition);
    }

    @Override
    public CircuitBreakerState getState() {
        Transition transition;
        CircuitBreakerState current;
        lock.lock();
        try {
            transition = maybeHalfOpen();
            current = state;
        } finally {
            lock.unlock();
        }
        publish(transition);
        return current;
    }

    @Override
    public int getFailureCount() {
        lock.lock();
        try {
            return failureCount;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void reset() {
        Transition transition;
        lock.lock();
        try {
            transition = state == CircuitBreakerState.CLOSED ? null : moveTo(CircuitBreakerState.CLOSED);
            failureCount = 0;
            trialInFlight = false;
        } finally {
            lock.unlock();
        }
        publish(transition);
    }

    /**
     * 설정 조회.
     *
     * @return 설정
     */
    public CircuitBreakerConfig getConfig() {
        return config;
    }

    // lock 보유 상태에서만 호출
    private boolean isTrial(CallPermission permission) {
        return permission != null && permission.epoch() == epoch && trialInFlight;
    }

    private void logStale(CallPermission permission) {
        log.debug("Circuit {} ignored outcome of call admitted in epoch {} (current: {}, HALF_OPEN)",
            name, permission == null ? "none" : permission.epoch(), epoch);
    }

    // lock 보유 상태에서만 호출
    private Transition maybeHalfOpen() {
        if (state == CircuitBreakerState.OPEN
            && timeSource.nanoTime() - lastFailureNanos >= recoveryTimeoutNanos) {
            trialInFlight = false;
            return moveTo(CircuitBreakerState.HALF_OPEN);
        }
        return null;
    }

    // lock 보유 상태에서만 호출
    private Transition moveTo(CircuitBreakerState target) {
        Transition transition = new Transition(state, target, failureCount);
        state = target;
        epoch++;
        return transition;
    }

    private void publish(Transition transition) {
        if (transition == null) {
            return;
        }
        if (transition.to() == CircuitBreakerState.OPEN) {
            log.warn("Circuit {} opened: {} -> OPEN after {} failures",
                name, transition.from(), transition.failureCount());
        } else {
            log.info("Circuit {} transitioned: {} -> {}", name, transition.from(), transition.to());
        }
        events.publish(ResilienceEvent.CIRCUIT_TRANSITION,
            "from", transition.from().name(),
            "to", transition.to().name(),
            "failureCount", transition.failureCount());
    }
}
