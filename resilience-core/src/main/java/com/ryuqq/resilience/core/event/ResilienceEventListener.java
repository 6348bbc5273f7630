package com.ryuqq.resilience.core.event;

/**
 * 진단 이벤트 수신자.
 *
 * <p>구현체는 빠르고 비블로킹이어야 하며 여러 스레드에서 동시에 호출될 수 있습니다.
 * 수신자가 던진 예외는 엔진이 잡아서 로그만 남기며, 재시도/차단/Permit 계산에 영향을 주지 않습니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ResilienceEventListener {

    /**
     * 이벤트 수신.
     *
     * @param event 진단 이벤트
     */
    void onEvent(ResilienceEvent event);

    /**
     * 아무 것도 하지 않는 수신자.
     *
     * @return NoOp 수신자
     */
    static ResilienceEventListener noop() {
        return event -> {
            // NoOp
        };
    }
}
