package com.ryuqq.resilience.runner.support;

import com.ryuqq.resilience.core.event.ResilienceEvent;
import com.ryuqq.resilience.core.event.ResilienceEventListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 진단 이벤트 발행기.
 *
 * <p>수신자가 던진 예외는 WARN 로그로만 남기고 호출자에게 전파하지 않습니다.
 * 이벤트 발행 실패가 재시도, 차단, Permit 계산을 바꾸지 않도록 하기 위함입니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(EventPublisher.class);

    private final String source;
    private final ResilienceEventListener listener;

    /**
     * 생성자.
     *
     * @param source 이벤트 발생 컴포넌트 이름
     * @param listener 수신자 (null이면 NoOp)
     */
    public EventPublisher(String source, ResilienceEventListener listener) {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("source cannot be null or blank");
        }
        this.source = source;
        this.listener = listener == null ? ResilienceEventListener.noop() : listener;
    }

    /**
     * 이벤트 발행.
     *
     * <p>속성은 key, value 쌍으로 전달합니다. null 값은 문자열 "null"로 기록됩니다.</p>
     *
     * @param type 이벤트 종류
     * @param keyValues key1, value1, key2, value2, ...
     */
    public void publish(String type, Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException(
                "keyValues must be pairs (current length: " + keyValues.length + ")"
            );
        }
        Map<String, Object> attributes = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            Object value = keyValues[i + 1];
            attributes.put(String.valueOf(keyValues[i]), value == null ? "null" : value);
        }

        try {
            listener.onEvent(new ResilienceEvent(source, type, attributes));
        } catch (RuntimeException e) {
            log.warn("Event listener failed for {} event from {}", type, source, e);
        }
    }

    /**
     * 이벤트 발생 컴포넌트 이름.
     *
     * @return 이름
     */
    public String source() {
        return source;
    }
}
