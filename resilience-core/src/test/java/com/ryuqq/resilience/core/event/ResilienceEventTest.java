package com.ryuqq.resilience.core.event;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ResilienceEvent 테스트.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
@DisplayName("ResilienceEvent 테스트")
class ResilienceEventTest {

    @Test
    @DisplayName("속성은 불변 복사본으로 보관된다")
    void attributesCopied() {
        Map<String, Object> attributes = new HashMap<>();
        attributes.put("attempt", 1);

        ResilienceEvent event = new ResilienceEvent("payments", ResilienceEvent.RETRY_ATTEMPT, attributes);
        attributes.put("attempt", 2);

        assertThat(event.attribute("attempt")).isEqualTo(1);
        assertThat(event.attribute("missing")).isNull();
    }

    @Test
    @DisplayName("속성이 null이면 빈 맵")
    void nullAttributes() {
        ResilienceEvent event = new ResilienceEvent("db", ResilienceEvent.POOL_ADMITTED, null);

        assertThat(event.attributes()).isEmpty();
    }

    @Test
    @DisplayName("source와 type은 필수")
    void requiredFields() {
        assertThatThrownBy(() -> new ResilienceEvent(" ", "x", Map.of()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ResilienceEvent("x", null, Map.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("noop 수신자는 아무 것도 하지 않는다")
    void noop() {
        ResilienceEventListener.noop().onEvent(new ResilienceEvent("x", "y", Map.of()));
    }
}
