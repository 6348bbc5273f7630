/**
 * 진단 이벤트.
 *
 * <p>엔진 컴포넌트는 상태 변화를 {@link com.ryuqq.resilience.core.event.ResilienceEvent}로 발행합니다.
 * 기본 수신자는 {@link com.ryuqq.resilience.core.event.ResilienceEventListener#noop()}입니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.event;
