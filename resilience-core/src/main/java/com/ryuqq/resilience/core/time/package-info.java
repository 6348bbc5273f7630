/**
 * 시간 추상화.
 *
 * <p>시간에 의존하는 모든 컴포넌트는 이 패키지의 인터페이스를 생성자로 주입받습니다.
 * 전역 시간 상태를 조작하지 않고도 테스트에서 시간을 결정적으로 제어할 수 있습니다.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.resilience.core.time.TimeSource} - 단조 시계</li>
 *   <li>{@link com.ryuqq.resilience.core.time.Sleeper} - 블로킹 대기</li>
 *   <li>{@link com.ryuqq.resilience.core.time.AsyncSleeper} - 비블로킹 대기</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.time;
