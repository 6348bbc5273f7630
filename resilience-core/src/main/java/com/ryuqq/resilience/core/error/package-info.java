/**
 * Resilience 엔진의 오류 분류.
 *
 * <p>보호 대상 작업의 예외는 감싸지 않고 그대로 전파됩니다. 엔진이 새로 만드는 예외는
 * {@link com.ryuqq.resilience.core.error.ResilienceFailure}를 구현하는 네 가지뿐입니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.error;
