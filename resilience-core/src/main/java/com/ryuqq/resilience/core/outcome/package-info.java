/**
 * 실행 결과 값 타입.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.outcome;
