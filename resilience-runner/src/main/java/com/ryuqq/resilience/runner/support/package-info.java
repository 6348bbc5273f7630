/**
 * runner 모듈 내부 지원 클래스.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.runner.support;
