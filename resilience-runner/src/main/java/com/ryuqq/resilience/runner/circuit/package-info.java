/**
 * Circuit Breaker 구현.
 *
 * @author Resilience Team
 * @since 1.0.0
 * @see com.ryuqq.resilience.core.protection.CircuitBreaker
 */
package com.ryuqq.resilience.runner.circuit;
