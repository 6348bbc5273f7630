/**
 * Deterministic test support for resilience components.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.testkit.support;
