/**
 * Fallback 체인.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.runner.fallback;
