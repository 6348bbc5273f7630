/**
 * 보호 계층 조합.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.runner.pipeline;
