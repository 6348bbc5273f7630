package com.ryuqq.resilience.core.error;

/**
 * Resilience 엔진이 직접 만들어내는 실패.
 *
 * <p>보호 대상 작업의 예외는 그대로 전파되며 이 타입을 구현하지 않습니다.
 * 이 인터페이스를 구현하는 예외만이 엔진의 새로운 오류 종류입니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public sealed interface ResilienceFailure
    permits CircuitOpenException, QueueFullException, BulkheadTimeoutException, ConfigurationException {

    /**
     * 실패 종류 조회.
     *
     * @return 실패 종류
     */
    ErrorKind kind();
}
