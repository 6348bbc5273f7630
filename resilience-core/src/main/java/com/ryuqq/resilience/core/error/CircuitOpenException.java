package com.ryuqq.resilience.core.error;

/**
 * Circuit Breaker가 OPEN 상태(또는 HALF_OPEN 시험 호출 진행 중)라서
 * 작업을 시도하지 않았음을 나타냅니다.
 *
 * <p>이 예외가 관찰되면 보호 대상 작업은 호출되지 않았습니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class CircuitOpenException extends RuntimeException implements ResilienceFailure {

    private final String circuitName;

    /**
     * 생성자.
     *
     * @param circuitName Circuit Breaker 이름 (진단용)
     */
    public CircuitOpenException(String circuitName) {
        super("Circuit breaker is open: " + circuitName);
        this.circuitName = circuitName;
    }

    public String getCircuitName() {
        return circuitName;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CIRCUIT_OPEN;
    }
}
