package com.ryuqq.resilience.core.error;

/**
 * Bulkhead 진입 대기 시간이 초과되어 작업이 시작되지 않았음을 나타냅니다.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class BulkheadTimeoutException extends RuntimeException implements ResilienceFailure {

    private final String bulkheadName;
    private final long timeoutMs;

    /**
     * 생성자.
     *
     * @param bulkheadName Bulkhead 이름
     * @param timeoutMs 대기한 시간 (밀리초)
     */
    public BulkheadTimeoutException(String bulkheadName, long timeoutMs) {
        super("Bulkhead '" + bulkheadName + "' could not admit within " + timeoutMs + "ms");
        this.bulkheadName = bulkheadName;
        this.timeoutMs = timeoutMs;
    }

    public String getBulkheadName() {
        return bulkheadName;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.BULKHEAD_TIMEOUT;
    }
}
