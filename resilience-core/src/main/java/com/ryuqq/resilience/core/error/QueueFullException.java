package com.ryuqq.resilience.core.error;

/**
 * Resource Pool의 대기열이 최대 크기에 도달하여 즉시 거부되었음을 나타냅니다.
 *
 * <p>대기열이 가득 찬 경우 호출자는 대기하지 않고 바로 이 예외를 받습니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class QueueFullException extends RuntimeException implements ResilienceFailure {

    private final int maxQueueSize;

    /**
     * 생성자.
     *
     * @param maxQueueSize 설정된 최대 대기열 크기
     */
    public QueueFullException(int maxQueueSize) {
        super("Queue is full (max queue size: " + maxQueueSize + ")");
        this.maxQueueSize = maxQueueSize;
    }

    public int getMaxQueueSize() {
        return maxQueueSize;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.QUEUE_FULL;
    }
}
