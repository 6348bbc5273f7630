package com.ryuqq.resilience.core.error;

/**
 * 실패 분류.
 *
 * <p>Resilience 엔진이 만들어내는 합성(synthetic) 실패와 보호 대상 작업 자체의 실패를
 * 닫힌 집합으로 구분합니다. 호출자는 예외 계층을 추측하지 않고 이 값으로 분기할 수 있습니다.</p>
 *
 * <ul>
 *   <li>{@link #ORIGINAL_FAILURE}: 작업이 던진 원래 예외 (재시도 소진 또는 재시도 불가)</li>
 *   <li>{@link #CIRCUIT_OPEN}: Circuit Breaker가 호출을 차단함</li>
 *   <li>{@link #QUEUE_FULL}: Resource Pool 대기열이 가득 참</li>
 *   <li>{@link #BULKHEAD_TIMEOUT}: 대기 시간 내에 Permit을 얻지 못함</li>
 *   <li>{@link #CONFIGURATION}: 잘못된 설정 조합</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public enum ErrorKind {

    ORIGINAL_FAILURE,

    CIRCUIT_OPEN,

    QUEUE_FULL,

    BULKHEAD_TIMEOUT,

    CONFIGURATION;

    /**
     * 예외를 분류합니다.
     *
     * @param error 분류할 예외
     * @return 엔진이 만든 예외면 해당 종류, 그 외에는 {@link #ORIGINAL_FAILURE}
     */
    public static ErrorKind of(Throwable error) {
        if (error instanceof ResilienceFailure failure) {
            return failure.kind();
        }
        return ORIGINAL_FAILURE;
    }
}
