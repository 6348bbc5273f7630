package com.ryuqq.resilience.core.error;

/**
 * 잘못된 설정 조합.
 *
 * <p>생성 시점(또는 실행 모드 검증 시점)에 즉시 발생하며, 재시도되거나
 * 조용히 보정되지 않습니다.</p>
 *
 * <p><strong>발생 예시:</strong></p>
 * <ul>
 *   <li>RetryPolicy와 개별 재시도 파라미터를 동시에 지정</li>
 *   <li>maxAttempts가 1 미만, 음수 지연 시간</li>
 *   <li>동기 실행에 비동기 Pool 사용 (또는 그 반대)</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class ConfigurationException extends IllegalArgumentException implements ResilienceFailure {

    /**
     * 생성자.
     *
     * @param message 오류 메시지
     */
    public ConfigurationException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CONFIGURATION;
    }
}
