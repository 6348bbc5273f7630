package com.ryuqq.resilience.runner.retry;

import com.ryuqq.resilience.core.policy.HasStatus;

/**
 * 재시도 대상 상태 코드를 가진 응답을 나타내는 예외.
 *
 * <p>호출자에게 던져지지 않습니다. 상태 코드 때문에 재시도할 때 {@link RetryObserver}와
 * 로그에 전달되는 용도입니다. 마지막 시도의 응답은 예외 없이 그대로 반환됩니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class RetryableResponseException extends RuntimeException {

    private final transient Object response;
    private final int statusCode;

    /**
     * 생성자.
     *
     * @param response 재시도 대상 응답
     */
    public RetryableResponseException(HasStatus response) {
        super("Retryable response status: " + response.statusCode(), null, false, false);
        this.response = response;
        this.statusCode = response.statusCode();
    }

    public Object getResponse() {
        return response;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
