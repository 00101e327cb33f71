package com.ryuqq.resilience.core.error;

/**
 * Resilience 계층이 발생시키는 런타임 예외의 최상위 타입.
 *
 * <p>가드(Timeout, Circuit Breaker, Retry)가 작업 대신 만들어내는 오류는 모두 이 타입을 상속합니다.
 * 작업 자체가 던진 예외는 감싸지 않고 그대로 호출자에게 전달됩니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class ResilienceException extends RuntimeException {

    /**
     * 메시지로 생성.
     *
     * @param message 오류 메시지
     */
    public ResilienceException(String message) {
        super(message);
    }

    /**
     * 메시지와 원인으로 생성.
     *
     * @param message 오류 메시지
     * @param cause 원인
     */
    public ResilienceException(String message, Throwable cause) {
        super(message, cause);
    }
}
