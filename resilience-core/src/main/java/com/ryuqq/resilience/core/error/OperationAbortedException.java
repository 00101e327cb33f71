package com.ryuqq.resilience.core.error;

/**
 * 작업이 비정상 종료되었음을 나타냅니다.
 *
 * <p>Timeout Guard의 백그라운드 작업에서 {@link Exception}이 아닌 {@link Throwable}
 * (예: {@link StackOverflowError}, {@link AssertionError})이 발생하면
 * 호출자 스레드로 전파하지 않고 이 예외로 변환합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class OperationAbortedException extends ResilienceException {

    public OperationAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
