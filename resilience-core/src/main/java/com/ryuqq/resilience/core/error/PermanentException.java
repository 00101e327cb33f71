package com.ryuqq.resilience.core.error;

/**
 * 호출자가 재시도 불가로 표시한 오류.
 *
 * <p>작업이 이 예외를 던지면 Retry 루프는 남은 재시도 횟수와 관계없이 즉시 중단하고,
 * 감싸진 원인 예외를 호출자에게 그대로 다시 던집니다. 재시도 가드가 없는 Policy에서도
 * {@code PolicyExecutor}가 원인 예외를 풀어서 던지므로 호출자는 항상 원인 예외를 받습니다.</p>
 *
 * <pre>{@code
 * executor.execute(ctx -> {
 *     if (response.status() == 404) {
 *         throw PermanentException.of(new NotFoundException(id));
 *     }
 *     return response.body();
 * });
 * }</pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class PermanentException extends ResilienceException {

    private PermanentException(Exception cause) {
        super("permanent failure: " + cause.getMessage(), cause);
    }

    /**
     * 예외를 영구 오류로 표시.
     *
     * @param cause 원인 예외
     * @return PermanentException 인스턴스
     * @throws IllegalArgumentException cause가 null인 경우
     */
    public static PermanentException of(Exception cause) {
        if (cause == null) {
            throw new IllegalArgumentException("cause cannot be null");
        }
        return new PermanentException(cause);
    }

    /**
     * 감싸진 원인 예외 조회.
     *
     * @return 원인 예외
     */
    public Exception unwrap() {
        return (Exception) getCause();
    }
}
