package com.ryuqq.resilience.core.outcome;

import com.ryuqq.resilience.core.error.PermanentException;
import com.ryuqq.resilience.core.protection.CircuitBreaker;

/**
 * 한 번의 시도(attempt) 결과.
 *
 * <p>Outcome은 세 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 성공, 값 보유</li>
 *   <li>{@link Retry}: 일시적 실패, 재시도 가능</li>
 *   <li>{@link Fail}: 영구적 실패, 재시도 불가</li>
 * </ul>
 *
 * <p>Retry 루프는 예외를 직접 비교하지 않고 {@link #classify(Exception, int)}로 분류된 Outcome을 보고
 * 계속할지 결정합니다.</p>
 *
 * @param <T> 결과 타입
 * @author Resilience Team
 * @since 1.0.0
 */
public sealed interface Outcome<T> permits Ok, Retry, Fail {

    /**
     * 실패 예외를 Outcome으로 분류.
     *
     * <ul>
     *   <li>{@link PermanentException}: 감싼 원인을 담은 {@link Fail}</li>
     *   <li>Circuit Breaker 거부 ({@link CircuitBreaker#isErrorPermanent(Throwable)}): {@link Fail}</li>
     *   <li>그 외 모든 예외: {@link Retry}</li>
     * </ul>
     *
     * @param error 시도에서 발생한 예외
     * @param attempt 시도 번호 (1부터 시작)
     * @param <T> 결과 타입
     * @return Retry 또는 Fail
     */
    static <T> Outcome<T> classify(Exception error, int attempt) {
        if (error instanceof PermanentException) {
            return new Fail<>(((PermanentException) error).unwrap(), attempt);
        }
        if (CircuitBreaker.isErrorPermanent(error)) {
            return new Fail<>(error, attempt);
        }
        return new Retry<>(error, attempt);
    }
}
