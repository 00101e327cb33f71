package com.ryuqq.resilience.core.protection;

import com.ryuqq.resilience.core.context.ExecutionContext;
import com.ryuqq.resilience.core.error.CircuitBreakerOpenException;
import com.ryuqq.resilience.core.error.TooManyRequestsException;
import com.ryuqq.resilience.core.model.Operation;

/**
 * Circuit Breaker SPI.
 *
 * <p>연속 실패를 추적하고, 임계값 도달 시 빠르게 실패(Fail-Fast)하여
 * 장애가 난 의존성을 계속 호출하지 않도록 합니다.</p>
 *
 * <p><strong>Circuit Breaker 패턴:</strong></p>
 * <ul>
 *   <li>CLOSED: 정상 동작, 연속 실패 추적</li>
 *   <li>OPEN: 요청 차단, 작업을 실행하지 않고 즉시 실패</li>
 *   <li>HALF_OPEN: 제한된 probe 요청으로 복구 테스트</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CircuitBreaker cb = new DefaultCircuitBreaker(
 *     CircuitBreakerSettings.of("payment-api", 1, "10s", "30s", 5));
 *
 * String body = cb.execute(ctx, c -> paymentClient.get(c, id));
 * }</pre>
 *
 * <p>하나의 인스턴스는 여러 호출자가 동시에 공유하며, 구현체는 thread-safe해야 합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface CircuitBreaker {

    /**
     * Circuit Breaker 이름 조회.
     *
     * @return 이름
     */
    String name();

    /**
     * 현재 상태에 따라 작업을 실행하거나 거부합니다.
     *
     * <ul>
     *   <li>OPEN: 작업을 호출하지 않고 {@link CircuitBreakerOpenException}</li>
     *   <li>HALF_OPEN + probe 한도 도달: {@link TooManyRequestsException}</li>
     *   <li>그 외: 작업 실행 후 성공/실패 기록</li>
     * </ul>
     *
     * @param ctx 실행 컨텍스트 (작업에 그대로 전달)
     * @param operation 보호 대상 작업
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws Exception 작업이 던진 예외 또는 거부 예외
     */
    <T> T execute(ExecutionContext ctx, Operation<T> operation) throws Exception;

    /**
     * 현재 Circuit Breaker 상태 조회.
     *
     * <p>OPEN 대기 시간이 지났다면 HALF_OPEN을 반환합니다.</p>
     *
     * @return CLOSED, OPEN, HALF_OPEN 중 하나
     */
    CircuitBreakerState getState();

    /**
     * 현재 세대(generation)의 카운터 스냅샷 조회.
     *
     * @return 카운터 스냅샷
     */
    Counts getCounts();

    /**
     * Circuit Breaker를 CLOSED 상태로 강제 리셋.
     *
     * <p>수동 복구 또는 테스트 목적으로 사용됩니다.
     * 리셋 이전에 시작된 요청의 결과는 기록되지 않습니다.</p>
     */
    void reset();

    /**
     * Circuit Breaker 거부 오류인지 확인.
     *
     * <p>원인 체인 어딘가에 {@link CircuitBreakerOpenException} 또는
     * {@link TooManyRequestsException}이 있으면 true를 반환합니다.
     * 그 외 모든 예외와 null은 false입니다.</p>
     *
     * @param error 검사할 예외 (null 허용)
     * @return 재시도하면 안 되는 거부 오류이면 true
     */
    static boolean isErrorPermanent(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 32) {
            if (current instanceof CircuitBreakerOpenException || current instanceof TooManyRequestsException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }
}
