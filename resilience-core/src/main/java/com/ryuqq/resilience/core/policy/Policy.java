package com.ryuqq.resilience.core.policy;

import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.retry.RetryPolicy;

import java.time.Duration;

/**
 * 호출에 적용할 가드 묶음 (불변 record).
 *
 * <p>각 가드는 선택 사항이며, 없는 가드는 적용되지 않습니다 (허용적인 기본값으로 대체하지 않음).
 * Policy 자체는 호출별 상태를 갖지 않으므로 여러 동시 실행이 안전하게 공유할 수 있습니다.
 * 단, 참조하는 {@link CircuitBreaker}는 공유 가변 상태입니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * Policy policy = Policy.none()
 *     .withTimeout(Duration.ofSeconds(1))
 *     .withRetry(RetryPolicy.of("100ms", 3))
 *     .withCircuitBreaker(breaker);
 * }</pre>
 *
 * @param timeout 시도당 제한 시간 (0 이하이면 비활성)
 * @param retryPolicy 재시도 정책 (null이면 비활성)
 * @param circuitBreaker Circuit Breaker (null이면 비활성)
 * @author Resilience Team
 * @since 1.0.0
 */
public record Policy(
    Duration timeout,
    RetryPolicy retryPolicy,
    CircuitBreaker circuitBreaker
) {

    private static final Policy NONE = new Policy(Duration.ZERO, null, null);

    /**
     * Compact constructor.
     *
     * <p>timeout이 null이면 {@link Duration#ZERO}(비활성)로 취급합니다.</p>
     */
    public Policy {
        if (timeout == null) {
            timeout = Duration.ZERO;
        }
        // retryPolicy, circuitBreaker는 null 허용
    }

    /**
     * 가드가 하나도 없는 Policy.
     *
     * @return 빈 Policy
     */
    public static Policy none() {
        return NONE;
    }

    /**
     * 타임아웃 적용 여부.
     *
     * @return timeout이 양수이면 true
     */
    public boolean hasTimeout() {
        return !timeout.isNegative() && !timeout.isZero();
    }

    /**
     * 재시도 적용 여부.
     *
     * @return retryPolicy가 있으면 true
     */
    public boolean hasRetry() {
        return retryPolicy != null;
    }

    /**
     * Circuit Breaker 적용 여부.
     *
     * @return circuitBreaker가 있으면 true
     */
    public boolean hasCircuitBreaker() {
        return circuitBreaker != null;
    }

    /**
     * 가드가 하나도 없는지 확인.
     *
     * @return 모든 가드가 비활성이면 true
     */
    public boolean isEmpty() {
        return !hasTimeout() && !hasRetry() && !hasCircuitBreaker();
    }

    /**
     * timeout만 변경한 새 인스턴스 생성.
     */
    public Policy withTimeout(Duration timeout) {
        return new Policy(timeout, retryPolicy, circuitBreaker);
    }

    /**
     * retryPolicy만 변경한 새 인스턴스 생성.
     */
    public Policy withRetry(RetryPolicy retryPolicy) {
        return new Policy(timeout, retryPolicy, circuitBreaker);
    }

    /**
     * circuitBreaker만 변경한 새 인스턴스 생성.
     */
    public Policy withCircuitBreaker(CircuitBreaker circuitBreaker) {
        return new Policy(timeout, retryPolicy, circuitBreaker);
    }
}
