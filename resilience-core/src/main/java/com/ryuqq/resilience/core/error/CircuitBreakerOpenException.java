package com.ryuqq.resilience.core.error;

/**
 * Circuit Breaker가 OPEN 상태라서 작업을 실행하지 않고 거부했음을 나타냅니다.
 *
 * <p>영구 오류로 분류되므로 바깥의 Retry 루프는 즉시 중단됩니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class CircuitBreakerOpenException extends ResilienceException {

    private final String breakerName;

    /**
     * 생성자.
     *
     * @param breakerName 거부한 Circuit Breaker 이름
     */
    public CircuitBreakerOpenException(String breakerName) {
        super("circuit breaker is open (breaker: " + breakerName + ")");
        this.breakerName = breakerName;
    }

    /**
     * 거부한 Circuit Breaker 이름 조회.
     *
     * @return Circuit Breaker 이름
     */
    public String getBreakerName() {
        return breakerName;
    }
}
