package com.ryuqq.resilience.core.error;

/**
 * HALF_OPEN 상태의 Circuit Breaker가 허용하는 probe 요청 수를 초과했음을 나타냅니다.
 *
 * <p>영구 오류로 분류되므로 바깥의 Retry 루프는 즉시 중단됩니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class TooManyRequestsException extends ResilienceException {

    private final String breakerName;

    /**
     * 생성자.
     *
     * @param breakerName 거부한 Circuit Breaker 이름
     */
    public TooManyRequestsException(String breakerName) {
        super("too many requests (breaker: " + breakerName + ")");
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
