package com.ryuqq.resilience.provider.config;

/**
 * 이름 붙은 Circuit Breaker 정의.
 *
 * @param maxRequests HALF_OPEN 상태 최대 요청 수 (0이면 1)
 * @param interval CLOSED 카운터 초기화 주기 문자열 (빈 값이면 초기화하지 않음)
 * @param timeout OPEN 유지 시간 문자열 (빈 값이면 60초)
 * @param failures OPEN으로 전이하는 연속 실패 수
 * @author Resilience Team
 * @since 1.0.0
 */
public record CircuitBreakerConfig(
    int maxRequests,
    String interval,
    String timeout,
    int failures
) {

    public CircuitBreakerConfig {
        if (interval == null) {
            interval = "";
        }
        if (timeout == null) {
            timeout = "";
        }
    }
}
