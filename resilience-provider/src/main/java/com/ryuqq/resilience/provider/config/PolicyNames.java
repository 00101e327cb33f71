package com.ryuqq.resilience.provider.config;

/**
 * 타겟이 선택한 정의 이름들.
 *
 * <p>각 항목은 선택 사항이며, null 또는 빈 문자열은 해당 가드를 사용하지 않음을 뜻합니다.</p>
 *
 * @param timeout 타임아웃 정의 이름
 * @param retry 재시도 정의 이름
 * @param circuitBreaker Circuit Breaker 정의 이름
 * @author Resilience Team
 * @since 1.0.0
 */
public record PolicyNames(String timeout, String retry, String circuitBreaker) {

    private static final PolicyNames NONE = new PolicyNames(null, null, null);

    /**
     * Compact constructor.
     *
     * <p>공백뿐인 이름은 null(가드 없음)로 정규화합니다.</p>
     */
    public PolicyNames {
        timeout = blankToNull(timeout);
        retry = blankToNull(retry);
        circuitBreaker = blankToNull(circuitBreaker);
    }

    /**
     * 아무 정의도 선택하지 않은 인스턴스.
     *
     * @return 빈 PolicyNames
     */
    public static PolicyNames none() {
        return NONE;
    }

    /**
     * timeout만 변경한 새 인스턴스 생성.
     */
    public PolicyNames withTimeout(String timeout) {
        return new PolicyNames(timeout, retry, circuitBreaker);
    }

    /**
     * retry만 변경한 새 인스턴스 생성.
     */
    public PolicyNames withRetry(String retry) {
        return new PolicyNames(timeout, retry, circuitBreaker);
    }

    /**
     * circuitBreaker만 변경한 새 인스턴스 생성.
     */
    public PolicyNames withCircuitBreaker(String circuitBreaker) {
        return new PolicyNames(timeout, retry, circuitBreaker);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
