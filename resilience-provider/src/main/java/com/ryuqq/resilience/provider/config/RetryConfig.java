package com.ryuqq.resilience.provider.config;

/**
 * 이름 붙은 재시도 정의.
 *
 * @param duration 재시도 간 대기 시간 문자열 (예: "100ms", 정수는 마이크로초, 빈 값은 0)
 * @param maxRetries 최대 재시도 횟수 (음수는 무제한)
 * @author Resilience Team
 * @since 1.0.0
 */
public record RetryConfig(String duration, int maxRetries) {

    public RetryConfig {
        if (duration == null) {
            duration = "";
        }
    }
}
