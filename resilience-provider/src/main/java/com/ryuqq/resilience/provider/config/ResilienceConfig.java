package com.ryuqq.resilience.provider.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 이름 붙은 정의 레지스트리 (불변 record).
 *
 * <p><strong>구성 항목:</strong></p>
 * <ul>
 *   <li>timeouts: 이름 → 기간 문자열</li>
 *   <li>retries: 이름 → {@link RetryConfig}</li>
 *   <li>circuitBreakers: 이름 → {@link CircuitBreakerConfig}</li>
 *   <li>targets: 타겟 이름 → {@link PolicyNames} (정의 이름 선택)</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * ResilienceConfig config = ResilienceConfig.empty()
 *     .withTimeout("short", "1s")
 *     .withRetry("default", new RetryConfig("100ms", 3))
 *     .withCircuitBreaker("payment", new CircuitBreakerConfig(1, "10s", "30s", 5))
 *     .withTarget("payment-api", new PolicyNames("short", "default", "payment"));
 * }</pre>
 *
 * @param timeouts 타임아웃 정의
 * @param retries 재시도 정의
 * @param circuitBreakers Circuit Breaker 정의
 * @param targets 타겟 정의
 * @author Resilience Team
 * @since 1.0.0
 */
public record ResilienceConfig(
    Map<String, String> timeouts,
    Map<String, RetryConfig> retries,
    Map<String, CircuitBreakerConfig> circuitBreakers,
    Map<String, PolicyNames> targets
) {

    /**
     * Compact constructor.
     *
     * <p>null 맵은 빈 맵으로 취급하며, 모든 맵은 방어적으로 복사됩니다.</p>
     *
     * @throws NullPointerException 맵에 null 키 또는 값이 있는 경우
     */
    public ResilienceConfig {
        timeouts = timeouts == null ? Map.of() : Map.copyOf(timeouts);
        retries = retries == null ? Map.of() : Map.copyOf(retries);
        circuitBreakers = circuitBreakers == null ? Map.of() : Map.copyOf(circuitBreakers);
        targets = targets == null ? Map.of() : Map.copyOf(targets);
    }

    /**
     * 빈 설정.
     *
     * @return 정의가 하나도 없는 설정
     */
    public static ResilienceConfig empty() {
        return new ResilienceConfig(null, null, null, null);
    }

    /**
     * 타임아웃 정의를 추가(또는 교체)한 새 인스턴스 생성.
     */
    public ResilienceConfig withTimeout(String name, String duration) {
        return new ResilienceConfig(with(timeouts, name, duration), retries, circuitBreakers, targets);
    }

    /**
     * 재시도 정의를 추가(또는 교체)한 새 인스턴스 생성.
     */
    public ResilienceConfig withRetry(String name, RetryConfig retry) {
        return new ResilienceConfig(timeouts, with(retries, name, retry), circuitBreakers, targets);
    }

    /**
     * Circuit Breaker 정의를 추가(또는 교체)한 새 인스턴스 생성.
     */
    public ResilienceConfig withCircuitBreaker(String name, CircuitBreakerConfig circuitBreaker) {
        return new ResilienceConfig(timeouts, retries, with(circuitBreakers, name, circuitBreaker), targets);
    }

    /**
     * 타겟 정의를 추가(또는 교체)한 새 인스턴스 생성.
     */
    public ResilienceConfig withTarget(String target, PolicyNames names) {
        return new ResilienceConfig(timeouts, retries, circuitBreakers, with(targets, target, names));
    }

    private static <V> Map<String, V> with(Map<String, V> source, String key, V value) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (value == null) {
            throw new IllegalArgumentException("value for \"" + key + "\" cannot be null");
        }
        Map<String, V> copy = new LinkedHashMap<>(source);
        copy.put(key, value);
        return copy;
    }
}
