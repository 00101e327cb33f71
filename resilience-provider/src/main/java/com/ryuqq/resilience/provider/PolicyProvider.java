package com.ryuqq.resilience.provider;

import com.ryuqq.resilience.core.context.ExecutionContext;
import com.ryuqq.resilience.core.duration.DurationResolver;
import com.ryuqq.resilience.core.executor.Executor;
import com.ryuqq.resilience.core.executor.PolicyExecutor;
import com.ryuqq.resilience.core.policy.Policy;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.CircuitBreakerSettings;
import com.ryuqq.resilience.core.protection.DefaultCircuitBreaker;
import com.ryuqq.resilience.core.protection.StateChangeListener;
import com.ryuqq.resilience.core.retry.RetryPolicy;
import com.ryuqq.resilience.provider.config.CircuitBreakerConfig;
import com.ryuqq.resilience.provider.config.PolicyConfigurationException;
import com.ryuqq.resilience.provider.config.PolicyNames;
import com.ryuqq.resilience.provider.config.ResilienceConfig;
import com.ryuqq.resilience.provider.config.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 이름 붙은 정의로부터 타겟별 {@link Policy}를 제공하는 레지스트리.
 *
 * <p>모든 정의는 {@link #fromConfig(ResilienceConfig)} 호출 시 한 번에 해석되고 검증됩니다.
 * 이후 조회는 불변 맵 조회이므로 여러 스레드에서 동시에 호출해도 안전합니다.</p>
 *
 * <p><strong>Circuit Breaker 공유:</strong> 같은 이름의 Circuit Breaker를 참조하는 모든 타겟은
 * 하나의 인스턴스(하나의 상태 머신)를 공유합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * PolicyProvider provider = PolicyProvider.fromConfig(
 *     ResiliencePropertiesLoader.loadResource("resilience.properties"));
 *
 * String body = provider.executor(ExecutionContext.background(), "payment-api")
 *     .execute(ctx -> client.get(ctx, "/payments"));
 * }</pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class PolicyProvider {

    private static final Logger log = LoggerFactory.getLogger(PolicyProvider.class);

    private final Map<String, CircuitBreaker> circuitBreakers;
    private final Map<String, Policy> policies;

    private PolicyProvider(Map<String, CircuitBreaker> circuitBreakers, Map<String, Policy> policies) {
        this.circuitBreakers = Map.copyOf(circuitBreakers);
        this.policies = Map.copyOf(policies);
    }

    /**
     * 설정으로부터 Provider 생성 (상태 전이 리스너 없음).
     *
     * @param config 설정
     * @return Provider
     * @throws PolicyConfigurationException 기간 문자열, 수치 값 또는 이름 참조가 잘못된 경우
     */
    public static PolicyProvider fromConfig(ResilienceConfig config) {
        return fromConfig(config, null);
    }

    /**
     * 설정으로부터 Provider 생성.
     *
     * @param config 설정
     * @param listener 모든 Circuit Breaker에 등록할 상태 전이 리스너 (null 허용)
     * @return Provider
     * @throws PolicyConfigurationException 기간 문자열, 수치 값 또는 이름 참조가 잘못된 경우
     */
    public static PolicyProvider fromConfig(ResilienceConfig config, StateChangeListener listener) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }

        Map<String, Duration> timeouts = new HashMap<>();
        config.timeouts().forEach((name, value) -> {
            try {
                timeouts.put(name, DurationResolver.resolve(value));
            } catch (IllegalArgumentException e) {
                throw new PolicyConfigurationException(
                    "invalid timeout duration " + value + " for \"" + name + "\": " + e.getMessage(), e);
            }
        });

        Map<String, RetryPolicy> retries = new HashMap<>();
        config.retries().forEach((name, retry) -> retries.put(name, createRetry(name, retry)));

        Map<String, CircuitBreaker> circuitBreakers = new HashMap<>();
        config.circuitBreakers().forEach((name, cb) ->
            circuitBreakers.put(name, createCircuitBreaker(name, cb, listener)));

        Map<String, Policy> policies = new HashMap<>();
        config.targets().forEach((target, names) ->
            policies.put(target, resolve(target, names, timeouts, retries, circuitBreakers)));

        log.info("PolicyProvider created: {} targets, {} timeouts, {} retries, {} circuit breakers",
            policies.size(), timeouts.size(), retries.size(), circuitBreakers.size());
        return new PolicyProvider(circuitBreakers, policies);
    }

    /**
     * 타겟의 정책 조회.
     *
     * @param target 타겟 이름
     * @return 정책, 정의되지 않은 타겟이면 빈 정책 ({@link Policy#none()})
     */
    public Policy policy(String target) {
        if (target == null) {
            return Policy.none();
        }
        return policies.getOrDefault(target, Policy.none());
    }

    /**
     * 타겟 정책을 적용한 Executor 생성.
     *
     * @param ctx 실행 컨텍스트
     * @param target 타겟 이름
     * @return Executor
     */
    public Executor executor(ExecutionContext ctx, String target) {
        return PolicyExecutor.create(ctx, policy(target));
    }

    /**
     * 이름으로 Circuit Breaker 조회.
     *
     * @param name Circuit Breaker 이름
     * @return Circuit Breaker (없으면 empty)
     */
    public Optional<CircuitBreaker> circuitBreaker(String name) {
        return Optional.ofNullable(name == null ? null : circuitBreakers.get(name));
    }

    /**
     * 정의된 타겟 이름 목록.
     *
     * @return 타겟 이름 (불변)
     */
    public Set<String> targets() {
        return policies.keySet();
    }

    private static RetryPolicy createRetry(String name, RetryConfig config) {
        try {
            return RetryPolicy.of(config.duration(), config.maxRetries());
        } catch (IllegalArgumentException e) {
            throw new PolicyConfigurationException(
                "failed to create retry for \"" + name + "\": " + e.getMessage(), e);
        }
    }

    private static CircuitBreaker createCircuitBreaker(
        String name,
        CircuitBreakerConfig config,
        StateChangeListener listener
    ) {
        try {
            CircuitBreakerSettings settings = CircuitBreakerSettings.of(
                name, config.maxRequests(), config.interval(), config.timeout(), config.failures());
            return new DefaultCircuitBreaker(settings, listener);
        } catch (IllegalArgumentException e) {
            throw new PolicyConfigurationException(
                "failed to create circuit breaker for \"" + name + "\": " + e.getMessage(), e);
        }
    }

    private static Policy resolve(
        String target,
        PolicyNames names,
        Map<String, Duration> timeouts,
        Map<String, RetryPolicy> retries,
        Map<String, CircuitBreaker> circuitBreakers
    ) {
        Policy policy = Policy.none();
        if (names.timeout() != null) {
            policy = policy.withTimeout(lookup(target, "timeout", names.timeout(), timeouts));
        }
        if (names.retry() != null) {
            policy = policy.withRetry(lookup(target, "retry", names.retry(), retries));
        }
        if (names.circuitBreaker() != null) {
            policy = policy.withCircuitBreaker(
                lookup(target, "circuit breaker", names.circuitBreaker(), circuitBreakers));
        }
        return policy;
    }

    private static <V> V lookup(String target, String kind, String name, Map<String, V> definitions) {
        V value = definitions.get(name);
        if (value == null) {
            throw new PolicyConfigurationException(
                "target \"" + target + "\" references undefined " + kind + " \"" + name + "\"");
        }
        return value;
    }
}
