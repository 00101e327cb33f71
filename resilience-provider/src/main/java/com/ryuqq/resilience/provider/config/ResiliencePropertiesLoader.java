package com.ryuqq.resilience.provider.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;

/**
 * {@link Properties} 기반 {@link ResilienceConfig} 로더.
 *
 * <p><strong>지원 키:</strong></p>
 * <pre>
 * resilience.timeouts.&lt;name&gt;=1s
 * resilience.retries.&lt;name&gt;.duration=100ms
 * resilience.retries.&lt;name&gt;.max-retries=3
 * resilience.circuit-breakers.&lt;name&gt;.max-requests=1
 * resilience.circuit-breakers.&lt;name&gt;.interval=10s
 * resilience.circuit-breakers.&lt;name&gt;.timeout=30s
 * resilience.circuit-breakers.&lt;name&gt;.failures=5
 * resilience.targets.&lt;target&gt;.timeout=&lt;name&gt;
 * resilience.targets.&lt;target&gt;.retry=&lt;name&gt;
 * resilience.targets.&lt;target&gt;.circuit-breaker=&lt;name&gt;
 * </pre>
 *
 * <p>{@code resilience.} 접두사가 없는 키는 무시합니다. 접두사가 있는데 형식이 맞지 않거나
 * 숫자 값이 잘못된 경우 {@link PolicyConfigurationException}을 던집니다.
 * 기간 문자열 자체의 검증은 정책 생성 시점에 수행됩니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class ResiliencePropertiesLoader {

    private static final Logger log = LoggerFactory.getLogger(ResiliencePropertiesLoader.class);

    /**
     * 이 로더가 해석하는 키 접두사. 접두사가 없는 키는 무시됩니다.
     */
    public static final String PREFIX = "resilience.";

    private static final String TIMEOUTS = "timeouts";
    private static final String RETRIES = "retries";
    private static final String CIRCUIT_BREAKERS = "circuit-breakers";
    private static final String TARGETS = "targets";

    private ResiliencePropertiesLoader() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * 클래스패스 리소스에서 설정 로드.
     *
     * @param resource 리소스 경로 (예: "resilience.properties")
     * @return 설정
     * @throws PolicyConfigurationException 리소스가 없거나 키 형식이 잘못된 경우
     * @throws UncheckedIOException 리소스를 읽지 못한 경우
     */
    public static ResilienceConfig loadResource(String resource) {
        if (resource == null || resource.isBlank()) {
            throw new IllegalArgumentException("resource cannot be null or blank");
        }
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        if (classLoader == null) {
            classLoader = ResiliencePropertiesLoader.class.getClassLoader();
        }
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new PolicyConfigurationException("resource not found: " + resource);
            }
            ResilienceConfig config = load(in);
            log.info("Loaded resilience configuration from {}", resource);
            return config;
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read resource: " + resource, e);
        }
    }

    /**
     * UTF-8 스트림에서 설정 로드. 스트림은 닫지 않습니다.
     *
     * @param in 입력 스트림
     * @return 설정
     * @throws PolicyConfigurationException 키 형식이 잘못된 경우
     * @throws UncheckedIOException 스트림을 읽지 못한 경우
     */
    public static ResilienceConfig load(InputStream in) {
        if (in == null) {
            throw new IllegalArgumentException("input stream cannot be null");
        }
        Properties properties = new Properties();
        try {
            properties.load(new InputStreamReader(in, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read resilience properties", e);
        }
        return load(properties);
    }

    /**
     * {@link Properties}에서 설정 로드.
     *
     * @param properties 속성
     * @return 설정
     * @throws PolicyConfigurationException 키 형식이 잘못된 경우
     */
    public static ResilienceConfig load(Properties properties) {
        if (properties == null) {
            throw new IllegalArgumentException("properties cannot be null");
        }

        Map<String, String> timeouts = new TreeMap<>();
        Map<String, RetryConfig> retries = new TreeMap<>();
        Map<String, CircuitBreakerConfig> circuitBreakers = new TreeMap<>();
        Map<String, PolicyNames> targets = new TreeMap<>();

        for (Map.Entry<String, String> entry : toStringMap(properties).entrySet()) {
            String key = entry.getKey();
            if (!key.startsWith(PREFIX)) {
                continue;
            }
            String value = entry.getValue().trim();
            String rest = key.substring(PREFIX.length());
            int dot = rest.indexOf('.');
            if (dot <= 0) {
                throw unknownKey(key);
            }
            String section = rest.substring(0, dot);
            String path = rest.substring(dot + 1);

            switch (section) {
                case TIMEOUTS -> timeouts.put(requireName(key, path), value);
                case RETRIES -> {
                    String[] parts = split(key, path);
                    RetryConfig current = retries.getOrDefault(parts[0], new RetryConfig("", 0));
                    retries.put(parts[0], switch (parts[1]) {
                        case "duration" -> new RetryConfig(value, current.maxRetries());
                        case "max-retries" -> new RetryConfig(current.duration(), parseInt(key, value));
                        default -> throw unknownKey(key);
                    });
                }
                case CIRCUIT_BREAKERS -> {
                    String[] parts = split(key, path);
                    CircuitBreakerConfig c = circuitBreakers.getOrDefault(
                        parts[0], new CircuitBreakerConfig(0, "", "", 0));
                    circuitBreakers.put(parts[0], switch (parts[1]) {
                        case "max-requests" -> new CircuitBreakerConfig(
                            parseInt(key, value), c.interval(), c.timeout(), c.failures());
                        case "interval" -> new CircuitBreakerConfig(
                            c.maxRequests(), value, c.timeout(), c.failures());
                        case "timeout" -> new CircuitBreakerConfig(
                            c.maxRequests(), c.interval(), value, c.failures());
                        case "failures" -> new CircuitBreakerConfig(
                            c.maxRequests(), c.interval(), c.timeout(), parseInt(key, value));
                        default -> throw unknownKey(key);
                    });
                }
                case TARGETS -> {
                    String[] parts = split(key, path);
                    PolicyNames names = targets.getOrDefault(parts[0], PolicyNames.none());
                    targets.put(parts[0], switch (parts[1]) {
                        case "timeout" -> names.withTimeout(value);
                        case "retry" -> names.withRetry(value);
                        case "circuit-breaker" -> names.withCircuitBreaker(value);
                        default -> throw unknownKey(key);
                    });
                }
                default -> throw unknownKey(key);
            }
        }

        log.debug("Parsed resilience properties: {} timeouts, {} retries, {} circuit breakers, {} targets",
            timeouts.size(), retries.size(), circuitBreakers.size(), targets.size());
        return new ResilienceConfig(timeouts, retries, circuitBreakers, targets);
    }

    private static Map<String, String> toStringMap(Properties properties) {
        Map<String, String> map = new TreeMap<>();
        for (String name : properties.stringPropertyNames()) {
            map.put(name, properties.getProperty(name));
        }
        return map;
    }

    private static String requireName(String key, String name) {
        if (name.isBlank() || name.indexOf('.') >= 0) {
            throw unknownKey(key);
        }
        return name;
    }

    private static String[] split(String key, String path) {
        int dot = path.indexOf('.');
        if (dot <= 0 || dot == path.length() - 1 || path.indexOf('.', dot + 1) >= 0) {
            throw unknownKey(key);
        }
        return new String[] {path.substring(0, dot), path.substring(dot + 1)};
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new PolicyConfigurationException(
                "invalid integer value \"" + value + "\" for " + key, e);
        }
    }

    private static PolicyConfigurationException unknownKey(String key) {
        return new PolicyConfigurationException("unknown resilience property: " + key);
    }
}
