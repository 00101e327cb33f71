package com.ryuqq.resilience.core.protection;

import com.ryuqq.resilience.core.duration.DurationResolver;

import java.time.Duration;

/**
 * Circuit Breaker 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxRequests: HALF_OPEN 상태에서 허용할 probe 요청 수이자, CLOSED 복귀에 필요한 연속 성공 수 (0이면 1)</li>
 *   <li>interval: CLOSED 상태에서 카운터를 초기화하는 주기 (0 이하이면 초기화하지 않음)</li>
 *   <li>openTimeout: OPEN 상태 유지 시간, 경과 후 HALF_OPEN (0 이하이면 60초)</li>
 *   <li>failureThreshold: OPEN으로 전이하는 연속 실패 수</li>
 * </ul>
 *
 * @param name Circuit Breaker 이름 (공백 불가)
 * @param maxRequests HALF_OPEN 최대 요청 수 (0 이상)
 * @param interval CLOSED 카운터 초기화 주기
 * @param openTimeout OPEN 유지 시간
 * @param failureThreshold 연속 실패 임계값 (0 이상)
 * @author Resilience Team
 * @since 1.0.0
 */
public record CircuitBreakerSettings(
    String name,
    int maxRequests,
    Duration interval,
    Duration openTimeout,
    int failureThreshold
) {

    /**
     * openTimeout 미설정 시 기본값.
     */
    public static final Duration DEFAULT_OPEN_TIMEOUT = Duration.ofSeconds(60);

    /**
     * Compact constructor (유효성 검증 및 기본값 적용).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CircuitBreakerSettings {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (maxRequests < 0) {
            throw new IllegalArgumentException(
                "maxRequests cannot be negative (current: " + maxRequests + ")"
            );
        }
        if (failureThreshold < 0) {
            throw new IllegalArgumentException(
                "failureThreshold cannot be negative (current: " + failureThreshold + ")"
            );
        }
        if (maxRequests == 0) {
            maxRequests = 1;
        }
        if (interval == null || interval.isNegative()) {
            interval = Duration.ZERO;
        }
        if (openTimeout == null || openTimeout.isNegative() || openTimeout.isZero()) {
            openTimeout = DEFAULT_OPEN_TIMEOUT;
        }
    }

    /**
     * 기간 문자열로 설정 생성.
     *
     * @param name 이름
     * @param maxRequests HALF_OPEN 최대 요청 수
     * @param interval CLOSED 카운터 초기화 주기 (예: "10s")
     * @param openTimeout OPEN 유지 시간 (예: "30s")
     * @param failureThreshold 연속 실패 임계값
     * @return 설정 인스턴스
     * @throws com.ryuqq.resilience.core.duration.DurationParseException 기간 문자열이 잘못된 경우
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public static CircuitBreakerSettings of(
        String name,
        int maxRequests,
        String interval,
        String openTimeout,
        int failureThreshold
    ) {
        return new CircuitBreakerSettings(
            name,
            maxRequests,
            DurationResolver.resolve(interval),
            DurationResolver.resolve(openTimeout),
            failureThreshold
        );
    }

    /**
     * CLOSED 상태 카운터를 주기적으로 초기화하는지 여부.
     *
     * @return interval이 양수이면 true
     */
    public boolean hasInterval() {
        return !interval.isZero();
    }

    /**
     * 현재 카운터로 OPEN 전이 여부 판단.
     *
     * @param counts 현재 카운터
     * @return 연속 실패 수가 임계값 이상이면 true
     */
    public boolean readyToTrip(Counts counts) {
        return counts.consecutiveFailures() >= failureThreshold;
    }

    /**
     * maxRequests만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerSettings withMaxRequests(int maxRequests) {
        return new CircuitBreakerSettings(name, maxRequests, interval, openTimeout, failureThreshold);
    }

    /**
     * interval만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerSettings withInterval(Duration interval) {
        return new CircuitBreakerSettings(name, maxRequests, interval, openTimeout, failureThreshold);
    }

    /**
     * openTimeout만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerSettings withOpenTimeout(Duration openTimeout) {
        return new CircuitBreakerSettings(name, maxRequests, interval, openTimeout, failureThreshold);
    }

    /**
     * failureThreshold만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerSettings withFailureThreshold(int failureThreshold) {
        return new CircuitBreakerSettings(name, maxRequests, interval, openTimeout, failureThreshold);
    }
}
