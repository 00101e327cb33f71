package com.ryuqq.resilience.core.protection;

/**
 * Circuit Breaker 상태 전이 리스너.
 *
 * <p>Circuit Breaker 내부 잠금 밖에서 호출됩니다. 리스너가 던진 예외는 기록만 하고 무시됩니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface StateChangeListener {

    /**
     * 상태 전이 통지.
     *
     * @param name Circuit Breaker 이름
     * @param from 이전 상태
     * @param to 새 상태
     */
    void onStateChange(String name, CircuitBreakerState from, CircuitBreakerState to);
}
