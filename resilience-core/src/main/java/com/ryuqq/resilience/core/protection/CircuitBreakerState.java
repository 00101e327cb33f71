package com.ryuqq.resilience.core.protection;

/**
 * Circuit Breaker 상태.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED (정상)
 *   │
 *   ▼ (연속 실패 수 ≥ failureThreshold)
 * OPEN (차단)
 *   │
 *   ▼ (openTimeout 경과)
 * HALF_OPEN (반개방)
 *   │
 *   ├─► maxRequests번 연속 성공 → CLOSED
 *   └─► 실패 1회 → OPEN
 * </pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public enum CircuitBreakerState {

    /**
     * 정상 상태 (요청 통과).
     *
     * <p>모든 요청이 정상적으로 처리되며, 연속 실패 수를 추적합니다.
     * 성공 시 연속 실패 수는 0으로 돌아가고, interval마다 카운터가 초기화됩니다.</p>
     */
    CLOSED,

    /**
     * 차단 상태 (요청 즉시 거부).
     *
     * <p>작업을 실행하지 않고 모든 요청을 즉시 거부합니다.
     * openTimeout이 경과하면 HALF_OPEN 상태로 전이합니다.</p>
     */
    OPEN,

    /**
     * 반개방 상태 (일부 요청만 통과하여 테스트).
     *
     * <p>maxRequests개의 probe 요청만 통과시켜 의존성의 복구 여부를 테스트합니다.</p>
     */
    HALF_OPEN
}
