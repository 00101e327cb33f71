package com.ryuqq.resilience.core.protection;

/**
 * Circuit Breaker 카운터 스냅샷.
 *
 * <p>세대(generation)가 바뀔 때(상태 전이 또는 CLOSED 상태의 interval 경과) 모두 0으로 초기화됩니다.</p>
 *
 * @param requests 현재 세대에서 통과시킨 요청 수
 * @param totalSuccesses 성공 수
 * @param totalFailures 실패 수
 * @param consecutiveSuccesses 연속 성공 수
 * @param consecutiveFailures 연속 실패 수
 * @author Resilience Team
 * @since 1.0.0
 */
public record Counts(
    long requests,
    long totalSuccesses,
    long totalFailures,
    long consecutiveSuccesses,
    long consecutiveFailures
) {

    /**
     * 모든 값이 0인 스냅샷.
     */
    public static final Counts EMPTY = new Counts(0, 0, 0, 0, 0);

    Counts onRequest() {
        return new Counts(requests + 1, totalSuccesses, totalFailures, consecutiveSuccesses, consecutiveFailures);
    }

    Counts onSuccess() {
        return new Counts(requests, totalSuccesses + 1, totalFailures, consecutiveSuccesses + 1, 0);
    }

    Counts onFailure() {
        return new Counts(requests, totalSuccesses, totalFailures + 1, 0, consecutiveFailures + 1);
    }
}
