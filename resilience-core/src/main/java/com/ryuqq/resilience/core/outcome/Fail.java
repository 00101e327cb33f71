package com.ryuqq.resilience.core.outcome;

/**
 * 영구적 실패 (재시도 불가).
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>Circuit Breaker OPEN 거부</li>
 *   <li>HALF_OPEN 상태의 probe 한도 초과</li>
 *   <li>호출자가 {@link com.ryuqq.resilience.core.error.PermanentException}으로 표시한 오류</li>
 * </ul>
 *
 * @param cause 호출자에게 전달할 원인 (PermanentException은 벗겨진 상태)
 * @param attempt 실패한 시도 번호 (1 이상)
 * @param <T> 결과 타입
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public record Fail<T>(Exception cause, int attempt) implements Outcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public Fail {
        if (cause == null) {
            throw new IllegalArgumentException("cause cannot be null");
        }
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be positive (current: " + attempt + ")");
        }
    }
}
