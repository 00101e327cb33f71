package com.ryuqq.resilience.core.outcome;

/**
 * 재시도 가능한 일시적 실패.
 *
 * <p>작업 자신의 오류, 데드라인 초과 등 영구 오류로 표시되지 않은 모든 실패가 여기에 해당합니다.
 * 오류 내용에 따른 필터링은 하지 않습니다.</p>
 *
 * @param cause 실패 원인
 * @param attempt 실패한 시도 번호 (1 이상)
 * @param <T> 결과 타입
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public record Retry<T>(Exception cause, int attempt) implements Outcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public Retry {
        if (cause == null) {
            throw new IllegalArgumentException("cause cannot be null");
        }
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be positive (current: " + attempt + ")");
        }
    }
}
