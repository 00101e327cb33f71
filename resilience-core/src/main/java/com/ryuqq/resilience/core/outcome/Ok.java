package com.ryuqq.resilience.core.outcome;

/**
 * 성공 결과.
 *
 * @param value 작업 결과 (null 허용)
 * @param attempt 성공한 시도 번호 (1 이상)
 * @param <T> 결과 타입
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public record Ok<T>(T value, int attempt) implements Outcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException attempt가 1 미만인 경우
     */
    public Ok {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be positive (current: " + attempt + ")");
        }
        // value는 null 허용
    }
}
