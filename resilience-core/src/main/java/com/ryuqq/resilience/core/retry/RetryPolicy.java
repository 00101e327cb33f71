package com.ryuqq.resilience.core.retry;

import com.ryuqq.resilience.core.context.ExecutionContext;
import com.ryuqq.resilience.core.duration.DurationResolver;

import java.time.Duration;

/**
 * 고정 간격 재시도 정책 (불변 record).
 *
 * <p>실행마다 {@link #backoff(ExecutionContext)}로 새 대기 시퀀스를 만들어 사용하는 템플릿입니다.</p>
 *
 * <ul>
 *   <li>maxRetries &lt; 0: 무제한 재시도 (컨텍스트 종료 또는 영구 오류로만 중단)</li>
 *   <li>maxRetries == 0: 재시도 없음 (1회 시도)</li>
 *   <li>maxRetries == N: 최대 N+1회 시도</li>
 * </ul>
 *
 * @param delay 재시도 간 고정 대기 시간
 * @param maxRetries 최대 재시도 횟수
 * @author Resilience Team
 * @since 1.0.0
 */
public record RetryPolicy(Duration delay, int maxRetries) {

    /**
     * Compact constructor.
     *
     * @throws IllegalArgumentException delay가 null인 경우
     */
    public RetryPolicy {
        if (delay == null) {
            throw new IllegalArgumentException("delay cannot be null");
        }
    }

    /**
     * 기간 문자열로 정책 생성.
     *
     * @param delay 재시도 간 대기 시간 (예: "100ms", 정수는 마이크로초)
     * @param maxRetries 최대 재시도 횟수
     * @return RetryPolicy 인스턴스
     * @throws com.ryuqq.resilience.core.duration.DurationParseException 기간 문자열이 잘못된 경우
     */
    public static RetryPolicy of(String delay, int maxRetries) {
        return new RetryPolicy(DurationResolver.resolve(delay), maxRetries);
    }

    /**
     * 재시도 횟수 제한 여부.
     *
     * @return maxRetries가 음수이면 true
     */
    public boolean isUnlimited() {
        return maxRetries < 0;
    }

    /**
     * 컨텍스트에 바인딩된 새 대기 시퀀스 생성.
     *
     * <p>첫 시도는 즉시 실행되고, 이후 시도는 delay만큼 대기합니다.
     * 컨텍스트가 종료되면 남은 재시도 횟수와 관계없이 시퀀스가 끝납니다.</p>
     *
     * @param ctx 실행 컨텍스트
     * @return Backoff 인스턴스
     */
    public Backoff backoff(ExecutionContext ctx) {
        Backoff backoff = Backoffs.constant(delay);
        if (maxRetries >= 0) {
            backoff = Backoffs.withMaxRetries(backoff, maxRetries);
        }
        return Backoffs.withContext(backoff, ctx);
    }
}
