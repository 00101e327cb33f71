package com.ryuqq.resilience.core.retry;

import com.ryuqq.resilience.core.context.ExecutionContext;

import java.time.Duration;
import java.util.Optional;

/**
 * {@link Backoff} 구성 요소 팩토리.
 *
 * <pre>{@code
 * Backoff backoff = Backoffs.withContext(
 *     Backoffs.withMaxRetries(Backoffs.constant(Duration.ofMillis(100)), 3),
 *     ctx);
 * }</pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class Backoffs {

    private Backoffs() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 항상 같은 시간을 반환하는 무한 시퀀스.
     *
     * @param delay 대기 시간 (음수는 0으로 취급)
     * @return Backoff
     * @throws IllegalArgumentException delay가 null인 경우
     */
    public static Backoff constant(Duration delay) {
        if (delay == null) {
            throw new IllegalArgumentException("delay cannot be null");
        }
        Duration effective = delay.isNegative() ? Duration.ZERO : delay;
        return new Backoff() {
            @Override
            public Optional<Duration> nextDelay() {
                return Optional.of(effective);
            }

            @Override
            public void reset() {
                // 상태 없음
            }
        };
    }

    /**
     * 최대 재시도 횟수 제한.
     *
     * @param delegate 원본 시퀀스
     * @param maxRetries 최대 재시도 횟수 (0 이상)
     * @return maxRetries번 이후 중단하는 Backoff
     * @throws IllegalArgumentException delegate가 null이거나 maxRetries가 음수인 경우
     */
    public static Backoff withMaxRetries(Backoff delegate, long maxRetries) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries cannot be negative (current: " + maxRetries + ")");
        }
        return new Backoff() {
            private long retries;

            @Override
            public Optional<Duration> nextDelay() {
                if (retries >= maxRetries) {
                    return Optional.empty();
                }
                retries++;
                return delegate.nextDelay();
            }

            @Override
            public void reset() {
                retries = 0;
                delegate.reset();
            }
        };
    }

    /**
     * 컨텍스트 종료 시 즉시 중단.
     *
     * @param delegate 원본 시퀀스
     * @param ctx 바인딩할 컨텍스트
     * @return 컨텍스트가 종료되면 empty를 반환하는 Backoff
     * @throws IllegalArgumentException delegate 또는 ctx가 null인 경우
     */
    public static Backoff withContext(Backoff delegate, ExecutionContext ctx) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        if (ctx == null) {
            throw new IllegalArgumentException("ctx cannot be null");
        }
        return new ContextBoundBackoff(delegate, ctx);
    }

    private static final class ContextBoundBackoff implements Backoff {

        private final Backoff delegate;
        private final ExecutionContext ctx;

        private ContextBoundBackoff(Backoff delegate, ExecutionContext ctx) {
            this.delegate = delegate;
            this.ctx = ctx;
        }

        @Override
        public Optional<Duration> nextDelay() {
            if (ctx.isDone()) {
                return Optional.empty();
            }
            return delegate.nextDelay();
        }

        @Override
        public void reset() {
            delegate.reset();
        }
    }
}
