package com.ryuqq.resilience.core.retry;

import com.ryuqq.resilience.core.context.ExecutionContext;
import com.ryuqq.resilience.core.error.ResilienceException;
import com.ryuqq.resilience.core.model.Operation;
import com.ryuqq.resilience.core.outcome.Fail;
import com.ryuqq.resilience.core.outcome.Ok;
import com.ryuqq.resilience.core.outcome.Outcome;
import com.ryuqq.resilience.core.outcome.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * 재시도 루프.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. 작업 실행 → 성공이면 결과 반환
 * 2. 실패를 Outcome으로 분류
 *    - Fail (영구 오류): 즉시 중단, 원인 예외를 그대로 던짐
 *    - Retry: 3으로
 * 3. backoff.nextDelay()
 *    - empty: 컨텍스트가 종료되었으면 컨텍스트 오류, 아니면 마지막 예외를 그대로 던짐
 *    - delay: 컨텍스트 위에서 대기 (대기 중 종료되면 컨텍스트 오류) 후 1로
 * </pre>
 *
 * <p>한 번의 실행 안에서 시도는 항상 순차적입니다. 서로 다른 실행은 동시에 같은 RetryLoop를 사용할 수 있습니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class RetryLoop {

    private static final Logger log = LoggerFactory.getLogger(RetryLoop.class);

    private final RetryPolicy policy;

    /**
     * 생성자.
     *
     * @param policy 재시도 정책
     * @throws IllegalArgumentException policy가 null인 경우
     */
    public RetryLoop(RetryPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        this.policy = policy;
    }

    /**
     * 정책으로부터 새 대기 시퀀스를 만들어 작업을 실행.
     *
     * @param ctx 실행 컨텍스트 (각 시도와 대기에 사용)
     * @param operation 작업
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws Exception 마지막 시도의 예외, 영구 오류의 원인 또는 컨텍스트 오류
     */
    public <T> T run(ExecutionContext ctx, Operation<T> operation) throws Exception {
        return retry(ctx, operation, policy.backoff(ctx));
    }

    /**
     * 주어진 대기 시퀀스로 작업을 실행.
     *
     * @param ctx 실행 컨텍스트
     * @param operation 작업
     * @param backoff 대기 시퀀스
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws Exception 마지막 시도의 예외, 영구 오류의 원인 또는 컨텍스트 오류
     */
    public static <T> T retry(ExecutionContext ctx, Operation<T> operation, Backoff backoff) throws Exception {
        backoff.reset();

        int attempt = 0;
        while (true) {
            attempt++;
            Outcome<T> outcome = attempt(ctx, operation, attempt);

            if (outcome instanceof Ok<T> ok) {
                return ok.value();
            }
            if (outcome instanceof Fail<T> fail) {
                log.debug("Attempt {} failed permanently, giving up: {}", attempt, fail.cause().toString());
                throw fail.cause();
            }

            Retry<T> retry = (Retry<T>) outcome;
            Optional<Duration> next = backoff.nextDelay();
            if (next.isEmpty()) {
                ResilienceException contextError = ctx.error();
                if (contextError != null) {
                    throw contextError;
                }
                log.debug("Retries exhausted after {} attempts: {}", attempt, retry.cause().toString());
                throw retry.cause();
            }

            log.debug("Attempt {} failed, retrying in {}: {}", attempt, next.get(), retry.cause().toString());
            if (ctx.await(next.get())) {
                throw ctx.error();
            }
        }
    }

    private static <T> Outcome<T> attempt(ExecutionContext ctx, Operation<T> operation, int attempt) {
        try {
            return new Ok<>(operation.execute(ctx), attempt);
        } catch (Exception e) {
            return Outcome.classify(e, attempt);
        }
    }

    /**
     * 재시도 정책 조회.
     *
     * @return 재시도 정책
     */
    public RetryPolicy policy() {
        return policy;
    }
}
