package com.ryuqq.resilience.core.executor;

import com.ryuqq.resilience.core.context.ExecutionContext;
import com.ryuqq.resilience.core.error.PermanentException;
import com.ryuqq.resilience.core.model.Operation;
import com.ryuqq.resilience.core.policy.Policy;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.retry.RetryLoop;
import com.ryuqq.resilience.core.timeout.TimeoutGuard;

import java.util.concurrent.ExecutorService;

/**
 * Policy 기반 작업 실행자 (가드 합성 엔진).
 *
 * <p><strong>합성 순서:</strong></p>
 * <pre>
 * 호출자 → RetryLoop → CircuitBreaker → TimeoutGuard → Operation
 *
 * 1. TimeoutGuard    → 원본 작업을 감쌈 (시도당 제한 시간)
 * 2. CircuitBreaker  → 1을 감쌈 (시도 타임아웃도 실패로 기록됨)
 * 3. RetryLoop       → 2를 반복 호출하는 가장 바깥 드라이버
 * </pre>
 *
 * <h3>순서 선정 이유</h3>
 * <ul>
 *   <li><strong>Timeout 안쪽:</strong> 시간 예산은 시도마다 새로 주어집니다.</li>
 *   <li><strong>Circuit Breaker 중간:</strong> 타임아웃도 의존성 장애로 집계되고,
 *       OPEN 거부는 영구 오류로 분류되어 RetryLoop를 즉시 멈춥니다.</li>
 *   <li><strong>Retry 바깥:</strong> 재시도 대기 시간은 시도당 타임아웃에 포함되지 않습니다.</li>
 * </ul>
 *
 * <p>Policy가 null이거나 비어 있으면 작업을 바인딩된 컨텍스트로 한 번 호출하는 항등 실행자입니다.</p>
 *
 * <p>작업이 던진 {@link PermanentException}은 재시도 가드 유무와 관계없이 감싸진 원인으로 풀려서 전달됩니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class PolicyExecutor implements Executor {

    private final ExecutionContext ctx;
    private final Policy policy;
    private final TimeoutGuard timeoutGuard;
    private final CircuitBreaker circuitBreaker;
    private final RetryLoop retryLoop;

    private PolicyExecutor(ExecutionContext ctx, Policy policy, TimeoutGuard timeoutGuard) {
        this.ctx = ctx;
        this.policy = policy;
        this.timeoutGuard = timeoutGuard;
        this.circuitBreaker = policy.circuitBreaker();
        this.retryLoop = policy.hasRetry() ? new RetryLoop(policy.retryPolicy()) : null;
    }

    /**
     * 실행자 생성.
     *
     * @param ctx 모든 호출에 사용할 실행 컨텍스트
     * @param policy 적용할 Policy (null이면 가드 없음)
     * @return 실행자
     * @throws IllegalArgumentException ctx가 null인 경우
     */
    public static PolicyExecutor create(ExecutionContext ctx, Policy policy) {
        validateContext(ctx);
        Policy effective = policy == null ? Policy.none() : policy;
        TimeoutGuard guard = effective.hasTimeout() ? new TimeoutGuard(effective.timeout()) : null;
        return new PolicyExecutor(ctx, effective, guard);
    }

    /**
     * 실행자 생성 (타임아웃 작업 스레드 풀 커스터마이징).
     *
     * @param ctx 모든 호출에 사용할 실행 컨텍스트
     * @param policy 적용할 Policy (null이면 가드 없음)
     * @param timeoutExecutor 타임아웃 가드가 작업을 실행할 스레드 풀
     * @return 실행자
     * @throws IllegalArgumentException ctx 또는 timeoutExecutor가 null인 경우
     */
    public static PolicyExecutor create(ExecutionContext ctx, Policy policy, ExecutorService timeoutExecutor) {
        validateContext(ctx);
        if (timeoutExecutor == null) {
            throw new IllegalArgumentException("timeoutExecutor cannot be null");
        }
        Policy effective = policy == null ? Policy.none() : policy;
        TimeoutGuard guard = effective.hasTimeout() ? new TimeoutGuard(effective.timeout(), timeoutExecutor) : null;
        return new PolicyExecutor(ctx, effective, guard);
    }

    @Override
    public <T> T execute(Operation<T> operation) throws Exception {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }

        Operation<T> guarded = operation;

        if (timeoutGuard != null) {
            guarded = timeoutGuard.guard(guarded);
        }

        if (circuitBreaker != null) {
            Operation<T> inner = guarded;
            guarded = attemptCtx -> circuitBreaker.execute(attemptCtx, inner);
        }

        if (retryLoop != null) {
            return retryLoop.run(ctx, guarded);
        }
        try {
            return guarded.execute(ctx);
        } catch (PermanentException e) {
            throw e.unwrap();
        }
    }

    /**
     * 적용 중인 Policy 조회.
     *
     * @return Policy (null이 아님)
     */
    public Policy policy() {
        return policy;
    }

    private static void validateContext(ExecutionContext ctx) {
        if (ctx == null) {
            throw new IllegalArgumentException("ctx cannot be null");
        }
    }
}
