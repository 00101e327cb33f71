package com.ryuqq.resilience.core.timeout;

import com.ryuqq.resilience.core.context.CancellableContext;
import com.ryuqq.resilience.core.context.ExecutionContext;
import com.ryuqq.resilience.core.error.CancelledException;
import com.ryuqq.resilience.core.error.OperationAbortedException;
import com.ryuqq.resilience.core.model.Operation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 시도당(per-attempt) 실행 시간 제한.
 *
 * <p>작업을 별도 스레드에서 실행하고, 작업 완료와 데드라인 중 먼저 일어난 쪽의 결과를 반환합니다.
 * 데드라인을 관찰하지 않는 작업이라도 호출자를 무한정 붙잡아 두지 못합니다.</p>
 *
 * <p><strong>경쟁(race) 구조:</strong></p>
 * <pre>
 * ctx.withTimeout(timeout) ─────────────┐ (데드라인/취소 → completeExceptionally)
 *                                       ▼
 * executor: operation.execute(child) → [CompletableFuture] ← 호출자 대기
 *                                       ▲ (먼저 채운 쪽만 유효)
 * </pre>
 *
 * <ul>
 *   <li>결과 전달 슬롯은 {@link CompletableFuture} 하나이며, 채우는 동작은 절대 블로킹되지 않습니다.
 *       데드라인 이후에 끝난 작업의 결과는 조용히 버려지고 작업 스레드는 정상 종료됩니다.</li>
 *   <li>데드라인이 지나도 작업을 강제로 중단(interrupt)하지 않습니다. 작업은 컨텍스트 종료를 보고 스스로 멈춰야 합니다.</li>
 *   <li>작업이 {@link Exception}이 아닌 {@link Throwable}로 비정상 종료하면
 *       {@link OperationAbortedException}으로 변환합니다.</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class TimeoutGuard {

    private static final Logger log = LoggerFactory.getLogger(TimeoutGuard.class);

    private static final ExecutorService SHARED_EXECUTOR = Executors.newCachedThreadPool(new GuardThreadFactory());

    private final Duration timeout;
    private final ExecutorService executor;

    /**
     * 생성자 (공유 캐시 스레드 풀 사용).
     *
     * @param timeout 시도당 제한 시간 (양수)
     * @throws IllegalArgumentException timeout이 null이거나 양수가 아닌 경우
     */
    public TimeoutGuard(Duration timeout) {
        this(timeout, SHARED_EXECUTOR);
    }

    /**
     * 생성자 (작업 실행 스레드 풀 커스터마이징).
     *
     * @param timeout 시도당 제한 시간 (양수)
     * @param executor 작업을 실행할 스레드 풀
     * @throws IllegalArgumentException timeout이 양수가 아니거나 executor가 null인 경우
     */
    public TimeoutGuard(Duration timeout, ExecutorService executor) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        this.timeout = timeout;
        this.executor = executor;
    }

    /**
     * 작업에 시간 제한을 적용한 작업을 반환.
     *
     * @param operation 원본 작업
     * @param <T> 결과 타입
     * @return 시간 제한이 적용된 작업
     */
    public <T> Operation<T> guard(Operation<T> operation) {
        return ctx -> execute(ctx, operation);
    }

    /**
     * 시간 제한을 적용하여 작업 실행.
     *
     * @param ctx 호출자 컨텍스트
     * @param operation 작업
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws Exception 작업 예외, 데드라인/취소 시 컨텍스트 오류,
     *                   비정상 종료 시 {@link OperationAbortedException}
     */
    public <T> T execute(ExecutionContext ctx, Operation<T> operation) throws Exception {
        CancellableContext attemptCtx = ctx.withTimeout(timeout);
        CompletableFuture<T> result = new CompletableFuture<>();
        try {
            submit(attemptCtx, operation, result);
            attemptCtx.onDone(result::completeExceptionally);
            return await(attemptCtx, result);
        } finally {
            attemptCtx.cancel();
        }
    }

    /**
     * 제한 시간 조회.
     *
     * @return 시도당 제한 시간
     */
    public Duration timeout() {
        return timeout;
    }

    private <T> void submit(ExecutionContext attemptCtx, Operation<T> operation, CompletableFuture<T> result) {
        try {
            executor.execute(() -> runOperation(attemptCtx, operation, result));
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(new OperationAbortedException("operation rejected by executor", e));
        }
    }

    private static <T> void runOperation(ExecutionContext attemptCtx, Operation<T> operation, CompletableFuture<T> result) {
        try {
            result.complete(operation.execute(attemptCtx));
        } catch (Exception e) {
            result.completeExceptionally(e);
        } catch (Throwable t) {
            log.warn("Guarded operation aborted abnormally", t);
            result.completeExceptionally(new OperationAbortedException("operation panicked: " + t, t));
        }
    }

    private <T> T await(ExecutionContext attemptCtx, CompletableFuture<T> result) throws Exception {
        try {
            return result.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause == attemptCtx.error()) {
                log.debug("Guarded operation did not finish within {}: {}", timeout, cause.getMessage());
            }
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            throw new OperationAbortedException("operation panicked: " + cause, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancelledException(e);
        }
    }

    private static final class GuardThreadFactory implements ThreadFactory {

        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "resilience-timeout-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
