package com.ryuqq.resilience.core.executor;

import com.ryuqq.resilience.core.model.Operation;

/**
 * 가드가 적용된 작업 실행자.
 *
 * <p>한 번 생성해 여러 번 호출하는 것을 전제로 하며, 구현체는 thread-safe해야 합니다.
 * 실행자는 생성 시 바인딩된 실행 컨텍스트를 모든 호출에 사용합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Executor executor = PolicyExecutor.create(ExecutionContext.background(), policy);
 * String body = executor.execute(ctx -&gt; client.fetch(ctx, url));
 * </pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface Executor {

    /**
     * 작업 실행.
     *
     * @param operation 실행할 작업
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws IllegalArgumentException operation이 null인 경우
     * @throws Exception 작업 예외 또는 가드가 만든 오류 (감추지 않고 그대로 전달)
     */
    <T> T execute(Operation<T> operation) throws Exception;
}
