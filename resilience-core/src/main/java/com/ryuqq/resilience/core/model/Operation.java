package com.ryuqq.resilience.core.model;

import com.ryuqq.resilience.core.context.ExecutionContext;

/**
 * 보호 대상 작업 단위.
 *
 * <p>호출자가 제공하며, 가드 계층은 작업 내부를 알지 못합니다.
 * 작업은 전달받은 {@link ExecutionContext}를 협조적으로 관찰하는 것이 권장됩니다
 * (예: 긴 루프에서 {@code ctx.isDone()} 확인).</p>
 *
 * <p>정상 결과는 반환값으로, 실패는 예외로 표현합니다.
 * 재시도를 원치 않는 실패는 {@link com.ryuqq.resilience.core.error.PermanentException}으로 감싸 던집니다.</p>
 *
 * @param <T> 결과 타입
 * @author Resilience Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Operation<T> {

    /**
     * 작업 실행.
     *
     * @param ctx 실행 컨텍스트
     * @return 작업 결과
     * @throws Exception 작업 실패
     */
    T execute(ExecutionContext ctx) throws Exception;
}
