package com.ryuqq.resilience.core.context;

import com.ryuqq.resilience.core.error.CancelledException;

/**
 * 명시적으로 취소할 수 있는 실행 컨텍스트.
 *
 * <p>{@link ExecutionContext#withCancel()}, {@link ExecutionContext#withTimeout(java.time.Duration)}로 생성합니다.
 * 사용이 끝나면 반드시 {@link #cancel()}(또는 try-with-resources)로 해제하여
 * 데드라인 타이머와 부모의 자식 참조를 정리해야 합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class CancellableContext extends ExecutionContext implements AutoCloseable {

    CancellableContext(ExecutionContext parent, long deadlineNanos, boolean hasDeadline) {
        super(parent, deadlineNanos, hasDeadline);
    }

    /**
     * 컨텍스트 취소.
     *
     * <p>이미 종료된 경우 아무 동작도 하지 않습니다 (멱등).</p>
     */
    public void cancel() {
        finish(new CancelledException());
    }

    @Override
    public void close() {
        cancel();
    }
}
