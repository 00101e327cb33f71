package com.ryuqq.resilience.core.error;

/**
 * 실행 컨텍스트가 취소되었음을 나타냅니다.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class CancelledException extends ResilienceException {

    public CancelledException() {
        super("context canceled");
    }

    /**
     * 원인과 함께 생성 (예: 대기 중 인터럽트).
     *
     * @param cause 원인
     */
    public CancelledException(Throwable cause) {
        super("context canceled", cause);
    }
}
