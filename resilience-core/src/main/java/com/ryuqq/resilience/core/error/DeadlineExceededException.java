package com.ryuqq.resilience.core.error;

/**
 * 실행 컨텍스트의 데드라인이 지났음을 나타냅니다.
 *
 * <p>Timeout Guard가 시도당 시간 예산을 초과했을 때 반환하는 오류이며,
 * 다른 작업 실패와 동일하게 재시도 대상입니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class DeadlineExceededException extends ResilienceException {

    public DeadlineExceededException() {
        super("context deadline exceeded");
    }
}
