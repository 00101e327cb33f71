package com.ryuqq.resilience.core.retry;

import java.time.Duration;
import java.util.Optional;

/**
 * 재시도 간 대기 시간 시퀀스.
 *
 * <p>상태를 가지며 한 번의 실행(invocation)에서만 사용됩니다.
 * 실패할 때마다 {@link #nextDelay()}를 호출하여 다음 재시도까지 기다릴 시간을 얻고,
 * empty가 반환되면 더 이상 재시도하지 않습니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface Backoff {

    /**
     * 다음 재시도 전 대기 시간.
     *
     * @return 대기 시간, 재시도를 중단해야 하면 empty
     */
    Optional<Duration> nextDelay();

    /**
     * 시퀀스를 처음 상태로 되돌립니다.
     */
    void reset();
}
