/**
 * 시도당 제한 시간 가드.
 *
 * <p>{@link com.ryuqq.resilience.core.timeout.TimeoutGuard}는 작업을 별도 스레드에서 실행하고,
 * 결과와 데드라인 중 먼저 도착한 쪽을 반환합니다. 실행 중인 작업을 인터럽트하지는 않습니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.timeout;
