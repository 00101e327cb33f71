/**
 * 실행 중 발생하는 오류 타입.
 *
 * <p>모두 {@link com.ryuqq.resilience.core.error.ResilienceException}을 상속하는 unchecked 예외입니다.</p>
 *
 * <h2>재시도 분류</h2>
 * <ul>
 *   <li>영구 오류: {@link com.ryuqq.resilience.core.error.CircuitBreakerOpenException},
 *       {@link com.ryuqq.resilience.core.error.TooManyRequestsException},
 *       {@link com.ryuqq.resilience.core.error.PermanentException}</li>
 *   <li>재시도 대상: 데드라인 초과를 포함한 그 외 모든 예외</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.error;
