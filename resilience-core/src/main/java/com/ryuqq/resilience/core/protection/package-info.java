/**
 * Circuit Breaker 패키지.
 *
 * <p>장애가 지속되는 의존성을 빠르게 차단하기 위한 Circuit Breaker SPI와 기본 구현을 제공합니다.</p>
 *
 * <h2>구성</h2>
 * <ul>
 *   <li>{@link com.ryuqq.resilience.core.protection.CircuitBreaker} - SPI 및 영구 오류 판별 ({@code isErrorPermanent})</li>
 *   <li>{@link com.ryuqq.resilience.core.protection.DefaultCircuitBreaker} - 연속 실패 기반 상태 머신</li>
 *   <li>{@link com.ryuqq.resilience.core.protection.CircuitBreakerSettings} - 불변 설정</li>
 *   <li>{@link com.ryuqq.resilience.core.protection.Counts} - 카운터 스냅샷</li>
 * </ul>
 *
 * <h2>Retry와의 관계</h2>
 *
 * <p>OPEN 거부와 HALF_OPEN 한도 초과 오류는 영구 오류로 분류됩니다.
 * Circuit Breaker가 Retry 루프 안쪽에 있을 때, 이미 차단된 의존성에 남은 재시도 횟수를 소진하지 않고
 * 첫 거부에서 바로 호출자에게 오류를 돌려줍니다.</p>
 *
 * <h2>확장 방법</h2>
 *
 * <p>다른 판정 규칙(실패율, 느린 호출 비율 등)이 필요하면 {@link com.ryuqq.resilience.core.protection.CircuitBreaker}를
 * 직접 구현하여 {@link com.ryuqq.resilience.core.policy.Policy}에 넣으면 됩니다.
 * 거부 시에는 반드시 {@link com.ryuqq.resilience.core.error.CircuitBreakerOpenException} 또는
 * {@link com.ryuqq.resilience.core.error.TooManyRequestsException}을 던져야 Retry 루프가 멈춥니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.protection;
