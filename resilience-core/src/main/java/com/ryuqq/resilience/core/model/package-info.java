/**
 * 보호 대상 작업 모델.
 *
 * <p>{@link com.ryuqq.resilience.core.model.Operation}은 컨텍스트를 받아 값을 반환하거나 예외를 던지는
 * 호출자 소유의 작업입니다. 가드 계층은 작업을 상태 없이 취급합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.model;
