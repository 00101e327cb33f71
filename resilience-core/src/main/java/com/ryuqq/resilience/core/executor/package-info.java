/**
 * Policy Executor 패키지.
 *
 * <p>{@link com.ryuqq.resilience.core.policy.Policy}를 받아 Timeout → Circuit Breaker → Retry 순서로
 * 가드를 합성한 {@link com.ryuqq.resilience.core.executor.Executor}를 만듭니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.executor;
