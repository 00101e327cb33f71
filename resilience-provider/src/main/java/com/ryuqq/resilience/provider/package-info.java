/**
 * 이름 붙은 정의 레지스트리.
 *
 * <p>{@link com.ryuqq.resilience.provider.PolicyProvider}가 설정을 한 번에 해석해
 * 타겟별 {@link com.ryuqq.resilience.core.policy.Policy}를 제공합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.provider;
