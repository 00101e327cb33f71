/**
 * 호출에 적용할 가드 묶음 ({@link com.ryuqq.resilience.core.policy.Policy}).
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.policy;
