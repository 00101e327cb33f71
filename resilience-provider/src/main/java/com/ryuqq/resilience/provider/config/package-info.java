/**
 * 이름 붙은 정책 정의 모델과 {@link java.util.Properties} 로더.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.provider.config;
