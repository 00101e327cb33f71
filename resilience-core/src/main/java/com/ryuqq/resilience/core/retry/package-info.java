/**
 * 고정 간격 재시도.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.retry;
