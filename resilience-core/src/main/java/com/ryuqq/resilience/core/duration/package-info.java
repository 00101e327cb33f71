/**
 * 기간 문자열 해석.
 *
 * <p>빈 문자열은 0, 부호 있는 정수는 마이크로초, 그 외에는 {@code 1h30m}, {@code 1.5s} 같은
 * 단위 표현식으로 해석합니다. 잘못된 입력은 {@link com.ryuqq.resilience.core.duration.DurationParseException}입니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.duration;
