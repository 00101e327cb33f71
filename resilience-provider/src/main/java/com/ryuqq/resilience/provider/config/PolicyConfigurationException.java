package com.ryuqq.resilience.provider.config;

/**
 * 정책 구성 오류.
 *
 * <p>잘못된 기간 문자열, 잘못된 숫자 값, 정의되지 않은 이름 참조 등
 * 정책을 만드는 시점에 발견되는 모든 오류를 나타냅니다. 재시도 대상이 아닙니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class PolicyConfigurationException extends IllegalArgumentException {

    public PolicyConfigurationException(String message) {
        super(message);
    }

    public PolicyConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
