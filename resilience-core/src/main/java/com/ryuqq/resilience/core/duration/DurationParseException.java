package com.ryuqq.resilience.core.duration;

/**
 * 잘못된 기간 문자열.
 *
 * <p>정책 구성 시점의 오류이며 재시도 대상이 아닙니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class DurationParseException extends IllegalArgumentException {

    private final String input;

    /**
     * 생성자.
     *
     * @param input 파싱에 실패한 원본 문자열
     * @param reason 실패 사유
     */
    public DurationParseException(String input, String reason) {
        super("invalid duration \"" + input + "\": " + reason);
        this.input = input;
    }

    /**
     * 파싱에 실패한 원본 문자열 조회.
     *
     * @return 원본 문자열
     */
    public String getInput() {
        return input;
    }
}
