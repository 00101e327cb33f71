package com.ryuqq.resilience.core.duration;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.util.Map;

/**
 * 설정 문자열을 {@link Duration}으로 변환합니다.
 *
 * <p><strong>허용 형식:</strong></p>
 * <ul>
 *   <li>빈 문자열 또는 null: {@link Duration#ZERO} (비활성화 의미)</li>
 *   <li>정수만 있는 경우: 마이크로초 단위 (예: {@code "1500"} = 1.5ms)</li>
 *   <li>단위가 붙은 표현식: {@code "100ms"}, {@code "2s"}, {@code "1000ns"}, {@code "1h30m"}, {@code "1.5s"}</li>
 * </ul>
 *
 * <p>지원 단위: ns, us (µs, μs), ms, s, m, h. 부호(+/-)는 표현식 맨 앞에 한 번만 올 수 있습니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class DurationResolver {

    private static final Map<String, Long> UNIT_NANOS = Map.of(
        "ns", 1L,
        "us", 1_000L,
        "µs", 1_000L,
        "μs", 1_000L,
        "ms", 1_000_000L,
        "s", 1_000_000_000L,
        "m", 60_000_000_000L,
        "h", 3_600_000_000_000L
    );

    private static final BigInteger MAX_NANOS = BigInteger.valueOf(Long.MAX_VALUE);
    private static final BigInteger MIN_NANOS = BigInteger.valueOf(Long.MIN_VALUE);

    private DurationResolver() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 문자열을 기간으로 변환.
     *
     * @param value 기간 문자열
     * @return 변환된 기간
     * @throws DurationParseException 형식이 잘못되었거나 표현 범위를 벗어난 경우
     */
    public static Duration resolve(String value) {
        if (value == null || value.isEmpty()) {
            return Duration.ZERO;
        }

        Long micros = parseMicros(value);
        if (micros != null) {
            try {
                return Duration.ofNanos(Math.multiplyExact(micros, 1_000L));
            } catch (ArithmeticException e) {
                throw new DurationParseException(value, "out of range");
            }
        }
        return parseExpression(value);
    }

    private static Long parseMicros(String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Duration parseExpression(String value) {
        int pos = 0;
        boolean negative = false;
        char first = value.charAt(0);
        if (first == '-' || first == '+') {
            negative = first == '-';
            pos++;
        }
        if ("0".equals(value.substring(pos))) {
            return Duration.ZERO;
        }
        if (pos == value.length()) {
            throw new DurationParseException(value, "missing value");
        }

        BigInteger total = BigInteger.ZERO;
        while (pos < value.length()) {
            int numberStart = pos;
            int integerDigits = 0;
            while (pos < value.length() && isDigit(value.charAt(pos))) {
                pos++;
                integerDigits++;
            }
            int fractionDigits = 0;
            if (pos < value.length() && value.charAt(pos) == '.') {
                pos++;
                while (pos < value.length() && isDigit(value.charAt(pos))) {
                    pos++;
                    fractionDigits++;
                }
            }
            if (integerDigits == 0 && fractionDigits == 0) {
                throw new DurationParseException(value, "expected number at position " + numberStart);
            }
            BigDecimal number = new BigDecimal(normalize(value.substring(numberStart, pos)));

            int unitStart = pos;
            while (pos < value.length() && value.charAt(pos) != '.' && !isDigit(value.charAt(pos))) {
                pos++;
            }
            if (unitStart == pos) {
                throw new DurationParseException(value, "missing unit");
            }
            String unit = value.substring(unitStart, pos);
            Long nanosPerUnit = UNIT_NANOS.get(unit);
            if (nanosPerUnit == null) {
                throw new DurationParseException(value, "unknown unit \"" + unit + "\"");
            }

            total = total.add(number.multiply(BigDecimal.valueOf(nanosPerUnit)).toBigInteger());
            if (total.compareTo(MAX_NANOS) > 0) {
                throw new DurationParseException(value, "out of range");
            }
        }

        BigInteger signed = negative ? total.negate() : total;
        if (signed.compareTo(MIN_NANOS) < 0) {
            throw new DurationParseException(value, "out of range");
        }
        return Duration.ofNanos(signed.longValueExact());
    }

    private static String normalize(String number) {
        if (number.startsWith(".")) {
            return "0" + number;
        }
        if (number.endsWith(".")) {
            return number + "0";
        }
        return number;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
