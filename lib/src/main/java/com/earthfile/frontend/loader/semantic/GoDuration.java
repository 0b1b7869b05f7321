package com.earthfile.frontend.loader.semantic;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Map;

/**
 * Parses durations written the way Go tools accept them: a signed sequence of decimal numbers,
 * each with a unit suffix ({@code ns}, {@code us}, {@code ms}, {@code s}, {@code m}, {@code h}),
 * as in {@code 300ms}, {@code 1.5h} or {@code 2h45m}. A bare {@code 0} is allowed.
 */
final class GoDuration {
    private static final Map<String, Long> UNIT_NANOS =
            Map.of(
                    "ns", 1L,
                    "us", 1_000L,
                    "µs", 1_000L,
                    "μs", 1_000L,
                    "ms", 1_000_000L,
                    "s", 1_000_000_000L,
                    "m", 60_000_000_000L,
                    "h", 3_600_000_000_000L);

    private GoDuration() {}

    static Duration parse(String text) {
        String rest = text;
        boolean negative = false;
        if (!rest.isEmpty() && (rest.charAt(0) == '-' || rest.charAt(0) == '+')) {
            negative = rest.charAt(0) == '-';
            rest = rest.substring(1);
        }
        if ("0".equals(rest)) {
            return Duration.ZERO;
        }
        if (rest.isEmpty()) {
            throw invalid(text);
        }
        BigDecimal total = BigDecimal.ZERO;
        int pos = 0;
        while (pos < rest.length()) {
            int numberStart = pos;
            while (pos < rest.length() && (Character.isDigit(rest.charAt(pos)) || rest.charAt(pos) == '.')) {
                pos++;
            }
            String number = rest.substring(numberStart, pos);
            if (number.isEmpty() || ".".equals(number) || number.indexOf('.') != number.lastIndexOf('.')) {
                throw invalid(text);
            }
            int unitStart = pos;
            while (pos < rest.length() && !Character.isDigit(rest.charAt(pos)) && rest.charAt(pos) != '.') {
                pos++;
            }
            String unit = rest.substring(unitStart, pos);
            Long nanos = UNIT_NANOS.get(unit);
            if (nanos == null) {
                throw invalid(text);
            }
            total = total.add(new BigDecimal(number).multiply(BigDecimal.valueOf(nanos)));
        }
        long nanos;
        try {
            nanos = total.setScale(0, RoundingMode.DOWN).longValueExact();
        } catch (ArithmeticException ex) {
            throw invalid(text);
        }
        return Duration.ofNanos(negative ? -nanos : nanos);
    }

    private static IllegalArgumentException invalid(String text) {
        return new IllegalArgumentException("time: invalid duration \"" + text + "\"");
    }
}
