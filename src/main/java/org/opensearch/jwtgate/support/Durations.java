/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.jwtgate.support;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;

import com.google.common.base.Strings;

/**
 * Parses duration strings like {@code 300ms}, {@code 1.5h} or {@code 1h15m30s}.
 * <p>
 * A duration is an optional sign followed by one or more decimal numbers, each with an optional fraction and a
 * unit suffix. Valid units are {@code ns}, {@code us} (or {@code µs}), {@code ms}, {@code s}, {@code m} and {@code h}.
 * The single unitless value {@code 0} is accepted as well.
 */
public final class Durations {

    private static final Map<String, Long> UNIT_NANOS = Map.of(
        "ns",
        1L,
        "us",
        1_000L,
        "µs",
        1_000L,
        "μs",
        1_000L,
        "ms",
        1_000_000L,
        "s",
        1_000_000_000L,
        "m",
        60_000_000_000L,
        "h",
        3_600_000_000_000L
    );

    private Durations() {}

    /**
     * Returns {@link Duration#ZERO} for null or empty input.
     *
     * @throws IllegalArgumentException if the value is not a valid duration
     */
    public static Duration parse(String value) {
        if (Strings.isNullOrEmpty(value)) {
            return Duration.ZERO;
        }

        String s = value;
        boolean negative = false;
        if (s.charAt(0) == '-' || s.charAt(0) == '+') {
            negative = s.charAt(0) == '-';
            s = s.substring(1);
        }

        if (s.equals("0")) {
            return Duration.ZERO;
        }
        if (s.isEmpty()) {
            throw invalid(value);
        }

        BigDecimal totalNanos = BigDecimal.ZERO;
        int i = 0;
        while (i < s.length()) {
            int numberStart = i;
            while (i < s.length() && (Character.isDigit(s.charAt(i)) || s.charAt(i) == '.')) {
                i++;
            }
            String number = s.substring(numberStart, i);
            if (number.isEmpty() || number.equals(".") || number.indexOf('.') != number.lastIndexOf('.')) {
                throw invalid(value);
            }

            int unitStart = i;
            while (i < s.length() && !Character.isDigit(s.charAt(i)) && s.charAt(i) != '.') {
                i++;
            }
            Long unit = UNIT_NANOS.get(s.substring(unitStart, i));
            if (unit == null) {
                throw new IllegalArgumentException(
                    unitStart == i ? "Missing unit in duration \"" + value + "\"" : "Unknown unit \"" + s.substring(unitStart, i)
                        + "\" in duration \"" + value + "\""
                );
            }

            totalNanos = totalNanos.add(new BigDecimal(number).multiply(BigDecimal.valueOf(unit)));
        }

        if (totalNanos.compareTo(BigDecimal.valueOf(Long.MAX_VALUE)) > 0) {
            throw invalid(value);
        }
        long nanos = totalNanos.longValue();
        return Duration.ofNanos(negative ? -nanos : nanos);
    }

    private static IllegalArgumentException invalid(String value) {
        return new IllegalArgumentException("Invalid duration \"" + value + "\"");
    }
}
