/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.jwtgate.requirement;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Structural operations on decoded claim and requirement values. Values are null, {@link Boolean},
 * {@link Number}, {@link String}, {@link List} or {@link Map} with string keys.
 */
public final class ClaimValues {

    private ClaimValues() {}

    /**
     * Structural equality. Numbers are equal if they denote the same value, regardless of their Java type.
     */
    public static boolean deepEquals(Object left, Object right) {
        if (left == right) {
            return true;
        }
        if (left == null || right == null) {
            return false;
        }
        if (left instanceof Number && right instanceof Number) {
            return numericEquals((Number) left, (Number) right);
        }
        if (left instanceof List && right instanceof List) {
            List<?> leftList = (List<?>) left;
            List<?> rightList = (List<?>) right;
            if (leftList.size() != rightList.size()) {
                return false;
            }
            Iterator<?> leftValues = leftList.iterator();
            Iterator<?> rightValues = rightList.iterator();
            while (leftValues.hasNext()) {
                if (!deepEquals(leftValues.next(), rightValues.next())) {
                    return false;
                }
            }
            return true;
        }
        if (left instanceof Map && right instanceof Map) {
            Map<?, ?> leftMap = (Map<?, ?>) left;
            Map<?, ?> rightMap = (Map<?, ?>) right;
            if (leftMap.size() != rightMap.size()) {
                return false;
            }
            for (Map.Entry<?, ?> entry : leftMap.entrySet()) {
                if (!rightMap.containsKey(entry.getKey()) || !deepEquals(entry.getValue(), rightMap.get(entry.getKey()))) {
                    return false;
                }
            }
            return true;
        }
        return Objects.equals(left, right);
    }

    /**
     * A single value becomes a one element list, a list stays as it is.
     */
    public static List<?> asList(Object value) {
        if (value instanceof List) {
            return (List<?>) value;
        }
        return Collections.singletonList(value);
    }

    public static boolean isIntegral(Number number) {
        return number instanceof Integer
            || number instanceof Long
            || number instanceof Short
            || number instanceof Byte
            || number instanceof BigInteger;
    }

    public static boolean isFloatingPoint(Number number) {
        return number instanceof Double || number instanceof Float || number instanceof BigDecimal;
    }

    static BigInteger toBigInteger(Number number) {
        return number instanceof BigInteger ? (BigInteger) number : BigInteger.valueOf(number.longValue());
    }

    private static boolean numericEquals(Number left, Number right) {
        if (isIntegral(left) && isIntegral(right)) {
            return toBigInteger(left).equals(toBigInteger(right));
        }
        return left.doubleValue() == right.doubleValue();
    }
}
