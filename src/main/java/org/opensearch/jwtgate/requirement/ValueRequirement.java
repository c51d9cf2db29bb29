/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.jwtgate.requirement;

import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import org.opensearch.jwtgate.support.WildcardMatcher;
import org.opensearch.jwtgate.template.TemplateVariables;

/**
 * Compares a claim value with a literal.
 * <p>
 * Arrays in the claim are satisfied by any element. For objects in the claim, any key has to satisfy the literal and
 * the value under that key has to satisfy the nested requirement. String comparison honours wildcards on both sides,
 * and a literal {@code example.com} is also satisfied by a claim {@code *.example.com}.
 * <p>
 * The nested requirement is either null (anything goes), a built {@link Requirement} or plain values of which at least
 * one has to be equal to at least one of the claim values.
 */
public class ValueRequirement implements Requirement {

    private static final Logger log = LogManager.getLogger(ValueRequirement.class);

    private final Object value;
    private final Object nested;
    private final WildcardMatcher matcher;

    public ValueRequirement(Object value, Object nested) {
        this.value = value;
        this.nested = nested;
        this.matcher = value instanceof String ? WildcardMatcher.from((String) value) : null;
    }

    @Override
    public boolean validate(Object claim, TemplateVariables variables) {
        if (claim instanceof List) {
            for (Object element : (List<?>) claim) {
                if (validate(element, variables)) {
                    return true;
                }
            }
        } else if (claim instanceof Map) {
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) claim).entrySet()) {
                if (validate(entry.getKey(), variables) && validateNested(entry.getValue(), variables)) {
                    return true;
                }
            }
        } else if (claim instanceof String) {
            return matchesString((String) claim);
        } else if (claim instanceof Number) {
            return matchesNumber((Number) claim);
        }

        return ClaimValues.deepEquals(claim, value);
    }

    private boolean matchesString(String claim) {
        if (matcher == null) {
            return false;
        }
        String required = (String) value;
        return WildcardMatcher.from(claim).test(required) || matcher.test(claim) || claim.equals("*." + required);
    }

    private boolean matchesNumber(Number claim) {
        if (value instanceof Number && ClaimValues.isIntegral((Number) value)) {
            return ClaimValues.isIntegral(claim) && ClaimValues.toBigInteger(claim).equals(ClaimValues.toBigInteger((Number) value));
        } else if (value instanceof Number && ClaimValues.isFloatingPoint((Number) value)) {
            return claim.doubleValue() == ((Number) value).doubleValue();
        }
        log.debug("Unsupported requirement type for numeric comparison: {} {}", value == null ? "null" : value.getClass(), value);
        return false;
    }

    boolean validateNested(Object supplied, TemplateVariables variables) {
        if (nested == null) {
            return true;
        }
        if (nested instanceof Requirement) {
            return ((Requirement) nested).validate(supplied, variables);
        }

        for (Object required : ClaimValues.asList(nested)) {
            for (Object candidate : ClaimValues.asList(supplied)) {
                if (ClaimValues.deepEquals(required, candidate)) {
                    return true;
                }
            }
        }
        return false;
    }

    public Object getValue() {
        return value;
    }

    public Object getNested() {
        return nested;
    }

    @Override
    public String toString() {
        return nested == null ? String.valueOf(value) : value + ": " + nested;
    }
}
