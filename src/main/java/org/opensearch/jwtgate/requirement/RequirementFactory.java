/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.jwtgate.requirement;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.opensearch.jwtgate.ConfigurationException;
import org.opensearch.jwtgate.template.RequestTemplate;
import org.opensearch.jwtgate.template.TemplateException;

/**
 * Builds requirement trees from the declarative {@code require} configuration.
 * <pre>
 * require:
 *   aud: customer.example.com          # single value
 *   roles: [admin, support]            # any of the values
 *   authority:                         # object claims: key and nested values
 *     "*.example.com": [user, admin]
 *   groups:
 *     $and: [staff, "{{.Team}}"]       # all of the values
 * </pre>
 */
public final class RequirementFactory {

    public static final String AND = "$and";
    public static final String OR = "$or";

    private RequirementFactory() {}

    public static Requirements buildRequirements(Map<String, Object> require) throws ConfigurationException {
        if (require == null || require.isEmpty()) {
            return Requirements.NONE;
        }
        Map<String, Requirement> requirements = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : require.entrySet()) {
            requirements.put(entry.getKey(), buildRequirement(entry.getValue()));
        }
        return new Requirements(requirements);
    }

    /**
     * A list becomes an OR over its elements, an object an OR over its entries and anything else a single requirement.
     */
    public static Requirement buildRequirement(Object value) throws ConfigurationException {
        if (value instanceof List) {
            return new ClaimRequirements(buildAll((List<?>) value));
        } else if (value instanceof Map) {
            List<Requirement> requirements = new ArrayList<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                requirements.add(buildEntry(String.valueOf(entry.getKey()), entry.getValue()));
            }
            return new ClaimRequirements(requirements);
        }
        return newRequirement(value, null);
    }

    private static Requirement buildEntry(String key, Object value) throws ConfigurationException {
        switch (key) {
            case AND:
                return new AllRequirements(buildAll(ClaimValues.asList(value)));
            case OR:
                return new ClaimRequirements(buildAll(ClaimValues.asList(value)));
            default:
                return newRequirement(key, buildNested(value));
        }
    }

    private static List<Requirement> buildAll(List<?> values) throws ConfigurationException {
        List<Requirement> requirements = new ArrayList<>(values.size());
        for (Object value : values) {
            requirements.add(buildRequirement(value));
        }
        return requirements;
    }

    /**
     * Objects, and lists holding objects or lists, are built into requirements. Plain values and lists of plain
     * values are kept for equality comparison.
     */
    static Object buildNested(Object nested) throws ConfigurationException {
        if (nested instanceof Map) {
            return buildRequirement(nested);
        }
        if (nested instanceof List) {
            for (Object element : (List<?>) nested) {
                if (element instanceof Map || element instanceof List) {
                    return buildRequirement(nested);
                }
            }
        }
        return nested;
    }

    public static Requirement newRequirement(Object value, Object nested) throws ConfigurationException {
        if (value instanceof String && RequestTemplate.isTemplate((String) value)) {
            try {
                return new TemplateRequirement(RequestTemplate.parse((String) value), nested);
            } catch (TemplateException e) {
                throw new ConfigurationException("Invalid requirement template " + value + ": " + e.getMessage(), e);
            }
        }
        return new ValueRequirement(value, nested);
    }
}
