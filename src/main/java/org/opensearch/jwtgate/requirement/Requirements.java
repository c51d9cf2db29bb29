/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.jwtgate.requirement;

import java.util.Map;

import com.google.common.collect.ImmutableMap;

import org.opensearch.jwtgate.template.TemplateVariables;

/**
 * The requirements of all configured claims. Every claim has to be present and satisfied.
 */
public class Requirements {

    public static final Requirements NONE = new Requirements(Map.of());

    private final Map<String, Requirement> requirements;

    public Requirements(Map<String, ? extends Requirement> requirements) {
        this.requirements = ImmutableMap.copyOf(requirements);
    }

    public void validate(Map<String, Object> claims, TemplateVariables variables) throws ClaimValidationException {
        for (Map.Entry<String, Requirement> entry : requirements.entrySet()) {
            String claim = entry.getKey();
            if (!claims.containsKey(claim)) {
                throw ClaimValidationException.missing(claim);
            }
            if (!entry.getValue().validate(claims.get(claim), variables)) {
                throw ClaimValidationException.invalid(claim);
            }
        }
    }

    public boolean isEmpty() {
        return requirements.isEmpty();
    }

    public Requirement get(String claim) {
        return requirements.get(claim);
    }

    @Override
    public String toString() {
        return requirements.toString();
    }
}
