/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.jwtgate.requirement;

import java.util.List;

import com.google.common.collect.ImmutableList;

import org.opensearch.jwtgate.template.TemplateVariables;

/**
 * Backs {@code $and}: every contained requirement has to be satisfied by the same claim value.
 */
public class AllRequirements implements Requirement {

    private final List<Requirement> requirements;

    public AllRequirements(List<? extends Requirement> requirements) {
        this.requirements = ImmutableList.copyOf(requirements);
    }

    @Override
    public boolean validate(Object value, TemplateVariables variables) {
        for (Requirement requirement : requirements) {
            if (!requirement.validate(value, variables)) {
                return false;
            }
        }
        return true;
    }

    public List<Requirement> getRequirements() {
        return requirements;
    }

    @Override
    public String toString() {
        return "all of " + requirements;
    }
}
