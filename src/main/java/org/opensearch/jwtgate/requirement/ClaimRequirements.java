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
 * Satisfied if any of the contained requirements is satisfied. Also backs {@code $or}.
 */
public class ClaimRequirements implements Requirement {

    private final List<Requirement> requirements;

    public ClaimRequirements(List<? extends Requirement> requirements) {
        this.requirements = ImmutableList.copyOf(requirements);
    }

    @Override
    public boolean validate(Object value, TemplateVariables variables) {
        for (Requirement requirement : requirements) {
            if (requirement.validate(value, variables)) {
                return true;
            }
        }
        return false;
    }

    public List<Requirement> getRequirements() {
        return requirements;
    }

    @Override
    public String toString() {
        return "any of " + requirements;
    }
}
