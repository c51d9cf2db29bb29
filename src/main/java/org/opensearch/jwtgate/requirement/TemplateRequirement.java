/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.jwtgate.requirement;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import org.opensearch.jwtgate.template.RequestTemplate;
import org.opensearch.jwtgate.template.TemplateException;
import org.opensearch.jwtgate.template.TemplateVariables;

/**
 * Expands its template with the variables of the current request and then behaves like a {@link ValueRequirement}
 * for the expanded text. A failing expansion never satisfies the requirement.
 */
public class TemplateRequirement implements Requirement {

    private static final Logger log = LogManager.getLogger(TemplateRequirement.class);

    private final RequestTemplate template;
    private final Object nested;

    public TemplateRequirement(RequestTemplate template, Object nested) {
        this.template = template;
        this.nested = nested;
    }

    @Override
    public boolean validate(Object value, TemplateVariables variables) {
        String expanded;
        try {
            expanded = template.expand(variables);
        } catch (TemplateException e) {
            log.warn("Error executing template {}: {}", template, e.getMessage());
            return false;
        }
        return new ValueRequirement(expanded, nested).validate(value, variables);
    }

    public RequestTemplate getTemplate() {
        return template;
    }

    @Override
    public String toString() {
        return nested == null ? template.getText() : template.getText() + ": " + nested;
    }
}
