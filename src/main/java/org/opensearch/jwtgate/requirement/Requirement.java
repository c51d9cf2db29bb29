/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.jwtgate.requirement;

import org.opensearch.jwtgate.template.TemplateVariables;

/**
 * A rule a claim value must satisfy.
 */
public interface Requirement {

    /**
     * Evaluates the requirement against a claim value as decoded from the token payload: null, {@link Boolean},
     * {@link Number}, {@link String}, {@link java.util.List} or {@link java.util.Map}.
     */
    boolean validate(Object value, TemplateVariables variables);
}
