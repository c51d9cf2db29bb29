/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.jwtgate.template;

/**
 * Thrown for malformed templates and for references to undefined variables during expansion.
 */
public class TemplateException extends Exception {
    private static final long serialVersionUID = 6617483036548914229L;

    public TemplateException(String message) {
        super(message);
    }
}
