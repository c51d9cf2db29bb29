/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.jwtgate;

/**
 * Thrown when the middleware cannot be constructed from its configuration.
 */
public class ConfigurationException extends Exception {
    private static final long serialVersionUID = 4217093785411923815L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
