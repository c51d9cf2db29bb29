/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.jwtgate.keybyoidc;

/**
 * Thrown when a token cannot be parsed, its signature does not verify, no key is available for it
 * or its time claims are out of range. Always results in a 401.
 */
public class BadCredentialsException extends Exception {
    private static final long serialVersionUID = -2391784305170398412L;

    public BadCredentialsException(String message) {
        super(message);
    }

    public BadCredentialsException(String message, Throwable cause) {
        super(message, cause);
    }
}
