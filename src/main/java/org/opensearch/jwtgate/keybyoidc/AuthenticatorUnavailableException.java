/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 *
 * Modifications Copyright OpenSearch Contributors. See
 * GitHub history for details.
 */

package org.opensearch.jwtgate.keybyoidc;

/**
 * Signals that keys could not be obtained from an issuer: transport failures, non-200 responses or
 * undecodable documents.
 */
public class AuthenticatorUnavailableException extends RuntimeException {
    private static final long serialVersionUID = -7007025852090301416L;

    public AuthenticatorUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public AuthenticatorUnavailableException(String message) {
        super(message);
    }
}
