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

import java.security.Key;

public interface KeyProvider {

    /**
     * Resolves the key a token has to be verified with.
     *
     * @param kid the key id from the token header, may be null
     * @param issuer the unverified issuer claim of the token, may be null
     * @throws BadCredentialsException if no key can be resolved
     */
    Key getKey(String kid, String issuer) throws BadCredentialsException;
}
