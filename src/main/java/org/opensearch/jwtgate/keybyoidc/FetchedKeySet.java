/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.jwtgate.keybyoidc;

import java.security.Key;
import java.util.Map;

/**
 * The keys of an issuer together with the JWKS URL they were loaded from.
 */
public record FetchedKeySet(String jwksUri, Map<String, Key> keys) {

    public FetchedKeySet {
        keys = Map.copyOf(keys);
    }
}
