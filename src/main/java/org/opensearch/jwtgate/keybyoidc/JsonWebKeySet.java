/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.jwtgate.keybyoidc;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A JWKS document with its key records left as JSON objects, so that each one is decoded on its own.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class JsonWebKeySet {

    @JsonProperty("keys")
    public List<Map<String, Object>> keys = new ArrayList<>();
}
