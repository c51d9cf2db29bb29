/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.jwtgate;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Options of a {@link JwtAuthorizationHandler}, decoded from YAML or JSON.
 */
public class JwtGateConfig {

    public static final List<String> DEFAULT_VALID_METHODS = List.of(
        "RS256",
        "RS384",
        "RS512",
        "ES256",
        "ES384",
        "ES512",
        "HS256",
        "HS384",
        "HS512"
    );
    public static final String DEFAULT_TOKEN_NAME = "Authorization";
    public static final long DEFAULT_FRESHNESS_SECONDS = 3600;

    public List<String> validMethods = new ArrayList<>(DEFAULT_VALID_METHODS);
    public List<String> issuers = new ArrayList<>();
    public boolean skipPrefetch = false;
    public String delayPrefetch;
    public String refreshKeysInterval;
    public List<String> insecureSkipVerify = new ArrayList<>();
    public List<String> rootCAs = new ArrayList<>();
    public String secret;
    public Map<String, String> secrets = new LinkedHashMap<>();
    public Map<String, Object> require = new LinkedHashMap<>();
    public boolean optional = false;
    public String redirectUnauthorized;
    public String redirectForbidden;
    public String cookieName = DEFAULT_TOKEN_NAME;
    public String headerName = DEFAULT_TOKEN_NAME;
    public String parameterName;
    public Map<String, String> headerMap = new LinkedHashMap<>();
    public boolean removeMissingHeaders = false;
    public boolean forwardToken = true;
    public long freshness = DEFAULT_FRESHNESS_SECONDS;

    public static JwtGateConfig fromYaml(String yaml) throws ConfigurationException {
        try {
            return nonNull(DefaultObjectMapper.readYaml(yaml, JwtGateConfig.class));
        } catch (IOException e) {
            throw new ConfigurationException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    public static JwtGateConfig fromYaml(InputStream in) throws ConfigurationException {
        try {
            return nonNull(DefaultObjectMapper.readYaml(in, JwtGateConfig.class));
        } catch (IOException e) {
            throw new ConfigurationException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    private static JwtGateConfig nonNull(JwtGateConfig config) {
        return config != null ? config : new JwtGateConfig();
    }

    @Override
    public String toString() {
        return "JwtGateConfig [validMethods="
            + validMethods
            + ", issuers="
            + issuers
            + ", skipPrefetch="
            + skipPrefetch
            + ", delayPrefetch="
            + delayPrefetch
            + ", refreshKeysInterval="
            + refreshKeysInterval
            + ", insecureSkipVerify="
            + insecureSkipVerify
            + ", secrets="
            + (secrets == null ? null : secrets.keySet())
            + ", require="
            + require
            + ", optional="
            + optional
            + ", cookieName="
            + cookieName
            + ", headerName="
            + headerName
            + ", parameterName="
            + parameterName
            + ", headerMap="
            + headerMap
            + ", forwardToken="
            + forwardToken
            + ", freshness="
            + freshness
            + "]";
    }
}
