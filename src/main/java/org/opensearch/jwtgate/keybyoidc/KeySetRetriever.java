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

import java.io.IOException;
import java.io.InputStream;
import java.security.Key;
import java.util.Map;

import com.google.common.base.Strings;
import org.apache.http.HttpEntity;
import org.apache.http.HttpStatus;
import org.apache.http.StatusLine;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import org.opensearch.jwtgate.DefaultObjectMapper;

/**
 * Loads the keys of an issuer. The JWKS URL is taken from the issuer's discovery document at
 * {@code <issuer>.well-known/openid-configuration}; if that cannot be read, {@code <issuer>.well-known/jwks.json}
 * is used instead.
 */
public class KeySetRetriever {
    private final static Logger log = LogManager.getLogger(KeySetRetriever.class);

    static final String DISCOVERY_PATH = ".well-known/openid-configuration";
    static final String JWKS_PATH = ".well-known/jwks.json";

    private final IssuerHttpClients httpClients;
    private int requestTimeoutMs = 10000;

    public KeySetRetriever(IssuerHttpClients httpClients) {
        this.httpClients = httpClients;
    }

    /**
     * @param issuer canonical issuer URL, ending with {@code /}
     * @throws AuthenticatorUnavailableException if the key set cannot be loaded
     */
    public FetchedKeySet fetchKeys(String issuer) throws AuthenticatorUnavailableException {
        String discoveryUri = issuer + DISCOVERY_PATH;
        String jwksUri;
        try {
            jwksUri = getJwksUri(discoveryUri);
            log.info("Fetched openid-configuration from {}", discoveryUri);
        } catch (AuthenticatorUnavailableException e) {
            jwksUri = issuer + JWKS_PATH;
            log.warn("Failed to get openid-configuration from {}, falling back to {}: {}", discoveryUri, jwksUri, e.getMessage());
        }

        Map<String, Key> keys = get(jwksUri);
        log.info("Fetched keys from {}: {}", jwksUri, keys.keySet());
        return new FetchedKeySet(jwksUri, keys);
    }

    Map<String, Key> get(String uri) throws AuthenticatorUnavailableException {
        try (CloseableHttpClient httpClient = httpClients.createHttpClient(uri)) {

            try (CloseableHttpResponse response = httpClient.execute(newGet(uri))) {
                try (InputStream content = contentOf(uri, response)) {
                    JsonWebKeySet keySet = DefaultObjectMapper.readValue(content, JsonWebKeySet.class);
                    return JsonWebKeys.toKeyMap(keySet);
                }
            }
        } catch (IOException e) {
            throw new AuthenticatorUnavailableException("Error while getting " + uri + ": " + e, e);
        }
    }

    String getJwksUri(String discoveryUri) throws AuthenticatorUnavailableException {
        try (CloseableHttpClient httpClient = httpClients.createHttpClient(discoveryUri)) {

            try (CloseableHttpResponse response = httpClient.execute(newGet(discoveryUri))) {
                try (InputStream content = contentOf(discoveryUri, response)) {
                    OpenIdProviderConfiguration parsedEntity = DefaultObjectMapper.readValue(content, OpenIdProviderConfiguration.class);

                    if (parsedEntity == null || Strings.isNullOrEmpty(parsedEntity.getJwksUri())) {
                        throw new AuthenticatorUnavailableException("Error while getting " + discoveryUri + ": jwks_uri is missing");
                    }
                    return parsedEntity.getJwksUri();
                }
            }
        } catch (IOException e) {
            throw new AuthenticatorUnavailableException("Error while getting " + discoveryUri + ": " + e, e);
        }
    }

    private HttpGet newGet(String uri) {
        HttpGet httpGet;
        try {
            httpGet = new HttpGet(uri);
        } catch (IllegalArgumentException e) {
            throw new AuthenticatorUnavailableException("Invalid URL " + uri + ": " + e.getMessage(), e);
        }

        RequestConfig requestConfig = RequestConfig.custom()
            .setConnectionRequestTimeout(getRequestTimeoutMs())
            .setConnectTimeout(getRequestTimeoutMs())
            .setSocketTimeout(getRequestTimeoutMs())
            .build();

        httpGet.setConfig(requestConfig);
        return httpGet;
    }

    private static InputStream contentOf(String uri, CloseableHttpResponse response) throws IOException {
        StatusLine statusLine = response.getStatusLine();

        if (statusLine.getStatusCode() != HttpStatus.SC_OK) {
            throw new AuthenticatorUnavailableException("Got " + statusLine.getStatusCode() + " from " + uri);
        }

        HttpEntity httpEntity = response.getEntity();

        if (httpEntity == null) {
            throw new AuthenticatorUnavailableException("Error while getting " + uri + ": Empty response entity");
        }
        return httpEntity.getContent();
    }

    public int getRequestTimeoutMs() {
        return requestTimeoutMs;
    }

    public void setRequestTimeoutMs(int httpTimeoutMs) {
        this.requestTimeoutMs = httpTimeoutMs;
    }
}
