/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.jwtgate.util;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetAddress;
import java.util.Arrays;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.http.HttpResponse;
import org.apache.http.HttpStatus;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.bootstrap.HttpServer;
import org.apache.http.impl.bootstrap.ServerBootstrap;

import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.JWKSet;

/**
 * Identity provider serving a discovery document and a key set on a free local port.
 * <p>
 * The discovery document points to {@link #CTX_KEYS}. The same key set is also served at the well-known fallback
 * location {@link #CTX_JWKS_FALLBACK}.
 */
public class MockIdpServer implements Closeable {

    public static final String CTX_DISCOVER = "/.well-known/openid-configuration";
    public static final String CTX_JWKS_FALLBACK = "/.well-known/jwks.json";
    public static final String CTX_KEYS = "/api/oauth/keys";

    private final HttpServer httpServer;
    private final int port;

    private volatile String keySet = "{\"keys\":[]}";
    private volatile int discoveryStatus = HttpStatus.SC_OK;
    private volatile int keysStatus = HttpStatus.SC_OK;

    private final AtomicInteger discoveryRequests = new AtomicInteger();
    private final AtomicInteger keysRequests = new AtomicInteger();
    private final AtomicInteger fallbackRequests = new AtomicInteger();

    public MockIdpServer() throws IOException {
        this.httpServer = ServerBootstrap.bootstrap()
            .setLocalAddress(InetAddress.getLoopbackAddress())
            .setListenerPort(0)
            .registerHandler(CTX_DISCOVER, (request, response, context) -> {
                discoveryRequests.incrementAndGet();
                respond(response, discoveryStatus, "{\"issuer\":\"" + getIssuer() + "\",\"jwks_uri\":\"" + getKeysUri() + "\"}");
            })
            .registerHandler(CTX_KEYS, (request, response, context) -> {
                keysRequests.incrementAndGet();
                respond(response, keysStatus, keySet);
            })
            .registerHandler(CTX_JWKS_FALLBACK, (request, response, context) -> {
                fallbackRequests.incrementAndGet();
                respond(response, keysStatus, keySet);
            })
            .create();
        this.httpServer.start();
        this.port = httpServer.getLocalPort();
    }

    private static void respond(HttpResponse response, int status, String body) {
        response.setStatusCode(status);
        response.setEntity(new StringEntity(body, ContentType.APPLICATION_JSON));
    }

    public String getIssuer() {
        return "http://127.0.0.1:" + port + "/";
    }

    public String getKeysUri() {
        return "http://127.0.0.1:" + port + CTX_KEYS;
    }

    public String getFallbackUri() {
        return "http://127.0.0.1:" + port + CTX_JWKS_FALLBACK;
    }

    public void setKeys(JWK... keys) {
        this.keySet = new JWKSet(Arrays.asList(keys)).toString();
    }

    public void setKeySet(String json) {
        this.keySet = json;
    }

    public void setDiscoveryStatus(int discoveryStatus) {
        this.discoveryStatus = discoveryStatus;
    }

    public void setKeysStatus(int keysStatus) {
        this.keysStatus = keysStatus;
    }

    public int getDiscoveryRequests() {
        return discoveryRequests.get();
    }

    public int getKeysRequests() {
        return keysRequests.get();
    }

    public int getFallbackRequests() {
        return fallbackRequests.get();
    }

    @Override
    public void close() {
        httpServer.shutdown(1, TimeUnit.SECONDS);
    }
}
