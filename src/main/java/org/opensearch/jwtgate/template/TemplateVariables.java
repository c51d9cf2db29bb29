/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.jwtgate.template;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.HashMap;
import java.util.Map;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import org.apache.http.Header;
import org.apache.http.HttpRequest;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Read-only variables available to templates while a single request is processed.
 * Seeded from the environment captured at startup and overwritten with the request fields
 * {@code Method}, {@code Host}, {@code Path}, {@code Scheme} and {@code URL}.
 */
public final class TemplateVariables {

    private static final Logger log = LogManager.getLogger(TemplateVariables.class);

    public static final String METHOD = "Method";
    public static final String HOST = "Host";
    public static final String PATH = "Path";
    public static final String SCHEME = "Scheme";
    public static final String URL = "URL";

    static final String FORWARDED_PROTO = "X-Forwarded-Proto";
    static final String DEFAULT_SCHEME = "https";

    private final Map<String, String> variables;

    public TemplateVariables(Map<String, String> variables) {
        this.variables = ImmutableMap.copyOf(variables);
    }

    public static TemplateVariables forRequest(HttpRequest request, Map<String, String> environment) {
        Map<String, String> variables = new HashMap<>(environment);

        String target = request.getRequestLine().getUri();
        URI uri = parseTarget(target);

        variables.put(METHOD, request.getRequestLine().getMethod());

        if (uri != null && uri.isAbsolute() && uri.getHost() != null) {
            variables.put(HOST, hostOf(request, uri));
            variables.put(PATH, requestUri(uri));
            variables.put(SCHEME, uri.getScheme());
            variables.put(URL, target);
        } else {
            String host = hostOf(request, null);
            String path = Strings.isNullOrEmpty(target) ? "/" : target;
            Header forwardedProto = request.getFirstHeader(FORWARDED_PROTO);
            String scheme = forwardedProto == null || Strings.isNullOrEmpty(forwardedProto.getValue())
                ? DEFAULT_SCHEME
                : forwardedProto.getValue();
            variables.put(HOST, host);
            variables.put(PATH, path);
            variables.put(SCHEME, scheme);
            variables.put(URL, scheme + "://" + host + path);
        }

        return new TemplateVariables(variables);
    }

    private static URI parseTarget(String target) {
        try {
            return new URI(target);
        } catch (URISyntaxException e) {
            log.debug("Request target {} is not a valid URI: {}", target, e.getMessage());
            return null;
        }
    }

    private static String hostOf(HttpRequest request, URI uri) {
        Header host = request.getFirstHeader("Host");
        if (host != null && !Strings.isNullOrEmpty(host.getValue())) {
            return host.getValue();
        }
        if (uri != null) {
            return uri.getPort() == -1 ? uri.getHost() : uri.getHost() + ":" + uri.getPort();
        }
        return "";
    }

    private static String requestUri(URI uri) {
        String path = Strings.isNullOrEmpty(uri.getRawPath()) ? "/" : uri.getRawPath();
        return uri.getRawQuery() == null ? path : path + "?" + uri.getRawQuery();
    }

    public String get(String name) {
        return variables.get(name);
    }

    public boolean contains(String name) {
        return variables.containsKey(name);
    }

    public Map<String, String> asMap() {
        return variables;
    }

    @Override
    public String toString() {
        return "TemplateVariables " + variables;
    }
}
