/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.jwtgate.filter;

import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import org.apache.commons.lang3.StringUtils;
import org.apache.http.Header;
import org.apache.http.NameValuePair;
import org.apache.http.client.methods.HttpRequestWrapper;
import org.apache.http.client.utils.URIBuilder;
import org.apache.http.message.BasicHeaderValueParser;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Finds the token of a request. The cookie is tried first, then the header and finally the query parameter; the
 * first non-empty value wins. Unless the token is forwarded, the location it was taken from is removed from the
 * request.
 */
public class TokenExtractor {
    private final static Logger log = LogManager.getLogger(TokenExtractor.class);

    static final String COOKIE = "Cookie";
    private static final String BEARER = "Bearer ";

    private final String cookieName;
    private final String headerName;
    private final String parameterName;
    private final boolean forwardToken;

    public TokenExtractor(String cookieName, String headerName, String parameterName, boolean forwardToken) {
        this.cookieName = Strings.emptyToNull(cookieName);
        this.headerName = Strings.emptyToNull(headerName);
        this.parameterName = Strings.emptyToNull(parameterName);
        this.forwardToken = forwardToken;
    }

    /**
     * Returns the token or an empty string.
     */
    public String extractToken(HttpRequestWrapper request) {
        String token = "";
        if (cookieName != null) {
            token = extractTokenFromCookie(request);
        }
        if (token.isEmpty() && headerName != null) {
            token = extractTokenFromHeader(request);
        }
        if (token.isEmpty() && parameterName != null) {
            token = extractTokenFromQuery(request);
        }
        return token;
    }

    String extractTokenFromCookie(HttpRequestWrapper request) {
        List<NameValuePair> cookies = new ArrayList<>();
        for (Header header : request.getHeaders(COOKIE)) {
            for (NameValuePair cookie : BasicHeaderValueParser.parseParameters(header.getValue(), BasicHeaderValueParser.INSTANCE)) {
                cookies.add(cookie);
            }
        }

        String token = null;
        List<String> remaining = new ArrayList<>();
        for (NameValuePair cookie : cookies) {
            if (cookieName.equals(cookie.getName())) {
                if (token == null) {
                    token = Strings.nullToEmpty(cookie.getValue());
                }
            } else {
                remaining.add(cookie.getName() + "=" + Strings.nullToEmpty(cookie.getValue()));
            }
        }

        if (token == null) {
            return "";
        }

        if (!forwardToken) {
            request.removeHeaders(COOKIE);
            if (!remaining.isEmpty()) {
                request.addHeader(COOKIE, Joiner.on("; ").join(remaining));
            }
        }
        return token;
    }

    String extractTokenFromHeader(HttpRequestWrapper request) {
        Header header = request.getFirstHeader(headerName);
        if (header == null) {
            return "";
        }

        String token = Strings.nullToEmpty(header.getValue());

        if (!forwardToken) {
            request.removeHeaders(headerName);
        }

        if (StringUtils.startsWithIgnoreCase(token, BEARER)) {
            return token.substring(BEARER.length());
        }
        return token;
    }

    String extractTokenFromQuery(HttpRequestWrapper request) {
        URIBuilder uriBuilder;
        try {
            uriBuilder = new URIBuilder(request.getRequestLine().getUri());
        } catch (URISyntaxException e) {
            log.debug("Cannot read query of {}: {}", request.getRequestLine().getUri(), e.getMessage());
            return "";
        }

        List<NameValuePair> parameters = uriBuilder.getQueryParams();
        String token = null;
        List<NameValuePair> remaining = new ArrayList<>(parameters.size());
        for (NameValuePair parameter : parameters) {
            if (parameterName.equals(parameter.getName())) {
                if (token == null) {
                    token = Strings.nullToEmpty(parameter.getValue());
                }
            } else {
                remaining.add(parameter);
            }
        }

        if (token == null) {
            return "";
        }

        if (!forwardToken) {
            if (remaining.isEmpty()) {
                uriBuilder.removeQuery();
            } else {
                uriBuilder.setParameters(remaining);
            }
            try {
                request.setURI(uriBuilder.build());
            } catch (URISyntaxException e) {
                log.warn("Cannot remove parameter {} from {}: {}", parameterName, request.getRequestLine().getUri(), e.getMessage());
            }
        }
        return token;
    }
}
