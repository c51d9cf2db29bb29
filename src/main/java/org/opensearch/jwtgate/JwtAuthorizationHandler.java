/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.jwtgate;

import java.io.Closeable;
import java.io.IOException;
import java.security.Key;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import org.apache.http.Header;
import org.apache.http.HttpException;
import org.apache.http.HttpHeaders;
import org.apache.http.HttpRequest;
import org.apache.http.HttpResponse;
import org.apache.http.HttpStatus;
import org.apache.http.client.methods.HttpRequestWrapper;
import org.apache.http.protocol.HttpContext;
import org.apache.http.protocol.HttpRequestHandler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import org.opensearch.jwtgate.filter.ClaimHeaderMapper;
import org.opensearch.jwtgate.filter.ContentTypes;
import org.opensearch.jwtgate.filter.JwtRequestValidator;
import org.opensearch.jwtgate.filter.SecurityResponse;
import org.opensearch.jwtgate.filter.TokenExtractor;
import org.opensearch.jwtgate.filter.ValidationResult;
import org.opensearch.jwtgate.keybyoidc.IssuerHttpClients;
import org.opensearch.jwtgate.keybyoidc.IssuerKeyCache;
import org.opensearch.jwtgate.keybyoidc.JwtVerifier;
import org.opensearch.jwtgate.keybyoidc.KeyRefresher;
import org.opensearch.jwtgate.keybyoidc.KeySetRetriever;
import org.opensearch.jwtgate.keybyoidc.StaticKeys;
import org.opensearch.jwtgate.requirement.RequirementFactory;
import org.opensearch.jwtgate.requirement.Requirements;
import org.opensearch.jwtgate.support.Durations;
import org.opensearch.jwtgate.template.RequestTemplate;
import org.opensearch.jwtgate.template.TemplateException;
import org.opensearch.jwtgate.template.TemplateVariables;

/**
 * Authorizes requests by their JWT before handing them to the next handler.
 * <p>
 * The next handler receives a wrapper of the incoming request that carries the claim headers and, unless the token is
 * forwarded, lacks the token. Rejected requests are redirected if a redirect template is configured, answered in gRPC
 * manner if they are gRPC requests and answered with a plain text error otherwise.
 * <p>
 * Closing the handler stops the background key refresh.
 */
public class JwtAuthorizationHandler implements HttpRequestHandler, Closeable {
    private final static Logger log = LogManager.getLogger(JwtAuthorizationHandler.class);

    private final String name;
    private final HttpRequestHandler next;
    private final Map<String, String> environment;
    private final IssuerKeyCache keyCache;
    private final JwtRequestValidator validator;
    private final RequestTemplate redirectUnauthorized;
    private final RequestTemplate redirectForbidden;
    private final KeyRefresher keyRefresher;

    public JwtAuthorizationHandler(JwtGateConfig config, HttpRequestHandler next, String name) throws ConfigurationException {
        this(config, next, name, System.getenv());
    }

    /**
     * @param environment variables available to templates in addition to the request fields
     */
    public JwtAuthorizationHandler(JwtGateConfig config, HttpRequestHandler next, String name, Map<String, String> environment)
        throws ConfigurationException {
        this(config, next, name, environment, Clock.systemUTC());
    }

    JwtAuthorizationHandler(JwtGateConfig config, HttpRequestHandler next, String name, Map<String, String> environment, Clock clock)
        throws ConfigurationException {
        this.name = name;
        this.next = next;
        this.environment = environment == null ? ImmutableMap.of() : ImmutableMap.copyOf(environment);

        Key fallbackKey = setupKey(config.secret);
        Map<String, Key> staticKeys = StaticKeys.toKeyMap(config.secrets);
        IssuerHttpClients httpClients = new IssuerHttpClients(config.insecureSkipVerify, config.rootCAs);
        Requirements requirements = RequirementFactory.buildRequirements(config.require);

        this.redirectUnauthorized = parseTemplate("redirectUnauthorized", config.redirectUnauthorized);
        this.redirectForbidden = parseTemplate("redirectForbidden", config.redirectForbidden);

        Duration delayPrefetch = parseDuration("delayPrefetch", config.delayPrefetch);
        Duration refreshKeysInterval = parseDuration("refreshKeysInterval", config.refreshKeysInterval);

        this.keyCache = new IssuerKeyCache(new KeySetRetriever(httpClients), config.issuers, staticKeys, fallbackKey);

        this.validator = new JwtRequestValidator(
            new TokenExtractor(config.cookieName, config.headerName, config.parameterName, config.forwardToken),
            new JwtVerifier(keyCache, config.validMethods),
            requirements,
            new ClaimHeaderMapper(config.headerMap, config.removeMissingHeaders),
            config.optional,
            config.freshness,
            clock
        );

        this.keyRefresher = KeyRefresher.start(keyCache, config.skipPrefetch ? null : delayPrefetch, refreshKeysInterval, name);

        if (log.isDebugEnabled()) {
            log.debug("Configured {}: {}", name, config);
        }
    }

    private static Key setupKey(String secret) throws ConfigurationException {
        try {
            return StaticKeys.toKey(secret);
        } catch (ConfigurationException e) {
            throw new ConfigurationException("secret: " + e.getMessage(), e);
        }
    }

    private static RequestTemplate parseTemplate(String setting, String text) throws ConfigurationException {
        if (Strings.isNullOrEmpty(text)) {
            return null;
        }
        try {
            return RequestTemplate.parse(text);
        } catch (TemplateException e) {
            throw new ConfigurationException("invalid " + setting + ": " + e.getMessage(), e);
        }
    }

    private static Duration parseDuration(String setting, String value) throws ConfigurationException {
        try {
            return Durations.parse(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("invalid " + setting + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void handle(HttpRequest request, HttpResponse response, HttpContext context) throws HttpException, IOException {
        TemplateVariables variables = TemplateVariables.forRequest(request, environment);
        HttpRequestWrapper forwarded = HttpRequestWrapper.wrap(request);

        ValidationResult result = validator.validate(forwarded, variables);
        if (result.isAllowed()) {
            next.handle(forwarded, response, context);
            return;
        }

        failureResponse(request, result, variables).applyTo(response);
    }

    SecurityResponse failureResponse(HttpRequest request, ValidationResult result, TemplateVariables variables) {
        if (redirectUnauthorized != null) {
            RequestTemplate template = result.status() == HttpStatus.SC_UNAUTHORIZED || redirectForbidden == null
                ? redirectUnauthorized
                : redirectForbidden;
            try {
                return SecurityResponse.redirect(template.expand(variables));
            } catch (TemplateException e) {
                log.error("Failed to get redirect URL for {}: {}", name, e.getMessage());
                return SecurityResponse.error(HttpStatus.SC_INTERNAL_SERVER_ERROR, e.getMessage());
            }
        }

        Header contentType = request.getFirstHeader(HttpHeaders.CONTENT_TYPE);
        if (contentType != null && ContentTypes.hasToken(contentType.getValue(), ContentTypes.GRPC)) {
            return SecurityResponse.grpc(result.status());
        }

        return SecurityResponse.error(result.status(), result.message());
    }

    public IssuerKeyCache getKeyCache() {
        return keyCache;
    }

    public String getName() {
        return name;
    }

    @Override
    public void close() {
        keyRefresher.close();
    }
}
