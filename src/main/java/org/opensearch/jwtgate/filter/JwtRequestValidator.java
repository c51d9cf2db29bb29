/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.jwtgate.filter;

import java.time.Clock;
import java.util.Map;

import org.apache.http.client.methods.HttpRequestWrapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import org.opensearch.jwtgate.keybyoidc.BadCredentialsException;
import org.opensearch.jwtgate.keybyoidc.JwtVerifier;
import org.opensearch.jwtgate.requirement.ClaimValidationException;
import org.opensearch.jwtgate.requirement.ClaimValues;
import org.opensearch.jwtgate.requirement.Requirements;
import org.opensearch.jwtgate.template.TemplateVariables;

/**
 * Decides whether a request may pass.
 * <p>
 * A request without token passes only in optional mode. A token that cannot be verified is answered with 401. If the
 * claims do not satisfy the requirements, the answer is 401 when the token is older than the freshness window and 403
 * otherwise, so that clients with a stale token know to get a new one. Allowed requests get the configured claim
 * headers.
 */
public class JwtRequestValidator {
    private final static Logger log = LogManager.getLogger(JwtRequestValidator.class);

    static final String NO_TOKEN = "no token provided";
    static final String ISSUED_AT = "iat";

    private final TokenExtractor tokenExtractor;
    private final JwtVerifier jwtVerifier;
    private final Requirements requirements;
    private final ClaimHeaderMapper claimHeaderMapper;
    private final boolean optional;
    private final long freshnessSeconds;
    private final Clock clock;

    public JwtRequestValidator(
        TokenExtractor tokenExtractor,
        JwtVerifier jwtVerifier,
        Requirements requirements,
        ClaimHeaderMapper claimHeaderMapper,
        boolean optional,
        long freshnessSeconds,
        Clock clock
    ) {
        this.tokenExtractor = tokenExtractor;
        this.jwtVerifier = jwtVerifier;
        this.requirements = requirements;
        this.claimHeaderMapper = claimHeaderMapper;
        this.optional = optional;
        this.freshnessSeconds = freshnessSeconds;
        this.clock = clock;
    }

    public ValidationResult validate(HttpRequestWrapper request, TemplateVariables variables) {
        String token = tokenExtractor.extractToken(request);
        if (token.isEmpty()) {
            return optional ? ValidationResult.ALLOWED : ValidationResult.unauthorized(NO_TOKEN);
        }

        Map<String, Object> claims;
        try {
            claims = jwtVerifier.getVerifiedClaims(token);
        } catch (BadCredentialsException e) {
            log.debug("Rejecting token: {}", e.getMessage());
            return ValidationResult.unauthorized(e.getMessage());
        }

        try {
            requirements.validate(claims, variables);
        } catch (ClaimValidationException e) {
            log.debug("Claims of {} rejected: {}", variables.get(TemplateVariables.URL), e.getMessage());
            return allowRefresh(claims) ? ValidationResult.unauthorized(e.getMessage()) : ValidationResult.forbidden(e.getMessage());
        }

        claimHeaderMapper.mapClaimsToHeaders(claims, request);
        return ValidationResult.ALLOWED;
    }

    /**
     * True if a freshness window is configured and the token was issued before it began.
     */
    boolean allowRefresh(Map<String, Object> claims) {
        if (freshnessSeconds == 0) {
            return false;
        }
        Object issuedAt = claims.get(ISSUED_AT);
        if (!(issuedAt instanceof Number) || !ClaimValues.isIntegral((Number) issuedAt)) {
            return false;
        }
        long age = clock.instant().getEpochSecond() - ((Number) issuedAt).longValue();
        return age > freshnessSeconds;
    }
}
