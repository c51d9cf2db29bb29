/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.jwtgate.filter;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import javax.crypto.spec.SecretKeySpec;

import org.apache.http.client.methods.HttpRequestWrapper;
import org.apache.http.message.BasicHttpRequest;
import org.junit.Test;

import org.opensearch.jwtgate.JwtGateConfig;
import org.opensearch.jwtgate.keybyoidc.JwtVerifier;
import org.opensearch.jwtgate.requirement.RequirementFactory;
import org.opensearch.jwtgate.template.TemplateVariables;
import org.opensearch.jwtgate.util.TestTokens;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.opensearch.jwtgate.util.TestTokens.claims;

public class JwtRequestValidatorTest {

    private static final long NOW = 1700000000L;
    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC);
    private static final String SECRET = "secret";
    private static final SecretKeySpec KEY = new SecretKeySpec(SECRET.getBytes(StandardCharsets.UTF_8), "HMAC");
    private static final TemplateVariables VARIABLES = new TemplateVariables(
        Map.of("Host", "app.example.com", "URL", "https://app.example.com/home")
    );

    private static JwtRequestValidator validator(boolean optional, long freshness) throws Exception {
        return new JwtRequestValidator(
            new TokenExtractor(null, "Authorization", null, false),
            new JwtVerifier((kid, issuer) -> KEY, JwtGateConfig.DEFAULT_VALID_METHODS),
            RequirementFactory.buildRequirements(JwtGateConfig.fromYaml("require:\n  aud: test\n").require),
            new ClaimHeaderMapper(Map.of("X-Subject", "sub"), false),
            optional,
            freshness,
            CLOCK
        );
    }

    private static HttpRequestWrapper request(String token) {
        BasicHttpRequest request = new BasicHttpRequest("GET", "/home");
        if (token != null) {
            request.addHeader("Authorization", "Bearer " + token);
        }
        return HttpRequestWrapper.wrap(request);
    }

    @Test
    public void testNoToken() throws Exception {
        ValidationResult result = validator(false, 3600).validate(request(null), VARIABLES);

        assertThat(result.status(), is(401));
        assertThat(result.message(), is("no token provided"));
    }

    @Test
    public void testOptional() throws Exception {
        ValidationResult result = validator(true, 3600).validate(request(null), VARIABLES);

        assertThat(result, sameInstance(ValidationResult.ALLOWED));
    }

    @Test
    public void testOptionalStillVerifiesTokens() throws Exception {
        ValidationResult result = validator(true, 3600).validate(request(TestTokens.hs256("wrong", claims("aud", "test"))), VARIABLES);

        assertThat(result.status(), is(401));
    }

    @Test
    public void testBadSignature() throws Exception {
        ValidationResult result = validator(false, 3600).validate(request(TestTokens.hs256("wrong", claims("aud", "test"))), VARIABLES);

        assertThat(result.status(), is(401));
        assertThat(result.message(), is("token signature is invalid"));
    }

    @Test
    public void testAllowed() throws Exception {
        HttpRequestWrapper request = request(TestTokens.hs256(SECRET, claims("aud", "test", "sub", "alice")));

        ValidationResult result = validator(false, 3600).validate(request, VARIABLES);

        assertTrue(result.isAllowed());
        assertThat(result.status(), is(200));
        assertThat(request.getFirstHeader("X-Subject").getValue(), is("alice"));
        assertFalse(request.containsHeader("Authorization"));
    }

    @Test
    public void testForbidden() throws Exception {
        ValidationResult result = validator(false, 3600).validate(request(TestTokens.hs256(SECRET, claims("aud", "other"))), VARIABLES);

        assertThat(result.status(), is(403));
        assertThat(result.message(), notNullValue());
    }

    @Test
    public void testMissingClaimWithoutIssuedAt() throws Exception {
        ValidationResult result = validator(false, 3600).validate(request(TestTokens.hs256(SECRET, claims("sub", "alice"))), VARIABLES);

        assertThat(result.status(), is(403));
    }

    @Test
    public void testStaleTokenMayRefresh() throws Exception {
        String token = TestTokens.hs256(SECRET, claims("aud", "other", "iat", NOW - 7200));

        ValidationResult result = validator(false, 3600).validate(request(token), VARIABLES);

        assertThat(result.status(), is(401));
    }

    @Test
    public void testFreshTokenIsForbidden() throws Exception {
        String token = TestTokens.hs256(SECRET, claims("aud", "other", "iat", NOW - 60));

        ValidationResult result = validator(false, 3600).validate(request(token), VARIABLES);

        assertThat(result.status(), is(403));
    }

    @Test
    public void testFreshnessDisabled() throws Exception {
        String token = TestTokens.hs256(SECRET, claims("aud", "other", "iat", 1692451139L));

        ValidationResult result = validator(false, 0).validate(request(token), VARIABLES);

        assertThat(result.status(), is(403));
    }

    @Test
    public void testAllowRefresh() throws Exception {
        JwtRequestValidator validator = validator(false, 3600);

        assertTrue(validator.allowRefresh(claims("iat", NOW - 3601)));
        assertFalse(validator.allowRefresh(claims("iat", NOW - 3600)));
        assertFalse(validator.allowRefresh(claims("iat", 1.5)));
        assertFalse(validator.allowRefresh(claims("iat", "1692451139")));
        assertFalse(validator.allowRefresh(claims()));
    }
}
