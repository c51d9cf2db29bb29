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
import java.security.GeneralSecurityException;
import java.security.Key;
import java.security.MessageDigest;
import java.text.ParseException;
import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.Map;
import java.util.Set;
import javax.crypto.Mac;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import com.google.common.collect.ImmutableSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import org.opensearch.jwtgate.DefaultObjectMapper;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.factories.DefaultJWSVerifierFactory;
import com.nimbusds.jose.proc.SimpleSecurityContext;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import com.nimbusds.jwt.proc.BadJWTException;
import com.nimbusds.jwt.proc.DefaultJWTClaimsVerifier;

/**
 * Parses a compact serialized JWT, verifies its signature with the key resolved by a {@link KeyProvider} and
 * checks its {@code exp} and {@code nbf} claims.
 */
public class JwtVerifier {

    private final static Logger log = LogManager.getLogger(JwtVerifier.class);

    private static final Map<JWSAlgorithm, String> HMAC_ALGORITHMS = Map.of(
        JWSAlgorithm.HS256,
        "HmacSHA256",
        JWSAlgorithm.HS384,
        "HmacSHA384",
        JWSAlgorithm.HS512,
        "HmacSHA512"
    );

    private final KeyProvider keyProvider;
    private final Set<String> validMethods;

    public JwtVerifier(KeyProvider keyProvider, Collection<String> validMethods) {
        this.keyProvider = keyProvider;
        this.validMethods = validMethods == null ? ImmutableSet.of() : ImmutableSet.copyOf(validMethods);
    }

    /**
     * Returns the claims of a valid token as decoded JSON values.
     *
     * @throws BadCredentialsException if the token is malformed, uses a disallowed algorithm, has no resolvable
     *                                 key, carries an invalid signature or is expired or not yet valid
     */
    public Map<String, Object> getVerifiedClaims(String encodedJwt) throws BadCredentialsException {
        SignedJWT jwt;
        try {
            jwt = SignedJWT.parse(encodedJwt);
        } catch (ParseException e) {
            throw new BadCredentialsException("token is malformed: " + e.getMessage(), e);
        }

        JWSHeader header = jwt.getHeader();
        String algorithm = header.getAlgorithm().getName();
        if (!validMethods.contains(algorithm)) {
            throw new BadCredentialsException("token signature is invalid: signing method " + algorithm + " is invalid");
        }

        Map<String, Object> claims;
        try {
            claims = DefaultObjectMapper.readMap(jwt.getPayload().toString());
        } catch (IOException e) {
            throw new BadCredentialsException("token is malformed: could not JSON decode claims", e);
        }
        if (claims == null) {
            throw new BadCredentialsException("token is malformed: claims are not a JSON object");
        }

        Object issuer = claims.get("iss");
        Key key = keyProvider.getKey(header.getKeyID(), issuer instanceof String ? (String) issuer : null);

        if (!verifySignature(jwt, key)) {
            throw new BadCredentialsException("token signature is invalid");
        }

        validateClaims(claims);

        return claims;
    }

    private boolean verifySignature(SignedJWT jwt, Key key) throws BadCredentialsException {
        try {
            if (key instanceof SecretKey) {
                return verifyHmac(jwt, (SecretKey) key);
            }
            JWSVerifier signatureVerifier = new DefaultJWSVerifierFactory().createJWSVerifier(jwt.getHeader(), key);
            return jwt.verify(signatureVerifier);
        } catch (JOSEException e) {
            throw new BadCredentialsException("token signature is invalid: " + e.getMessage(), e);
        }
    }

    // Nimbus insists on secrets of at least 256 bits, configured secrets may be shorter
    private boolean verifyHmac(SignedJWT jwt, SecretKey key) throws BadCredentialsException {
        String macAlgorithm = HMAC_ALGORITHMS.get(jwt.getHeader().getAlgorithm());
        if (macAlgorithm == null) {
            throw new BadCredentialsException("token signature is invalid: key is of invalid type");
        }
        try {
            Mac mac = Mac.getInstance(macAlgorithm);
            mac.init(new SecretKeySpec(key.getEncoded(), macAlgorithm));
            byte[] expected = mac.doFinal(jwt.getSigningInput());
            return MessageDigest.isEqual(expected, jwt.getSignature().decode());
        } catch (GeneralSecurityException e) {
            throw new BadCredentialsException("token signature is invalid: " + e.getMessage(), e);
        }
    }

    // only the time claims are checked, other registered claims may carry any JSON type
    void validateClaims(Map<String, Object> claims) throws BadCredentialsException {
        JWTClaimsSet timeClaims = new JWTClaimsSet.Builder().expirationTime(numericDate(claims, "exp"))
            .notBeforeTime(numericDate(claims, "nbf"))
            .build();
        try {
            DefaultJWTClaimsVerifier<SimpleSecurityContext> claimsVerifier = new DefaultJWTClaimsVerifier<>(
                (Set<String>) null,
                null,
                Collections.emptySet(),
                null
            );
            claimsVerifier.setMaxClockSkew(0);
            claimsVerifier.verify(timeClaims, null);
        } catch (BadJWTException e) {
            log.debug("Rejecting token: {}", e.getMessage());
            throw new BadCredentialsException("token has invalid claims: " + e.getMessage(), e);
        }
    }

    private static Date numericDate(Map<String, Object> claims, String name) throws BadCredentialsException {
        if (!claims.containsKey(name)) {
            return null;
        }
        Object value = claims.get(name);
        if (!(value instanceof Number)) {
            throw new BadCredentialsException("token has invalid claims: " + name + " is not a numeric date");
        }
        return new Date((long) (((Number) value).doubleValue() * 1000));
    }
}
