/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.jwtgate.keybyoidc;

import java.security.Key;
import java.text.ParseException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.jwk.Curve;
import com.nimbusds.jose.jwk.ECKey;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.KeyType;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jose.jwk.ThumbprintUtils;

/**
 * Turns published key records into verification keys.
 */
public final class JsonWebKeys {

    private static final Logger log = LogManager.getLogger(JsonWebKeys.class);

    private static final Set<String> SUPPORTED_CURVES = ImmutableSet.of(
        Curve.P_256.getName(),
        Curve.P_384.getName(),
        Curve.P_521.getName()
    );

    private JsonWebKeys() {}

    /**
     * Decodes all RSA and EC keys of the set, keyed by their kid. Keys without kid are keyed by their thumbprint.
     * A key with malformed parameters is logged and skipped, other key types are ignored.
     */
    public static Map<String, Key> toKeyMap(JsonWebKeySet keySet) {
        if (keySet == null || keySet.keys == null) {
            return Collections.emptyMap();
        }

        Map<String, Key> result = new LinkedHashMap<>(keySet.keys.size());

        for (Map<String, Object> record : keySet.keys) {
            if (record == null) {
                continue;
            }
            Object kty = record.get("kty");
            if (!KeyType.RSA.getValue().equals(kty) && !KeyType.EC.getValue().equals(kty)) {
                log.debug("Ignoring key {} of type {}", record.get("kid"), kty);
                continue;
            }

            try {
                JWK jwk = parse(record);
                String kid = Strings.isNullOrEmpty(jwk.getKeyID()) ? thumbprint(jwk) : jwk.getKeyID();
                result.put(kid, toPublicKey(jwk));
            } catch (ParseException | JOSEException e) {
                log.warn("Error decoding {} key {}: {}", kty, record.get("kid"), e.getMessage());
            }
        }

        return result;
    }

    // an EC record with a missing or unsupported crv takes its curve from alg
    static JWK parse(Map<String, Object> record) throws ParseException {
        if (KeyType.EC.getValue().equals(record.get("kty")) && !SUPPORTED_CURVES.contains(String.valueOf(record.get("crv")))) {
            Map<String, Object> withCurve = new LinkedHashMap<>(record);
            withCurve.put("crv", curveOf(record).getName());
            return JWK.parse(withCurve);
        }
        return JWK.parse(record);
    }

    private static Key toPublicKey(JWK jwk) throws JOSEException {
        if (jwk instanceof RSAKey) {
            return ((RSAKey) jwk).toRSAPublicKey();
        }
        return ((ECKey) jwk).toECPublicKey();
    }

    /**
     * RFC 7638 SHA-256 thumbprint. The EC form always names curve P-256, so keys on other curves get identifiers
     * that differ from their standard thumbprints.
     */
    public static String thumbprint(JWK jwk) throws JOSEException {
        if (jwk instanceof ECKey && !Curve.P_256.equals(((ECKey) jwk).getCurve())) {
            LinkedHashMap<String, Object> members = new LinkedHashMap<>(jwk.getRequiredParams());
            members.put("crv", Curve.P_256.getName());
            return ThumbprintUtils.compute("SHA-256", members).toString();
        }
        return jwk.computeThumbprint().toString();
    }

    /**
     * The curve implied by the algorithm of the record, else P-256.
     */
    static Curve curveOf(Map<String, Object> record) {
        Object alg = record.get("alg");
        if ("ES384".equals(alg)) {
            return Curve.P_384;
        } else if ("ES512".equals(alg)) {
            return Curve.P_521;
        }
        return Curve.P_256;
    }
}
