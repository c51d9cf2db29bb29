/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.jwtgate.keybyoidc;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.Key;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.crypto.spec.SecretKeySpec;

import com.google.common.base.Strings;

import org.opensearch.jwtgate.ConfigurationException;
import org.opensearch.jwtgate.support.PemKeyReader;

/**
 * Keys given in the configuration rather than fetched from an issuer. A value is read as PEM encoded public key if it
 * looks like one, otherwise its UTF-8 bytes are an HMAC secret.
 */
public final class StaticKeys {

    static final String HMAC = "HMAC";

    private StaticKeys() {}

    /**
     * Returns null for a null or empty value.
     */
    public static Key toKey(String value) throws ConfigurationException {
        if (Strings.isNullOrEmpty(value)) {
            return null;
        }
        if (PemKeyReader.isPublicKeyPem(value)) {
            try {
                return PemKeyReader.readPublicKey(value);
            } catch (IOException | GeneralSecurityException | IllegalArgumentException e) {
                throw new ConfigurationException("invalid key: Key must be a PEM encoded PKCS1 or PKCS8 key: " + e.getMessage(), e);
            }
        }
        return new SecretKeySpec(value.getBytes(StandardCharsets.UTF_8), HMAC);
    }

    public static Map<String, Key> toKeyMap(Map<String, String> secrets) throws ConfigurationException {
        Map<String, Key> keys = new LinkedHashMap<>();
        if (secrets == null) {
            return keys;
        }
        for (Map.Entry<String, String> entry : secrets.entrySet()) {
            Key key;
            try {
                key = toKey(entry.getValue());
            } catch (ConfigurationException e) {
                throw new ConfigurationException("kid " + entry.getKey() + ": " + e.getMessage(), e);
            }
            if (key == null) {
                throw new ConfigurationException("kid " + entry.getKey() + ": invalid key: Key is empty");
            }
            keys.put(entry.getKey(), key);
        }
        return keys;
    }
}
