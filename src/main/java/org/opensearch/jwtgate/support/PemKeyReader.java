/*
 * Copyright 2015-2018 _floragunn_ GmbH
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

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

package org.opensearch.jwtgate.support;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyStore;
import java.security.PublicKey;
import java.security.cert.Certificate;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.security.interfaces.ECPublicKey;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.RSAPublicKeySpec;
import java.util.Collection;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.bouncycastle.asn1.pkcs.RSAPublicKey;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.bouncycastle.util.io.pem.PemObject;
import org.bouncycastle.util.io.pem.PemReader;

public final class PemKeyReader {

    private static final Logger log = LogManager.getLogger(PemKeyReader.class);

    public static final String PEM_PREFIX = "-----BEGIN ";

    static final String RSA_PUBLIC_KEY = "RSA PUBLIC KEY";
    static final String EC_PUBLIC_KEY = "EC PUBLIC KEY";
    static final String PUBLIC_KEY = "PUBLIC KEY";

    private PemKeyReader() {}

    /**
     * Returns true if the value looks like a PEM encoded public key this class is able to read.
     */
    public static boolean isPublicKeyPem(String value) {
        return value != null
            && (value.startsWith(PEM_PREFIX + RSA_PUBLIC_KEY)
                || value.startsWith(PEM_PREFIX + EC_PUBLIC_KEY)
                || value.startsWith(PEM_PREFIX + PUBLIC_KEY));
    }

    /**
     * Reads an RSA or EC public key.
     * <p>
     * {@code RSA PUBLIC KEY} blocks carry a PKCS#1 structure. {@code PUBLIC KEY} and {@code EC PUBLIC KEY} blocks carry
     * a SubjectPublicKeyInfo, the latter must hold an EC key.
     */
    public static PublicKey readPublicKey(String pem) throws IOException, GeneralSecurityException {
        PemObject pemObject;
        try (PemReader reader = new PemReader(new StringReader(pem))) {
            pemObject = reader.readPemObject();
        }

        if (pemObject == null) {
            throw new InvalidKeySpecException("No PEM block found");
        }

        switch (pemObject.getType()) {
            case RSA_PUBLIC_KEY: {
                RSAPublicKey rsaPublicKey;
                try {
                    rsaPublicKey = RSAPublicKey.getInstance(pemObject.getContent());
                } catch (IllegalArgumentException e) {
                    // not PKCS#1, some tools put a SubjectPublicKeyInfo into this block type
                    PublicKey publicKey = toPublicKey(pemObject);
                    if (!"RSA".equals(publicKey.getAlgorithm())) {
                        throw new InvalidKeySpecException("Not an RSA public key: " + publicKey.getAlgorithm());
                    }
                    return publicKey;
                }
                return KeyFactory.getInstance("RSA")
                    .generatePublic(new RSAPublicKeySpec(rsaPublicKey.getModulus(), rsaPublicKey.getPublicExponent()));
            }
            case EC_PUBLIC_KEY: {
                PublicKey publicKey = toPublicKey(pemObject);
                if (!(publicKey instanceof ECPublicKey)) {
                    throw new InvalidKeySpecException("Not an EC public key: " + publicKey.getAlgorithm());
                }
                return publicKey;
            }
            case PUBLIC_KEY:
                return toPublicKey(pemObject);
            default:
                throw new InvalidKeySpecException("Unsupported PEM block type " + pemObject.getType());
        }
    }

    private static PublicKey toPublicKey(PemObject pemObject) throws IOException, InvalidKeySpecException {
        SubjectPublicKeyInfo publicKeyInfo;
        try {
            publicKeyInfo = SubjectPublicKeyInfo.getInstance(pemObject.getContent());
        } catch (IllegalArgumentException e) {
            throw new InvalidKeySpecException("Malformed public key: " + e.getMessage(), e);
        }
        return new JcaPEMKeyConverter().getPublicKey(publicKeyInfo);
    }

    /**
     * Resolves a configuration value that is either inline PEM content or the path of a file holding it.
     */
    public static String readPemContent(String value) throws IOException {
        if (value == null || value.startsWith(PEM_PREFIX)) {
            return value;
        }

        Path path = Paths.get(value);
        if (!Files.isRegularFile(path)) {
            throw new IOException("Invalid file " + value + ": not a readable file");
        }
        log.debug("Reading PEM content from {}", path);
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    public static X509Certificate[] loadCertificatesFromPem(String pem) throws CertificateException {
        if (pem == null) {
            return null;
        }

        CertificateFactory fact = CertificateFactory.getInstance("X.509");
        Collection<? extends Certificate> certs = fact.generateCertificates(new ByteArrayInputStream(pem.getBytes(StandardCharsets.UTF_8)));
        X509Certificate[] x509Certs = new X509Certificate[certs.size()];
        int i = 0;
        for (Certificate cert : certs) {
            x509Certs[i++] = (X509Certificate) cert;
        }
        return x509Certs;
    }

    public static KeyStore toTruststore(final String trustCertificatesAliasPrefix, final X509Certificate[] trustCertificates)
        throws GeneralSecurityException, IOException {

        KeyStore ks = KeyStore.getInstance(KeyStore.getDefaultType());
        ks.load(null);

        if (trustCertificates != null) {
            for (int i = 0; i < trustCertificates.length; i++) {
                ks.setCertificateEntry(trustCertificatesAliasPrefix + "_" + i, trustCertificates[i]);
            }
        }
        return ks;
    }
}
