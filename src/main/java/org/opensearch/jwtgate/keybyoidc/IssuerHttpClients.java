/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.jwtgate.keybyoidc;

import java.io.IOException;
import java.net.URI;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509TrustManager;

import com.google.common.collect.ImmutableSet;
import org.apache.http.conn.ssl.NoopHostnameVerifier;
import org.apache.http.conn.ssl.TrustAllStrategy;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClientBuilder;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.ssl.SSLContexts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import org.opensearch.jwtgate.ConfigurationException;
import org.opensearch.jwtgate.support.PemKeyReader;

/**
 * Creates the HTTP clients used to talk to issuers.
 * <p>
 * Hosts listed as insecure get a client that neither verifies certificates nor host names. All other hosts get a
 * client that trusts the JVM default CAs plus the configured root CAs.
 */
public class IssuerHttpClients {

    private static final Logger log = LogManager.getLogger(IssuerHttpClients.class);

    private final Set<String> insecureHosts;
    private final SSLContext defaultSslContext;
    private final SSLContext insecureSslContext;

    public IssuerHttpClients(Collection<String> insecureSkipVerify, Collection<String> rootCAs) throws ConfigurationException {
        this.insecureHosts = insecureSkipVerify == null ? ImmutableSet.of() : ImmutableSet.copyOf(insecureSkipVerify);
        this.defaultSslContext = rootCAs == null || rootCAs.isEmpty() ? null : buildDefaultSslContext(rootCAs);
        this.insecureSslContext = insecureHosts.isEmpty() ? null : buildInsecureSslContext();
    }

    public CloseableHttpClient createHttpClient(String url) {
        HttpClientBuilder builder = HttpClients.custom().useSystemProperties();

        if (insecureSslContext != null && insecureHosts.contains(hostname(url))) {
            log.debug("Using client without TLS verification for {}", url);
            builder.setSSLContext(insecureSslContext).setSSLHostnameVerifier(NoopHostnameVerifier.INSTANCE);
        } else if (defaultSslContext != null) {
            builder.setSSLContext(defaultSslContext);
        }

        return builder.build();
    }

    public boolean isInsecure(String url) {
        return insecureHosts.contains(hostname(url));
    }

    static String hostname(String url) {
        try {
            String host = URI.create(url).getHost();
            if (host == null) {
                return "";
            }
            return host.startsWith("[") && host.endsWith("]") ? host.substring(1, host.length() - 1) : host;
        } catch (IllegalArgumentException e) {
            log.warn("Cannot determine host name of {}: {}", url, e.getMessage());
            return "";
        }
    }

    private static SSLContext buildDefaultSslContext(Collection<String> rootCAs) throws ConfigurationException {
        List<X509Certificate> certificates = new ArrayList<>(systemTrustAnchors());

        for (String rootCA : rootCAs) {
            String pem;
            try {
                pem = PemKeyReader.readPemContent(rootCA);
            } catch (IOException e) {
                throw new ConfigurationException("Cannot read root CA " + rootCA + ": " + e.getMessage(), e);
            }
            try {
                X509Certificate[] parsed = PemKeyReader.loadCertificatesFromPem(pem);
                if (parsed == null || parsed.length == 0) {
                    log.warn("Failed to add root CA: {}", rootCA);
                } else {
                    certificates.addAll(Arrays.asList(parsed));
                }
            } catch (CertificateException e) {
                log.warn("Failed to add root CA: {}", e.getMessage());
            }
        }

        try {
            KeyStore trustStore = PemKeyReader.toTruststore("root-ca", certificates.toArray(new X509Certificate[0]));
            return SSLContexts.custom().loadTrustMaterial(trustStore, null).build();
        } catch (GeneralSecurityException | IOException e) {
            throw new ConfigurationException("Cannot build trust store: " + e.getMessage(), e);
        }
    }

    private static List<X509Certificate> systemTrustAnchors() throws ConfigurationException {
        try {
            TrustManagerFactory trustManagerFactory = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            trustManagerFactory.init((KeyStore) null);
            List<X509Certificate> result = new ArrayList<>();
            for (TrustManager trustManager : trustManagerFactory.getTrustManagers()) {
                if (trustManager instanceof X509TrustManager) {
                    result.addAll(Arrays.asList(((X509TrustManager) trustManager).getAcceptedIssuers()));
                }
            }
            return result;
        } catch (GeneralSecurityException e) {
            throw new ConfigurationException("Cannot load system trust anchors: " + e.getMessage(), e);
        }
    }

    private static SSLContext buildInsecureSslContext() throws ConfigurationException {
        try {
            return SSLContexts.custom().loadTrustMaterial(TrustAllStrategy.INSTANCE).build();
        } catch (GeneralSecurityException e) {
            throw new ConfigurationException("Cannot build insecure TLS context: " + e.getMessage(), e);
        }
    }
}
