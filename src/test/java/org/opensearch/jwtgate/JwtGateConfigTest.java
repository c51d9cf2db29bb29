/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.jwtgate;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class JwtGateConfigTest {

    @Test
    public void testDefaults() {
        JwtGateConfig config = new JwtGateConfig();

        assertThat(config.validMethods, hasSize(9));
        assertThat(config.cookieName, is("Authorization"));
        assertThat(config.headerName, is("Authorization"));
        assertNull(config.parameterName);
        assertThat(config.freshness, is(3600L));
        assertTrue(config.forwardToken);
        assertFalse(config.optional);
        assertFalse(config.skipPrefetch);
        assertTrue(config.issuers.isEmpty());
        assertTrue(config.require.isEmpty());
    }

    @Test
    public void testFromYaml() throws Exception {
        JwtGateConfig config = JwtGateConfig.fromYaml(
            "validMethods: [RS256]\n"
                + "issuers:\n"
                + "  - https://auth.example.com\n"
                + "skipPrefetch: true\n"
                + "refreshKeysInterval: 15m\n"
                + "secrets:\n"
                + "  kid-1: secret\n"
                + "require:\n"
                + "  aud: test\n"
                + "  roles: [user, admin]\n"
                + "optional: true\n"
                + "redirectUnauthorized: 'https://example.com/login?return_to={{URLQueryEscape .URL}}'\n"
                + "parameterName: token\n"
                + "headerMap:\n"
                + "  X-Subject: sub\n"
                + "removeMissingHeaders: true\n"
                + "forwardToken: false\n"
                + "freshness: 0\n"
        );

        assertThat(config.validMethods, contains("RS256"));
        assertThat(config.issuers, contains("https://auth.example.com"));
        assertTrue(config.skipPrefetch);
        assertThat(config.refreshKeysInterval, is("15m"));
        assertThat(config.secrets, is(Map.of("kid-1", "secret")));
        assertThat(config.require.get("aud"), is("test"));
        assertThat(config.require.get("roles"), is(List.of("user", "admin")));
        assertTrue(config.optional);
        assertThat(config.redirectUnauthorized, startsWith("https://example.com/login"));
        assertThat(config.parameterName, is("token"));
        assertThat(config.headerMap, is(Map.of("X-Subject", "sub")));
        assertTrue(config.removeMissingHeaders);
        assertFalse(config.forwardToken);
        assertThat(config.freshness, is(0L));
        assertThat(config.cookieName, is("Authorization"));
    }

    @Test
    public void testFromJson() throws Exception {
        String json = "{\"secret\": \"s3cr3t\", \"issuers\": [\"https://auth.example.com\"]}";

        JwtGateConfig config = JwtGateConfig.fromYaml(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));

        assertThat(config.secret, is("s3cr3t"));
        assertThat(config.issuers, contains("https://auth.example.com"));
    }

    @Test
    public void testUnknownOption() {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> JwtGateConfig.fromYaml("secrett: typo\n"));

        assertThat(e.getMessage(), startsWith("Invalid configuration"));
        assertThat(e.getMessage(), containsString("secrett"));
    }

    @Test
    public void testWrongType() {
        assertThrows(ConfigurationException.class, () -> JwtGateConfig.fromYaml("freshness: [1, 2]\n"));
    }

    @Test
    public void testSecretsNotPrinted() throws Exception {
        JwtGateConfig config = JwtGateConfig.fromYaml("secret: topsecret\nsecrets:\n  kid-1: alsosecret\n");

        assertThat(config.toString(), not(containsString("topsecret")));
        assertThat(config.toString(), not(containsString("alsosecret")));
        assertThat(config.toString(), containsString("kid-1"));
    }
}
