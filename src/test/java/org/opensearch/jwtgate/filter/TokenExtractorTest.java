/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.jwtgate.filter;

import org.apache.http.client.methods.HttpRequestWrapper;
import org.apache.http.message.BasicHttpRequest;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class TokenExtractorTest {

    private static HttpRequestWrapper request(String uri, String... headers) {
        BasicHttpRequest request = new BasicHttpRequest("GET", uri);
        for (int i = 0; i < headers.length; i += 2) {
            request.addHeader(headers[i], headers[i + 1]);
        }
        return HttpRequestWrapper.wrap(request);
    }

    @Test
    public void testNoToken() {
        TokenExtractor extractor = new TokenExtractor("Authorization", "Authorization", "token", false);

        assertThat(extractor.extractToken(request("/path?a=1", "Cookie", "other=1")), is(""));
    }

    @Test
    public void testBearerHeader() {
        TokenExtractor extractor = new TokenExtractor(null, "Authorization", null, false);

        assertThat(extractor.extractToken(request("/", "Authorization", "Bearer abc.def.ghi")), is("abc.def.ghi"));
        assertThat(extractor.extractToken(request("/", "Authorization", "bearer abc.def.ghi")), is("abc.def.ghi"));
        assertThat(extractor.extractToken(request("/", "Authorization", "abc.def.ghi")), is("abc.def.ghi"));
    }

    @Test
    public void testHeaderRemoved() {
        TokenExtractor extractor = new TokenExtractor(null, "X-Token", null, false);
        HttpRequestWrapper request = request("/", "X-Token", "abc", "X-Other", "1");

        assertThat(extractor.extractToken(request), is("abc"));

        assertFalse(request.containsHeader("X-Token"));
        assertTrue(request.containsHeader("X-Other"));
    }

    @Test
    public void testHeaderForwarded() {
        TokenExtractor extractor = new TokenExtractor(null, "X-Token", null, true);
        HttpRequestWrapper request = request("/", "X-Token", "Bearer abc");

        assertThat(extractor.extractToken(request), is("abc"));

        assertThat(request.getFirstHeader("X-Token").getValue(), is("Bearer abc"));
    }

    @Test
    public void testCookie() {
        TokenExtractor extractor = new TokenExtractor("jwt", null, null, false);
        HttpRequestWrapper request = request("/", "Cookie", "a=1; jwt=abc; b=2");

        assertThat(extractor.extractToken(request), is("abc"));

        assertThat(request.getHeaders("Cookie").length, is(1));
        assertThat(request.getFirstHeader("Cookie").getValue(), is("a=1; b=2"));
    }

    @Test
    public void testOnlyCookieRemoved() {
        TokenExtractor extractor = new TokenExtractor("jwt", null, null, false);
        HttpRequestWrapper request = request("/", "Cookie", "jwt=abc");

        assertThat(extractor.extractToken(request), is("abc"));

        assertFalse(request.containsHeader("Cookie"));
    }

    @Test
    public void testCookieForwarded() {
        TokenExtractor extractor = new TokenExtractor("jwt", null, null, true);
        HttpRequestWrapper request = request("/", "Cookie", "a=1; jwt=abc");

        assertThat(extractor.extractToken(request), is("abc"));

        assertThat(request.getFirstHeader("Cookie").getValue(), is("a=1; jwt=abc"));
    }

    @Test
    public void testCookiesAcrossHeaders() {
        TokenExtractor extractor = new TokenExtractor("jwt", null, null, false);
        HttpRequestWrapper request = request("/", "Cookie", "a=1", "Cookie", "jwt=abc");

        assertThat(extractor.extractToken(request), is("abc"));

        assertThat(request.getHeaders("Cookie").length, is(1));
        assertThat(request.getFirstHeader("Cookie").getValue(), is("a=1"));
    }

    @Test
    public void testQuery() {
        TokenExtractor extractor = new TokenExtractor(null, null, "token", false);
        HttpRequestWrapper request = request("/path?a=1&token=abc&b=2");

        assertThat(extractor.extractToken(request), is("abc"));

        assertThat(request.getRequestLine().getUri(), is("/path?a=1&b=2"));
    }

    @Test
    public void testOnlyQueryParameterRemoved() {
        TokenExtractor extractor = new TokenExtractor(null, null, "token", false);
        HttpRequestWrapper request = request("/path?token=abc");

        assertThat(extractor.extractToken(request), is("abc"));

        assertThat(request.getRequestLine().getUri(), is("/path"));
    }

    @Test
    public void testQueryForwarded() {
        TokenExtractor extractor = new TokenExtractor(null, null, "token", true);
        HttpRequestWrapper request = request("/path?token=abc");

        assertThat(extractor.extractToken(request), is("abc"));

        assertThat(request.getRequestLine().getUri(), is("/path?token=abc"));
    }

    @Test
    public void testPrecedence() {
        TokenExtractor extractor = new TokenExtractor("jwt", "Authorization", "token", false);
        HttpRequestWrapper request = request("/path?token=query", "Cookie", "jwt=cookie", "Authorization", "Bearer header");

        assertThat(extractor.extractToken(request), is("cookie"));

        assertThat(request.getFirstHeader("Authorization").getValue(), is("Bearer header"));
        assertThat(request.getRequestLine().getUri(), is("/path?token=query"));
    }

    @Test
    public void testEmptyCookieFallsThrough() {
        TokenExtractor extractor = new TokenExtractor("jwt", "Authorization", null, false);
        HttpRequestWrapper request = request("/", "Cookie", "jwt=", "Authorization", "Bearer header");

        assertThat(extractor.extractToken(request), is("header"));
    }

    @Test
    public void testEmptyNamesDisableSources() {
        TokenExtractor extractor = new TokenExtractor("", "", "", false);
        HttpRequestWrapper request = request("/path?=abc", "Cookie", "=abc");

        assertThat(extractor.extractToken(request), is(""));
        assertNull(request.getFirstHeader("Authorization"));
    }
}
