/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.jwtgate.filter;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.http.message.BasicHttpRequest;
import org.junit.Test;

import org.opensearch.jwtgate.DefaultObjectMapper;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertFalse;
import static org.opensearch.jwtgate.util.TestTokens.claims;

public class ClaimHeaderMapperTest {

    @Test
    public void testHeaderValues() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("a", 1);
        map.put("b", 2);

        assertThat(ClaimHeaderMapper.headerValue("text"), is("text"));
        assertThat(ClaimHeaderMapper.headerValue(1234), is("1234"));
        assertThat(ClaimHeaderMapper.headerValue(new BigInteger("12345678901234567890")), is("12345678901234567890"));
        assertThat(ClaimHeaderMapper.headerValue(1.5), is("1.5"));
        assertThat(ClaimHeaderMapper.headerValue(true), is("true"));
        assertThat(ClaimHeaderMapper.headerValue(null), is("null"));
        assertThat(ClaimHeaderMapper.headerValue(Arrays.asList("test", 1, null)), is("[\"test\",1,null]"));
        assertThat(ClaimHeaderMapper.headerValue(map), is("{\"a\":1,\"b\":2}"));
    }

    @Test
    public void testDecodedNumbersKeepTheirDigits() throws Exception {
        Map<String, Object> claims = DefaultObjectMapper.readMap("{\"ratio\": 1.10, \"big\": 12345678901234567.25, \"list\": [0.10]}");

        assertThat(ClaimHeaderMapper.headerValue(claims.get("ratio")), is("1.10"));
        assertThat(ClaimHeaderMapper.headerValue(claims.get("big")), is("12345678901234567.25"));
        assertThat(ClaimHeaderMapper.headerValue(claims.get("list")), is("[0.10]"));
    }

    @Test
    public void testMapClaims() {
        Map<String, String> headerMap = new LinkedHashMap<>();
        headerMap.put("X-Subject", "sub");
        headerMap.put("X-Roles", "roles");
        headerMap.put("X-Missing", "missing");
        ClaimHeaderMapper mapper = new ClaimHeaderMapper(headerMap, false);
        BasicHttpRequest request = new BasicHttpRequest("GET", "/");
        request.addHeader("X-Subject", "spoofed");
        request.addHeader("X-Missing", "kept");

        mapper.mapClaimsToHeaders(claims("sub", "alice", "roles", List.of("admin")), request);

        assertThat(request.getHeaders("X-Subject").length, is(1));
        assertThat(request.getFirstHeader("X-Subject").getValue(), is("alice"));
        assertThat(request.getFirstHeader("X-Roles").getValue(), is("[\"admin\"]"));
        assertThat(request.getFirstHeader("X-Missing").getValue(), is("kept"));
    }

    @Test
    public void testRemoveMissingHeaders() {
        ClaimHeaderMapper mapper = new ClaimHeaderMapper(Map.of("X-Missing", "missing"), true);
        BasicHttpRequest request = new BasicHttpRequest("GET", "/");
        request.addHeader("X-Missing", "spoofed");

        mapper.mapClaimsToHeaders(claims("sub", "alice"), request);

        assertFalse(request.containsHeader("X-Missing"));
    }

    @Test
    public void testNullClaim() {
        ClaimHeaderMapper mapper = new ClaimHeaderMapper(Map.of("X-Null", "nothing"), true);
        BasicHttpRequest request = new BasicHttpRequest("GET", "/");

        mapper.mapClaimsToHeaders(claims("nothing", null), request);

        assertThat(request.getFirstHeader("X-Null").getValue(), is("null"));
    }

    @Test
    public void testNoHeaderMap() {
        ClaimHeaderMapper mapper = new ClaimHeaderMapper(null, true);
        BasicHttpRequest request = new BasicHttpRequest("GET", "/");

        mapper.mapClaimsToHeaders(claims("sub", "alice"), request);

        assertThat(request.getAllHeaders().length, is(0));
        assertThat(mapper.getHeaderMap().isEmpty(), is(true));
    }
}
