/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.jwtgate.filter;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.google.common.collect.ImmutableMap;
import org.apache.http.HttpRequest;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import org.opensearch.jwtgate.DefaultObjectMapper;

/**
 * Copies claims of a verified token into headers of the forwarded request.
 */
public class ClaimHeaderMapper {
    private final static Logger log = LogManager.getLogger(ClaimHeaderMapper.class);

    private final Map<String, String> headerMap;
    private final boolean removeMissingHeaders;

    /**
     * @param headerMap claim name by header name
     * @param removeMissingHeaders remove a header from the request if its claim is not part of the token
     */
    public ClaimHeaderMapper(Map<String, String> headerMap, boolean removeMissingHeaders) {
        this.headerMap = headerMap == null ? ImmutableMap.of() : ImmutableMap.copyOf(headerMap);
        this.removeMissingHeaders = removeMissingHeaders;
    }

    public void mapClaimsToHeaders(Map<String, Object> claims, HttpRequest request) {
        for (Map.Entry<String, String> entry : headerMap.entrySet()) {
            String header = entry.getKey();
            String claim = entry.getValue();

            if (claims.containsKey(claim)) {
                String value = headerValue(claims.get(claim));
                if (value != null) {
                    request.setHeader(header, value);
                }
            } else if (removeMissingHeaders) {
                request.removeHeaders(header);
            }
        }
    }

    static String headerValue(Object value) {
        if (value == null || value instanceof List || value instanceof Map) {
            try {
                return DefaultObjectMapper.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                log.warn("Cannot serialize claim value {}: {}", value, e.getMessage());
                return null;
            }
        }
        return String.valueOf(value);
    }

    public Map<String, String> getHeaderMap() {
        return headerMap;
    }
}
