/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.jwtgate.filter;

public final class ContentTypes {

    public static final String GRPC = "application/grpc";

    private ContentTypes() {}

    /**
     * Case-insensitive search for a token in a header value. Tokens are delimited by space, comma, tab or {@code +},
     * so {@code application/grpc+proto} contains {@code application/grpc}.
     */
    public static boolean hasToken(String header, String token) {
        if (header == null || token == null || token.isEmpty() || token.length() > header.length()) {
            return false;
        }
        if (header.equals(token)) {
            return true;
        }
        for (int start = 0; start <= header.length() - token.length(); start++) {
            if (start > 0 && !isTokenBoundary(header.charAt(start - 1))) {
                continue;
            }
            int end = start + token.length();
            if (end != header.length() && !isTokenBoundary(header.charAt(end))) {
                continue;
            }
            if (header.regionMatches(true, start, token, 0, token.length())) {
                return true;
            }
        }
        return false;
    }

    private static boolean isTokenBoundary(char c) {
        return c == ' ' || c == ',' || c == '\t' || c == '+';
    }
}
