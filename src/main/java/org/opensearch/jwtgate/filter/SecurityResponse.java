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

package org.opensearch.jwtgate.filter;

import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;
import org.apache.http.HttpHeaders;
import org.apache.http.HttpResponse;
import org.apache.http.HttpStatus;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;

/**
 * A response produced in place of the protected handler's response.
 */
public class SecurityResponse {

    public static final String NOSNIFF_HEADER = "X-Content-Type-Options";
    public static final String GRPC_STATUS = "grpc-status";
    public static final String GRPC_MESSAGE = "grpc-message";

    private static final ContentType TEXT_PLAIN = ContentType.create("text/plain", "UTF-8");

    private final int status;
    private final ListMultimap<String, String> headers = LinkedListMultimap.create(2);
    private final String body;

    private SecurityResponse(final int status, final String body) {
        this.status = status;
        this.body = body;
    }

    /**
     * Plain text error with the message on its own line.
     */
    public static SecurityResponse error(int status, String message) {
        return new SecurityResponse(status, message + "\n").header(NOSNIFF_HEADER, "nosniff");
    }

    public static SecurityResponse redirect(String location) {
        return new SecurityResponse(HttpStatus.SC_MOVED_TEMPORARILY, null).header(HttpHeaders.LOCATION, location);
    }

    /**
     * gRPC clients read the outcome from headers of a successful HTTP response.
     */
    public static SecurityResponse grpc(int status) {
        SecurityResponse response = new SecurityResponse(HttpStatus.SC_OK, null).header(HttpHeaders.CONTENT_TYPE, ContentTypes.GRPC);
        switch (status) {
            case HttpStatus.SC_UNAUTHORIZED:
                return response.header(GRPC_STATUS, "16").header(GRPC_MESSAGE, "UNAUTHENTICATED");
            case HttpStatus.SC_FORBIDDEN:
                return response.header(GRPC_STATUS, "7").header(GRPC_MESSAGE, "PERMISSION_DENIED");
            default:
                return response;
        }
    }

    private SecurityResponse header(String name, String value) {
        headers.put(name, value);
        return this;
    }

    public int getStatus() {
        return status;
    }

    public ListMultimap<String, String> getHeaders() {
        return headers;
    }

    public String getBody() {
        return body;
    }

    public void applyTo(HttpResponse response) {
        response.setStatusCode(status);
        headers.forEach(response::addHeader);
        if (body != null) {
            response.setEntity(new StringEntity(body, TEXT_PLAIN));
        }
    }
}
