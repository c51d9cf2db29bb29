/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.jwtgate.filter;

import org.apache.http.HttpStatus;

/**
 * Outcome of validating a request: {@link HttpStatus#SC_OK} if it may pass, otherwise the status to answer with and
 * the reason.
 */
public record ValidationResult(int status, String message) {

    public static final ValidationResult ALLOWED = new ValidationResult(HttpStatus.SC_OK, null);

    public static ValidationResult unauthorized(String message) {
        return new ValidationResult(HttpStatus.SC_UNAUTHORIZED, message);
    }

    public static ValidationResult forbidden(String message) {
        return new ValidationResult(HttpStatus.SC_FORBIDDEN, message);
    }

    public boolean isAllowed() {
        return status == HttpStatus.SC_OK;
    }
}
