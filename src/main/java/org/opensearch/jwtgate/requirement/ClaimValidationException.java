/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.jwtgate.requirement;

/**
 * A required claim is missing from the token or its value does not satisfy the configured requirement.
 */
public class ClaimValidationException extends Exception {
    private static final long serialVersionUID = -5313470236845077718L;

    private final String claim;
    private final boolean missing;

    private ClaimValidationException(String message, String claim, boolean missing) {
        super(message);
        this.claim = claim;
        this.missing = missing;
    }

    public static ClaimValidationException missing(String claim) {
        return new ClaimValidationException("claim is not present: " + claim, claim, true);
    }

    public static ClaimValidationException invalid(String claim) {
        return new ClaimValidationException("claim is not valid: " + claim, claim, false);
    }

    public String getClaim() {
        return claim;
    }

    public boolean isMissing() {
        return missing;
    }
}
