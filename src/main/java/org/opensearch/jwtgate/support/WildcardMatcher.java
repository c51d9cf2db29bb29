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

import java.util.Collection;
import java.util.List;
import java.util.function.Predicate;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Shell style glob matching used for issuers and claim values.
 * <p>
 * {@code *} matches any run of characters, {@code ?} matches exactly one character. Everything else is
 * matched literally and case sensitively. Patterns frequently come out of tokens, so there is no regex form.
 */
public abstract class WildcardMatcher implements Predicate<String> {

    public static final WildcardMatcher ANY = new WildcardMatcher("*") {
        @Override
        public boolean test(String candidate) {
            return candidate != null;
        }
    };

    public static final WildcardMatcher NONE = new WildcardMatcher("<NONE>") {
        @Override
        public boolean test(String candidate) {
            return false;
        }
    };

    private final String description;

    private WildcardMatcher(String description) {
        this.description = description;
    }

    public static WildcardMatcher from(String pattern) {
        if (pattern == null) {
            return NONE;
        }
        if ("*".equals(pattern)) {
            return ANY;
        }
        return isExact(pattern) ? new Literal(pattern) : new Glob(pattern);
    }

    /**
     * Matches if any of the given patterns matches. An empty or null collection matches nothing.
     */
    public static WildcardMatcher from(Collection<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            return NONE;
        }
        if (patterns.size() == 1) {
            return from(patterns.iterator().next());
        }
        ImmutableList.Builder<WildcardMatcher> alternatives = ImmutableList.builder();
        patterns.forEach(pattern -> alternatives.add(from(pattern)));
        return new AnyOf(alternatives.build(), patterns.toString());
    }

    public static boolean isExact(String pattern) {
        return pattern == null || (pattern.indexOf('*') < 0 && pattern.indexOf('?') < 0);
    }

    /**
     * A null candidate never matches.
     */
    @Override
    public abstract boolean test(String candidate);

    @Override
    public String toString() {
        return description;
    }

    static final class Literal extends WildcardMatcher {
        private final String value;

        Literal(String value) {
            super(value);
            this.value = value;
        }

        @Override
        public boolean test(String candidate) {
            return value.equals(candidate);
        }
    }

    static final class Glob extends WildcardMatcher {
        private final String glob;

        Glob(String glob) {
            super(glob);
            this.glob = glob;
        }

        // greedy walk that backtracks to the most recent '*' on mismatch
        @Override
        public boolean test(String candidate) {
            if (candidate == null) {
                return false;
            }
            int c = 0;
            int g = 0;
            int resumeCandidate = -1;
            int resumeGlob = -1;
            while (c < candidate.length()) {
                char next = g < glob.length() ? glob.charAt(g) : 0;
                if (g < glob.length() && next == '*') {
                    resumeGlob = ++g;
                    resumeCandidate = c;
                } else if (g < glob.length() && (next == '?' || next == candidate.charAt(c))) {
                    c++;
                    g++;
                } else if (resumeGlob >= 0) {
                    c = ++resumeCandidate;
                    g = resumeGlob;
                } else {
                    return false;
                }
            }
            while (g < glob.length() && glob.charAt(g) == '*') {
                g++;
            }
            return g == glob.length();
        }
    }

    static final class AnyOf extends WildcardMatcher {
        private final List<WildcardMatcher> alternatives;

        AnyOf(List<WildcardMatcher> alternatives, String description) {
            super(description);
            Preconditions.checkArgument(!alternatives.isEmpty(), "no alternatives");
            this.alternatives = alternatives;
        }

        @Override
        public boolean test(String candidate) {
            return alternatives.stream().anyMatch(matcher -> matcher.test(candidate));
        }
    }
}
