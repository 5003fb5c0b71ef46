/*
 * Copyright 2025 AxonOps
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.axonops.libwildcard.api;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Static helpers for code that filters names by user-supplied wildcards.
 *
 * <pre>{@code
 * List<WildcardPattern> include = Wildcards.createWildcardsFromStrings(
 *     List.of("Get-*", "Set-*"), EnumSet.of(WildcardOption.IGNORE_CASE));
 * Wildcards.matchesAnyWildcardPattern("get-item", include, true); // true
 * Wildcards.matchesAnyWildcardPattern("get-item", List.of(), true); // true: no filter given
 * }</pre>
 *
 * @since 1.0.0
 */
public final class Wildcards {

    private Wildcards() {
    }

    /**
     * Matches input against a wildcard pattern (uses the pattern cache).
     *
     * @param pattern wildcard pattern
     * @param input input to match; {@code null} never matches
     * @return true if the whole input matches
     */
    public static boolean matches(String pattern, String input) {
        return WildcardPattern.compile(pattern).isMatch(input);
    }

    public static boolean matches(String pattern, String input, Set<WildcardOption> options) {
        return WildcardPattern.compile(pattern, options).isMatch(input);
    }

    /**
     * Compiles every non-empty string in {@code patterns}.
     *
     * @param patterns pattern strings; null and empty elements are skipped
     * @param options options applied to every pattern
     * @return compiled patterns in iteration order
     * @throws WildcardPatternException if any pattern is malformed
     */
    public static List<WildcardPattern> createWildcardsFromStrings(Collection<String> patterns, Set<WildcardOption> options) {
        Objects.requireNonNull(patterns, "patterns cannot be null");
        Objects.requireNonNull(options, "options cannot be null");

        List<WildcardPattern> result = new ArrayList<>(patterns.size());
        for (String pattern : patterns) {
            if (pattern != null && !pattern.isEmpty()) {
                result.add(WildcardPattern.compile(pattern, options));
            }
        }
        return result;
    }

    /**
     * Tests {@code text} against a list of patterns.
     *
     * @param text text to test
     * @param patterns patterns to try, may be null
     * @param defaultValue result when {@code patterns} is null or empty
     * @return true if any pattern matches, {@code defaultValue} if there are no patterns
     */
    public static boolean matchesAnyWildcardPattern(String text, Collection<WildcardPattern> patterns, boolean defaultValue) {
        if (patterns == null || patterns.isEmpty()) {
            return defaultValue;
        }

        for (WildcardPattern pattern : patterns) {
            if (pattern.isMatch(text)) {
                return true;
            }
        }
        return false;
    }
}
