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

package com.axonops.libwildcard.util;

import com.axonops.libwildcard.api.WildcardOption;

import java.util.Set;

/**
 * Log-safe identifiers for wildcard patterns.
 *
 * <p>Patterns often embed user, host or path names, so logs carry a hash instead of the text.
 * The same pattern always yields the same hash.
 *
 * @since 1.0.0
 */
public final class PatternHasher {

    private PatternHasher() {
    }

    /**
     * Compact hash of a pattern.
     *
     * @param pattern the wildcard pattern, may be null
     * @return hex hash such as {@code "7a3f2b1c"}, or {@code "null"}
     */
    public static String hash(String pattern) {
        if (pattern == null) {
            return "null";
        }
        return Integer.toHexString(pattern.hashCode());
    }

    /**
     * Hash plus a marker for how case is compared: {@code [CS]} case-sensitive,
     * {@code [CI]} case-insensitive under the default locale, {@code [CI-INV]} case-insensitive
     * under the invariant locale. {@link WildcardOption#CULTURE_INVARIANT} alone does not change
     * matching and is reported as {@code [CS]}.
     *
     * @param pattern the wildcard pattern
     * @param options the pattern options
     * @return e.g. {@code "7a3f2b1c[CI-INV]"}
     */
    public static String hashWithOptions(String pattern, Set<WildcardOption> options) {
        return hash(pattern) + caseMarker(options);
    }

    /**
     * Hash, case marker and shape of the pattern for compile-time logging. Counts the wildcard
     * characters so a log line shows whether a pattern is a plain literal without showing it.
     *
     * @param pattern the wildcard pattern
     * @param options the pattern options
     * @return e.g. {@code "7a3f2b1c[CS] len=9 wildcards=2"}
     */
    public static String describe(String pattern, Set<WildcardOption> options) {
        if (pattern == null) {
            return "null";
        }
        return hashWithOptions(pattern, options)
            + " len=" + pattern.length()
            + " wildcards=" + countWildcards(pattern);
    }

    private static String caseMarker(Set<WildcardOption> options) {
        if (!options.contains(WildcardOption.IGNORE_CASE)) {
            return "[CS]";
        }
        return options.contains(WildcardOption.CULTURE_INVARIANT) ? "[CI-INV]" : "[CI]";
    }

    // Unescaped '*', '?' and '[' only; a bracket expression counts once
    private static int countWildcards(String pattern) {
        int count = 0;
        boolean inBracket = false;
        int bracketStart = -1;
        for (int i = 0; i < pattern.length(); i++) {
            char ch = pattern.charAt(i);
            if (ch == '`') {
                i++;
            } else if (inBracket) {
                if (ch == ']' && i != bracketStart + 1) {
                    inBracket = false;
                }
            } else if (ch == '*' || ch == '?') {
                count++;
            } else if (ch == '[') {
                count++;
                inBracket = true;
                bracketStart = i;
            }
        }
        return count;
    }
}
