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

package com.axonops.libwildcard.engine;

import com.axonops.libwildcard.api.WildcardOption;

import java.util.Locale;
import java.util.Set;

/**
 * Case folding applied to pattern characters at compile time and to input characters
 * at match time.
 *
 * <p>Decided once from the pattern options and never changed afterwards, so a compiled
 * pattern keeps folding the same way even if the default locale changes later.
 *
 * @since 1.0.0
 */
final class CharacterNormalizer {

    static final CharacterNormalizer IDENTITY = new CharacterNormalizer(false, null);

    private final boolean caseInsensitive;

    // null means culture-invariant folding (Unicode default case mapping)
    private final Locale locale;

    // Only these languages have locale-specific case mappings for single chars (dotted/dotless i)
    private final boolean localeSensitive;

    private CharacterNormalizer(boolean caseInsensitive, Locale locale) {
        this.caseInsensitive = caseInsensitive;
        this.locale = locale;
        this.localeSensitive = locale != null && isLocaleSensitive(locale);
    }

    static CharacterNormalizer forOptions(Set<WildcardOption> options) {
        if (!options.contains(WildcardOption.IGNORE_CASE)) {
            return IDENTITY;
        }
        return options.contains(WildcardOption.CULTURE_INVARIANT)
            ? new CharacterNormalizer(true, null)
            : new CharacterNormalizer(true, Locale.getDefault());
    }

    private static boolean isLocaleSensitive(Locale locale) {
        String language = locale.getLanguage();
        return "tr".equals(language) || "az".equals(language) || "lt".equals(language);
    }

    boolean isCaseInsensitive() {
        return caseInsensitive;
    }

    /**
     * Folds {@code c} to its lower-case form, or returns it unchanged when matching is
     * case-sensitive.
     */
    char normalize(char c) {
        if (!caseInsensitive) {
            return c;
        }
        if (localeSensitive) {
            String lower = String.valueOf(c).toLowerCase(locale);
            if (lower.length() == 1) {
                return lower.charAt(0);
            }
        }
        return Character.toLowerCase(c);
    }

    /**
     * Upper-case counterpart of {@link #normalize(char)}, used to test character ranges
     * written in upper case.
     */
    char toUpperCase(char c) {
        if (localeSensitive) {
            String upper = String.valueOf(c).toUpperCase(locale);
            if (upper.length() == 1) {
                return upper.charAt(0);
            }
        }
        return Character.toUpperCase(c);
    }

    @Override
    public String toString() {
        if (!caseInsensitive) {
            return "CharacterNormalizer[case-sensitive]";
        }
        return "CharacterNormalizer[ignore-case, locale=" + (locale == null ? "invariant" : locale.toLanguageTag()) + "]";
    }
}
