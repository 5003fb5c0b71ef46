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

import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.*;

/**
 * Public API tests for {@link WildcardPattern}.
 */
class WildcardPatternTest {

    @Test
    void testMatchAllPatternMatchesEverything() {
        WildcardPattern pattern = WildcardPattern.compile("*");
        assertThat(pattern.isMatch("")).isTrue();
        assertThat(pattern.isMatch("anything at all")).isTrue();
        assertThat(pattern.isMatch(null)).isFalse();
    }

    @Test
    void testMatchAllPatternIsSharedSingleton() {
        WildcardPattern first = WildcardPattern.compile("*");
        WildcardPattern second = WildcardPattern.compile("*", WildcardOption.IGNORE_CASE);
        assertThat(second).isSameAs(first);
        assertThat(first.options()).isEmpty();
    }

    @Test
    void testEmptyPattern() {
        WildcardPattern pattern = WildcardPattern.compile("");
        assertThat(pattern.isMatch("")).isTrue();
        assertThat(pattern.isMatch("x")).isFalse();
    }

    @Test
    void testNullInputNeverMatches() {
        assertThat(WildcardPattern.compile("a*").isMatch(null)).isFalse();
        assertThat(WildcardPattern.compileWithoutCache("*").isMatch(null)).isFalse();
    }

    @Test
    void testIgnoreCase() {
        assertThat(WildcardPattern.compile("abc", WildcardOption.IGNORE_CASE).isMatch("ABC")).isTrue();
        assertThat(WildcardPattern.compile("abc").isMatch("ABC")).isFalse();
    }

    @Test
    void testGetCommandScenario() {
        WildcardPattern pattern = WildcardPattern.compile("Get-*", WildcardOption.IGNORE_CASE);
        assertThat(pattern.isMatch("get-childitem")).isTrue();
        assertThat(pattern.isMatch("GET-HELP")).isTrue();
        assertThat(pattern.isMatch("Set-Item")).isFalse();
    }

    @Test
    void testCompiledOptionDoesNotChangeResults() {
        WildcardPattern plain = WildcardPattern.compileWithoutCache("a?c");
        WildcardPattern compiled = WildcardPattern.compileWithoutCache("a?c", WildcardOption.COMPILED);
        for (String input : new String[] {"abc", "ac", "ABC", "abbc"}) {
            assertThat(compiled.isMatch(input)).isEqualTo(plain.isMatch(input));
        }
    }

    @Test
    void testInvalidPatternFailsAtCompile() {
        assertThatThrownBy(() -> WildcardPattern.compile("[z-a]"))
            .isInstanceOf(WildcardPatternException.class)
            .isInstanceOf(WildcardException.class)
            .hasMessageContaining("[z-a]");
        assertThatThrownBy(() -> WildcardPattern.compileWithoutCache("abc[", EnumSet.noneOf(WildcardOption.class)))
            .isInstanceOf(WildcardPatternException.class);
    }

    @Test
    void testNullArguments() {
        assertThatThrownBy(() -> WildcardPattern.compile(null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("pattern");
        assertThatThrownBy(() -> WildcardPattern.compile("a", (java.util.Set<WildcardOption>) null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("options");
    }

    @Test
    void testAccessors() {
        WildcardPattern pattern = WildcardPattern.compileWithoutCache("a*", WildcardOption.IGNORE_CASE);
        assertThat(pattern.pattern()).isEqualTo("a*");
        assertThat(pattern.options()).containsExactly(WildcardOption.IGNORE_CASE);
        assertThatThrownBy(() -> pattern.options().add(WildcardOption.COMPILED))
            .isInstanceOf(UnsupportedOperationException.class);
        assertThat(pattern.toString()).contains("a*").contains("IGNORE_CASE");
    }

    @Test
    void testOptionsAreCopied() {
        EnumSet<WildcardOption> options = EnumSet.of(WildcardOption.IGNORE_CASE);
        WildcardPattern pattern = WildcardPattern.compileWithoutCache("a", options);
        options.clear();
        assertThat(pattern.options()).containsExactly(WildcardOption.IGNORE_CASE);
        assertThat(pattern.isMatch("A")).isTrue();
    }

    @Test
    void testToRegexString() {
        assertThat(WildcardPattern.compile("*").toRegexString()).isEmpty();
        assertThat(WildcardPattern.compile("a?b*").toRegexString()).isEqualTo("^a.b");
    }

    @Test
    void testToRegexFindsSameStrings() {
        WildcardPattern wildcard = WildcardPattern.compile("Get-[a-c]*", WildcardOption.IGNORE_CASE);
        Pattern regex = wildcard.toRegex();
        for (String input : new String[] {"get-ChildItem", "GET-acl", "Set-Item", "get-"}) {
            assertThat(regex.matcher(input).find()).as(input).isEqualTo(wildcard.isMatch(input));
        }
    }

    @Test
    void testToDosWildcardString() {
        assertThat(WildcardPattern.compile("file[0-9]?.*").toDosWildcardString()).isEqualTo("file??.*");
    }

    @Test
    void testToWql() {
        assertThat(WildcardPattern.compile("Win32_*").toWql()).isEqualTo("Win32[_]%");
        assertThatThrownBy(() -> WildcardPattern.compile("[^a]*").toWql())
            .isInstanceOf(WildcardConversionException.class)
            .isNotInstanceOf(WildcardPatternException.class);
    }

    @Test
    void testMatchingNeverThrowsForCompiledPattern() {
        WildcardPattern pattern = WildcardPattern.compile("*[`]]?`*");
        assertThatCode(() -> {
            pattern.isMatch("");
            pattern.isMatch("]]x*");
            pattern.isMatch("\u0000\uFFFF");
        }).doesNotThrowAnyException();
        assertThat(pattern.isMatch("]x*")).isTrue();
    }
}
