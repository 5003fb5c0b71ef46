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

package com.axonops.libwildcard.parser;

import com.axonops.libwildcard.api.WildcardOption;
import com.axonops.libwildcard.api.WildcardPatternException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Tokenizer tests: records the callbacks a pattern produces.
 */
class WildcardPatternParserTest {

    private static final Set<WildcardOption> NONE = EnumSet.noneOf(WildcardOption.class);

    /** Records each callback as a short token. */
    private static final class RecordingParser extends WildcardPatternParser {
        final List<String> events = new ArrayList<>();
        Set<WildcardOption> seenOptions;

        @Override
        protected void beginWildcardPattern(String pattern, Set<WildcardOption> options) {
            seenOptions = options;
            events.add("begin");
        }

        @Override
        protected void appendLiteralCharacter(char c) {
            events.add("lit:" + c);
        }

        @Override
        protected void appendAsterisk() {
            events.add("*");
        }

        @Override
        protected void appendQuestionMark() {
            events.add("?");
        }

        @Override
        protected void endWildcardPattern() {
            events.add("end");
        }

        @Override
        protected void beginBracketExpression() {
            events.add("[");
        }

        @Override
        protected void appendLiteralCharacterToBracketExpression(char c) {
            events.add("blit:" + c);
        }

        @Override
        protected void appendCharacterRangeToBracketExpression(char startOfCharacterRange, char endOfCharacterRange) {
            events.add("range:" + startOfCharacterRange + "-" + endOfCharacterRange);
        }

        @Override
        protected void endBracketExpression() {
            events.add("]");
        }
    }

    private static List<String> events(String pattern) {
        RecordingParser parser = new RecordingParser();
        WildcardPatternParser.parse(pattern, NONE, parser);
        return parser.events;
    }

    @Test
    void testLiteralsAndWildcards() {
        assertThat(events("a*b?"))
            .containsExactly("begin", "lit:a", "*", "lit:b", "?", "end");
    }

    @Test
    void testEmptyPattern() {
        assertThat(events("")).containsExactly("begin", "end");
    }

    @Test
    void testEscapedWildcardsAreLiterals() {
        assertThat(events("`*`?`[``"))
            .containsExactly("begin", "lit:*", "lit:?", "lit:[", "lit:`", "end");
    }

    @Test
    void testEscapedOrdinaryCharacterIsLiteral() {
        assertThat(events("`a")).containsExactly("begin", "lit:a", "end");
    }

    @Test
    void testTrailingBacktickIsLiteral() {
        assertThat(events("ab`")).containsExactly("begin", "lit:a", "lit:b", "lit:`", "end");
    }

    @Test
    void testLoneBacktickIsEmptyPattern() {
        assertThat(events("`")).containsExactly("begin", "end");
    }

    @Test
    void testBracketLiteralsAndRange() {
        assertThat(events("[abx-z]"))
            .containsExactly("begin", "[", "blit:a", "blit:b", "range:x-z", "]", "end");
    }

    @Test
    void testLeadingCloseBracketIsLiteral() {
        assertThat(events("[]a]"))
            .containsExactly("begin", "[", "blit:]", "blit:a", "]", "end");
    }

    @Test
    void testEscapedCloseBracketInsideBracket() {
        assertThat(events("[a`]]"))
            .containsExactly("begin", "[", "blit:a", "blit:]", "]", "end");
    }

    @Test
    void testDashAtEdgesIsLiteral() {
        assertThat(events("[-a]")).containsExactly("begin", "[", "blit:-", "blit:a", "]", "end");
        assertThat(events("[a-]")).containsExactly("begin", "[", "blit:a", "blit:-", "]", "end");
    }

    @Test
    void testEscapedDashIsLiteral() {
        assertThat(events("[a`-c]"))
            .containsExactly("begin", "[", "blit:a", "blit:-", "blit:c", "]", "end");
    }

    @Test
    void testCaretAndBangAreLiterals() {
        assertThat(events("[^!]")).containsExactly("begin", "[", "blit:^", "blit:!", "]", "end");
    }

    @Test
    void testNoNestedBrackets() {
        assertThat(events("[[a]]"))
            .containsExactly("begin", "[", "blit:[", "blit:a", "]", "lit:]", "end");
    }

    @Test
    void testWildcardsInsideBracketAreLiterals() {
        assertThat(events("[*?]")).containsExactly("begin", "[", "blit:*", "blit:?", "]", "end");
    }

    @Test
    void testUnterminatedBracketFails() {
        assertThatThrownBy(() -> events("abc[de"))
            .isInstanceOf(WildcardPatternException.class)
            .satisfies(e -> {
                WildcardPatternException wpe = (WildcardPatternException) e;
                assertThat(wpe.getPattern()).isEqualTo("abc[de");
                assertThat(wpe.getErrorId()).isEqualTo(WildcardPatternException.ERROR_ID);
            });
    }

    @Test
    void testInvertedRangeFails() {
        assertThatThrownBy(() -> events("[z-a]"))
            .isInstanceOf(WildcardPatternException.class)
            .hasMessageContaining("z-a");
    }

    @Test
    void testSingleCharacterRangeIsAllowed() {
        assertThat(events("[a-a]")).containsExactly("begin", "[", "range:a-a", "]", "end");
    }

    @Test
    void testOptionsArePassedThrough() {
        RecordingParser parser = new RecordingParser();
        Set<WildcardOption> options = EnumSet.of(WildcardOption.IGNORE_CASE);
        WildcardPatternParser.parse("x", options, parser);
        assertThat(parser.seenOptions).isEqualTo(options);
    }

    @Test
    void testNullArguments() {
        RecordingParser parser = new RecordingParser();
        assertThatThrownBy(() -> WildcardPatternParser.parse(null, NONE, parser))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("pattern");
        assertThatThrownBy(() -> WildcardPatternParser.parse("a", NONE, null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("parser");
    }
}
