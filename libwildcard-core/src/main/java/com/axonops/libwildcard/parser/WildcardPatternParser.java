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

import java.util.Objects;
import java.util.Set;

/**
 * Base class for consumers of wildcard pattern syntax.
 *
 * <p>{@link #parse(String, Set, WildcardPatternParser)} walks the pattern once, left to
 * right, and reports what it finds through the callback methods. Subclasses decide what
 * to build from those events: a compiled matcher, a regex, a DOS wildcard, a WQL operand.
 *
 * <p><strong>Syntax:</strong>
 * <ul>
 *   <li>{@code *} - any sequence of characters, including the empty one</li>
 *   <li>{@code ?} - exactly one character</li>
 *   <li>{@code [...]} - one character from a set of literals and {@code lo-hi} ranges</li>
 *   <li>{@code `} - escapes the next character</li>
 * </ul>
 *
 * <p>Bracket expressions are a greatly simplified version of POSIX bracket expressions.
 * Negation ({@code !} or {@code ^}), character classes ({@code [:alpha:]}) and nesting
 * are not supported; {@code ^} and {@code !} are plain literals.
 *
 * <p>Parsers are single-use and not thread-safe.
 *
 * @since 1.0.0
 */
public abstract class WildcardPatternParser {

    /**
     * Character that removes the special meaning of the character after it.
     */
    public static final char ESCAPE_CHAR = '`';

    /**
     * Called once before any other callback. Default implementation does nothing.
     *
     * @param pattern the pattern being parsed
     * @param options options the pattern was created with
     */
    protected void beginWildcardPattern(String pattern, Set<WildcardOption> options) {
    }

    /**
     * The next part of the pattern matches the literal character {@code c}.
     */
    protected abstract void appendLiteralCharacter(char c);

    /**
     * The next part of the pattern matches any string, including an empty one.
     */
    protected abstract void appendAsterisk();

    /**
     * The next part of the pattern matches any single character.
     */
    protected abstract void appendQuestionMark();

    /**
     * Called once after all other callbacks. Default implementation does nothing.
     */
    protected void endWildcardPattern() {
    }

    /**
     * Starts a bracket expression. Followed by literal and range callbacks and then
     * {@link #endBracketExpression()}.
     */
    protected abstract void beginBracketExpression();

    /**
     * The current bracket expression includes the literal character {@code c}.
     */
    protected abstract void appendLiteralCharacterToBracketExpression(char c);

    /**
     * The current bracket expression includes every character from {@code startOfCharacterRange}
     * to {@code endOfCharacterRange}, both inclusive. Start is never greater than end.
     */
    protected abstract void appendCharacterRangeToBracketExpression(
        char startOfCharacterRange,
        char endOfCharacterRange);

    /**
     * Ends the current bracket expression.
     */
    protected abstract void endBracketExpression();

    /**
     * Splits the collected contents of a bracket expression into literals and ranges.
     *
     * <p>{@code operators} is parallel to {@code contents} and holds {@code '-'} where the
     * content character is an unescaped dash. Everything except such a dash is literal, so
     * {@code ^}, {@code [} and {@code ]} keep no special meaning here.
     */
    private void appendBracketExpression(String contents, String operators, String pattern) {
        beginBracketExpression();

        int i = 0;
        while (i < contents.length()) {
            if ((i + 2) < contents.length() && operators.charAt(i + 1) == '-') {
                char lowerBound = contents.charAt(i);
                char upperBound = contents.charAt(i + 2);
                i += 3;

                if (lowerBound > upperBound) {
                    throw newWildcardPatternException(pattern,
                        "character range '" + lowerBound + "-" + upperBound + "' is out of order");
                }

                appendCharacterRangeToBracketExpression(lowerBound, upperBound);
            } else {
                appendLiteralCharacterToBracketExpression(contents.charAt(i));
                i++;
            }
        }

        endBracketExpression();
    }

    /**
     * Parses {@code pattern}, calling back into {@code parser}.
     *
     * @param pattern pattern to parse
     * @param options options the pattern was created with (passed through to the parser)
     * @param parser parser to call back
     * @throws WildcardPatternException if a bracket expression is unterminated or holds an
     *     inverted character range
     */
    public static void parse(String pattern, Set<WildcardOption> options, WildcardPatternParser parser) {
        Objects.requireNonNull(pattern, "pattern cannot be null");
        Objects.requireNonNull(options, "options cannot be null");
        Objects.requireNonNull(parser, "parser cannot be null");

        parser.beginWildcardPattern(pattern, options);

        boolean previousCharacterIsAnEscape = false;
        boolean previousCharacterStartedBracketExpression = false;
        boolean insideBracketExpression = false;
        StringBuilder bracketContents = null;
        StringBuilder bracketOperators = null;

        for (int index = 0; index < pattern.length(); index++) {
            char c = pattern.charAt(index);

            if (insideBracketExpression) {
                if (c == ']' && !previousCharacterStartedBracketExpression && !previousCharacterIsAnEscape) {
                    // No nested brackets: the first unescaped ']' closes the expression
                    insideBracketExpression = false;
                    parser.appendBracketExpression(bracketContents.toString(), bracketOperators.toString(), pattern);
                    bracketContents = null;
                    bracketOperators = null;
                } else if (c != ESCAPE_CHAR || previousCharacterIsAnEscape) {
                    bracketContents.append(c);
                    bracketOperators.append(c == '-' && !previousCharacterIsAnEscape ? '-' : ' ');
                }

                previousCharacterStartedBracketExpression = false;
            } else {
                if (c == '*' && !previousCharacterIsAnEscape) {
                    parser.appendAsterisk();
                } else if (c == '?' && !previousCharacterIsAnEscape) {
                    parser.appendQuestionMark();
                } else if (c == '[' && !previousCharacterIsAnEscape) {
                    insideBracketExpression = true;
                    bracketContents = new StringBuilder();
                    bracketOperators = new StringBuilder();
                    previousCharacterStartedBracketExpression = true;
                } else if (c != ESCAPE_CHAR || previousCharacterIsAnEscape) {
                    parser.appendLiteralCharacter(c);
                }
            }

            previousCharacterIsAnEscape = c == ESCAPE_CHAR && !previousCharacterIsAnEscape;
        }

        if (insideBracketExpression) {
            throw newWildcardPatternException(pattern, "bracket expression is not closed");
        }

        // A trailing lone escape is a literal backtick, except that the pattern "`" on its own
        // is treated as the empty pattern
        if (previousCharacterIsAnEscape && !pattern.equals(String.valueOf(ESCAPE_CHAR))) {
            parser.appendLiteralCharacter(pattern.charAt(pattern.length() - 1));
        }

        parser.endWildcardPattern();
    }

    /**
     * Creates the exception reported for a malformed pattern.
     */
    public static WildcardPatternException newWildcardPatternException(String invalidPattern, String reason) {
        return new WildcardPatternException(invalidPattern, reason);
    }
}
