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

import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Converts a wildcard pattern into an equivalent regular expression.
 *
 * <p>A list of wildcard patterns and their regex renderings:
 * <pre>
 * wildcard        regex
 * --------        -----
 * *foo*           foo
 * foo             ^foo$
 * foo*bar         ^foo.*bar$
 * foo`*bar        ^foo\*bar$
 * [a-c]at         ^[a-c]at$
 * </pre>
 *
 * <p>The rendering is anchored with {@code ^...$}, after which a single leading {@code ^.*}
 * and a single trailing {@code .*$} are dropped (each end independently), and the
 * pattern {@code *} renders as the empty string. Existing consumers depend on this exact
 * output, so repeated {@code .*} runs are deliberately left in place.
 *
 * @since 1.0.0
 */
public final class WildcardPatternToRegexParser extends WildcardPatternParser {

    // ']' is missing on purpose: outside a class it is literal for the JDK regex engine
    private static final String REGEX_CHARS = "()[.?*{}^$+|\\";

    private StringBuilder regexPattern;
    private int regexFlags;

    private WildcardPatternToRegexParser() {
    }

    private static boolean isRegexChar(char ch) {
        return REGEX_CHARS.indexOf(ch) >= 0;
    }

    /**
     * Maps wildcard options onto {@link Pattern} flags.
     *
     * <p>Matching is always single-line ({@code .} also matches line terminators), the same
     * as the wildcard matcher where {@code ?} and {@code *} accept any character.
     */
    public static int translateWildcardOptionsIntoRegexFlags(Set<WildcardOption> options) {
        int flags = Pattern.DOTALL;
        if (options.contains(WildcardOption.IGNORE_CASE)) {
            flags |= Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
        }
        return flags;
    }

    @Override
    protected void beginWildcardPattern(String pattern, Set<WildcardOption> options) {
        regexPattern = new StringBuilder(pattern.length() * 2 + 2);
        regexPattern.append('^');
        regexFlags = translateWildcardOptionsIntoRegexFlags(options);
    }

    static void appendLiteralCharacter(StringBuilder regexPattern, char c) {
        if (isRegexChar(c)) {
            regexPattern.append('\\');
        }
        regexPattern.append(c);
    }

    @Override
    protected void appendLiteralCharacter(char c) {
        appendLiteralCharacter(regexPattern, c);
    }

    @Override
    protected void appendAsterisk() {
        regexPattern.append(".*");
    }

    @Override
    protected void appendQuestionMark() {
        regexPattern.append('.');
    }

    @Override
    protected void endWildcardPattern() {
        regexPattern.append('$');

        String regexPatternString = regexPattern.toString();
        if (regexPatternString.equals("^.*$")) {
            regexPattern.setLength(0);
        } else {
            if (regexPatternString.startsWith("^.*")) {
                regexPattern.delete(0, 3);
            }
            if (regexPatternString.endsWith(".*$")) {
                regexPattern.setLength(regexPattern.length() - 3);
            }
        }
    }

    @Override
    protected void beginBracketExpression() {
        regexPattern.append('[');
    }

    static void appendLiteralCharacterToBracketExpression(StringBuilder regexPattern, char c) {
        switch (c) {
            case '[':
                // Would open a nested class in a JDK regex
                regexPattern.append("\\[");
                break;
            case ']':
                regexPattern.append("\\]");
                break;
            case '-':
                regexPattern.append("\\x2d");
                break;
            case '&':
                // "&&" is class intersection in a JDK regex
                regexPattern.append("\\&");
                break;
            default:
                appendLiteralCharacter(regexPattern, c);
                break;
        }
    }

    @Override
    protected void appendLiteralCharacterToBracketExpression(char c) {
        appendLiteralCharacterToBracketExpression(regexPattern, c);
    }

    @Override
    protected void appendCharacterRangeToBracketExpression(char startOfCharacterRange, char endOfCharacterRange) {
        appendLiteralCharacterToBracketExpression(regexPattern, startOfCharacterRange);
        regexPattern.append('-');
        appendLiteralCharacterToBracketExpression(regexPattern, endOfCharacterRange);
    }

    @Override
    protected void endBracketExpression() {
        regexPattern.append(']');
    }

    /**
     * Renders {@code pattern} as a regular expression string.
     *
     * @param pattern wildcard pattern
     * @param options options of the wildcard pattern (only used for {@link #toRegex})
     * @return regex string
     * @throws WildcardPatternException if the pattern is malformed
     */
    public static String toRegexString(String pattern, Set<WildcardOption> options) {
        WildcardPatternToRegexParser parser = new WildcardPatternToRegexParser();
        parse(pattern, options, parser);
        return parser.regexPattern.toString();
    }

    /**
     * Renders {@code pattern} as a compiled JDK regular expression honoring the case options.
     *
     * @param pattern wildcard pattern
     * @param options options of the wildcard pattern
     * @return compiled regex
     * @throws WildcardPatternException if the pattern is malformed
     *     or its rendering is rejected by the JDK regex engine
     */
    public static Pattern toRegex(String pattern, Set<WildcardOption> options) {
        WildcardPatternToRegexParser parser = new WildcardPatternToRegexParser();
        parse(pattern, options, parser);
        try {
            return Pattern.compile(parser.regexPattern.toString(), parser.regexFlags);
        } catch (PatternSyntaxException e) {
            throw new WildcardPatternException(pattern,
                "regex rendering was rejected: " + e.getDescription(), e);
        }
    }
}
