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

import com.axonops.libwildcard.api.WildcardConversionException;
import com.axonops.libwildcard.api.WildcardOption;

import java.util.EnumSet;

/**
 * Converts a wildcard pattern into the right-hand operand of a WQL {@code LIKE} operator.
 *
 * <p>For example {@code a*b?} becomes {@code a%b_}. Characters that are special to
 * {@code LIKE} ({@code %}, {@code _}, {@code [}) are wrapped in a one-character set.
 *
 * <p>{@code LIKE} sets treat {@code ^} as negation and cannot contain {@code ]} or a
 * literal {@code -}. A bracket expression using any of those has no {@code LIKE}
 * equivalent; conversion then fails with {@link WildcardConversionException} so the
 * caller can query more broadly and filter client-side.
 *
 * @since 1.0.0
 */
public final class WildcardPatternToWqlParser extends WildcardPatternParser {

    public static final String TARGET_FORMAT = "WQL";

    private final StringBuilder result = new StringBuilder();
    private boolean needsClientSideFiltering;

    private WildcardPatternToWqlParser() {
    }

    @Override
    protected void appendLiteralCharacter(char c) {
        switch (c) {
            case '%':
            case '_':
            case '[':
                result.append('[').append(c).append(']');
                break;
            default:
                result.append(c);
                break;
        }
    }

    @Override
    protected void appendAsterisk() {
        result.append('%');
    }

    @Override
    protected void appendQuestionMark() {
        result.append('_');
    }

    @Override
    protected void beginBracketExpression() {
        result.append('[');
    }

    @Override
    protected void appendLiteralCharacterToBracketExpression(char c) {
        if (isUnrepresentableInSet(c)) {
            needsClientSideFiltering = true;
        }
        result.append(c);
    }

    @Override
    protected void appendCharacterRangeToBracketExpression(char startOfCharacterRange, char endOfCharacterRange) {
        if (isUnrepresentableInSet(startOfCharacterRange) || isUnrepresentableInSet(endOfCharacterRange)) {
            needsClientSideFiltering = true;
        }
        result.append(startOfCharacterRange).append('-').append(endOfCharacterRange);
    }

    @Override
    protected void endBracketExpression() {
        result.append(']');
    }

    private static boolean isUnrepresentableInSet(char c) {
        return c == '^' || c == ']' || c == '-';
    }

    /**
     * Converts {@code pattern} into a WQL {@code LIKE} operand.
     *
     * @throws com.axonops.libwildcard.api.WildcardPatternException if the pattern is malformed
     * @throws WildcardConversionException if the pattern has no exact {@code LIKE} equivalent
     */
    public static String toWql(String pattern) {
        WildcardPatternToWqlParser parser = new WildcardPatternToWqlParser();
        parse(pattern, EnumSet.noneOf(WildcardOption.class), parser);
        if (parser.needsClientSideFiltering) {
            throw new WildcardConversionException(pattern, TARGET_FORMAT, WildcardConversionException.WQL_ERROR_ID);
        }
        return parser.result.toString();
    }
}
