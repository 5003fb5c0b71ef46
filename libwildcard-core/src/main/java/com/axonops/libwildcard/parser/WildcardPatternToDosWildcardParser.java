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

import java.util.EnumSet;

/**
 * Converts a wildcard pattern into a DOS wildcard.
 *
 * <p>Literals, {@code *} and {@code ?} carry over unchanged. DOS wildcards have no bracket
 * expressions, so each one collapses into a single {@code ?}: the result matches a superset
 * of what the original pattern matches.
 *
 * @since 1.0.0
 */
public final class WildcardPatternToDosWildcardParser extends WildcardPatternParser {

    private final StringBuilder result = new StringBuilder();

    private WildcardPatternToDosWildcardParser() {
    }

    @Override
    protected void appendLiteralCharacter(char c) {
        result.append(c);
    }

    @Override
    protected void appendAsterisk() {
        result.append('*');
    }

    @Override
    protected void appendQuestionMark() {
        result.append('?');
    }

    @Override
    protected void beginBracketExpression() {
    }

    @Override
    protected void appendLiteralCharacterToBracketExpression(char c) {
    }

    @Override
    protected void appendCharacterRangeToBracketExpression(char startOfCharacterRange, char endOfCharacterRange) {
    }

    @Override
    protected void endBracketExpression() {
        result.append('?');
    }

    /**
     * Converts {@code pattern} into a DOS wildcard.
     *
     * @throws com.axonops.libwildcard.api.WildcardPatternException if the pattern is malformed
     */
    public static String toDosWildcard(String pattern) {
        WildcardPatternToDosWildcardParser parser = new WildcardPatternToDosWildcardParser();
        parse(pattern, EnumSet.noneOf(WildcardOption.class), parser);
        return parser.result.toString();
    }
}
