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
import com.axonops.libwildcard.parser.WildcardPatternParser;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Turns the parser events of a wildcard pattern into an array of {@link PatternElement}s,
 * one per event, with a whole bracket expression collapsing into one element.
 *
 * <p>Literal characters are normalized here, once, so matching only has to normalize the
 * input side.
 */
final class MatcherBuilder extends WildcardPatternParser {

    private final CharacterNormalizer normalizer;
    private final List<PatternElement> patternElements = new ArrayList<>();
    private BracketSetElement.Builder bracketExpression;

    private MatcherBuilder(CharacterNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    static PatternElement[] build(String pattern, Set<WildcardOption> options, CharacterNormalizer normalizer) {
        MatcherBuilder builder = new MatcherBuilder(normalizer);
        parse(pattern, options, builder);
        return builder.patternElements.toArray(new PatternElement[0]);
    }

    @Override
    protected void appendLiteralCharacter(char c) {
        patternElements.add(new LiteralElement(normalizer.normalize(c)));
    }

    @Override
    protected void appendAsterisk() {
        patternElements.add(new AnySequenceElement());
    }

    @Override
    protected void appendQuestionMark() {
        patternElements.add(new AnyOneElement());
    }

    @Override
    protected void beginBracketExpression() {
        bracketExpression = new BracketSetElement.Builder(normalizer);
    }

    @Override
    protected void appendLiteralCharacterToBracketExpression(char c) {
        bracketExpression.addLiteral(c);
    }

    @Override
    protected void appendCharacterRangeToBracketExpression(char startOfCharacterRange, char endOfCharacterRange) {
        bracketExpression.addRange(startOfCharacterRange, endOfCharacterRange);
    }

    @Override
    protected void endBracketExpression() {
        patternElements.add(bracketExpression.build());
        bracketExpression = null;
    }
}
