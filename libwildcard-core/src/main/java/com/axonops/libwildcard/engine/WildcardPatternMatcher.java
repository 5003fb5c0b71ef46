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

import java.util.Objects;
import java.util.Set;

/**
 * A compiled wildcard pattern: the pattern elements plus the case folding they were
 * compiled with.
 *
 * <p>Matching simulates an NFA whose states are (patternPosition, stringPosition) pairs and
 * looks for a path from (0, 0) to (elements, length of input):
 * <ul>
 *   <li>every state has at most two outgoing edges (see the {@link PatternElement}
 *       subclasses), so the traversal costs O(pattern length x input length)</li>
 *   <li>states are visited in string position order, so remembering visited states only
 *       needs O(pattern length) memory</li>
 *   <li>there is no backtracking and no recursion; patterns such as {@code *a*a*a*a*b}
 *       cannot blow up</li>
 * </ul>
 *
 * <p>Thread-safe: instances are immutable. Each call to {@link #isMatch(String)} allocates
 * its own traversal state.
 *
 * @since 1.0.0
 */
public final class WildcardPatternMatcher {

    private final PatternElement[] patternElements;
    private final CharacterNormalizer characterNormalizer;

    private WildcardPatternMatcher(PatternElement[] patternElements, CharacterNormalizer characterNormalizer) {
        this.patternElements = patternElements;
        this.characterNormalizer = characterNormalizer;
    }

    /**
     * Compiles {@code pattern}.
     *
     * @throws com.axonops.libwildcard.api.WildcardPatternException if the pattern is malformed
     */
    public static WildcardPatternMatcher compile(String pattern, Set<WildcardOption> options) {
        Objects.requireNonNull(pattern, "pattern cannot be null");
        Objects.requireNonNull(options, "options cannot be null");

        CharacterNormalizer normalizer = CharacterNormalizer.forOptions(options);
        return new WildcardPatternMatcher(MatcherBuilder.build(pattern, options, normalizer), normalizer);
    }

    /**
     * Tests whether the whole of {@code input} matches.
     *
     * @param input string to test, not null
     * @return true if the pattern matches the entire input
     */
    public boolean isMatch(String input) {
        PatternPositions patternPositionsForCurrentStringPosition = new PatternPositions(patternElements.length);
        patternPositionsForCurrentStringPosition.add(0);

        PatternPositions patternPositionsForNextStringPosition = new PatternPositions(patternElements.length);

        for (int currentStringPosition = 0; currentStringPosition < input.length(); currentStringPosition++) {
            char currentStringCharacter = characterNormalizer.normalize(input.charAt(currentStringPosition));
            patternPositionsForCurrentStringPosition.setStringPosition(currentStringPosition);
            patternPositionsForNextStringPosition.setStringPosition(currentStringPosition + 1);

            int patternPosition;
            while ((patternPosition = patternPositionsForCurrentStringPosition.next()) >= 0) {
                patternElements[patternPosition].processStringCharacter(
                    currentStringCharacter,
                    patternPosition,
                    patternPositionsForCurrentStringPosition,
                    patternPositionsForNextStringPosition);
            }

            PatternPositions tmp = patternPositionsForCurrentStringPosition;
            patternPositionsForCurrentStringPosition = patternPositionsForNextStringPosition;
            patternPositionsForNextStringPosition = tmp;
        }

        int patternPosition;
        while ((patternPosition = patternPositionsForCurrentStringPosition.next()) >= 0) {
            patternElements[patternPosition].processEndOfString(
                patternPosition,
                patternPositionsForCurrentStringPosition);
        }

        return patternPositionsForCurrentStringPosition.reachedEndOfPattern();
    }

    /**
     * Number of compiled elements (a bracket expression counts as one).
     */
    public int getElementCount() {
        return patternElements.length;
    }

    public boolean isCaseInsensitive() {
        return characterNormalizer.isCaseInsensitive();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("WildcardPatternMatcher[");
        for (PatternElement element : patternElements) {
            sb.append(element);
        }
        return sb.append(", ").append(characterNormalizer).append(']').toString();
    }
}
