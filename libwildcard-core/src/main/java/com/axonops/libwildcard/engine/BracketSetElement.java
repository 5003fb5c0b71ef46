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

import java.util.Arrays;

/**
 * {@code [...]}: consumes one character that is one of the listed literals or falls in
 * one of the listed ranges.
 *
 * <p>Literals are stored normalized and sorted, so membership is a binary search. Range
 * endpoints are stored as written; under case-insensitive matching a character is also
 * tried in its upper-case form so that {@code [A-Z]} accepts lower-case input.
 */
final class BracketSetElement extends AnyOneElement {

    private final char[] literals;
    private final char[] rangeStarts;
    private final char[] rangeEnds;
    private final CharacterNormalizer normalizer;

    private BracketSetElement(char[] literals, char[] rangeStarts, char[] rangeEnds, CharacterNormalizer normalizer) {
        this.literals = literals;
        this.rangeStarts = rangeStarts;
        this.rangeEnds = rangeEnds;
        this.normalizer = normalizer;
    }

    @Override
    boolean accepts(char c) {
        if (contains(c)) {
            return true;
        }
        if (normalizer.isCaseInsensitive()) {
            char upper = normalizer.toUpperCase(c);
            return upper != c && inRange(upper);
        }
        return false;
    }

    private boolean contains(char c) {
        return Arrays.binarySearch(literals, c) >= 0 || inRange(c);
    }

    private boolean inRange(char c) {
        for (int i = 0; i < rangeStarts.length; i++) {
            if (rangeStarts[i] <= c && c <= rangeEnds[i]) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (char literal : literals) {
            sb.append(literal);
        }
        for (int i = 0; i < rangeStarts.length; i++) {
            sb.append(rangeStarts[i]).append('-').append(rangeEnds[i]);
        }
        return sb.append(']').toString();
    }

    /**
     * Collects the contents of one bracket expression.
     */
    static final class Builder {
        private final CharacterNormalizer normalizer;
        private final StringBuilder literals = new StringBuilder();
        private final StringBuilder rangeStarts = new StringBuilder();
        private final StringBuilder rangeEnds = new StringBuilder();

        Builder(CharacterNormalizer normalizer) {
            this.normalizer = normalizer;
        }

        Builder addLiteral(char c) {
            literals.append(normalizer.normalize(c));
            return this;
        }

        Builder addRange(char start, char end) {
            rangeStarts.append(start);
            rangeEnds.append(end);
            return this;
        }

        BracketSetElement build() {
            char[] sortedLiterals = literals.toString().toCharArray();
            Arrays.sort(sortedLiterals);
            return new BracketSetElement(
                sortedLiterals,
                rangeStarts.toString().toCharArray(),
                rangeEnds.toString().toCharArray(),
                normalizer);
        }
    }
}
