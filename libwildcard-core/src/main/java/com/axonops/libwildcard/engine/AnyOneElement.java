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

/**
 * {@code ?}: consumes exactly one character.
 *
 * <p>Base class of the other single-character elements, which narrow the set of
 * characters accepted through {@link #accepts(char)}.
 */
class AnyOneElement extends PatternElement {

    boolean accepts(char c) {
        return true;
    }

    @Override
    final void processStringCharacter(
        char c,
        int patternPosition,
        PatternPositions currentStringPosition,
        PatternPositions nextStringPosition) {
        // (p, s) => (p + 1, s + 1)
        if (accepts(c)) {
            nextStringPosition.add(patternPosition + 1);
        }
    }

    @Override
    final void processEndOfString(int patternPosition, PatternPositions endOfStringPosition) {
        // cannot move beyond the end of the string
    }

    @Override
    public String toString() {
        return "?";
    }
}
