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
 * One compiled unit of a wildcard pattern.
 *
 * <p>An element only describes the NFA edges leaving its own position: given the
 * character at the current string position (or the end of the string), which pattern
 * positions become reachable at the same and at the next string position. Elements are
 * immutable and shared by all concurrent matches of a pattern.
 */
abstract class PatternElement {

    /**
     * Adds the successors of state (patternPosition, stringPosition) for input character
     * {@code c}.
     *
     * @param c normalized input character at the current string position
     * @param patternPosition index of this element
     * @param currentStringPosition positions reachable without consuming {@code c}
     * @param nextStringPosition positions reachable after consuming {@code c}
     */
    abstract void processStringCharacter(
        char c,
        int patternPosition,
        PatternPositions currentStringPosition,
        PatternPositions nextStringPosition);

    /**
     * Adds the successors of state (patternPosition, endOfString).
     */
    abstract void processEndOfString(int patternPosition, PatternPositions endOfStringPosition);
}
