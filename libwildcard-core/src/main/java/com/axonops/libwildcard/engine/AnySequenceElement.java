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
 * {@code *}: consumes any number of characters, including none.
 */
final class AnySequenceElement extends PatternElement {

    @Override
    void processStringCharacter(
        char c,
        int patternPosition,
        PatternPositions currentStringPosition,
        PatternPositions nextStringPosition) {
        // (p, s) => (p + 1, s): the sequence ends here
        currentStringPosition.add(patternPosition + 1);

        // (p, s) => (p, s + 1): the sequence swallows c
        nextStringPosition.add(patternPosition);
    }

    @Override
    void processEndOfString(int patternPosition, PatternPositions endOfStringPosition) {
        // (p, end) => (p + 1, end)
        endOfStringPosition.add(patternPosition + 1);
    }

    @Override
    public String toString() {
        return "*";
    }
}
