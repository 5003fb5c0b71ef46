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
 * The set of pattern positions reachable at one string position (one NFA frontier).
 *
 * <p>Positions waiting to be processed are kept on a stack bounded by the pattern length.
 * Duplicates are suppressed with a per-position stamp holding the string position at
 * which the pattern position was last added; moving to another string position therefore
 * needs no clearing, only a new stamp value.
 *
 * <p>Two instances are rotated for the whole scan of one input string. Not thread-safe.
 */
final class PatternPositions {

    private final int lengthOfPattern;

    // index: pattern position (0..lengthOfPattern), value: string position of last visit
    private final int[] visitedAtStringPosition;

    private final int[] pendingPatternPositions;
    private int pendingCount;

    private int stringPosition;

    PatternPositions(int lengthOfPattern) {
        this.lengthOfPattern = lengthOfPattern;
        this.visitedAtStringPosition = new int[lengthOfPattern + 1];
        Arrays.fill(visitedAtStringPosition, -1);
        this.pendingPatternPositions = new int[lengthOfPattern];
        this.pendingCount = 0;
    }

    void setStringPosition(int stringPosition) {
        this.stringPosition = stringPosition;
    }

    /**
     * Adds {@code patternPosition} unless it is already present for the current string position.
     * The end-of-pattern position is recorded but never queued, since no element follows it.
     */
    void add(int patternPosition) {
        if (visitedAtStringPosition[patternPosition] == stringPosition) {
            return;
        }
        visitedAtStringPosition[patternPosition] = stringPosition;

        if (patternPosition < lengthOfPattern) {
            pendingPatternPositions[pendingCount++] = patternPosition;
        }
    }

    /**
     * Pops the next pattern position to process.
     *
     * @return pattern position, or -1 when none is left
     */
    int next() {
        if (pendingCount == 0) {
            return -1;
        }
        return pendingPatternPositions[--pendingCount];
    }

    boolean reachedEndOfPattern() {
        return visitedAtStringPosition[lengthOfPattern] == stringPosition;
    }
}
