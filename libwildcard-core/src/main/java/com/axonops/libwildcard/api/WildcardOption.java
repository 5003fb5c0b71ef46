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

package com.axonops.libwildcard.api;

/**
 * Options that modify how a {@link WildcardPattern} matches.
 *
 * <p>Options are combined as a set; an empty set means case-sensitive, culture-aware
 * matching with no hints.
 *
 * @since 1.0.0
 */
public enum WildcardOption {

    /**
     * Performance hint only. Has no effect on match results.
     */
    COMPILED,

    /**
     * Case-insensitive matching. Characters are folded to lower case using the default
     * locale, or {@link java.util.Locale#ROOT} when combined with {@link #CULTURE_INVARIANT}.
     */
    IGNORE_CASE,

    /**
     * Culture-invariant case folding.
     */
    CULTURE_INVARIANT
}
