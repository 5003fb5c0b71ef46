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
 * Thrown when a wildcard pattern is malformed.
 *
 * <p>Raised for an unterminated bracket expression, an inverted character range such as
 * {@code [z-a]}, or a regex rendering of the pattern that the JDK regex engine rejects.
 *
 * @since 1.0.0
 */
public final class WildcardPatternException extends WildcardException {

    public static final String ERROR_ID = "WildcardPattern_Invalid";

    public WildcardPatternException(String pattern, String message) {
        super(pattern, ERROR_ID,
            "Wildcard: Invalid pattern: " + message + " (pattern: " + truncate(pattern) + ")");
    }

    public WildcardPatternException(String pattern, String message, Throwable cause) {
        super(pattern, ERROR_ID,
            "Wildcard: Invalid pattern: " + message + " (pattern: " + truncate(pattern) + ")", cause);
    }
}
