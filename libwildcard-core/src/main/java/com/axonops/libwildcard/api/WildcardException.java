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
 * Base exception for all wildcard pattern errors.
 *
 * Sealed class ensuring exhaustive handling of all error types.
 *
 * @since 1.0.0
 */
public sealed class WildcardException extends RuntimeException
    permits WildcardPatternException,
            WildcardConversionException {

    private final String pattern;
    private final String errorId;

    protected WildcardException(String pattern, String errorId, String message) {
        super(message);
        this.pattern = pattern;
        this.errorId = errorId;
    }

    protected WildcardException(String pattern, String errorId, String message, Throwable cause) {
        super(message, cause);
        this.pattern = pattern;
        this.errorId = errorId;
    }

    /**
     * The pattern text that caused the error.
     */
    public String getPattern() {
        return pattern;
    }

    /**
     * Stable identifier of the error condition, suitable for programmatic checks.
     */
    public String getErrorId() {
        return errorId;
    }

    static String truncate(String s) {
        return s != null && s.length() > 100 ? s.substring(0, 97) + "..." : s;
    }
}
