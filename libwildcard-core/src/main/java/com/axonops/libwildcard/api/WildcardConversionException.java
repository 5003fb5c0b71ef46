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
 * Thrown when a valid wildcard pattern cannot be expressed in a target format.
 *
 * <p>Callers typically catch this to fall back to client-side filtering with
 * {@link WildcardPattern#isMatch(String)}.
 *
 * @since 1.0.0
 */
public final class WildcardConversionException extends WildcardException {

    public static final String WQL_ERROR_ID = "UnsupportedWildcardToWqlConversion";

    private final String targetFormat;

    public WildcardConversionException(String pattern, String targetFormat, String errorId) {
        super(pattern, errorId,
            "Wildcard: Pattern cannot be converted to " + targetFormat + " without client-side filtering (pattern: "
                + truncate(pattern) + ")");
        this.targetFormat = targetFormat;
    }

    public String getTargetFormat() {
        return targetFormat;
    }
}
