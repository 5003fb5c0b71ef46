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
 * A literal character, already normalized at compile time.
 */
final class LiteralElement extends AnyOneElement {

    private final char literal;

    LiteralElement(char literal) {
        this.literal = literal;
    }

    @Override
    boolean accepts(char c) {
        return literal == c;
    }

    @Override
    public String toString() {
        return String.valueOf(literal);
    }
}
