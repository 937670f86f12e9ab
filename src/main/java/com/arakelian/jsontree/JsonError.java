/*
 * Copyright 2012-2017 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.arakelian.jsontree;

/**
 * Reasons a parse or print operation can fail.
 */
public enum JsonError {
    NO_INPUT("No input"),

    MALFORMED_VALUE("Unrecognized value"),

    UNTERMINATED_STRING("Unterminated string"),

    INVALID_ESCAPE("Invalid character escape"),

    // bad surrogate pairing, zero code point or out-of-range code point
    INVALID_UNICODE_ESCAPE("Invalid unicode escape"),

    MALFORMED_NUMBER("Expected digit"),

    UNTERMINATED_CONTAINER("Unterminated array or object"),

    MISSING_MEMBER_NAME("Expected quoted string"),

    MISSING_NAME_SEPARATOR("Expected key,value separator ':'"),

    // only reported when full consumption of the input is required
    TRAILING_GARBAGE("Unexpected data after JSON value"),

    NESTING_TOO_DEEP("Maximum nesting depth exceeded"),

    ALLOCATION_FAILURE("Allocation failed"),

    BUFFER_OVERFLOW("Output does not fit into buffer"),

    INVALID_NODE("Node cannot be printed");

    private final String message;

    private JsonError(final String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
