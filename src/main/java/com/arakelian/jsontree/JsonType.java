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

public enum JsonType {
    // JSON null
    NULL,

    // JSON false
    FALSE,

    // JSON true
    TRUE,

    // JSON number, stored as a double with a saturated int mirror
    NUMBER,

    // JSON string, stored as UTF-8 bytes
    STRING,

    /**
     * Pre-serialized JSON fragment. The stored bytes are copied to the output verbatim, without
     * escaping; the parser never produces this type.
     */
    RAW,

    // Ordered list of unnamed members
    ARRAY,

    // Ordered list of named members
    OBJECT;

    public final boolean isBoolean() {
        return this == FALSE || this == TRUE;
    }

    public final boolean isContainer() {
        return this == ARRAY || this == OBJECT;
    }
}
