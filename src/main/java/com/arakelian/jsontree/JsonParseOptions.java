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

import org.immutables.value.Value;

import com.google.common.base.Preconditions;

@Value.Immutable(copy = false)
@Value.Style(get = { "is*", "get*" })
public abstract class JsonParseOptions {
    /** Default nesting limit **/
    public static final int DEFAULT_MAX_DEPTH = 1000;

    private static final JsonParseOptions DEFAULTS = ImmutableJsonParseOptions.builder().build();

    public static JsonParseOptions defaults() {
        return DEFAULTS;
    }

    /**
     * Returns the deepest nesting of arrays and objects the parser accepts.
     *
     * @return maximum nesting depth
     */
    @Value.Default
    public int getMaxDepth() {
        return DEFAULT_MAX_DEPTH;
    }

    /**
     * Returns true if anything but whitespace after the top-level value is an error.
     *
     * @return true if the whole input must be consumed
     */
    @Value.Default
    public boolean isRequireFullConsumption() {
        return false;
    }

    @Value.Check
    protected void check() {
        Preconditions.checkState(getMaxDepth() > 0, "maxDepth must be positive");
    }
}
