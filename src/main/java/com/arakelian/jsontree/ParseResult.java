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

import com.arakelian.jsontree.JsonParser.JsonParseException;
import com.google.common.base.Preconditions;

/**
 * Outcome of a parse: the root node and the position after it, or the reason and position of the
 * first failure.
 */
@Value.Immutable(copy = false)
public abstract class ParseResult {
    static ParseResult failure(final JsonError error, final int position, final String message) {
        return ImmutableParseResult.builder() //
                .error(error) //
                .position(position) //
                .message(message) //
                .build();
    }

    static ParseResult success(final JsonNode node, final int end) {
        return ImmutableParseResult.builder() //
                .node(node) //
                .position(end) //
                .build();
    }

    @Nullable
    public abstract JsonError getError();

    @Nullable
    public abstract String getMessage();

    @Nullable
    @Value.Auxiliary
    public abstract JsonNode getNode();

    /**
     * Returns the root node, converting a failure into an exception.
     *
     * @return root node
     * @throws JsonParseException
     *             if the parse failed
     */
    public final JsonNode getOrThrow() throws JsonParseException {
        if (!isSuccess()) {
            throw new JsonParseException(getMessage(), getError(), getPosition());
        }
        return getNode();
    }

    /**
     * Returns the position after the parsed value on success, or the position of the first
     * offending byte on failure.
     *
     * @return byte position
     */
    public abstract int getPosition();

    public final boolean isSuccess() {
        return getError() == null;
    }

    @Value.Check
    protected void check() {
        Preconditions.checkState(getError() != null ^ getNode() != null, "exactly one of node and error must be set");
    }
}
