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

import java.nio.charset.StandardCharsets;

import org.immutables.value.Value;

import com.google.common.base.Preconditions;

/**
 * Outcome of printing a tree: the serialized bytes, or the reason printing failed. Partial output
 * is never returned.
 */
@Value.Immutable(copy = false)
public abstract class PrintResult {
    static PrintResult failure(final JsonError error) {
        return ImmutablePrintResult.builder().error(error).build();
    }

    static PrintResult success(final byte[] bytes) {
        return ImmutablePrintResult.builder().bytes(bytes).build();
    }

    /**
     * Returns the UTF-8 serialization, without a terminator.
     *
     * @return serialized bytes, or null on failure
     */
    @Nullable
    public abstract byte[] getBytes();

    @Nullable
    public abstract JsonError getError();

    public final int getLength() {
        final byte[] bytes = getBytes();
        return bytes != null ? bytes.length : 0;
    }

    /**
     * Returns the serialization as a string.
     *
     * @return decoded text, or null on failure
     */
    @Nullable
    public final String getText() {
        final byte[] bytes = getBytes();
        return bytes != null ? new String(bytes, StandardCharsets.UTF_8) : null;
    }

    public final boolean isSuccess() {
        return getError() == null;
    }

    @Value.Check
    protected void check() {
        Preconditions.checkState(getError() != null ^ getBytes() != null, "exactly one of bytes and error must be set");
    }
}
