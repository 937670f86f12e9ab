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

import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Allocator backed by the Java heap. Released blocks are left to the garbage collector.
 */
public final class HeapAllocator implements JsonAllocator {
    public static final HeapAllocator INSTANCE = new HeapAllocator();

    /** Logger **/
    private static final Logger LOGGER = LoggerFactory.getLogger(HeapAllocator.class);

    private HeapAllocator() {
    }

    @Override
    public byte[] allocate(final int size) {
        if (size < 0) {
            return null;
        }
        try {
            return new byte[size];
        } catch (final OutOfMemoryError e) {
            LOGGER.warn("Unable to allocate {} bytes", Integer.valueOf(size), e);
            return null;
        }
    }

    @Override
    public void free(final byte[] block) {
    }

    @Override
    public byte[] reallocate(final byte[] block, final int size) {
        if (size < 0) {
            return null;
        }
        try {
            return Arrays.copyOf(block, size);
        } catch (final OutOfMemoryError e) {
            LOGGER.warn("Unable to reallocate {} bytes", Integer.valueOf(size), e);
            return null;
        }
    }

    @Override
    public void releaseNode() {
    }

    @Override
    public boolean reserveNode() {
        return true;
    }

    @Override
    public String toString() {
        return "HeapAllocator";
    }
}
