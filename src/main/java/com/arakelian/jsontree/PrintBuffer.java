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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only output buffer shared by the printer and the codec. Content is always followed by a
 * 0 terminator, so every write reserves one byte more than it emits.
 *
 * <p>
 * A growable buffer doubles the required size through its allocator when it runs out of room; a
 * fixed buffer wraps caller storage and refuses to grow, so it can never write at or beyond its
 * capacity.
 * </p>
 */
final class PrintBuffer {
    /** largest array size the VM reliably allocates **/
    static final int MAX_SIZE = Integer.MAX_VALUE - 8;

    /** Logger **/
    private static final Logger LOGGER = LoggerFactory.getLogger(PrintBuffer.class);

    /**
     * Returns a buffer that grows on demand.
     *
     * @param allocator
     *            allocator for the storage
     * @param capacity
     *            initial capacity
     * @return new buffer, or null if the initial storage could not be allocated
     */
    @Nullable
    static PrintBuffer growable(final JsonAllocator allocator, final int capacity) {
        final byte[] storage = allocator.allocate(capacity);
        if (storage == null) {
            return null;
        }
        return new PrintBuffer(allocator, storage, capacity, false);
    }

    /**
     * Returns a buffer over caller storage that never grows.
     *
     * @param storage
     *            destination
     * @param capacity
     *            number of usable bytes at the start of <code>storage</code>
     * @return new buffer
     */
    static PrintBuffer fixed(final byte[] storage, final int capacity) {
        return new PrintBuffer(null, storage, capacity, true);
    }

    private final JsonAllocator allocator;

    private byte[] buffer;

    /** usable capacity **/
    private int length;

    /** end of content, where the terminator lives **/
    private int offset;

    private final boolean noAlloc;

    private PrintBuffer(final JsonAllocator allocator, final byte[] buffer, final int length, final boolean noAlloc) {
        this.allocator = allocator;
        this.buffer = buffer;
        this.length = length;
        this.noAlloc = noAlloc;
    }

    void advance(final int count) {
        offset += count;
    }

    /**
     * Appends ASCII text followed by the terminator.
     *
     * @param text
     *            text to append
     * @return false if the buffer could not make room
     */
    boolean append(final String text) {
        final int count = text.length();
        final int pos = ensure(count + 1);
        if (pos < 0) {
            return false;
        }
        for (int i = 0; i < count; i++) {
            buffer[pos + i] = (byte) text.charAt(i);
        }
        buffer[pos + count] = 0;
        offset += count;
        return true;
    }

    /**
     * Appends the given bytes verbatim, followed by the terminator.
     *
     * @param bytes
     *            bytes to append
     * @return false if the buffer could not make room
     */
    boolean append(final byte[] bytes) {
        final int pos = ensure(bytes.length + 1);
        if (pos < 0) {
            return false;
        }
        System.arraycopy(bytes, 0, buffer, pos, bytes.length);
        buffer[pos + bytes.length] = 0;
        offset += bytes.length;
        return true;
    }

    /**
     * Appends <code>count</code> copies of a byte, followed by the terminator.
     *
     * @param b
     *            byte to repeat
     * @param count
     *            number of copies
     * @return false if the buffer could not make room
     */
    boolean appendRepeated(final byte b, final int count) {
        final int pos = ensure(count + 1);
        if (pos < 0) {
            return false;
        }
        for (int i = 0; i < count; i++) {
            buffer[pos + i] = b;
        }
        buffer[pos + count] = 0;
        offset += count;
        return true;
    }

    byte[] buffer() {
        return buffer;
    }

    /**
     * Guarantees that <code>needed</code> bytes can be written at the current offset.
     *
     * @param needed
     *            number of bytes about to be written
     * @return index in {@link #buffer()} where writing may start, or -1 if the room cannot be
     *         provided. The storage may have moved, so {@link #buffer()} must be read again.
     */
    int ensure(final int needed) {
        if (buffer == null || needed < 0) {
            return -1;
        }

        final long required = (long) offset + needed;
        if (required <= length) {
            return offset;
        }
        if (noAlloc) {
            return -1;
        }
        if (required > MAX_SIZE) {
            return -1;
        }

        final int newSize = (int) Math.min(required * 2, MAX_SIZE);
        final byte[] resized = allocator.reallocate(buffer, newSize);
        if (resized == null) {
            return -1;
        }
        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("Grew print buffer from {} to {} bytes", Integer.valueOf(length), Integer.valueOf(newSize));
        }
        buffer = resized;
        length = newSize;
        return offset;
    }

    boolean isGrowable() {
        return !noAlloc;
    }

    int length() {
        return length;
    }

    int offset() {
        return offset;
    }

    /**
     * Returns the storage of a growable buffer to its allocator.
     */
    void release() {
        if (!noAlloc && buffer != null) {
            allocator.free(buffer);
        }
        buffer = null;
        length = 0;
        offset = 0;
    }

    /**
     * Recomputes the end of content by scanning forward from the current offset to the
     * terminator. Used after text was written at the offset without advancing it.
     */
    void update() {
        int pos = offset;
        while (pos < length && buffer[pos] != 0) {
            pos++;
        }
        offset = pos;
    }
}
