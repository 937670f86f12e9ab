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
 * Allocation strategy used by a {@link JsonContext} for every node, text payload, key and output
 * buffer it creates. Implementations report exhaustion by returning <code>null</code> (or
 * <code>false</code> for nodes) and must never throw.
 */
public interface JsonAllocator {
    /**
     * Returns a new zero-filled block of exactly <code>size</code> bytes.
     *
     * @param size
     *            number of bytes requested
     * @return new block, or null if the request cannot be satisfied
     */
    @Nullable
    public byte[] allocate(int size);

    /**
     * Releases a block previously returned by {@link #allocate(int)} or
     * {@link #reallocate(byte[], int)}.
     *
     * @param block
     *            block to release
     */
    public void free(byte[] block);

    /**
     * Returns a block of <code>size</code> bytes holding the leading content of
     * <code>block</code>. On success the old block has been released; on failure it is left
     * untouched and still belongs to the caller.
     *
     * @param block
     *            existing block
     * @param size
     *            new size in bytes
     * @return new block, or null if the request cannot be satisfied
     */
    @Nullable
    public default byte[] reallocate(final byte[] block, final int size) {
        final byte[] resized = allocate(size);
        if (resized == null) {
            return null;
        }
        System.arraycopy(block, 0, resized, 0, Math.min(block.length, size));
        free(block);
        return resized;
    }

    /**
     * Accounts for a new tree node.
     *
     * @return true if the node may be created
     */
    public boolean reserveNode();

    /**
     * Releases a node previously accounted for by {@link #reserveNode()}.
     */
    public void releaseNode();
}
