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

import com.google.common.base.Preconditions;

/**
 * Heap allocator that keeps count of the live nodes and bytes it has handed out and refuses
 * requests beyond optional limits. Useful for constrained environments and for verifying that a
 * failed operation released everything it allocated.
 */
public final class BoundedAllocator implements JsonAllocator {
    public static final long UNLIMITED = Long.MAX_VALUE;

    private final long maxBytes;

    private final long maxNodes;

    private long liveBytes;

    private long liveNodes;

    /** number of successful block and node allocations **/
    private long allocations;

    /** number of refused requests **/
    private long failures;

    public BoundedAllocator() {
        this(UNLIMITED, UNLIMITED);
    }

    public BoundedAllocator(final long maxBytes, final long maxNodes) {
        Preconditions.checkArgument(maxBytes >= 0, "maxBytes must be non-negative");
        Preconditions.checkArgument(maxNodes >= 0, "maxNodes must be non-negative");
        this.maxBytes = maxBytes;
        this.maxNodes = maxNodes;
    }

    @Override
    public byte[] allocate(final int size) {
        if (size < 0 || size > maxBytes - liveBytes) {
            failures++;
            return null;
        }
        final byte[] block = HeapAllocator.INSTANCE.allocate(size);
        if (block == null) {
            failures++;
            return null;
        }
        liveBytes += size;
        allocations++;
        return block;
    }

    @Override
    public void free(final byte[] block) {
        if (block != null) {
            liveBytes -= block.length;
        }
    }

    public long getAllocations() {
        return allocations;
    }

    public long getFailures() {
        return failures;
    }

    public long getLiveBytes() {
        return liveBytes;
    }

    public long getLiveNodes() {
        return liveNodes;
    }

    public long getMaxBytes() {
        return maxBytes;
    }

    public long getMaxNodes() {
        return maxNodes;
    }

    @Override
    public void releaseNode() {
        liveNodes--;
    }

    @Override
    public boolean reserveNode() {
        if (liveNodes >= maxNodes) {
            failures++;
            return false;
        }
        liveNodes++;
        allocations++;
        return true;
    }

    @Override
    public String toString() {
        return "BoundedAllocator[liveBytes=" + liveBytes + ",liveNodes=" + liveNodes + ",maxBytes="
                + maxBytes + ",maxNodes=" + maxNodes + "]";
    }
}
