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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class PrintBufferTest {
    private static String content(final PrintBuffer buffer) {
        return new String(buffer.buffer(), 0, buffer.offset(), StandardCharsets.US_ASCII);
    }

    @Test
    public void testEnsureWithinCapacity() {
        final PrintBuffer buffer = PrintBuffer.growable(HeapAllocator.INSTANCE, 16);
        final byte[] storage = buffer.buffer();
        Assertions.assertEquals(0, buffer.ensure(16));
        Assertions.assertSame(storage, buffer.buffer());
        Assertions.assertEquals(16, buffer.length());
        Assertions.assertEquals(-1, buffer.ensure(-1));
    }

    @Test
    public void testFixedNeverGrows() {
        final byte[] storage = new byte[8];
        final PrintBuffer buffer = PrintBuffer.fixed(storage, 6);
        Assertions.assertFalse(buffer.isGrowable());
        Assertions.assertTrue(buffer.append("abcde"));
        Assertions.assertEquals("abcde", content(buffer));
        Assertions.assertEquals(0, storage[5]);

        Assertions.assertFalse(buffer.append("f"));
        Assertions.assertEquals(-1, buffer.ensure(2));
        Assertions.assertEquals(5, buffer.offset());
        Assertions.assertEquals(0, storage[6]);
        Assertions.assertEquals(0, storage[7]);
    }

    @Test
    public void testGrowth() {
        final BoundedAllocator allocator = new BoundedAllocator();
        final PrintBuffer buffer = PrintBuffer.growable(allocator, 4);
        Assertions.assertTrue(buffer.isGrowable());
        Assertions.assertTrue(buffer.append("hello"));
        Assertions.assertEquals(12, buffer.length());
        Assertions.assertEquals(12, allocator.getLiveBytes());
        Assertions.assertEquals("hello", content(buffer));

        Assertions.assertTrue(buffer.appendRepeated((byte) '\t', 3));
        Assertions.assertTrue(buffer.append(", world".getBytes(StandardCharsets.US_ASCII)));
        Assertions.assertEquals("hello\t\t\t, world", content(buffer));
        Assertions.assertEquals(0, buffer.buffer()[buffer.offset()]);

        buffer.release();
        Assertions.assertEquals(0, allocator.getLiveBytes());
        Assertions.assertEquals(-1, buffer.ensure(1));
    }

    @Test
    public void testGrowthRefused() {
        final BoundedAllocator allocator = new BoundedAllocator(10, BoundedAllocator.UNLIMITED);
        final PrintBuffer buffer = PrintBuffer.growable(allocator, 4);
        Assertions.assertTrue(buffer.append("abc"));
        Assertions.assertFalse(buffer.append("defg"));
        Assertions.assertEquals("abc", content(buffer));
        Assertions.assertEquals(4, allocator.getLiveBytes());

        Assertions.assertNull(PrintBuffer.growable(allocator, 100));
        Assertions.assertEquals(-1, PrintBuffer.growable(HeapAllocator.INSTANCE, 1).ensure(Integer.MAX_VALUE));
    }

    @Test
    public void testUpdate() {
        final PrintBuffer buffer = PrintBuffer.growable(HeapAllocator.INSTANCE, 16);
        Assertions.assertTrue(buffer.append("x"));
        final int pos = buffer.ensure(4);
        final byte[] storage = buffer.buffer();
        storage[pos] = 'a';
        storage[pos + 1] = 'b';
        storage[pos + 2] = 'c';
        storage[pos + 3] = 0;
        Assertions.assertEquals(1, buffer.offset());
        buffer.update();
        Assertions.assertEquals(4, buffer.offset());
        Assertions.assertEquals("xabc", content(buffer));
    }
}
