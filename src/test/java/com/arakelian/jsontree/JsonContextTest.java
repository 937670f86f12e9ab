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

public class JsonContextTest {
    private static final String DOCUMENT = "{\"a\":[1,\"x\"],\"b\":{\"c\":true,\"d\":\"text\"}}";

    private static JsonNode parse(final JsonContext context, final String json) {
        final ParseResult result = new JsonParser(context).parse(json);
        Assertions.assertTrue(result.isSuccess(), result::getMessage);
        return result.getNode();
    }

    @Test
    public void testConstantKeys() {
        final BoundedAllocator allocator = new BoundedAllocator();
        final JsonContext context = new JsonContext(allocator);
        final byte[] name = "const".getBytes(StandardCharsets.UTF_8);

        final JsonNode object = context.createObject();
        context.addItemToObjectCS(object, name, context.createNumber(1));
        Assertions.assertEquals(0, allocator.getLiveBytes());

        final JsonNode member = object.getObjectItem("CONST");
        Assertions.assertTrue(member.hasConstantKey());
        Assertions.assertEquals("const", member.getKey());
        Assertions.assertEquals("{\"const\":1}", object.toString());

        final JsonNode copy = context.duplicate(object, true);
        Assertions.assertTrue(copy.getFirstChild().hasConstantKey());
        Assertions.assertEquals(0, allocator.getLiveBytes());

        context.delete(copy);
        context.delete(object);
        Assertions.assertEquals(0, allocator.getLiveNodes());
        Assertions.assertEquals(0, allocator.getLiveBytes());
        Assertions.assertEquals("const", new String(name, StandardCharsets.UTF_8));
    }

    @Test
    public void testCreate() {
        final JsonContext context = new JsonContext();
        Assertions.assertEquals(JsonType.NULL, context.createNull().getType());
        Assertions.assertEquals(JsonType.TRUE, context.createTrue().getType());
        Assertions.assertEquals(JsonType.FALSE, context.createFalse().getType());
        Assertions.assertEquals(JsonType.TRUE, context.createBool(true).getType());
        Assertions.assertEquals(JsonType.FALSE, context.createBool(false).getType());
        Assertions.assertEquals(JsonType.ARRAY, context.createArray().getType());
        Assertions.assertEquals(JsonType.OBJECT, context.createObject().getType());

        final JsonNode number = context.createNumber(-7.5);
        Assertions.assertEquals(-7.5, number.getNumber());
        Assertions.assertEquals(-7, number.getInt());

        final JsonNode raw = context.createRaw("{\"pre\":1}");
        Assertions.assertTrue(raw.isRaw());
        Assertions.assertEquals("{\"pre\":1}", raw.getString());

        final JsonNode string = context.createString("café");
        Assertions.assertEquals(5, string.getValueBytes().length);

        final JsonNode object = context.createObject();
        Assertions.assertTrue(context.addItemToObject(object, "n", number));
        Assertions.assertTrue(context.addItemToObject(object, "s", string));
        Assertions.assertTrue(context.addItemToObject(object, "r", raw));
        Assertions.assertEquals("{\"n\":-7.500000,\"s\":\"café\",\"r\":{\"pre\":1}}", object.toString());
    }

    @Test
    public void testCreateFailures() {
        final BoundedAllocator bytes = new BoundedAllocator(2, BoundedAllocator.UNLIMITED);
        final JsonContext context = new JsonContext(bytes);
        Assertions.assertNull(context.createString("hello"));
        Assertions.assertEquals(JsonError.ALLOCATION_FAILURE, context.getLastError());
        Assertions.assertEquals(-1, context.getLastErrorPosition());
        Assertions.assertEquals(0, bytes.getLiveNodes());
        Assertions.assertNull(context.createStringArray("a", "b", "c"));
        Assertions.assertEquals(0, bytes.getLiveNodes());
        Assertions.assertEquals(0, bytes.getLiveBytes());

        final JsonNode object = context.createObject();
        final JsonNode item = context.createNull();
        Assertions.assertFalse(context.addItemToObject(object, "long name", item));
        Assertions.assertNull(object.getFirstChild());
        Assertions.assertTrue(context.addItemToObject(object, "ok", item));

        final BoundedAllocator nodes = new BoundedAllocator(BoundedAllocator.UNLIMITED, 2);
        final JsonContext small = new JsonContext(nodes);
        Assertions.assertNull(small.createIntArray(1, 2, 3));
        Assertions.assertEquals(0, nodes.getLiveNodes());
        final JsonNode ints = small.createIntArray(1);
        Assertions.assertNotNull(ints);
        Assertions.assertNull(small.createReference(ints));
        Assertions.assertEquals(JsonError.ALLOCATION_FAILURE, small.getLastError());
    }

    @Test
    public void testDeleteReleasesEverything() {
        final BoundedAllocator allocator = new BoundedAllocator();
        final JsonContext context = new JsonContext(allocator);
        final JsonNode root = parse(context, DOCUMENT);
        Assertions.assertEquals(7, allocator.getLiveNodes());
        Assertions.assertTrue(allocator.getLiveBytes() > 0);

        Assertions.assertTrue(context.addItemToObject(root, "extra", context.createStringArray("p", "q")));
        context.delete(root);
        Assertions.assertEquals(0, allocator.getLiveNodes());
        Assertions.assertEquals(0, allocator.getLiveBytes());

        context.delete(null);
    }

    @Test
    public void testDeleteRequiresDetachedNode() {
        final JsonContext context = new JsonContext();
        final JsonNode array = parse(context, "[1,2]");
        Assertions.assertThrows(IllegalArgumentException.class, () -> context.delete(array.getArrayItem(0)));
        Assertions.assertThrows(IllegalArgumentException.class, () -> context.delete(array.getArrayItem(1)));
        Assertions.assertEquals("[1,2]", array.toString());

        // a sole member is linked even though it has no siblings
        final JsonNode single = parse(context, "[1]");
        Assertions.assertThrows(IllegalArgumentException.class, () -> context.delete(single.getArrayItem(0)));
        Assertions.assertEquals("[1]", single.toString());
        context.delete(single.detachItemFromArray(0));
        Assertions.assertEquals("[]", single.toString());
    }

    @Test
    public void testDeleteItems() {
        final BoundedAllocator allocator = new BoundedAllocator();
        final JsonContext context = new JsonContext(allocator);
        final JsonNode root = parse(context, DOCUMENT);

        context.deleteItemFromArray(root.getObjectItem("a"), 1);
        Assertions.assertEquals("{\"a\":[1],\"b\":{\"c\":true,\"d\":\"text\"}}", root.toString());
        context.deleteItemFromObject(root, "B");
        Assertions.assertEquals("{\"a\":[1]}", root.toString());
        context.deleteItemFromObject(root, "missing");
        context.deleteItemFromArray(root.getObjectItem("a"), 5);

        Assertions.assertEquals(3, allocator.getLiveNodes());
        Assertions.assertEquals(1, allocator.getLiveBytes());
    }

    @Test
    public void testDuplicate() {
        final JsonContext context = new JsonContext();
        final JsonNode original = parse(context, DOCUMENT);

        final JsonNode copy = context.duplicate(original, true);
        Assertions.assertEquals(original.toString(), copy.toString());
        Assertions.assertNotSame(original.getFirstChild(), copy.getFirstChild());
        copy.getObjectItem("a").addItemToArray(context.createNull());
        Assertions.assertEquals(DOCUMENT, original.toString());

        final JsonNode shallow = context.duplicate(original, false);
        Assertions.assertTrue(shallow.isObject());
        Assertions.assertNull(shallow.getFirstChild());
        Assertions.assertEquals("{}", shallow.toString());

        final JsonNode member = context.duplicate(original.getObjectItem("b"), true);
        Assertions.assertEquals("b", member.getKey());
        Assertions.assertNull(member.getPrevious());
        Assertions.assertNull(member.getNext());
    }

    @Test
    public void testDuplicateFailureReleasesPartialCopy() {
        final BoundedAllocator allocator = new BoundedAllocator(BoundedAllocator.UNLIMITED, 8);
        final JsonContext context = new JsonContext(allocator);
        final JsonNode original = parse(context, "[1,2,3,4,5]");
        Assertions.assertEquals(6, allocator.getLiveNodes());

        Assertions.assertNull(context.duplicate(original, true));
        Assertions.assertEquals(JsonError.ALLOCATION_FAILURE, context.getLastError());
        Assertions.assertEquals(6, allocator.getLiveNodes());
    }

    @Test
    public void testDuplicateOfReference() {
        final JsonContext context = new JsonContext();
        final JsonNode target = parse(context, "[1,{\"k\":\"v\"}]");
        final JsonNode copy = context.duplicate(context.createReference(target), true);
        Assertions.assertFalse(copy.isReference());
        Assertions.assertEquals("[1,{\"k\":\"v\"}]", copy.toString());

        copy.addItemToArray(context.createTrue());
        Assertions.assertEquals(2, target.getArraySize());
    }

    @Test
    public void testOwnedKeyIsReleased() {
        final BoundedAllocator allocator = new BoundedAllocator();
        final JsonContext context = new JsonContext(allocator);
        final JsonNode first = context.createObject();
        final JsonNode second = context.createObject();

        Assertions.assertTrue(context.addItemToObject(first, "first", context.createNull()));
        Assertions.assertEquals(5, allocator.getLiveBytes());

        final JsonNode moved = first.detachItemFromObject("first");
        Assertions.assertTrue(context.addItemToObject(second, "second", moved));
        Assertions.assertEquals(6, allocator.getLiveBytes());
        Assertions.assertEquals("{\"second\":null}", second.toString());
    }

    @Test
    public void testReferences() {
        final BoundedAllocator allocator = new BoundedAllocator();
        final JsonContext context = new JsonContext(allocator);
        final JsonNode target = parse(context, "[\"a\",\"b\"]");
        final long targetBytes = allocator.getLiveBytes();

        final JsonNode container = context.createObject();
        Assertions.assertTrue(context.addItemReferenceToObject(container, "ref", target));
        Assertions.assertTrue(context.addItemReferenceToObject(container, "again", target));
        Assertions.assertEquals(6, allocator.getLiveNodes());
        Assertions.assertEquals("{\"ref\":[\"a\",\"b\"],\"again\":[\"a\",\"b\"]}", container.toString());

        // deleting the container releases the references and their keys, never the target
        context.delete(container);
        Assertions.assertEquals(3, allocator.getLiveNodes());
        Assertions.assertEquals(targetBytes, allocator.getLiveBytes());
        Assertions.assertEquals("[\"a\",\"b\"]", target.toString());

        context.delete(target);
        Assertions.assertEquals(0, allocator.getLiveNodes());
        Assertions.assertEquals(0, allocator.getLiveBytes());
    }

    @Test
    public void testReplace() {
        final BoundedAllocator allocator = new BoundedAllocator();
        final JsonContext context = new JsonContext(allocator);
        final JsonNode array = parse(context, "[1,2,3]");

        Assertions.assertTrue(context.replaceItemInArray(array, 1, context.createString("two")));
        Assertions.assertEquals("[1,\"two\",3]", array.toString());
        Assertions.assertEquals(4, allocator.getLiveNodes());
        Assertions.assertEquals(3, allocator.getLiveBytes());
        Assertions.assertSame(array.getArrayItem(2), array.getArrayItem(1).getNext());
        Assertions.assertSame(array.getArrayItem(1), array.getArrayItem(2).getPrevious());

        final JsonNode unused = context.createNull();
        Assertions.assertFalse(context.replaceItemInArray(array, 3, unused));
        context.delete(unused);

        final JsonNode object = parse(context, "{\"a\":1,\"b\":2}");
        Assertions.assertTrue(context.replaceItemInObject(object, "B", context.createTrue()));
        Assertions.assertEquals("{\"a\":1,\"B\":true}", object.toString());
        Assertions.assertTrue(context.replaceItemInObject(object, "a", context.createFalse()));
        Assertions.assertEquals("{\"a\":false,\"B\":true}", object.toString());
        Assertions.assertFalse(context.replaceItemInObject(object, "missing", context.createNull()));
    }

    @Test
    public void testTypedArrays() {
        final JsonContext context = new JsonContext();
        Assertions.assertEquals("[1,2,3]", context.createIntArray(1, 2, 3).toString());
        Assertions.assertEquals("[0.500000,1.000000e+100]", context.createDoubleArray(0.5, 1e100).toString());
        Assertions.assertEquals("[1.500000]", context.createFloatArray(1.5f).toString());
        Assertions.assertEquals("[\"a\",\"b\"]", context.createStringArray("a", "b").toString());
        Assertions.assertEquals("[]", context.createIntArray().toString());
    }
}
