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

import com.google.common.base.Preconditions;

/**
 * Carries the allocation strategy and the error slot used by parse and print operations, and
 * creates, copies and destroys nodes.
 *
 * <p>
 * Factory methods return <code>null</code> when the allocator refuses a request; the failure is
 * also recorded in the error slot. A tree must be created and destroyed with the same context.
 * Contexts are not thread safe; use one per thread.
 * </p>
 */
public final class JsonContext {
    private final JsonAllocator allocator;

    /** last failure recorded by an operation on this context **/
    private JsonError lastError;

    /** byte position of {@link #lastError}, or -1 if it has none **/
    private int lastErrorPosition = -1;

    public JsonContext() {
        this(HeapAllocator.INSTANCE);
    }

    public JsonContext(final JsonAllocator allocator) {
        Preconditions.checkArgument(allocator != null, "allocator must be non-null");
        this.allocator = allocator;
    }

    /**
     * Adds a node to an object under a copy of the given name. Any owned key the node had before
     * is released.
     *
     * @param object
     *            object node
     * @param name
     *            member name
     * @param item
     *            standalone node
     * @return false if the key could not be allocated
     */
    public boolean addItemToObject(final JsonNode object, final String name, final JsonNode item) {
        Preconditions.checkArgument(object != null, "object must be non-null");
        Preconditions.checkArgument(name != null, "name must be non-null");
        Preconditions.checkState(object.isObject(), "not an object: %s", object.getType());
        object.checkStandalone(item);

        final byte[] key = copyOf(name.getBytes(StandardCharsets.UTF_8));
        if (key == null) {
            return false;
        }
        replaceKey(item, key, false);
        object.append(item);
        return true;
    }

    /**
     * Adds a node to an object under a caller-owned name. The tree borrows the array and never
     * releases it, so it must stay unchanged while the node is alive.
     *
     * @param object
     *            object node
     * @param name
     *            UTF-8 member name
     * @param item
     *            standalone node
     */
    public void addItemToObjectCS(final JsonNode object, final byte[] name, final JsonNode item) {
        Preconditions.checkArgument(object != null, "object must be non-null");
        Preconditions.checkArgument(name != null, "name must be non-null");
        Preconditions.checkState(object.isObject(), "not an object: %s", object.getType());
        object.checkStandalone(item);
        replaceKey(item, name, true);
        object.append(item);
    }

    /**
     * Appends a reference to <code>item</code> to an array; <code>item</code> itself is not
     * linked and stays owned by the caller.
     *
     * @param array
     *            array node
     * @param item
     *            node to reference
     * @return false if the reference could not be allocated
     */
    public boolean addItemReferenceToArray(final JsonNode array, final JsonNode item) {
        Preconditions.checkArgument(array != null, "array must be non-null");
        Preconditions.checkArgument(item != null, "item must be non-null");
        Preconditions.checkState(array.isArray(), "not an array: %s", array.getType());
        array.checkAcyclic(item);
        final JsonNode reference = createReference(item);
        if (reference == null) {
            return false;
        }
        array.addItemToArray(reference);
        return true;
    }

    /**
     * Adds a reference to <code>item</code> to an object under a copy of the given name.
     *
     * @param object
     *            object node
     * @param name
     *            member name
     * @param item
     *            node to reference
     * @return false if the reference or its key could not be allocated
     */
    public boolean addItemReferenceToObject(final JsonNode object, final String name, final JsonNode item) {
        Preconditions.checkArgument(object != null, "object must be non-null");
        Preconditions.checkArgument(item != null, "item must be non-null");
        Preconditions.checkState(object.isObject(), "not an object: %s", object.getType());
        object.checkAcyclic(item);
        final JsonNode reference = createReference(item);
        if (reference == null) {
            return false;
        }
        if (!addItemToObject(object, name, reference)) {
            delete(reference);
            return false;
        }
        return true;
    }

    public void clearError() {
        lastError = null;
        lastErrorPosition = -1;
    }

    @Nullable
    byte[] copyOf(final byte[] bytes) {
        final byte[] block = allocator.allocate(bytes.length);
        if (block == null) {
            setError(JsonError.ALLOCATION_FAILURE, -1);
            return null;
        }
        System.arraycopy(bytes, 0, block, 0, bytes.length);
        return block;
    }

    @Nullable
    public JsonNode createArray() {
        return createNode(JsonType.ARRAY);
    }

    @Nullable
    public JsonNode createBool(final boolean value) {
        return createNode(value ? JsonType.TRUE : JsonType.FALSE);
    }

    /**
     * Creates an array of numbers.
     *
     * @param numbers
     *            values
     * @return new array, or null if allocation failed
     */
    @Nullable
    public JsonNode createDoubleArray(final double... numbers) {
        Preconditions.checkArgument(numbers != null, "numbers must be non-null");
        final JsonNode array = createArray();
        if (array == null) {
            return null;
        }
        final SiblingChain chain = new SiblingChain();
        for (final double number : numbers) {
            final JsonNode item = createNumber(number);
            if (item == null) {
                chain.release(this);
                delete(array);
                return null;
            }
            chain.append(item);
        }
        chain.attachTo(array);
        return array;
    }

    @Nullable
    public JsonNode createFalse() {
        return createNode(JsonType.FALSE);
    }

    /**
     * Creates an array of numbers. Floats are widened to double, so values such as
     * <code>0.1f</code> keep their float rounding.
     *
     * @param numbers
     *            values
     * @return new array, or null if allocation failed
     */
    @Nullable
    public JsonNode createFloatArray(final float... numbers) {
        Preconditions.checkArgument(numbers != null, "numbers must be non-null");
        final double[] widened = new double[numbers.length];
        for (int i = 0; i < numbers.length; i++) {
            widened[i] = numbers[i];
        }
        return createDoubleArray(widened);
    }

    @Nullable
    public JsonNode createIntArray(final int... numbers) {
        Preconditions.checkArgument(numbers != null, "numbers must be non-null");
        final double[] widened = new double[numbers.length];
        for (int i = 0; i < numbers.length; i++) {
            widened[i] = numbers[i];
        }
        return createDoubleArray(widened);
    }

    @Nullable
    private JsonNode createNode(final JsonType type) {
        final JsonNode node = newNode();
        if (node != null) {
            node.setType(type);
        }
        return node;
    }

    @Nullable
    public JsonNode createNull() {
        return createNode(JsonType.NULL);
    }

    @Nullable
    public JsonNode createNumber(final double number) {
        final JsonNode node = createNode(JsonType.NUMBER);
        if (node != null) {
            node.setNumber(number);
        }
        return node;
    }

    @Nullable
    public JsonNode createObject() {
        return createNode(JsonType.OBJECT);
    }

    /**
     * Creates a pre-serialized fragment that is printed verbatim. The text is not validated.
     *
     * @param raw
     *            JSON text
     * @return new node, or null if allocation failed
     */
    @Nullable
    public JsonNode createRaw(final String raw) {
        Preconditions.checkArgument(raw != null, "raw must be non-null");
        return createText(JsonType.RAW, raw.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Creates a standalone node that borrows the payload of <code>item</code>. The reference must
     * be deleted before <code>item</code> is.
     *
     * @param item
     *            node to borrow from
     * @return new reference, or null if allocation failed
     */
    @Nullable
    public JsonReference createReference(final JsonNode item) {
        Preconditions.checkArgument(item != null, "item must be non-null");
        if (!allocator.reserveNode()) {
            setError(JsonError.ALLOCATION_FAILURE, -1);
            return null;
        }
        return new JsonReference(item);
    }

    @Nullable
    public JsonNode createString(final String value) {
        Preconditions.checkArgument(value != null, "value must be non-null");
        return createText(JsonType.STRING, value.getBytes(StandardCharsets.UTF_8));
    }

    @Nullable
    public JsonNode createStringArray(final String... values) {
        Preconditions.checkArgument(values != null, "values must be non-null");
        final JsonNode array = createArray();
        if (array == null) {
            return null;
        }
        final SiblingChain chain = new SiblingChain();
        for (final String value : values) {
            final JsonNode item = createString(value);
            if (item == null) {
                chain.release(this);
                delete(array);
                return null;
            }
            chain.append(item);
        }
        chain.attachTo(array);
        return array;
    }

    @Nullable
    private JsonNode createText(final JsonType type, final byte[] bytes) {
        final JsonNode node = newNode();
        if (node == null) {
            return null;
        }
        final byte[] text = copyOf(bytes);
        if (text == null) {
            delete(node);
            return null;
        }
        node.setType(type);
        node.setText(text);
        return node;
    }

    @Nullable
    public JsonNode createTrue() {
        return createNode(JsonType.TRUE);
    }

    /**
     * Destroys a standalone node and everything it owns: its members (recursively), its text and
     * its key. Borrowed payloads of references and constant keys are left alone.
     *
     * @param item
     *            node to destroy; null is ignored
     */
    public void delete(final JsonNode item) {
        if (item == null) {
            return;
        }
        Preconditions.checkArgument(item.isDetached(), "item is still linked into a container; detach it first");
        deleteChain(item);
    }

    /**
     * Destroys a node and every sibling after it.
     *
     * @param head
     *            first node of the chain
     */
    void deleteChain(JsonNode head) {
        while (head != null) {
            final JsonNode next = head.getNext();
            if (!head.isReference()) {
                final JsonNode child = head.getFirstChild();
                if (child != null) {
                    deleteChain(child);
                }
                if (head.text() != null) {
                    allocator.free(head.text());
                }
            }
            if (!head.hasConstantKey() && head.key() != null) {
                allocator.free(head.key());
            }
            head.clear();
            allocator.releaseNode();
            head = next;
        }
    }

    /**
     * Removes the member at the given index and destroys it.
     *
     * @param array
     *            container
     * @param index
     *            zero-based index
     */
    public void deleteItemFromArray(final JsonNode array, final int index) {
        Preconditions.checkArgument(array != null, "array must be non-null");
        delete(array.detachItemFromArray(index));
    }

    public void deleteItemFromObject(final JsonNode object, final String name) {
        Preconditions.checkArgument(object != null, "object must be non-null");
        delete(object.detachItemFromObject(name));
    }

    /**
     * Creates an owned copy of a node. References are copied into ordinary nodes; constant keys
     * stay borrowed.
     *
     * @param item
     *            node to copy
     * @param recurse
     *            true to copy all members as well
     * @return new standalone node, or null if allocation failed
     */
    @Nullable
    public JsonNode duplicate(final JsonNode item, final boolean recurse) {
        Preconditions.checkArgument(item != null, "item must be non-null");
        final JsonNode copy = newNode();
        if (copy == null) {
            return null;
        }
        copy.setType(item.getType());
        copy.setNumber(item.getNumber());
        copy.setIntValue(item.getInt());

        if (item.text() != null) {
            final byte[] text = copyOf(item.text());
            if (text == null) {
                delete(copy);
                return null;
            }
            copy.setText(text);
        }

        final byte[] key = item.key();
        if (key != null) {
            if (item.hasConstantKey()) {
                copy.setKey(key, true);
            } else {
                final byte[] owned = copyOf(key);
                if (owned == null) {
                    delete(copy);
                    return null;
                }
                copy.setKey(owned, false);
            }
        }

        if (!recurse) {
            return copy;
        }

        final SiblingChain chain = new SiblingChain();
        for (JsonNode child = item.getFirstChild(); child != null; child = child.getNext()) {
            final JsonNode childCopy = duplicate(child, true);
            if (childCopy == null) {
                chain.release(this);
                delete(copy);
                return null;
            }
            chain.append(childCopy);
        }
        chain.attachTo(copy);
        return copy;
    }

    public JsonAllocator getAllocator() {
        return allocator;
    }

    /**
     * Returns the failure recorded by the last operation that failed on this context.
     *
     * @return last error, or null if none was recorded since the last {@link #clearError()}
     */
    @Nullable
    public JsonError getLastError() {
        return lastError;
    }

    /**
     * Returns the byte position of the last parse failure, or -1 if the last failure has no
     * position.
     *
     * @return byte position or -1
     */
    public int getLastErrorPosition() {
        return lastErrorPosition;
    }

    /**
     * Allocates an empty node.
     *
     * @return new node with no type, or null if the allocator refused
     */
    @Nullable
    JsonNode newNode() {
        if (!allocator.reserveNode()) {
            setError(JsonError.ALLOCATION_FAILURE, -1);
            return null;
        }
        return new JsonNode();
    }

    /**
     * Replaces a member of an array and destroys the old member.
     *
     * @param array
     *            array node
     * @param index
     *            zero-based index
     * @param item
     *            standalone replacement without a key
     * @return false if there is no member at the index
     */
    public boolean replaceItemInArray(final JsonNode array, final int index, final JsonNode item) {
        Preconditions.checkArgument(array != null, "array must be non-null");
        Preconditions.checkState(array.isArray(), "not an array: %s", array.getType());
        array.checkStandalone(item);
        Preconditions.checkArgument(item.key() == null, "array members cannot have a key");
        final JsonNode existing = array.getArrayItem(index);
        if (existing == null) {
            return false;
        }
        delete(array.replace(existing, item));
        return true;
    }

    /**
     * Replaces the first member whose name matches <code>name</code>, ignoring ASCII case, and
     * destroys the old member. The replacement receives a copy of <code>name</code>.
     *
     * @param object
     *            object node
     * @param name
     *            member name
     * @param item
     *            standalone replacement
     * @return false if there is no such member or the key could not be allocated
     */
    public boolean replaceItemInObject(final JsonNode object, final String name, final JsonNode item) {
        Preconditions.checkArgument(object != null, "object must be non-null");
        Preconditions.checkArgument(name != null, "name must be non-null");
        Preconditions.checkState(object.isObject(), "not an object: %s", object.getType());
        object.checkStandalone(item);
        final JsonNode existing = object.getObjectItem(name);
        if (existing == null) {
            return false;
        }
        final byte[] key = copyOf(name.getBytes(StandardCharsets.UTF_8));
        if (key == null) {
            return false;
        }
        replaceKey(item, key, false);
        delete(object.replace(existing, item));
        return true;
    }

    private void replaceKey(final JsonNode item, final byte[] key, final boolean constant) {
        if (!item.hasConstantKey() && item.key() != null) {
            allocator.free(item.key());
        }
        item.setKey(key, constant);
    }

    void setError(final JsonError error, final int position) {
        this.lastError = error;
        this.lastErrorPosition = position;
    }

    @Override
    public String toString() {
        return "JsonContext[allocator=" + allocator + ",lastError=" + lastError + ",lastErrorPosition="
                + lastErrorPosition + "]";
    }
}
