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

import com.google.common.base.Ascii;
import com.google.common.base.Preconditions;
import com.google.common.primitives.Ints;

/**
 * One JSON value in a mutable tree.
 *
 * <p>
 * Containers keep their members in a doubly linked sibling list: the container owns its first
 * child, every member owns the member after it, and the backward link exists only for O(1)
 * detaching. Every member also points back at its container. The links are private to this class
 * and change only through the splice methods below, which refuse to link a node that is still part
 * of another container or that would end up inside itself.
 * </p>
 *
 * <p>
 * Nodes are created through a {@link JsonContext}, which accounts every node, text payload and
 * owned key with its {@link JsonAllocator}. Nodes are not thread safe.
 * </p>
 */
public class JsonNode {
    private static boolean keyEquals(final byte[] key, final byte[] name) {
        if (key == null || name == null) {
            return key == name;
        }
        if (key.length != name.length) {
            return false;
        }
        for (int i = 0; i < key.length; i++) {
            final char c1 = Ascii.toLowerCase((char) (key[i] & 0xFF));
            final char c2 = Ascii.toLowerCase((char) (name[i] & 0xFF));
            if (c1 != c2) {
                return false;
            }
        }
        return true;
    }

    /**
     * Clamps a double to the int range, mapping NaN to zero.
     *
     * @param number
     *            value to convert
     * @return saturated int value
     */
    static int saturate(final double number) {
        if (number >= Integer.MAX_VALUE) {
            return Integer.MAX_VALUE;
        }
        if (number <= Integer.MIN_VALUE) {
            return Integer.MIN_VALUE;
        }
        return Ints.saturatedCast((long) number);
    }

    /** value type; null until the node is populated **/
    private JsonType type;

    private double number;

    /** saturated int mirror of {@link #number} **/
    private int intValue;

    /** UTF-8 payload of STRING and RAW nodes **/
    private byte[] text;

    /** UTF-8 member name when this node belongs to an object **/
    private byte[] key;

    /** true if {@link #key} is borrowed from the caller and never released by the tree **/
    private boolean constantKey;

    private JsonNode child;

    private JsonNode next;

    /** back link, never owning **/
    private JsonNode prev;

    /** containing array or object, never owning **/
    private JsonNode parent;

    JsonNode() {
    }

    /**
     * Appends the given standalone node to the members of this array.
     *
     * @param item
     *            node to append; must not be linked into another list and must not have a key
     */
    public final void addItemToArray(final JsonNode item) {
        Preconditions.checkState(isArray(), "not an array: %s", getType());
        checkStandalone(item);
        Preconditions.checkArgument(item.key == null, "array members cannot have a key");
        append(item);
    }

    /**
     * Links a standalone node after the last member of this container.
     *
     * @param item
     *            node to append
     */
    final void append(final JsonNode item) {
        checkMutable();
        item.parent = this;
        JsonNode c = child;
        if (c == null) {
            child = item;
            return;
        }
        while (c.next != null) {
            c = c.next;
        }
        c.next = item;
        item.prev = c;
    }

    /**
     * Rejects a node that is, or references, this container or any container above it.
     *
     * @param item
     *            node about to become a member of this container
     */
    final void checkAcyclic(final JsonNode item) {
        final JsonNode value = item instanceof JsonReference ? ((JsonReference) item).getTarget() : item;
        for (JsonNode ancestor = this; ancestor != null; ancestor = ancestor.parent) {
            Preconditions.checkArgument(
                    ancestor != item && ancestor != value,
                    "node cannot contain itself or one of its ancestors");
        }
    }

    final void checkMutable() {
        Preconditions.checkState(!isReference(), "members of a reference cannot be modified");
        Preconditions.checkState(getType() != null && getType().isContainer(), "not a container: %s", getType());
    }

    final void checkStandalone(final JsonNode item) {
        Preconditions.checkArgument(item != null, "item must be non-null");
        Preconditions.checkArgument(item.isDetached(), "item is still linked into another container");
        checkAcyclic(item);
    }

    /**
     * Unlinks the given member from this container. Runs in constant time.
     *
     * @param item
     *            a member of this container
     * @return the detached node, which has no siblings afterwards
     */
    public final JsonNode detach(final JsonNode item) {
        checkMutable();
        Preconditions.checkArgument(item != null, "item must be non-null");
        Preconditions.checkArgument(item.parent == this, "item is not a member of this container");
        if (item.prev != null) {
            item.prev.next = item.next;
        }
        if (item.next != null) {
            item.next.prev = item.prev;
        }
        if (item == child) {
            child = item.next;
        }
        item.prev = null;
        item.next = null;
        item.parent = null;
        return item;
    }

    /**
     * Detaches the member at the given index.
     *
     * @param index
     *            zero-based index
     * @return the detached node, or null if there is no member at that index
     */
    @Nullable
    public final JsonNode detachItemFromArray(final int index) {
        final JsonNode item = getArrayItem(index);
        if (item == null) {
            return null;
        }
        return detach(item);
    }

    /**
     * Detaches the first member whose name matches the given key, ignoring ASCII case.
     *
     * @param name
     *            member name
     * @return the detached node, or null if there is no such member
     */
    @Nullable
    public final JsonNode detachItemFromObject(final String name) {
        final JsonNode item = getObjectItem(name);
        if (item == null) {
            return null;
        }
        return detach(item);
    }

    /**
     * Returns the number of members of this container.
     *
     * @return the number of members
     */
    public final int getArraySize() {
        int size = 0;
        for (JsonNode c = getFirstChild(); c != null; c = c.next) {
            size++;
        }
        return size;
    }

    /**
     * Returns the member at the given index.
     *
     * @param index
     *            zero-based index
     * @return member at the index, or null if the index is negative or past the end
     */
    @Nullable
    public final JsonNode getArrayItem(int index) {
        if (index < 0) {
            return null;
        }
        JsonNode c = getFirstChild();
        while (c != null && index > 0) {
            index--;
            c = c.next;
        }
        return c;
    }

    @Nullable
    public JsonNode getFirstChild() {
        return child;
    }

    /**
     * Returns the saturated int mirror of the number value; 1 for a parsed <code>true</code>.
     *
     * @return int value
     */
    public int getInt() {
        return intValue;
    }

    @Nullable
    public final String getKey() {
        return key != null ? new String(key, StandardCharsets.UTF_8) : null;
    }

    @Nullable
    public final byte[] getKeyBytes() {
        return key != null ? key.clone() : null;
    }

    @Nullable
    public final JsonNode getNext() {
        return next;
    }

    public double getNumber() {
        return number;
    }

    /**
     * Returns the first member whose name matches the given key, comparing ASCII letters without
     * regard to case.
     *
     * @param name
     *            member name
     * @return the member, or null if not found
     */
    @Nullable
    public final JsonNode getObjectItem(final String name) {
        final byte[] bytes = name != null ? name.getBytes(StandardCharsets.UTF_8) : null;
        JsonNode c = getFirstChild();
        while (c != null && !keyEquals(c.key, bytes)) {
            c = c.next;
        }
        return c;
    }

    @Nullable
    public final JsonNode getPrevious() {
        return prev;
    }

    /**
     * Returns the decoded text of a STRING or RAW node.
     *
     * @return text value, or null if this node has no text
     */
    @Nullable
    public final String getString() {
        final byte[] bytes = text();
        return bytes != null ? new String(bytes, StandardCharsets.UTF_8) : null;
    }

    @Nullable
    public JsonType getType() {
        return type;
    }

    /**
     * Returns a copy of the UTF-8 text of a STRING or RAW node.
     *
     * @return text bytes, or null if this node has no text
     */
    @Nullable
    public final byte[] getValueBytes() {
        final byte[] bytes = text();
        return bytes != null ? bytes.clone() : null;
    }

    public final boolean hasConstantKey() {
        return constantKey;
    }

    public final boolean hasObjectItem(final String name) {
        return getObjectItem(name) != null;
    }

    /**
     * Inserts a standalone node before the member at the given index, or appends it if the index
     * is past the end.
     *
     * @param index
     *            zero-based index
     * @param item
     *            node to insert
     */
    public final void insertItemInArray(final int index, final JsonNode item) {
        Preconditions.checkState(isArray(), "not an array: %s", getType());
        Preconditions.checkArgument(index >= 0, "index must be non-negative");
        checkStandalone(item);
        Preconditions.checkArgument(item.key == null, "array members cannot have a key");
        final JsonNode c = getArrayItem(index);
        if (c == null) {
            append(item);
            return;
        }
        item.parent = this;
        item.next = c;
        item.prev = c.prev;
        c.prev = item;
        if (c == child) {
            child = item;
        } else {
            item.prev.next = item;
        }
    }

    public final boolean isArray() {
        return getType() == JsonType.ARRAY;
    }

    public final boolean isBoolean() {
        return getType() != null && getType().isBoolean();
    }

    /**
     * Returns true if this node has no container and no siblings.
     *
     * @return true if the node may be linked into a container or deleted
     */
    final boolean isDetached() {
        return parent == null && next == null && prev == null;
    }

    public final boolean isFalse() {
        return getType() == JsonType.FALSE;
    }

    public final boolean isNull() {
        return getType() == JsonType.NULL;
    }

    public final boolean isNumber() {
        return getType() == JsonType.NUMBER;
    }

    public final boolean isObject() {
        return getType() == JsonType.OBJECT;
    }

    public final boolean isRaw() {
        return getType() == JsonType.RAW;
    }

    /**
     * Returns true if this node borrows its payload from another node.
     *
     * @return true if this node is a {@link JsonReference}
     */
    public boolean isReference() {
        return false;
    }

    public final boolean isString() {
        return getType() == JsonType.STRING;
    }

    public final boolean isTrue() {
        return getType() == JsonType.TRUE;
    }

    /**
     * Puts a standalone node in place of an existing member, taking over its position and links.
     *
     * @param existing
     *            member to replace
     * @param item
     *            replacement
     * @return the replaced member, now unlinked
     */
    final JsonNode replace(final JsonNode existing, final JsonNode item) {
        checkMutable();
        checkStandalone(item);
        Preconditions.checkArgument(existing.parent == this, "node is not a member of this container");
        item.parent = this;
        item.next = existing.next;
        item.prev = existing.prev;
        if (item.next != null) {
            item.next.prev = item;
        }
        if (existing == child) {
            child = item;
        } else {
            item.prev.next = item;
        }
        existing.next = null;
        existing.prev = null;
        existing.parent = null;
        return existing;
    }

    /**
     * Makes a freshly built sibling chain the members of this container.
     *
     * @param child
     *            first node of the chain, or null
     */
    final void setChild(final JsonNode child) {
        this.child = child;
        for (JsonNode c = child; c != null; c = c.next) {
            c.parent = this;
        }
    }

    final void setIntValue(final int intValue) {
        this.intValue = intValue;
    }

    final void setKey(final byte[] key, final boolean constantKey) {
        this.key = key;
        this.constantKey = constantKey;
    }

    /**
     * Links <code>item</code> directly after this node. Used while building a fresh sibling chain.
     *
     * @param item
     *            standalone node
     */
    final void setNext(final JsonNode item) {
        this.next = item;
        if (item != null) {
            item.prev = this;
        }
    }

    /**
     * Sets the number value and its saturated int mirror.
     *
     * @param number
     *            new value
     * @return the value that was set
     */
    public double setNumber(final double number) {
        this.intValue = saturate(number);
        this.number = number;
        return number;
    }

    final void setText(final byte[] text) {
        this.text = text;
    }

    final void setType(final JsonType type) {
        this.type = type;
    }

    /**
     * Returns the text payload without copying.
     *
     * @return text payload, or null
     */
    @Nullable
    byte[] text() {
        return text;
    }

    @Override
    public String toString() {
        final PrintResult result = new JsonPrinter(new JsonContext()).print(this, false);
        return result.isSuccess() ? result.getText() : "JsonNode[type=" + getType() + "]";
    }

    /**
     * Returns the owned key without copying.
     *
     * @return key bytes, or null
     */
    @Nullable
    final byte[] key() {
        return key;
    }

    /**
     * Clears every field after the node has been released.
     */
    final void clear() {
        type = null;
        number = 0;
        intValue = 0;
        text = null;
        key = null;
        constantKey = false;
        child = null;
        next = null;
        prev = null;
        parent = null;
    }
}
