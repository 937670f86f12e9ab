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

import com.google.common.base.Preconditions;

/**
 * Serializes a tree of {@link JsonNode} as JSON text.
 *
 * <p>
 * Compact output has no whitespace between tokens. Pretty output keeps arrays on one line with
 * <code>", "</code> between elements, and puts every object member on its own line, indented with
 * one tab per nesting level and with a tab after the colon. Empty containers print as
 * <code>[]</code> and <code>{}</code> in both modes.
 * </p>
 */
public final class JsonPrinter {
    /** initial capacity of the growable buffer used by {@link #print(JsonNode, boolean)} **/
    public static final int DEFAULT_CAPACITY = 256;

    private static JsonError bufferError(final PrintBuffer buffer) {
        return buffer.isGrowable() ? JsonError.ALLOCATION_FAILURE : JsonError.BUFFER_OVERFLOW;
    }

    private final JsonContext context;

    public JsonPrinter(final JsonContext context) {
        Preconditions.checkArgument(context != null, "context must be non-null");
        this.context = context;
    }

    private PrintResult failed(final JsonError error) {
        context.setError(error, -1);
        return PrintResult.failure(error);
    }

    public JsonContext getContext() {
        return context;
    }

    /**
     * Prints a tree into a buffer that grows as needed.
     *
     * @param item
     *            root node
     * @param pretty
     *            true for indented output
     * @return serialized bytes, or the reason printing failed
     */
    public PrintResult print(final JsonNode item, final boolean pretty) {
        return printBuffered(item, DEFAULT_CAPACITY, pretty);
    }

    private JsonError printArray(final JsonNode item, final int depth, final boolean pretty, final PrintBuffer buffer) {
        JsonNode child = item.getFirstChild();
        if (child == null) {
            return buffer.append("[]") ? null : bufferError(buffer);
        }

        if (!buffer.append("[")) {
            return bufferError(buffer);
        }
        for (; child != null; child = child.getNext()) {
            final JsonError error = printValue(child, depth + 1, pretty, buffer);
            if (error != null) {
                return error;
            }
            if (child.getNext() != null && !buffer.append(pretty ? ", " : ",")) {
                return bufferError(buffer);
            }
        }
        return buffer.append("]") ? null : bufferError(buffer);
    }

    /**
     * Prints a tree into a buffer that starts at the given capacity and grows as needed. The
     * output is the same as {@link #print(JsonNode, boolean)}; a good estimate only saves
     * reallocations.
     *
     * @param item
     *            root node
     * @param prebuffer
     *            initial capacity in bytes
     * @param pretty
     *            true for indented output
     * @return serialized bytes, or the reason printing failed
     */
    public PrintResult printBuffered(final JsonNode item, final int prebuffer, final boolean pretty) {
        context.clearError();
        if (item == null) {
            return failed(JsonError.INVALID_NODE);
        }
        if (prebuffer < 0) {
            return failed(JsonError.ALLOCATION_FAILURE);
        }

        final PrintBuffer buffer = PrintBuffer.growable(context.getAllocator(), prebuffer);
        if (buffer == null) {
            return failed(JsonError.ALLOCATION_FAILURE);
        }
        final JsonError error = printValue(item, 0, pretty, buffer);
        if (error != null) {
            buffer.release();
            return failed(error);
        }
        final byte[] bytes = Arrays.copyOf(buffer.buffer(), buffer.offset());
        buffer.release();
        return PrintResult.success(bytes);
    }

    private JsonError printObject(final JsonNode item, final int depth, final boolean pretty, final PrintBuffer buffer) {
        JsonNode child = item.getFirstChild();
        if (child == null) {
            return buffer.append("{}") ? null : bufferError(buffer);
        }

        if (!buffer.append(pretty ? "{\n" : "{")) {
            return bufferError(buffer);
        }
        final int memberDepth = depth + 1;
        for (; child != null; child = child.getNext()) {
            if (pretty && !buffer.appendRepeated((byte) '\t', memberDepth)) {
                return bufferError(buffer);
            }
            if (!JsonStringCodec.printString(child.key(), buffer)) {
                return bufferError(buffer);
            }
            if (!buffer.append(pretty ? ":\t" : ":")) {
                return bufferError(buffer);
            }

            final JsonError error = printValue(child, memberDepth, pretty, buffer);
            if (error != null) {
                return error;
            }

            final String separator = (child.getNext() != null ? "," : "") + (pretty ? "\n" : "");
            if (!buffer.append(separator)) {
                return bufferError(buffer);
            }
        }

        if (pretty && !buffer.appendRepeated((byte) '\t', depth)) {
            return bufferError(buffer);
        }
        return buffer.append("}") ? null : bufferError(buffer);
    }

    /**
     * Prints a tree into caller storage without ever growing it. The output is followed by a 0
     * terminator, so it needs one byte more than its length.
     *
     * @param item
     *            root node
     * @param storage
     *            destination
     * @param capacity
     *            number of bytes of <code>storage</code> that may be written
     * @param pretty
     *            true for indented output
     * @return true if the whole output and its terminator fit; nothing is ever written at or
     *         beyond <code>capacity</code>
     */
    public boolean printPreallocated(final JsonNode item, final byte[] storage, final int capacity, final boolean pretty) {
        Preconditions.checkArgument(storage != null, "storage must be non-null");
        Preconditions.checkArgument(capacity <= storage.length, "capacity exceeds storage length");
        context.clearError();
        if (item == null) {
            failed(JsonError.INVALID_NODE);
            return false;
        }
        if (capacity < 0) {
            failed(JsonError.BUFFER_OVERFLOW);
            return false;
        }

        final JsonError error = printValue(item, 0, pretty, PrintBuffer.fixed(storage, capacity));
        if (error != null) {
            failed(error);
            return false;
        }
        return true;
    }

    private JsonError printValue(final JsonNode item, final int depth, final boolean pretty, final PrintBuffer buffer) {
        final JsonType type = item.getType();
        if (type == null) {
            return JsonError.INVALID_NODE;
        }

        final boolean written;
        switch (type) {
        case NULL:
            written = buffer.append("null");
            break;
        case FALSE:
            written = buffer.append("false");
            break;
        case TRUE:
            written = buffer.append("true");
            break;
        case NUMBER:
            written = JsonNumberCodec.printNumber(item, buffer);
            break;
        case RAW:
            if (item.text() == null) {
                return JsonError.INVALID_NODE;
            }
            written = buffer.append(item.text());
            break;
        case STRING:
            written = JsonStringCodec.printString(item.text(), buffer);
            break;
        case ARRAY:
            return printArray(item, depth, pretty, buffer);
        case OBJECT:
            return printObject(item, depth, pretty, buffer);
        default:
            return JsonError.INVALID_NODE;
        }
        return written ? null : bufferError(buffer);
    }
}
