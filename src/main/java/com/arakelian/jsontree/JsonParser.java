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

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

/**
 * Recursive-descent parser that turns JSON text into a tree of {@link JsonNode}.
 *
 * <p>
 * Input is UTF-8; the end of the array or the first 0 byte ends it. Failures are reported through
 * the returned {@link ParseResult} and the context's error slot, with the position of the first
 * offending byte. Nodes built before a failure are released, so a failed parse leaves nothing
 * allocated behind.
 * </p>
 */
public final class JsonParser {
    public static class JsonParseException extends IOException {
        private final JsonError error;

        private final int position;

        public JsonParseException(final String msg, final JsonError error, final int position) {
            super(msg);
            this.error = error;
            this.position = position;
        }

        public JsonError getError() {
            return error;
        }

        public int getPosition() {
            return position;
        }
    }

    /** Logger **/
    private static final Logger LOGGER = LoggerFactory.getLogger(JsonParser.class);

    private final JsonContext context;

    private final JsonParseOptions options;

    public JsonParser(final JsonContext context) {
        this(context, JsonParseOptions.defaults());
    }

    public JsonParser(final JsonContext context, final JsonParseOptions options) {
        Preconditions.checkArgument(context != null, "context must be non-null");
        Preconditions.checkArgument(options != null, "options must be non-null");
        this.context = context;
        this.options = options;
    }

    public JsonContext getContext() {
        return context;
    }

    public JsonParseOptions getOptions() {
        return options;
    }

    /**
     * Parses UTF-8 JSON text.
     *
     * @param input
     *            JSON text, ended by the end of the array or a 0 byte
     * @return root node and end position, or the first failure
     */
    public ParseResult parse(final byte[] input) {
        context.clearError();
        if (input == null) {
            context.setError(JsonError.NO_INPUT, 0);
            return ParseResult.failure(JsonError.NO_INPUT, 0, JsonError.NO_INPUT.getMessage());
        }

        final JsonInput in = new JsonInput(input, context);
        final JsonNode root = context.newNode();
        if (root == null) {
            in.fail(JsonError.ALLOCATION_FAILURE, 0);
            return failed(in);
        }

        int end = parseValue(root, in, in.skipWhitespace(0), 0);
        if (end >= 0 && options.isRequireFullConsumption()) {
            end = in.skipWhitespace(end);
            if (in.at(end) != JsonInput.TERMINATOR) {
                end = in.fail(JsonError.TRAILING_GARBAGE, end);
            }
        }
        if (end < 0) {
            context.delete(root);
            return failed(in);
        }
        return ParseResult.success(root, end);
    }

    /**
     * Parses JSON text after encoding it as UTF-8.
     *
     * @param json
     *            JSON text
     * @return root node and end position (in UTF-8 bytes), or the first failure
     */
    public ParseResult parse(final CharSequence json) {
        return parse(json != null ? json.toString().getBytes(StandardCharsets.UTF_8) : null);
    }

    private ParseResult failed(final JsonInput in) {
        final JsonError error = in.getError();
        final int position = in.getErrorPosition();
        context.setError(error, position);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Parse failed with {} at position {}", error, Integer.valueOf(position));
        }
        return ParseResult.failure(error, position, in.getErrorMessage());
    }

    private int parseArray(final JsonNode item, final JsonInput in, final int start, final int depth) {
        if (depth >= options.getMaxDepth()) {
            return in.fail(JsonError.NESTING_TOO_DEEP, start);
        }

        final SiblingChain chain = new SiblingChain();
        int pos = in.skipWhitespace(start + 1);
        if (in.at(pos) != ']') {
            // step back so every element, including the first, starts one byte after pos
            pos--;
            do {
                final JsonNode element = context.newNode();
                if (element == null) {
                    chain.release(context);
                    return in.fail(JsonError.ALLOCATION_FAILURE, pos + 1);
                }
                chain.append(element);

                pos = parseValue(element, in, in.skipWhitespace(pos + 1), depth + 1);
                if (pos < 0) {
                    chain.release(context);
                    return -1;
                }
                pos = in.skipWhitespace(pos);
            } while (in.at(pos) == ',');

            if (in.at(pos) != ']') {
                chain.release(context);
                return in.fail(JsonError.UNTERMINATED_CONTAINER, pos);
            }
        }

        item.setType(JsonType.ARRAY);
        chain.attachTo(item);
        return pos + 1;
    }

    private int parseObject(final JsonNode item, final JsonInput in, final int start, final int depth) {
        if (depth >= options.getMaxDepth()) {
            return in.fail(JsonError.NESTING_TOO_DEEP, start);
        }

        final SiblingChain chain = new SiblingChain();
        int pos = in.skipWhitespace(start + 1);
        if (in.at(pos) != '}') {
            pos--;
            do {
                final JsonNode member = context.newNode();
                if (member == null) {
                    chain.release(context);
                    return in.fail(JsonError.ALLOCATION_FAILURE, pos + 1);
                }
                chain.append(member);

                // the member name is parsed as a string value, then moved to the key slot
                pos = in.skipWhitespace(pos + 1);
                if (in.at(pos) != '"') {
                    chain.release(context);
                    return in.fail(JsonError.MISSING_MEMBER_NAME, pos);
                }
                pos = JsonStringCodec.parseString(member, in, pos);
                if (pos < 0) {
                    chain.release(context);
                    return -1;
                }
                member.setKey(member.text(), false);
                member.setText(null);
                member.setType(null);

                pos = in.skipWhitespace(pos);
                if (in.at(pos) != ':') {
                    chain.release(context);
                    return in.fail(JsonError.MISSING_NAME_SEPARATOR, pos);
                }

                pos = parseValue(member, in, in.skipWhitespace(pos + 1), depth + 1);
                if (pos < 0) {
                    chain.release(context);
                    return -1;
                }
                pos = in.skipWhitespace(pos);
            } while (in.at(pos) == ',');

            if (in.at(pos) != '}') {
                chain.release(context);
                return in.fail(JsonError.UNTERMINATED_CONTAINER, pos);
            }
        }

        item.setType(JsonType.OBJECT);
        chain.attachTo(item);
        return pos + 1;
    }

    private int parseValue(final JsonNode item, final JsonInput in, final int pos, final int depth) {
        if (in.startsWith(pos, "null")) {
            item.setType(JsonType.NULL);
            return pos + 4;
        }
        if (in.startsWith(pos, "false")) {
            item.setType(JsonType.FALSE);
            return pos + 5;
        }
        if (in.startsWith(pos, "true")) {
            item.setType(JsonType.TRUE);
            item.setIntValue(1);
            return pos + 4;
        }

        final int ch = in.at(pos);
        if (ch == '"') {
            return JsonStringCodec.parseString(item, in, pos);
        }
        if (ch == '-' || ch >= '0' && ch <= '9') {
            return JsonNumberCodec.parseNumber(item, in, pos);
        }
        if (ch == '[') {
            return parseArray(item, in, pos, depth);
        }
        if (ch == '{') {
            return parseObject(item, in, pos, depth);
        }
        return in.fail(JsonError.MALFORMED_VALUE, pos);
    }
}
