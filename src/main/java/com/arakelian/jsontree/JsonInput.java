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

/**
 * Terminator-delimited view of the bytes being parsed. The end of the array and the first 0 byte
 * both read as the terminator. Also retains the first failure reported during a parse.
 */
final class JsonInput {
    /** returned by {@link #at(int)} at and beyond the end of the input **/
    static final int TERMINATOR = 0;

    private final byte[] bytes;

    private final JsonContext context;

    private JsonError error;

    private int errorPosition = -1;

    JsonInput(final byte[] bytes, final JsonContext context) {
        this.bytes = bytes;
        this.context = context;
    }

    /**
     * Returns the unsigned byte at the given position, or {@link #TERMINATOR} past the end.
     *
     * @param pos
     *            byte position
     * @return unsigned byte value
     */
    int at(final int pos) {
        return pos >= 0 && pos < bytes.length ? bytes[pos] & 0xFF : TERMINATOR;
    }

    byte[] bytes() {
        return bytes;
    }

    JsonContext context() {
        return context;
    }

    private String escape(final int from, int to) {
        to = Math.min(to, bytes.length);
        if (from >= to) {
            return "";
        }
        return new String(bytes, from, to - from, StandardCharsets.UTF_8).replaceAll("\\s+", " ");
    }

    /**
     * Records a failure unless an earlier one has already been recorded.
     *
     * @param error
     *            reason
     * @param pos
     *            position of the offending byte
     * @return -1, so callers can <code>return fail(...)</code>
     */
    int fail(final JsonError error, final int pos) {
        if (this.error == null) {
            this.error = error;
            this.errorPosition = pos;
        }
        return -1;
    }

    @Nullable
    JsonError getError() {
        return error;
    }

    int getErrorPosition() {
        return errorPosition;
    }

    private static String describe(final int ch) {
        if (ch == TERMINATOR) {
            return "(EOF)";
        }
        // bytes of a multi-byte UTF-8 sequence are not characters on their own
        return ch < 0x80 ? String.valueOf((char) ch) : String.format("0x%02X", Integer.valueOf(ch));
    }

    /**
     * Describes the recorded failure with the offending character and surrounding text.
     *
     * @return failure message, or null if nothing failed
     */
    @Nullable
    String getErrorMessage() {
        if (error == null) {
            return null;
        }
        final int pos = errorPosition;
        final int ch = at(pos);
        final String chs = "char=" + describe(ch);
        String context = " BEFORE='" + escape(Math.max(pos - 60, 0), pos + 1) + "'";
        if (pos < bytes.length) {
            context += " AFTER='" + escape(pos + 1, pos + 40) + "'";
        }
        return error.getMessage() + ": " + chs + ",position=" + pos + context;
    }

    /**
     * Skips bytes with unsigned values 1 to 32.
     *
     * @param pos
     *            start position
     * @return position of the first non-whitespace byte
     */
    int skipWhitespace(int pos) {
        for (;;) {
            final int ch = at(pos);
            if (ch == TERMINATOR || ch > ' ') {
                return pos;
            }
            pos++;
        }
    }

    boolean startsWith(final int pos, final String literal) {
        for (int i = 0, length = literal.length(); i < length; i++) {
            if (at(pos + i) != literal.charAt(i)) {
                return false;
            }
        }
        return true;
    }
}
