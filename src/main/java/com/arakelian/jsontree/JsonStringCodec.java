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
 * Unescapes JSON string literals into UTF-8 and escapes UTF-8 text for output.
 */
final class JsonStringCodec {
    private static final byte[] HEX_DIGITS = { '0', '1', '2', '3', '4', '5', '6', '7', '8', '9', 'a', 'b', 'c',
            'd', 'e', 'f' };

    /**
     * Returns the number of bytes needed to encode a code point as UTF-8.
     *
     * @param codepoint
     *            code point
     * @return 1 to 4, or 0 if the code point is out of range
     */
    static int utf8Length(final int codepoint) {
        if (codepoint < 0x80) {
            return 1;
        } else if (codepoint < 0x800) {
            return 2;
        } else if (codepoint < 0x10000) {
            return 3;
        } else if (codepoint <= 0x10FFFF) {
            return 4;
        }
        return 0;
    }

    private static int encodeUtf8(int codepoint, final int utf8Length, final byte[] out, final int pos) {
        switch (utf8Length) {
        case 4:
            out[pos + 3] = (byte) (codepoint & 0x3F | 0x80);
            codepoint >>= 6;
            // fall through
        case 3:
            out[pos + 2] = (byte) (codepoint & 0x3F | 0x80);
            codepoint >>= 6;
            // fall through
        case 2:
            out[pos + 1] = (byte) (codepoint & 0x3F | 0x80);
            codepoint >>= 6;
            out[pos] = (byte) (codepoint | (utf8Length == 2 ? 0xC0 : utf8Length == 3 ? 0xE0 : 0xF0));
            break;
        default:
            out[pos] = (byte) codepoint;
            break;
        }
        return pos + utf8Length;
    }

    private static boolean needsEscape(final int ch) {
        return ch < 32 || ch == '"' || ch == '\\';
    }

    /**
     * Parses four hex digits; any invalid digit makes the whole value 0.
     *
     * @param in
     *            input
     * @param pos
     *            position of the first digit
     * @return parsed value, or 0 if a digit was invalid
     */
    static int parseHex4(final JsonInput in, final int pos) {
        int h = 0;
        for (int i = 0; i < 4; i++) {
            final int ch = in.at(pos + i);
            final int digit;
            if (ch >= '0' && ch <= '9') {
                digit = ch - '0';
            } else if (ch >= 'A' && ch <= 'F') {
                digit = ch + 10 - 'A';
            } else if (ch >= 'a' && ch <= 'f') {
                digit = ch + 10 - 'a';
            } else {
                return 0;
            }
            h = h << 4 | digit;
        }
        return h;
    }

    /**
     * Parses the string literal starting at <code>start</code> into <code>item</code>, which
     * becomes a STRING node owning the unescaped UTF-8 bytes.
     *
     * @param item
     *            node to populate
     * @param in
     *            input; <code>in.at(start)</code> must be a double quote
     * @param start
     *            position of the opening quote
     * @return position after the closing quote, or -1 on failure
     */
    static int parseString(final JsonNode item, final JsonInput in, final int start) {
        if (in.at(start) != '"') {
            return in.fail(JsonError.MALFORMED_VALUE, start);
        }

        // find the closing quote and count escapes to bound the output size
        int end = start + 1;
        int skipped = 0;
        for (int ch = in.at(end); ch != '"'; ch = in.at(end)) {
            if (ch == JsonInput.TERMINATOR) {
                return in.fail(JsonError.UNTERMINATED_STRING, end);
            }
            if (ch == '\\') {
                if (in.at(end + 1) == JsonInput.TERMINATOR) {
                    return in.fail(JsonError.UNTERMINATED_STRING, end + 1);
                }
                skipped++;
                end++;
            }
            end++;
        }

        final JsonAllocator allocator = in.context().getAllocator();
        final byte[] bytes = in.bytes();
        byte[] out = allocator.allocate(end - start - 1 - skipped);
        if (out == null) {
            return in.fail(JsonError.ALLOCATION_FAILURE, start);
        }

        int o = 0;
        int p = start + 1;
        while (p < end) {
            if (bytes[p] != '\\') {
                out[o++] = bytes[p++];
                continue;
            }

            int sequenceLength = 2;
            switch (in.at(p + 1)) {
            case 'b':
                out[o++] = '\b';
                break;
            case 'f':
                out[o++] = '\f';
                break;
            case 'n':
                out[o++] = '\n';
                break;
            case 'r':
                out[o++] = '\r';
                break;
            case 't':
                out[o++] = '\t';
                break;
            case '"':
            case '\\':
            case '/':
                out[o++] = bytes[p + 1];
                break;
            case 'u': {
                if (end - p < 6) {
                    allocator.free(out);
                    return in.fail(JsonError.INVALID_UNICODE_ESCAPE, p);
                }
                final int first = parseHex4(in, p + 2);
                if (first >= 0xDC00 && first <= 0xDFFF || first == 0) {
                    allocator.free(out);
                    return in.fail(JsonError.INVALID_UNICODE_ESCAPE, p);
                }

                final int codepoint;
                if (first >= 0xD800 && first <= 0xDBFF) {
                    // surrogate pair, the low half must follow immediately
                    final int second = p + 6;
                    if (end - second < 6 || in.at(second) != '\\' || in.at(second + 1) != 'u') {
                        allocator.free(out);
                        return in.fail(JsonError.INVALID_UNICODE_ESCAPE, p);
                    }
                    final int low = parseHex4(in, second + 2);
                    if (low < 0xDC00 || low > 0xDFFF) {
                        allocator.free(out);
                        return in.fail(JsonError.INVALID_UNICODE_ESCAPE, p);
                    }
                    codepoint = 0x10000 + ((first & 0x3FF) << 10 | low & 0x3FF);
                    sequenceLength = 12;
                } else {
                    codepoint = first;
                    sequenceLength = 6;
                }

                final int utf8Length = utf8Length(codepoint);
                if (utf8Length == 0) {
                    allocator.free(out);
                    return in.fail(JsonError.INVALID_UNICODE_ESCAPE, p);
                }
                o = encodeUtf8(codepoint, utf8Length, out, o);
                break;
            }
            default:
                allocator.free(out);
                return in.fail(JsonError.INVALID_ESCAPE, p);
            }
            p += sequenceLength;
        }

        if (o != out.length) {
            final byte[] trimmed = allocator.reallocate(out, o);
            if (trimmed == null) {
                allocator.free(out);
                return in.fail(JsonError.ALLOCATION_FAILURE, start);
            }
            out = trimmed;
        }

        item.setType(JsonType.STRING);
        item.setText(out);
        return end + 1;
    }

    /**
     * Writes <code>text</code> as a quoted JSON string. Text without bytes that need escaping is
     * copied as-is; otherwise the exact escaped length is reserved first.
     *
     * @param text
     *            UTF-8 text; null prints as an empty string
     * @param buffer
     *            output
     * @return false if the buffer could not make room
     */
    static boolean printString(final byte[] text, final PrintBuffer buffer) {
        if (text == null) {
            return buffer.append("\"\"");
        }

        boolean special = false;
        for (final byte b : text) {
            if (needsEscape(b & 0xFF)) {
                special = true;
                break;
            }
        }

        if (!special) {
            final int pos = buffer.ensure(text.length + 3);
            if (pos < 0) {
                return false;
            }
            final byte[] out = buffer.buffer();
            out[pos] = '"';
            System.arraycopy(text, 0, out, pos + 1, text.length);
            out[pos + text.length + 1] = '"';
            out[pos + text.length + 2] = 0;
            buffer.advance(text.length + 2);
            return true;
        }

        final int length = escapedLength(text);
        final int pos = buffer.ensure(length + 3);
        if (pos < 0) {
            return false;
        }
        final byte[] out = buffer.buffer();
        int o = pos;
        out[o++] = '"';
        for (final byte b : text) {
            final int ch = b & 0xFF;
            if (!needsEscape(ch)) {
                out[o++] = b;
                continue;
            }
            out[o++] = '\\';
            switch (ch) {
            case '\\':
                out[o++] = '\\';
                break;
            case '"':
                out[o++] = '"';
                break;
            case '\b':
                out[o++] = 'b';
                break;
            case '\f':
                out[o++] = 'f';
                break;
            case '\n':
                out[o++] = 'n';
                break;
            case '\r':
                out[o++] = 'r';
                break;
            case '\t':
                out[o++] = 't';
                break;
            default:
                out[o++] = 'u';
                out[o++] = '0';
                out[o++] = '0';
                out[o++] = HEX_DIGITS[ch >> 4];
                out[o++] = HEX_DIGITS[ch & 0x0F];
                break;
            }
        }
        out[o++] = '"';
        out[o] = 0;
        buffer.advance(length + 2);
        return true;
    }

    /**
     * Returns the length of <code>text</code> once escaped, without the surrounding quotes.
     *
     * @param text
     *            UTF-8 text
     * @return escaped length in bytes
     */
    static int escapedLength(final byte[] text) {
        int length = 0;
        for (final byte b : text) {
            final int ch = b & 0xFF;
            switch (ch) {
            case '"':
            case '\\':
            case '\b':
            case '\f':
            case '\n':
            case '\r':
            case '\t':
                length += 2;
                break;
            default:
                length += ch < 32 ? 6 : 1;
                break;
            }
        }
        return length;
    }

    private JsonStringCodec() {
    }
}
