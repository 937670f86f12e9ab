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
 * Removes whitespace and comments from JSON text without parsing it.
 *
 * <p>
 * Spaces, tabs, carriage returns and line feeds are dropped, as are <code>//</code> comments up to
 * the end of the line and <code>/* ... *&#47;</code> comments. String literals, including their
 * escape sequences, are copied unchanged. The text is not validated.
 * </p>
 */
public final class JsonMinifier {
    private static boolean isWhitespace(final char ch) {
        return ch == ' ' || ch == '\t' || ch == '\r' || ch == '\n';
    }

    /**
     * Returns the minified form of the given text.
     *
     * @param json
     *            JSON text, possibly with comments
     * @return minified text, or null if <code>json</code> is null
     */
    public static String minify(final CharSequence json) {
        if (json == null) {
            return null;
        }

        final int length = json.length();
        final StringBuilder out = new StringBuilder(length);
        int i = 0;
        while (i < length) {
            final char ch = json.charAt(i);
            final char next = i + 1 < length ? json.charAt(i + 1) : 0;
            if (isWhitespace(ch)) {
                i++;
            } else if (ch == '/' && next == '/') {
                // line comment, the newline itself is dropped as whitespace
                while (i < length && json.charAt(i) != '\n') {
                    i++;
                }
            } else if (ch == '/' && next == '*') {
                i += 2;
                while (i < length && !(json.charAt(i) == '*' && i + 1 < length && json.charAt(i + 1) == '/')) {
                    i++;
                }
                i = Math.min(i + 2, length);
            } else if (ch == '"') {
                out.append(ch);
                i++;
                while (i < length && json.charAt(i) != '"') {
                    if (json.charAt(i) == '\\' && i + 1 < length) {
                        out.append(json.charAt(i++));
                    }
                    out.append(json.charAt(i++));
                }
                if (i < length) {
                    out.append(json.charAt(i++));
                }
            } else {
                out.append(ch);
                i++;
            }
        }
        return out.toString();
    }

    private JsonMinifier() {
    }
}
