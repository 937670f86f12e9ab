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

import com.arakelian.jsontree.JsonParser.JsonParseException;
import com.google.common.base.Preconditions;

/**
 * Static shortcuts for one-off parsing and printing on the Java heap. Each call uses its own
 * {@link JsonContext}, so calls from different threads do not interfere.
 */
public final class Json {
    public static final int VERSION_MAJOR = 1;

    public static final int VERSION_MINOR = 0;

    public static final int VERSION_PATCH = 0;

    /**
     * Returns the compact version of the given JSON text.
     *
     * @param json
     *            JSON text
     * @return compact version of the given text
     * @throws JsonParseException
     *             if the text is not valid JSON
     */
    public static String compact(final CharSequence json) throws JsonParseException {
        return printUnformatted(parse(json));
    }

    /**
     * Returns the compact version of the given JSON text; if the text cannot be parsed for
     * whatever reason, the original value is returned as-is.
     *
     * @param json
     *            JSON text
     * @return compact version of the given text or the original text if invalid JSON
     */
    public static CharSequence compactQuietly(final CharSequence json) {
        if (json == null || json.length() == 0) {
            return json;
        }
        final ParseResult result = new JsonParser(new JsonContext(), fullConsumption()).parse(json);
        if (!result.isSuccess()) {
            return json;
        }
        return printUnformatted(result.getNode());
    }

    private static JsonParseOptions fullConsumption() {
        return ImmutableJsonParseOptions.builder().requireFullConsumption(true).build();
    }

    public static String minify(final CharSequence json) {
        return JsonMinifier.minify(json);
    }

    /**
     * Parses JSON text that must consist of a single value, optionally surrounded by whitespace.
     *
     * @param json
     *            JSON text
     * @return root node
     * @throws JsonParseException
     *             if the text is not valid JSON
     */
    public static JsonNode parse(final CharSequence json) throws JsonParseException {
        return parse(json, fullConsumption());
    }

    public static JsonNode parse(final CharSequence json, final JsonParseOptions options)
            throws JsonParseException {
        return new JsonParser(new JsonContext(), options).parse(json).getOrThrow();
    }

    /**
     * Returns the indented form of a tree.
     *
     * @param node
     *            root node
     * @return indented JSON
     */
    public static String print(final JsonNode node) {
        return print(node, true);
    }

    private static String print(final JsonNode node, final boolean pretty) {
        Preconditions.checkArgument(node != null, "node must be non-null");
        final PrintResult result = new JsonPrinter(new JsonContext()).print(node, pretty);
        if (!result.isSuccess()) {
            throw new IllegalStateException("Unable to print JSON: " + result.getError());
        }
        return result.getText();
    }

    public static String printUnformatted(final JsonNode node) {
        return print(node, false);
    }

    public static String version() {
        return VERSION_MAJOR + "." + VERSION_MINOR + "." + VERSION_PATCH;
    }

    private Json() {
    }
}
