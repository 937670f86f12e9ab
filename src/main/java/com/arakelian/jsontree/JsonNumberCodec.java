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

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;

/**
 * Parses numbers with <code>strtod</code> decimal syntax and formats them with the printer's
 * heuristics. Formatting works on the exact binary value with round-half-even, like C
 * <code>printf</code>, and never depends on the default locale.
 */
final class JsonNumberCodec {
    /** difference between 1.0 and the next larger double, C's <code>DBL_EPSILON</code> **/
    static final double DBL_EPSILON = Math.ulp(1.0);

    /** significant digits of a <code>%e</code> mantissa **/
    private static final MathContext EXPONENTIAL_PRECISION = new MathContext(7, RoundingMode.HALF_EVEN);

    private static String exponential(final double d) {
        final BigDecimal rounded = new BigDecimal(d).round(EXPONENTIAL_PRECISION);
        final int exponent = rounded.precision() - rounded.scale() - 1;
        final BigDecimal mantissa = rounded.movePointLeft(exponent).setScale(6, RoundingMode.HALF_EVEN);
        final int magnitude = Math.abs(exponent);
        return mantissa.toPlainString() + (exponent < 0 ? "e-" : "e+") + (magnitude < 10 ? "0" : "")
                + magnitude;
    }

    private static String fixed(final double d, final int decimals) {
        return new BigDecimal(d).setScale(decimals, RoundingMode.HALF_EVEN).toPlainString();
    }

    /**
     * Formats a number value.
     *
     * <ol>
     * <li>integral values within the int range print as a plain integer;</li>
     * <li>NaN and infinities print as <code>null</code>;</li>
     * <li>other integral values below 1e60 in magnitude print without decimals;</li>
     * <li>magnitudes below 1e-6 or above 1e9 print like <code>%e</code>;</li>
     * <li>everything else prints like <code>%f</code>.</li>
     * </ol>
     *
     * @param d
     *            number value
     * @param intValue
     *            saturated int mirror of <code>d</code>
     * @return ASCII representation
     */
    static String format(final double d, final int intValue) {
        if (Math.abs(intValue - d) <= DBL_EPSILON && d <= Integer.MAX_VALUE && d >= Integer.MIN_VALUE) {
            return Integer.toString(intValue);
        }
        if (d * 0 != 0) {
            return "null";
        }
        if (Math.abs(Math.floor(d) - d) <= DBL_EPSILON && Math.abs(d) < 1.0e60) {
            return fixed(d, 0);
        }
        if (Math.abs(d) < 1.0e-6 || Math.abs(d) > 1.0e9) {
            return exponential(d);
        }
        return fixed(d, 6);
    }

    private static boolean isDigit(final int ch) {
        return ch >= '0' && ch <= '9';
    }

    /**
     * Parses the number starting at <code>start</code> into <code>item</code>.
     *
     * @param item
     *            node to populate
     * @param in
     *            input
     * @param start
     *            position of the sign or first digit
     * @return position after the number, or -1 if no digits were found
     */
    static int parseNumber(final JsonNode item, final JsonInput in, final int start) {
        int pos = start;
        if (in.at(pos) == '-') {
            pos++;
        }

        int digits = 0;
        while (isDigit(in.at(pos))) {
            pos++;
            digits++;
        }
        if (in.at(pos) == '.') {
            int fraction = pos + 1;
            while (isDigit(in.at(fraction))) {
                fraction++;
                digits++;
            }
            if (digits != 0) {
                pos = fraction;
            }
        }
        if (digits == 0) {
            return in.fail(JsonError.MALFORMED_NUMBER, start);
        }

        // exponent only counts when at least one digit follows
        final int e = in.at(pos);
        if (e == 'e' || e == 'E') {
            int exponent = pos + 1;
            final int sign = in.at(exponent);
            if (sign == '+' || sign == '-') {
                exponent++;
            }
            if (isDigit(in.at(exponent))) {
                while (isDigit(in.at(exponent))) {
                    exponent++;
                }
                pos = exponent;
            }
        }

        final String text = new String(in.bytes(), start, pos - start, StandardCharsets.US_ASCII);
        item.setType(JsonType.NUMBER);
        item.setNumber(Double.parseDouble(text));
        return pos;
    }

    /**
     * Formats the number of <code>item</code> at the buffer offset, <code>sprintf</code>-style:
     * the text and its terminator are written without advancing the offset, which is then
     * recomputed with {@link PrintBuffer#update()}.
     *
     * @param item
     *            NUMBER node
     * @param buffer
     *            output
     * @return false if the buffer could not make room
     */
    static boolean printNumber(final JsonNode item, final PrintBuffer buffer) {
        final String text = format(item.getNumber(), item.getInt());
        final int pos = buffer.ensure(text.length() + 1);
        if (pos < 0) {
            return false;
        }
        final byte[] out = buffer.buffer();
        for (int i = 0, length = text.length(); i < length; i++) {
            out[pos + i] = (byte) text.charAt(i);
        }
        out[pos + text.length()] = 0;
        buffer.update();
        return true;
    }

    private JsonNumberCodec() {
    }
}
