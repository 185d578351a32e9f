/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.trellis.css;

import dev.trellis.style.CssUnit;
import dev.trellis.style.Length;

/**
 * Grammar pieces shared by the property parsers. Every method either
 * consumes exactly the tokens of the value it returns, or consumes nothing
 * and returns null.
 */
final class ValueParsers {

    private ValueParsers() {
    }

    /**
     * Parse {@code <length> | <percentage>}; a unitless number is accepted
     * as pixels.
     */
    static Length parseLengthPercentage(TokenCursor cursor, boolean allowNegative) {
        return parseLength(cursor, allowNegative, true);
    }

    static Length parseLength(TokenCursor cursor, boolean allowNegative, boolean allowPercentage) {
        CssToken token = cursor.peek();
        if (token == null) {
            return null;
        }
        Length length = switch (token.type()) {
            case NUMBER -> new Length(token.number(), CssUnit.PX);
            case PERCENTAGE -> allowPercentage ? Length.percent(token.number()) : null;
            case DIMENSION -> {
                CssUnit unit = CssUnit.fromSuffix(token.text());
                yield unit != null && unit.isLength() ? new Length(token.number(), unit) : null;
            }
            default -> null;
        };
        if (length == null || (!allowNegative && length.value() < 0)) {
            return null;
        }
        cursor.next();
        return length;
    }

    /**
     * Parse an integer number token (no fraction, no exponent).
     *
     * @return the value, or null if the next token is not an integer
     */
    static Integer parseInteger(TokenCursor cursor) {
        CssToken token = cursor.peek();
        if (token == null || token.type() != CssToken.Type.NUMBER || !token.integer()) {
            return null;
        }
        double value = token.number();
        if (value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
            return null;
        }
        cursor.next();
        return (int) value;
    }

    /**
     * Consume an identifier matching one of the given names, ignoring case.
     *
     * @return the matched name as given, or null
     */
    static String parseKeyword(TokenCursor cursor, String... names) {
        CssToken token = cursor.peek();
        if (token == null || token.type() != CssToken.Type.IDENT) {
            return null;
        }
        for (String name : names) {
            if (token.isIdent(name)) {
                cursor.next();
                return name;
            }
        }
        return null;
    }
}
