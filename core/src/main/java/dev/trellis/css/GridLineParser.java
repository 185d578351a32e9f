/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.trellis.css;

import dev.trellis.style.GridLine;

/**
 * Parser for grid-line values: {@code auto}, a non-zero integer, or
 * {@code span [<positive integer>]}. The shorthand form
 * {@code <start> [ / <end> ]} is parsed by {@link #parsePair(TokenCursor)}.
 */
public final class GridLineParser {

    /**
     * Start and end line of one axis. An omitted end is {@code auto}.
     */
    public record LinePair(GridLine start, GridLine end) {

        public LinePair {
            if (start == null || end == null) {
                throw new IllegalArgumentException("Grid lines must not be null");
            }
        }
    }

    private GridLineParser() {
    }

    /**
     * Parse a single grid-line value.
     *
     * @return the line, or null with the cursor unchanged
     */
    public static GridLine parse(TokenCursor cursor) {
        int start = cursor.mark();
        cursor.skipWhitespace();

        if (ValueParsers.parseKeyword(cursor, "auto") != null) {
            return GridLine.AUTO;
        }

        if (ValueParsers.parseKeyword(cursor, "span") != null) {
            int afterSpan = cursor.mark();
            cursor.skipWhitespace();
            Integer count = ValueParsers.parseInteger(cursor);
            if (count == null) {
                cursor.reset(afterSpan);
                return GridLine.span(1);
            }
            if (count < 1) {
                cursor.reset(start);
                return null;
            }
            return GridLine.span(count);
        }

        Integer line = ValueParsers.parseInteger(cursor);
        if (line == null || line == 0) {
            cursor.reset(start);
            return null;
        }
        return GridLine.line(line);
    }

    /**
     * Parse the {@code grid-column} / {@code grid-row} shorthand.
     *
     * @return the pair, or null with the cursor unchanged
     */
    public static LinePair parsePair(TokenCursor cursor) {
        int start = cursor.mark();

        GridLine first = parse(cursor);
        if (first == null) {
            return null;
        }

        int afterFirst = cursor.mark();
        cursor.skipWhitespace();
        CssToken token = cursor.peek();
        if (token == null || !token.isDelim('/')) {
            cursor.reset(afterFirst);
            return new LinePair(first, GridLine.AUTO);
        }
        cursor.next();

        GridLine second = parse(cursor);
        if (second == null) {
            cursor.reset(start);
            return null;
        }
        return new LinePair(first, second);
    }
}
