/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.trellis.css;

import dev.trellis.style.GridAutoFlow;

/**
 * Parser for {@code grid-auto-flow}: {@code [ row | column ] || dense}.
 */
public final class AutoFlowParser {

    private AutoFlowParser() {
    }

    /**
     * @return the flow, or null with the cursor unchanged
     */
    public static GridAutoFlow parse(TokenCursor cursor) {
        int start = cursor.mark();
        String direction = null;
        boolean dense = false;

        for (int i = 0; i < 2; i++) {
            int beforeKeyword = cursor.mark();
            cursor.skipWhitespace();
            String keyword = ValueParsers.parseKeyword(cursor, "row", "column", "dense");
            if (keyword == null) {
                cursor.reset(beforeKeyword);
                break;
            }
            if (keyword.equals("dense")) {
                if (dense) {
                    cursor.reset(start);
                    return null;
                }
                dense = true;
            }
            else {
                if (direction != null) {
                    cursor.reset(start);
                    return null;
                }
                direction = keyword;
            }
        }

        if (direction == null && !dense) {
            cursor.reset(start);
            return null;
        }
        return GridAutoFlow.of("column".equals(direction), dense);
    }
}
