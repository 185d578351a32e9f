/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.trellis.style;

import java.util.Locale;

/**
 * Computed values of the {@code display} property understood by layout.
 */
public enum Display {

    BLOCK("block"),
    INLINE("inline"),
    INLINE_BLOCK("inline-block"),
    LIST_ITEM("list-item"),
    FLEX("flex"),
    INLINE_FLEX("inline-flex"),
    GRID("grid"),
    INLINE_GRID("inline-grid"),
    TABLE("table"),
    NONE("none");

    private final String keyword;

    Display(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    /**
     * @return the display value for a keyword, or null if unknown
     */
    public static Display fromKeyword(String keyword) {
        String lower = keyword.toLowerCase(Locale.ROOT);
        for (Display display : values()) {
            if (display.keyword.equals(lower)) {
                return display;
            }
        }
        return null;
    }
}
