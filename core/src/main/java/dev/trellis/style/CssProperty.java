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
 * Longhand properties held by {@link ComputedStyle}. Shorthands are expanded
 * into these by the declaration parser.
 */
public enum CssProperty {

    DISPLAY("display"),
    POSITION("position"),
    WIDTH("width"),
    HEIGHT("height"),
    MIN_WIDTH("min-width"),
    MAX_WIDTH("max-width"),
    MARGIN_TOP("margin-top"),
    MARGIN_RIGHT("margin-right"),
    MARGIN_BOTTOM("margin-bottom"),
    MARGIN_LEFT("margin-left"),
    PADDING_TOP("padding-top"),
    PADDING_RIGHT("padding-right"),
    PADDING_BOTTOM("padding-bottom"),
    PADDING_LEFT("padding-left"),
    BORDER_TOP_WIDTH("border-top-width"),
    BORDER_RIGHT_WIDTH("border-right-width"),
    BORDER_BOTTOM_WIDTH("border-bottom-width"),
    BORDER_LEFT_WIDTH("border-left-width"),
    COLUMN_GAP("column-gap"),
    ROW_GAP("row-gap"),
    GRID_TEMPLATE_COLUMNS("grid-template-columns"),
    GRID_TEMPLATE_ROWS("grid-template-rows"),
    GRID_COLUMN_START("grid-column-start"),
    GRID_COLUMN_END("grid-column-end"),
    GRID_ROW_START("grid-row-start"),
    GRID_ROW_END("grid-row-end"),
    GRID_AUTO_FLOW("grid-auto-flow");

    private final String propertyName;

    CssProperty(String propertyName) {
        this.propertyName = propertyName;
    }

    public String propertyName() {
        return propertyName;
    }

    /**
     * @return the longhand with this name, or null if there is none
     */
    public static CssProperty fromName(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        for (CssProperty property : values()) {
            if (property.propertyName.equals(lower)) {
                return property;
            }
        }
        return null;
    }
}
