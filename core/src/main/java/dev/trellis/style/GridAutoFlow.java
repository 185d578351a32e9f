/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.trellis.style;

/**
 * Computed value of {@code grid-auto-flow}.
 */
public enum GridAutoFlow {

    ROW(false, false),
    COLUMN(true, false),
    ROW_DENSE(false, true),
    COLUMN_DENSE(true, true);

    private final boolean column;
    private final boolean dense;

    GridAutoFlow(boolean column, boolean dense) {
        this.column = column;
        this.dense = dense;
    }

    public boolean isColumn() {
        return column;
    }

    public boolean isDense() {
        return dense;
    }

    public static GridAutoFlow of(boolean column, boolean dense) {
        if (column) {
            return dense ? COLUMN_DENSE : COLUMN;
        }
        return dense ? ROW_DENSE : ROW;
    }
}
