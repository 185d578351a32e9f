/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.trellis.layout.grid;

/**
 * Resolved grid area of an item: 0-based start track and span per axis.
 */
record GridArea(int column, int row, int columnSpan, int rowSpan) {

    GridArea {
        if (column < 0 || row < 0) {
            throw new IllegalArgumentException("Grid area cannot start before the grid: column=" + column + ", row=" + row);
        }
        if (columnSpan < 1 || rowSpan < 1) {
            throw new IllegalArgumentException("Grid area spans must be positive: " + columnSpan + "x" + rowSpan);
        }
    }

    /**
     * Exclusive end column.
     */
    int columnEnd() {
        return column + columnSpan;
    }

    /**
     * Exclusive end row.
     */
    int rowEnd() {
        return row + rowSpan;
    }
}
