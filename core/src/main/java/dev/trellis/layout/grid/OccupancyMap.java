/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.trellis.layout.grid;

import java.util.HashSet;
import java.util.Set;

import dev.trellis.layout.LayoutException;

/**
 * Sparse set of occupied grid cells, bounded by a maximum number of columns
 * and rows.
 */
final class OccupancyMap {

    private final Set<Long> cells = new HashSet<>();
    private final int maxColumns;
    private final int maxRows;
    private int rowCount;

    OccupancyMap(int maxColumns, int maxRows) {
        this.maxColumns = maxColumns;
        this.maxRows = maxRows;
    }

    boolean isFree(int column, int row, int columnSpan, int rowSpan) {
        for (int r = row; r < row + rowSpan; r++) {
            for (int c = column; c < column + columnSpan; c++) {
                if (cells.contains(key(c, r))) {
                    return false;
                }
            }
        }
        return true;
    }

    void occupy(GridArea area) throws LayoutException {
        checkColumns(area.column(), area.columnSpan());
        checkRows(area.row(), area.rowSpan());
        for (int r = area.row(); r < area.rowEnd(); r++) {
            for (int c = area.column(); c < area.columnEnd(); c++) {
                cells.add(key(c, r));
            }
        }
        rowCount = Math.max(rowCount, area.rowEnd());
    }

    /**
     * Fails if an area starting at the given column would exceed the column limit.
     */
    void checkColumns(int column, int columnSpan) throws LayoutException {
        if ((long) column + columnSpan > maxColumns) {
            throw new LayoutException("Grid exceeds the maximum of " + maxColumns + " columns (column " + column + ", span " + columnSpan + ")");
        }
    }

    /**
     * Fails if an area starting at the given row would exceed the row limit.
     */
    void checkRows(int row, int rowSpan) throws LayoutException {
        if ((long) row + rowSpan > maxRows) {
            throw new LayoutException("Grid exceeds the maximum of " + maxRows + " rows (row " + row + ", span " + rowSpan + ")");
        }
    }

    /**
     * Returns the number of rows touched by occupied cells.
     */
    int rowCount() {
        return rowCount;
    }

    private static long key(int column, int row) {
        return ((long) row << 32) | (column & 0xFFFFFFFFL);
    }
}
