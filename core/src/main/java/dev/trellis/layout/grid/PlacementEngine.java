/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.trellis.layout.grid;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.ArrayList;
import java.util.List;

import dev.trellis.box.Box;
import dev.trellis.layout.LayoutException;
import dev.trellis.style.ComputedStyle;
import dev.trellis.style.GridAutoFlow;
import dev.trellis.style.GridLine;
import dev.trellis.style.TrackList;

/**
 * Assigns every grid item a {@link GridArea}.
 * <p>
 * Placement runs in three passes over the items in document order:
 * <ol>
 *   <li>items with a definite row and column are placed where they ask to be;</li>
 *   <li>items with one definite axis get the first free position along the other axis,
 *       searched from the start of the grid;</li>
 *   <li>fully automatic items follow the auto-placement cursor in flow order,
 *       wrapping at the column count (row flow) or at the explicit row count
 *       (column flow).</li>
 * </ol>
 * With sparse packing the cursor never moves backwards and is advanced past
 * every item of the second pass that precedes the next item in document
 * order. With dense packing the search restarts at the grid origin for each item.
 * </p>
 */
final class PlacementEngine {

    private static final Logger LOG = System.getLogger(PlacementEngine.class.getName());

    private final int maxColumns;
    private final int maxRows;

    PlacementEngine(int maxColumns, int maxRows) {
        this.maxColumns = maxColumns;
        this.maxRows = maxRows;
    }

    /**
     * Line range along one axis. A negative start means the position is automatic.
     */
    record Axis(int start, int span) {

        static Axis auto(int span) {
            return new Axis(-1, span);
        }

        boolean isDefinite() {
            return start >= 0;
        }

        long end() {
            return (long) start + span;
        }
    }

    GridPlacement place(List<Box> items, TrackList columns, TrackList rows, GridAutoFlow flow) throws LayoutException {
        int itemCount = items.size();
        int explicitRows = rows.trackCount();

        OccupancyMap occupancy = new OccupancyMap(maxColumns, maxRows);
        Axis[] columnAxes = new Axis[itemCount];
        Axis[] rowAxes = new Axis[itemCount];
        int columnCount = Math.max(1, columns.trackCount());
        for (int i = 0; i < itemCount; i++) {
            ComputedStyle style = items.get(i).style();
            columnAxes[i] = resolve(style.gridColumnStart(), style.gridColumnEnd(), columns.trackCount());
            rowAxes[i] = resolve(style.gridRowStart(), style.gridRowEnd(), explicitRows);
            if (columnAxes[i].isDefinite()) {
                occupancy.checkColumns(columnAxes[i].start(), columnAxes[i].span());
                columnCount = Math.max(columnCount, (int) columnAxes[i].end());
            }
            if (rowAxes[i].isDefinite()) {
                occupancy.checkRows(rowAxes[i].start(), rowAxes[i].span());
            }
        }
        int rowBound = Math.max(1, explicitRows);

        GridArea[] areas = new GridArea[itemCount];
        List<PlacedItem> placed = new ArrayList<>(itemCount);

        for (int i = 0; i < itemCount; i++) {
            if (columnAxes[i].isDefinite() && rowAxes[i].isDefinite()) {
                areas[i] = new GridArea(columnAxes[i].start(), rowAxes[i].start(), columnAxes[i].span(), rowAxes[i].span());
                occupancy.occupy(areas[i]);
                placed.add(new PlacedItem(items.get(i), areas[i]));
            }
        }

        List<Integer> semiLocked = new ArrayList<>();
        for (int i = 0; i < itemCount; i++) {
            Axis column = columnAxes[i];
            Axis row = rowAxes[i];
            if (column.isDefinite() == row.isDefinite()) {
                continue;
            }
            if (column.isDefinite()) {
                int r = 0;
                while (true) {
                    occupancy.checkRows(r, row.span());
                    if (occupancy.isFree(column.start(), r, column.span(), row.span())) {
                        break;
                    }
                    r++;
                }
                areas[i] = new GridArea(column.start(), r, column.span(), row.span());
            }
            else {
                int c = 0;
                while (true) {
                    occupancy.checkColumns(c, column.span());
                    if (occupancy.isFree(c, row.start(), column.span(), row.span())) {
                        break;
                    }
                    c++;
                }
                areas[i] = new GridArea(c, row.start(), column.span(), row.span());
                columnCount = Math.max(columnCount, areas[i].columnEnd());
            }
            occupancy.occupy(areas[i]);
            placed.add(new PlacedItem(items.get(i), areas[i]));
            semiLocked.add(i);
        }

        // Cursor in flow order: major is the row under row flow, the column under column flow
        boolean columnFlow = flow.isColumn();
        int cursorMajor = 0;
        int cursorMinor = 0;
        int nextSemiLocked = 0;
        for (int i = 0; i < itemCount; i++) {
            if (columnAxes[i].isDefinite() || rowAxes[i].isDefinite()) {
                continue;
            }

            int minorBound = columnFlow ? rowBound : columnCount;
            int majorSpan = columnFlow ? columnAxes[i].span() : rowAxes[i].span();
            int minorSpan = Math.min(columnFlow ? rowAxes[i].span() : columnAxes[i].span(), minorBound);

            if (flow.isDense()) {
                cursorMajor = 0;
                cursorMinor = 0;
            }
            else {
                while (nextSemiLocked < semiLocked.size() && semiLocked.get(nextSemiLocked) < i) {
                    GridArea before = areas[semiLocked.get(nextSemiLocked++)];
                    int major = columnFlow ? before.column() : before.row();
                    int minor = columnFlow ? before.rowEnd() : before.columnEnd();
                    if (cursorMajor < major || (cursorMajor == major && cursorMinor < minor)) {
                        cursorMajor = major;
                        cursorMinor = minor;
                    }
                }
            }

            while (true) {
                if (cursorMinor + minorSpan > minorBound) {
                    cursorMinor = 0;
                    cursorMajor++;
                }
                int column = columnFlow ? cursorMajor : cursorMinor;
                int row = columnFlow ? cursorMinor : cursorMajor;
                int columnSpan = columnFlow ? majorSpan : minorSpan;
                int rowSpan = columnFlow ? minorSpan : majorSpan;
                occupancy.checkColumns(column, columnSpan);
                occupancy.checkRows(row, rowSpan);
                if (occupancy.isFree(column, row, columnSpan, rowSpan)) {
                    areas[i] = new GridArea(column, row, columnSpan, rowSpan);
                    break;
                }
                cursorMinor++;
            }

            occupancy.occupy(areas[i]);
            columnCount = Math.max(columnCount, areas[i].columnEnd());
            placed.add(new PlacedItem(items.get(i), areas[i]));
            cursorMinor += minorSpan;
        }

        int rowCount = Math.max(explicitRows, occupancy.rowCount());
        if (LOG.isLoggable(Level.DEBUG)) {
            for (int i = 0; i < itemCount; i++) {
                LOG.log(Level.DEBUG, "Grid item {0} placed at {1}", i, areas[i]);
            }
            LOG.log(Level.DEBUG, "Grid placement: {0} columns, {1} rows, flow {2}", columnCount, rowCount, flow);
        }
        return new GridPlacement(placed, columnCount, rowCount);
    }

    /**
     * Resolve the start and end line values of one axis to a line range.
     *
     * @param explicitTracks number of explicit tracks on the axis, for negative line numbers
     */
    static Axis resolve(GridLine start, GridLine end, int explicitTracks) {
        if (start instanceof GridLine.Set startLine) {
            int from = lineIndex(startLine.line(), explicitTracks);
            if (end instanceof GridLine.Set endLine) {
                int to = lineIndex(endLine.line(), explicitTracks);
                if (from == to) {
                    return new Axis(from, 1);
                }
                return new Axis(Math.min(from, to), Math.abs(to - from));
            }
            if (end instanceof GridLine.Span span) {
                return new Axis(from, span.count());
            }
            return new Axis(from, 1);
        }

        if (end instanceof GridLine.Set endLine) {
            int to = lineIndex(endLine.line(), explicitTracks);
            int span = start instanceof GridLine.Span startSpan ? startSpan.count() : 1;
            int from = Math.max(0, to - span);
            // a span reaching before the first line is cut short so the end line holds
            return new Axis(from, Math.max(1, to - from));
        }

        if (start instanceof GridLine.Span startSpan) {
            return Axis.auto(startSpan.count());
        }
        if (end instanceof GridLine.Span endSpan) {
            return Axis.auto(endSpan.count());
        }
        return Axis.auto(1);
    }

    // 0-based line index; negative line numbers count back from the last explicit line
    private static int lineIndex(int line, int explicitTracks) {
        if (line > 0) {
            return line - 1;
        }
        return Math.max(0, explicitTracks + 1 + line);
    }
}
