/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.trellis.layout.grid;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import dev.trellis.box.Box;
import dev.trellis.box.BoxTree;
import dev.trellis.layout.LayoutContext;
import dev.trellis.layout.LayoutException;
import dev.trellis.layout.ResolvedDimensions;
import dev.trellis.style.TrackList;

/**
 * Lays out placed grid items inside their areas and computes row heights.
 */
final class BoxPositioner {

    private final BoxTree tree;
    private final LayoutContext context;
    private final int[] columnWidths;
    private final int columnGap;
    private final int rowGap;

    BoxPositioner(BoxTree tree, LayoutContext context, int[] columnWidths, int columnGap, int rowGap) {
        this.tree = tree;
        this.context = context;
        this.columnWidths = columnWidths;
        this.columnGap = columnGap;
        this.rowGap = rowGap;
    }

    /**
     * Lay out and position every placed item.
     *
     * @return the total height of the rows including gaps
     */
    int position(GridPlacement placement, TrackList rowTracks) throws LayoutException {
        List<PlacedItem> items = placement.items();
        boolean[] stretch = new boolean[items.size()];

        for (int i = 0; i < items.size(); i++) {
            PlacedItem item = items.get(i);
            Box box = item.box();
            GridArea area = item.area();

            int cellWidth = span(columnWidths, area.column(), area.columnSpan(), columnGap);
            ResolvedDimensions dimensions = context.dimensionResolver().apply(box, cellWidth, context);
            // items always fill their cell horizontally, whatever width they declare
            int contentWidth = Math.max(0, cellWidth - dimensions.horizontalEdges());

            context.dispatcher().layout(tree, box, contentWidth, context);
            if (dimensions.hasHeight()) {
                box.setHeight(dimensions.height());
            }
            stretch[i] = !dimensions.hasHeight();
        }

        int[] rowHeights = TrackResolver.initialRowHeights(rowTracks, placement.rowCount(), context.units());

        // Grow the last spanned row of each area, visiting areas by their last row
        List<PlacedItem> byLastRow = new ArrayList<>(items);
        byLastRow.sort(Comparator.comparingInt(item -> item.area().rowEnd()));
        for (PlacedItem item : byLastRow) {
            GridArea area = item.area();
            int last = area.rowEnd() - 1;
            int earlier = span(rowHeights, area.row(), area.rowSpan() - 1, rowGap);
            if (area.rowSpan() > 1) {
                earlier += rowGap;
            }
            int needed = item.box().outerHeight() - earlier;
            if (needed > rowHeights[last]) {
                rowHeights[last] = needed;
            }
        }

        for (int i = 0; i < items.size(); i++) {
            Box box = items.get(i).box();
            GridArea area = items.get(i).area();
            box.setX(offset(columnWidths, area.column(), columnGap) + box.margin().left());
            box.setY(offset(rowHeights, area.row(), rowGap) + box.margin().top());
            if (stretch[i]) {
                int areaHeight = span(rowHeights, area.row(), area.rowSpan(), rowGap);
                int edges = box.margin().vertical() + box.padding().vertical() + box.border().vertical();
                box.setHeight(Math.max(0, areaHeight - edges));
            }
        }

        if (rowHeights.length == 0) {
            return 0;
        }
        return span(rowHeights, 0, rowHeights.length, rowGap);
    }

    // Sum of count tracks from start, with the gaps between them
    private static int span(int[] sizes, int start, int count, int gap) {
        int total = 0;
        for (int i = start; i < start + count; i++) {
            total += sizes[i];
            if (i > start) {
                total += gap;
            }
        }
        return total;
    }

    private static int offset(int[] sizes, int index, int gap) {
        int offset = 0;
        for (int i = 0; i < index; i++) {
            offset += sizes[i] + gap;
        }
        return offset;
    }
}
