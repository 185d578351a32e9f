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
import java.util.List;

import dev.trellis.box.Box;
import dev.trellis.box.BoxTree;
import dev.trellis.layout.FontMetrics;
import dev.trellis.layout.LayoutContext;
import dev.trellis.layout.LayoutException;
import dev.trellis.layout.UnitConverter;
import dev.trellis.style.ComputedStyle;
import dev.trellis.style.TrackList;
import dev.trellis.style.TrackSize;

/**
 * Computes the minimum and maximum intrinsic widths of a grid container.
 * Items are assigned to columns round-robin in document order; explicit
 * placement is not taken into account.
 */
final class IntrinsicSizeCalculator {

    private static final Logger LOG = System.getLogger(IntrinsicSizeCalculator.class.getName());

    private IntrinsicSizeCalculator() {
    }

    static void compute(BoxTree tree, Box grid, FontMetrics fontMetrics, LayoutContext context) throws LayoutException {
        if (grid.hasIntrinsicWidths()) {
            return;
        }

        ComputedStyle style = grid.style();
        TrackList tracks = style.gridTemplateColumns();
        int columns = Math.max(1, tracks.trackCount());
        int[] columnMin = new int[columns];
        int[] columnMax = new int[columns];

        List<Box> items = GridLayout.gridItems(tree, grid);
        for (int i = 0; i < items.size(); i++) {
            Box item = items.get(i);
            context.dispatcher().layoutMinMax(tree, item, fontMetrics, context);
            int column = i % columns;
            columnMin[column] = Math.max(columnMin[column], item.minWidth());
            columnMax[column] = Math.max(columnMax[column], item.maxWidth());
        }

        int min = 0;
        int max = 0;
        for (int i = 0; i < columns; i++) {
            TrackSize track = tracks.trackFor(i);
            // minmax() with a definite maximum sizes like that maximum
            if (track instanceof TrackSize.MinMax minMax && minMax.max().isDefinite()) {
                track = minMax.max();
            }
            if (track instanceof TrackSize.Fixed fixed) {
                int width = UnitConverter.toDevicePixels(fixed.toLength(), context.units());
                min += width;
                max += width;
            }
            else if (!(track instanceof TrackSize.Percentage)) {
                min += columnMin[i];
                max += columnMax[i];
            }
        }

        // percentage gaps have no base during intrinsic sizing
        int gap = GridLayout.gapPixels(style.columnGap(), 0, context.units());
        min += (columns - 1) * gap;
        max += (columns - 1) * gap;

        grid.setMinWidth(min);
        grid.setMaxWidth(Math.max(min, max));
        LOG.log(Level.DEBUG, "Grid {0} intrinsic widths: min={1}, max={2}, columns={3}", grid.id(), min, grid.maxWidth(), columns);
    }
}
