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
import dev.trellis.box.BoxTree;
import dev.trellis.box.BoxType;
import dev.trellis.layout.FontMetrics;
import dev.trellis.layout.LayoutContext;
import dev.trellis.layout.LayoutException;
import dev.trellis.layout.ResolvedDimensions;
import dev.trellis.layout.UnitContext;
import dev.trellis.layout.UnitConverter;
import dev.trellis.style.ComputedStyle;
import dev.trellis.style.Gap;

/**
 * Entry points of grid layout.
 * <p>
 * {@link #layoutGrid} places the container's items, sizes the columns from
 * the available width, lays out each item in its area and sets the
 * container's height. {@link #layoutMinMaxGrid} computes the container's
 * intrinsic widths. Both are synchronous and keep no state between calls.
 * </p>
 */
public final class GridLayout {

    private static final Logger LOG = System.getLogger(GridLayout.class.getName());

    private GridLayout() {
    }

    /**
     * Lay out a grid container.
     *
     * @param tree the box tree holding the container
     * @param container a {@link BoxType#GRID} or {@link BoxType#INLINE_GRID} box
     * @param availableWidth the container's content width in device pixels
     * @param context layout configuration and collaborators
     * @throws LayoutException if an item cannot be laid out or the grid grows past the column or row limit;
     *         geometry written before the failure is not meaningful
     */
    public static void layoutGrid(BoxTree tree, Box container, int availableWidth, LayoutContext context) throws LayoutException {
        checkGrid(container);
        ComputedStyle style = container.style();
        UnitContext units = context.units();
        container.setWidth(Math.max(0, availableWidth));

        int columnGap = gapPixels(style.columnGap(), container.width(), units);
        // row gaps have no definite percentage base
        int rowGap = gapPixels(style.rowGap(), 0, units);

        List<Box> items = gridItems(tree, container);
        GridPlacement placement = new PlacementEngine(context.maxColumns(), context.maxImplicitRows())
                .place(items, style.gridTemplateColumns(), style.gridTemplateRows(), style.gridAutoFlow());

        int[] columnWidths = TrackResolver.resolveColumns(style.gridTemplateColumns(), placement.columnCount(),
                container.width(), columnGap, units);

        int height = new BoxPositioner(tree, context, columnWidths, columnGap, rowGap)
                .position(placement, style.gridTemplateRows());
        container.setHeight(height);

        layoutOutOfFlow(tree, container, context);

        LOG.log(Level.DEBUG, "Grid {0} laid out: {1} items, {2}x{3} tracks, size {4}x{5}", container.id(), items.size(),
                placement.columnCount(), placement.rowCount(), container.width(), height);
    }

    /**
     * Compute the minimum and maximum intrinsic widths of a grid container.
     * Does nothing if they are already known.
     */
    public static void layoutMinMaxGrid(BoxTree tree, Box container, FontMetrics fontMetrics, LayoutContext context) throws LayoutException {
        checkGrid(container);
        IntrinsicSizeCalculator.compute(tree, container, fontMetrics, context);
    }

    /**
     * Returns the children taking part in grid layout: in-flow, generating a
     * box, and not whitespace-only text.
     */
    static List<Box> gridItems(BoxTree tree, Box container) {
        List<Box> items = new ArrayList<>();
        for (Box child : tree.children(container)) {
            if (child.type() == BoxType.NONE || child.style().isOutOfFlow()) {
                continue;
            }
            if (child.type() == BoxType.TEXT && child.text().isBlank()) {
                continue;
            }
            items.add(child);
        }
        return items;
    }

    /**
     * Resolve a gap to device pixels; {@code normal} is zero and
     * percentages resolve against the given base.
     */
    static int gapPixels(Gap gap, int percentageBase, UnitContext units) {
        if (gap.isNormal()) {
            return 0;
        }
        return Math.max(0, UnitConverter.toDevicePixels(gap.length(), percentageBase, units));
    }

    // Absolutely positioned children sit at the container's content origin
    private static void layoutOutOfFlow(BoxTree tree, Box container, LayoutContext context) throws LayoutException {
        for (Box child : tree.children(container)) {
            if (child.type() == BoxType.NONE) {
                child.setWidth(0);
                child.setHeight(0);
                continue;
            }
            if (!child.style().isOutOfFlow()) {
                continue;
            }
            ResolvedDimensions dimensions = context.dimensionResolver().apply(child, container.width(), context);
            int width = dimensions.hasWidth()
                    ? dimensions.width()
                    : Math.max(0, container.width() - dimensions.horizontalEdges());
            context.dispatcher().layout(tree, child, dimensions.clampWidth(width), context);
            if (dimensions.hasHeight()) {
                child.setHeight(dimensions.height());
            }
            child.setX(dimensions.margin().left());
            child.setY(dimensions.margin().top());
        }
    }

    private static void checkGrid(Box container) {
        if (!container.type().isGridContainer()) {
            throw new IllegalArgumentException("Box " + container.id() + " is not a grid container: " + container.type());
        }
    }
}
