/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.trellis.layout;

import dev.trellis.box.Box;
import dev.trellis.box.BoxTree;
import dev.trellis.box.BoxType;
import dev.trellis.style.ComputedStyle;
import dev.trellis.style.Edges;
import dev.trellis.style.Length;

/**
 * Minimal block formatting: children are stacked vertically, each at the
 * full available width unless it has a definite width. Margins do not
 * collapse. Out-of-flow children are laid out at their static position
 * without taking up space.
 */
final class BlockLayout {

    private BlockLayout() {
    }

    static void layout(BoxTree tree, Box box, int contentWidth, LayoutContext context) throws LayoutException {
        box.setWidth(contentWidth);
        int y = 0;
        for (Box child : tree.children(box)) {
            if (child.type() == BoxType.NONE) {
                child.setWidth(0);
                child.setHeight(0);
                continue;
            }

            ResolvedDimensions dimensions = context.dimensionResolver().apply(child, contentWidth, context);
            int childWidth = dimensions.hasWidth()
                    ? dimensions.width()
                    : Math.max(0, contentWidth - dimensions.horizontalEdges());
            childWidth = dimensions.clampWidth(childWidth);

            context.dispatcher().layout(tree, child, childWidth, context);
            if (dimensions.hasHeight()) {
                child.setHeight(dimensions.height());
            }
            child.setX(dimensions.margin().left());
            child.setY(y + dimensions.margin().top());

            if (!child.style().isOutOfFlow()) {
                y += child.outerHeight();
            }
        }
        box.setHeight(y);
    }

    static void layoutMinMax(BoxTree tree, Box box, FontMetrics fontMetrics, LayoutContext context) throws LayoutException {
        int min = 0;
        int max = 0;
        for (Box child : tree.children(box)) {
            if (child.type() == BoxType.NONE || child.style().isOutOfFlow()) {
                continue;
            }
            context.dispatcher().layoutMinMax(tree, child, fontMetrics, context);
            min = Math.max(min, child.minWidth());
            max = Math.max(max, child.maxWidth());
        }

        ComputedStyle style = box.style();
        Length width = style.width();
        if (width != null && !width.isPercentage()) {
            min = UnitConverter.toDevicePixels(width, context.units());
            max = min;
        }

        int edges = fixedHorizontal(style.margin(), context) + fixedHorizontal(style.padding(), context)
                + fixedHorizontal(style.borderWidth(), context);
        box.setMinWidth(min + edges);
        box.setMaxWidth(Math.max(min, max) + edges);
    }

    // percentages are unknown during intrinsic sizing and count as zero
    private static int fixedHorizontal(Edges edges, LayoutContext context) {
        return fixed(edges.left(), context) + fixed(edges.right(), context);
    }

    private static int fixed(Length length, LayoutContext context) {
        return length.isPercentage() ? 0 : UnitConverter.toDevicePixels(length, context.units());
    }
}
