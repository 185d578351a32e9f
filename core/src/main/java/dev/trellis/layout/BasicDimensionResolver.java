/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.trellis.layout;

import dev.trellis.box.Box;
import dev.trellis.box.Insets;
import dev.trellis.style.ComputedStyle;
import dev.trellis.style.Edges;
import dev.trellis.style.Length;

/**
 * Content-box {@link DimensionResolver}. Horizontal and vertical percentages
 * of margins and padding resolve against the available width; percentage
 * heights behave as {@code auto} since the containing block height is not
 * known during width-driven layout.
 */
public final class BasicDimensionResolver implements DimensionResolver {

    public static final BasicDimensionResolver INSTANCE = new BasicDimensionResolver();

    @Override
    public ResolvedDimensions resolve(Box box, int availableWidth, LayoutContext context) {
        ComputedStyle style = box.style();
        UnitContext units = context.units();

        int width = size(style.width(), availableWidth, units);
        int height = style.height() == null || style.height().isPercentage()
                ? Box.AUTO
                : UnitConverter.toDevicePixels(style.height(), units);
        int minWidth = style.minWidth() == null ? 0 : UnitConverter.toDevicePixels(style.minWidth(), availableWidth, units);
        int maxWidth = size(style.maxWidth(), availableWidth, units);

        return new ResolvedDimensions(width, height, minWidth, maxWidth,
                insets(style.margin(), availableWidth, units),
                insets(style.padding(), availableWidth, units),
                insets(style.borderWidth(), availableWidth, units));
    }

    private static int size(Length length, int availableWidth, UnitContext units) {
        if (length == null) {
            return Box.AUTO;
        }
        return Math.max(0, UnitConverter.toDevicePixels(length, availableWidth, units));
    }

    private static Insets insets(Edges edges, int availableWidth, UnitContext units) {
        return new Insets(
                UnitConverter.toDevicePixels(edges.top(), availableWidth, units),
                UnitConverter.toDevicePixels(edges.right(), availableWidth, units),
                UnitConverter.toDevicePixels(edges.bottom(), availableWidth, units),
                UnitConverter.toDevicePixels(edges.left(), availableWidth, units));
    }
}
