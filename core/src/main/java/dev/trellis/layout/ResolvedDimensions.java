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

/**
 * Used values of a box's size properties in device pixels.
 * {@link Box#AUTO} stands for {@code auto} sizes and for a {@code max-width}
 * of {@code none}.
 */
public record ResolvedDimensions(int width, int height, int minWidth, int maxWidth,
        Insets margin, Insets padding, Insets border) {

    public boolean hasWidth() {
        return width != Box.AUTO;
    }

    public boolean hasHeight() {
        return height != Box.AUTO;
    }

    /**
     * Apply {@code min-width} and {@code max-width} to a content width;
     * the minimum wins over the maximum.
     */
    public int clampWidth(int contentWidth) {
        int result = contentWidth;
        if (maxWidth != Box.AUTO && result > maxWidth) {
            result = maxWidth;
        }
        if (result < minWidth) {
            result = minWidth;
        }
        return result;
    }

    /**
     * Sum of horizontal margins, padding and borders.
     */
    public int horizontalEdges() {
        return margin.horizontal() + padding.horizontal() + border.horizontal();
    }
}
