/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.trellis.layout;

import dev.trellis.box.Box;

/**
 * Resolves the size properties of a box against its containing block.
 */
public interface DimensionResolver {

    /**
     * @param box the box whose style is resolved
     * @param availableWidth containing block width in device pixels, the base for percentages
     * @param context unit environment and configuration
     */
    ResolvedDimensions resolve(Box box, int availableWidth, LayoutContext context);

    /**
     * Resolve the box's dimensions and store its margin, padding and border
     * widths on the box.
     */
    default ResolvedDimensions apply(Box box, int availableWidth, LayoutContext context) {
        ResolvedDimensions dimensions = resolve(box, availableWidth, context);
        box.setMargin(dimensions.margin());
        box.setPadding(dimensions.padding());
        box.setBorder(dimensions.border());
        return dimensions;
    }
}
