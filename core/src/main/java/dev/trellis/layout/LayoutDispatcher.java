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

/**
 * Lays out a box according to its type. Formatting contexts call back into
 * the dispatcher for their children.
 */
public interface LayoutDispatcher {

    /**
     * Lay out the contents of a box whose content width is given. Sets the
     * box's width and height and the geometry of its descendants.
     */
    void layout(BoxTree tree, Box box, int contentWidth, LayoutContext context) throws LayoutException;

    /**
     * Compute the box's minimum and maximum intrinsic widths. Does nothing
     * if they are already known.
     */
    void layoutMinMax(BoxTree tree, Box box, FontMetrics fontMetrics, LayoutContext context) throws LayoutException;
}
