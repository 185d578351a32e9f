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
import dev.trellis.layout.grid.GridLayout;

/**
 * Dispatcher routing grid containers to {@link GridLayout}, text to
 * {@link TextLayout} and every other box to the vertical stacking of
 * {@link BlockLayout}.
 */
public final class DefaultLayoutDispatcher implements LayoutDispatcher {

    public static final DefaultLayoutDispatcher INSTANCE = new DefaultLayoutDispatcher();

    @Override
    public void layout(BoxTree tree, Box box, int contentWidth, LayoutContext context) throws LayoutException {
        switch (box.type()) {
            case GRID, INLINE_GRID -> GridLayout.layoutGrid(tree, box, contentWidth, context);
            case TEXT -> TextLayout.layout(box, contentWidth, context.fontMetrics());
            case NONE -> {
                box.setWidth(0);
                box.setHeight(0);
            }
            case BLOCK, INLINE_BLOCK, INLINE, LIST_ITEM, FLEX, INLINE_FLEX, TABLE -> BlockLayout.layout(tree, box, contentWidth, context);
        }
    }

    @Override
    public void layoutMinMax(BoxTree tree, Box box, FontMetrics fontMetrics, LayoutContext context) throws LayoutException {
        if (box.hasIntrinsicWidths()) {
            return;
        }
        switch (box.type()) {
            case GRID, INLINE_GRID -> GridLayout.layoutMinMaxGrid(tree, box, fontMetrics, context);
            case TEXT -> TextLayout.layoutMinMax(box, fontMetrics);
            case NONE -> {
                box.setMinWidth(0);
                box.setMaxWidth(0);
            }
            case BLOCK, INLINE_BLOCK, INLINE, LIST_ITEM, FLEX, INLINE_FLEX, TABLE -> BlockLayout.layoutMinMax(tree, box, fontMetrics, context);
        }
    }
}
