/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.trellis.layout.grid;

import java.util.List;

import dev.trellis.box.Box;

/**
 * Result of grid item placement.
 *
 * @param items items in the order they were placed
 * @param columnCount number of columns, explicit and implicit
 * @param rowCount number of rows, explicit and implicit
 */
record GridPlacement(List<PlacedItem> items, int columnCount, int rowCount) {

    GridPlacement {
        items = List.copyOf(items);
    }

    /**
     * Returns the area of the given box, or null if it was not placed.
     */
    GridArea areaOf(Box box) {
        for (PlacedItem item : items) {
            if (item.box() == box) {
                return item.area();
            }
        }
        return null;
    }
}
