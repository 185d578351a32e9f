/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.trellis.box;

import dev.trellis.style.Display;

/**
 * Kind of a node in the box tree.
 */
public enum BoxType {
    BLOCK,
    INLINE_BLOCK,
    INLINE,
    LIST_ITEM,
    FLEX,
    INLINE_FLEX,
    GRID,
    INLINE_GRID,
    TABLE,
    TEXT,
    /**
     * A box that generates no layout, from {@code display: none}.
     */
    NONE;

    public static BoxType forDisplay(Display display) {
        return switch (display) {
            case BLOCK -> BLOCK;
            case INLINE -> INLINE;
            case INLINE_BLOCK -> INLINE_BLOCK;
            case LIST_ITEM -> LIST_ITEM;
            case FLEX -> FLEX;
            case INLINE_FLEX -> INLINE_FLEX;
            case GRID -> GRID;
            case INLINE_GRID -> INLINE_GRID;
            case TABLE -> TABLE;
            case NONE -> NONE;
        };
    }

    /**
     * Returns the block-level equivalent of this type, as used for the
     * children of a grid container.
     */
    public BoxType blockified() {
        return switch (this) {
            case INLINE, INLINE_BLOCK -> BLOCK;
            case INLINE_FLEX -> FLEX;
            case INLINE_GRID -> GRID;
            default -> this;
        };
    }

    public boolean isGridContainer() {
        return this == GRID || this == INLINE_GRID;
    }
}
