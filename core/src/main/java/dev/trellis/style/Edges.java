/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.trellis.style;

/**
 * Four per-side lengths, used for margins, padding and border widths.
 */
public record Edges(Length top, Length right, Length bottom, Length left) {

    public static final Edges ZERO = new Edges(Length.ZERO, Length.ZERO, Length.ZERO, Length.ZERO);

    public Edges {
        if (top == null || right == null || bottom == null || left == null) {
            throw new IllegalArgumentException("Edges require all four sides");
        }
    }

    public static Edges all(Length length) {
        return new Edges(length, length, length, length);
    }

    public Edges withTop(Length length) {
        return new Edges(length, right, bottom, left);
    }

    public Edges withRight(Length length) {
        return new Edges(top, length, bottom, left);
    }

    public Edges withBottom(Length length) {
        return new Edges(top, right, length, left);
    }

    public Edges withLeft(Length length) {
        return new Edges(top, right, bottom, length);
    }
}
