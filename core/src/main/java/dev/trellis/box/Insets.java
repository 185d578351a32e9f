/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.trellis.box;

/**
 * Resolved edge widths of a box in device pixels.
 */
public record Insets(int top, int right, int bottom, int left) {

    public static final Insets ZERO = new Insets(0, 0, 0, 0);

    public int horizontal() {
        return left + right;
    }

    public int vertical() {
        return top + bottom;
    }
}
