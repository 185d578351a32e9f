/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.trellis.layout;

/**
 * Environment needed to convert CSS lengths to device pixels.
 *
 * @param dpi device resolution; 96 maps one CSS pixel to one device pixel
 * @param fontSize computed font size in CSS pixels, for {@code em}, {@code ex} and {@code ch}
 * @param rootFontSize font size of the root element in CSS pixels, for {@code rem}
 * @param viewportWidth viewport width in CSS pixels
 * @param viewportHeight viewport height in CSS pixels
 */
public record UnitContext(double dpi, double fontSize, double rootFontSize, int viewportWidth, int viewportHeight) {

    public static final double CSS_DPI = 96.0;

    public static final UnitContext DEFAULT = new UnitContext(CSS_DPI, 16, 16, 1024, 768);

    public UnitContext {
        if (dpi <= 0) {
            throw new IllegalArgumentException("DPI must be positive: " + dpi);
        }
        if (fontSize <= 0 || rootFontSize <= 0) {
            throw new IllegalArgumentException("Font sizes must be positive: " + fontSize + ", " + rootFontSize);
        }
        if (viewportWidth < 0 || viewportHeight < 0) {
            throw new IllegalArgumentException("Viewport cannot be negative: " + viewportWidth + "x" + viewportHeight);
        }
    }

    public UnitContext withViewport(int width, int height) {
        return new UnitContext(dpi, fontSize, rootFontSize, width, height);
    }

    public UnitContext withDpi(double dpi) {
        return new UnitContext(dpi, fontSize, rootFontSize, viewportWidth, viewportHeight);
    }
}
