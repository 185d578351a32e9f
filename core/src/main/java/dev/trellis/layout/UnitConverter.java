/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.trellis.layout;

import dev.trellis.style.CssUnit;
import dev.trellis.style.Length;

/**
 * Converts CSS lengths to integer device pixels. Results are truncated
 * towards zero.
 */
public final class UnitConverter {

    // Font-relative x-height and advance of "0", as a fraction of the font size
    private static final double EX_RATIO = 0.5;

    private UnitConverter() {
    }

    /**
     * Convert an absolute, font-relative or viewport-relative length.
     *
     * @throws IllegalArgumentException for percentages and non-length units
     */
    public static int toDevicePixels(Length length, UnitContext units) {
        return (int) (toCssPixels(length.value(), length.unit(), units) * units.dpi() / UnitContext.CSS_DPI);
    }

    /**
     * Convert a length, resolving percentages against the given base (in
     * device pixels).
     */
    public static int toDevicePixels(Length length, int percentageBase, UnitContext units) {
        if (length.isPercentage()) {
            return (int) (length.value() * percentageBase / 100);
        }
        return toDevicePixels(length, units);
    }

    static double toCssPixels(double value, CssUnit unit, UnitContext units) {
        return switch (unit) {
            case PX -> value;
            case IN -> value * 96;
            case CM -> value * 96 / 2.54;
            case MM -> value * 96 / 25.4;
            case Q -> value * 96 / 101.6;
            case PT -> value * 96 / 72;
            case PC -> value * 16;
            case EM -> value * units.fontSize();
            case REM -> value * units.rootFontSize();
            case EX, CH -> value * units.fontSize() * EX_RATIO;
            case VW -> value * units.viewportWidth() / 100;
            case VH -> value * units.viewportHeight() / 100;
            case VMIN -> value * Math.min(units.viewportWidth(), units.viewportHeight()) / 100;
            case VMAX -> value * Math.max(units.viewportWidth(), units.viewportHeight()) / 100;
            case PCT, FR, MIN_CONTENT, MAX_CONTENT, MINMAX -> throw new IllegalArgumentException("Not an absolute length unit: " + unit);
        };
    }
}
