/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.trellis.style;

/**
 * A number paired with a length or percentage unit.
 */
public record Length(double value, CssUnit unit) {

    public static final Length ZERO = new Length(0, CssUnit.PX);

    public Length {
        if (unit == null) {
            throw new IllegalArgumentException("Unit must not be null");
        }
        if (!unit.isLength() && unit != CssUnit.PCT) {
            throw new IllegalArgumentException("Not a length unit: " + unit);
        }
    }

    public static Length px(double value) {
        return new Length(value, CssUnit.PX);
    }

    public static Length percent(double value) {
        return new Length(value, CssUnit.PCT);
    }

    public boolean isPercentage() {
        return unit == CssUnit.PCT;
    }

    @Override
    public String toString() {
        return format(value) + unit.suffix();
    }

    static String format(double value) {
        if (value == Math.rint(value)) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
