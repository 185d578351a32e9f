/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.trellis.style;

/**
 * Sizing function of a single grid track.
 */
public sealed

interface TrackSize
permits TrackSize.Fixed,TrackSize.Percentage,TrackSize.Flex,TrackSize.MinContent,TrackSize.MaxContent,TrackSize.MinMax
{

    /**
     * Returns true if the track resolves to a size without looking at flexible
     * space or content.
     */
    default boolean isDefinite() {
        return this instanceof Fixed || this instanceof Percentage;
    }

    record Fixed(double value, CssUnit unit) implements TrackSize {
        public Fixed {
            if (unit == null || !unit.isLength()) {
                throw new IllegalArgumentException("Fixed track requires a length unit: " + unit);
            }
        }

        public Length toLength() {
            return new Length(value, unit);
        }

        @Override
        public String toString() {
            return Length.format(value) + unit.suffix();
        }
    }

    record Percentage(double value) implements TrackSize {
        @Override
        public String toString() {
            return Length.format(value) + "%";
        }
    }

    record Flex(double factor) implements TrackSize {
        public Flex {
            if (factor < 0) {
                throw new IllegalArgumentException("Flex factor cannot be negative: " + factor);
            }
        }

        @Override
        public String toString() {
            return Length.format(factor) + "fr";
        }
    }

    record MinContent() implements TrackSize {
        @Override
        public String toString() {
            return "min-content";
        }
    }

    record MaxContent() implements TrackSize {
        @Override
        public String toString() {
            return "max-content";
        }
    }

    // Sides are plain track sizes; nesting minmax() is not allowed
    record MinMax(TrackSize min, TrackSize max) implements TrackSize {
        public MinMax {
            if (min == null || max == null) {
                throw new IllegalArgumentException("minmax() requires both sides");
            }
            if (min instanceof MinMax || max instanceof MinMax) {
                throw new IllegalArgumentException("minmax() cannot be nested");
            }
        }

        @Override
        public String toString() {
            return "minmax(" + min + ", " + max + ")";
        }
    }
}
