/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.trellis.style;

/**
 * Value of one grid-line property ({@code grid-column-start} etc.).
 */
public sealed

interface GridLine
permits GridLine.Auto,GridLine.Set,GridLine.Span
{

    GridLine AUTO = new Auto();

    record Auto() implements GridLine {
        @Override
        public String toString() {
            return "auto";
        }
    }

    /**
     * An explicit line number. Positive numbers count from the start of the
     * explicit grid (1 is the first line), negative numbers from its end.
     */
    record Set(int line) implements GridLine {
        public Set {
            if (line == 0) {
                throw new IllegalArgumentException("Grid line number cannot be 0");
            }
        }

        @Override
        public String toString() {
            return Integer.toString(line);
        }
    }

    record Span(int count) implements GridLine {
        public Span {
            if (count < 1) {
                throw new IllegalArgumentException("Span must be positive: " + count);
            }
        }

        @Override
        public String toString() {
            return "span " + count;
        }
    }

    static GridLine line(int line) {
        return new Set(line);
    }

    static GridLine span(int count) {
        return new Span(count);
    }
}
