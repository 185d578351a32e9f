/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.trellis.layout;

/**
 * {@link FontMetrics} for a monospaced font: every code point has the same
 * advance.
 */
public final class FixedWidthFontMetrics implements FontMetrics {

    public static final FixedWidthFontMetrics DEFAULT = new FixedWidthFontMetrics(8, 16);

    private final int advance;
    private final int lineHeight;

    public FixedWidthFontMetrics(int advance, int lineHeight) {
        if (advance < 0 || lineHeight < 0) {
            throw new IllegalArgumentException("Metrics cannot be negative: advance=" + advance + ", lineHeight=" + lineHeight);
        }
        this.advance = advance;
        this.lineHeight = lineHeight;
    }

    @Override
    public int width(String text) {
        return text.codePointCount(0, text.length()) * advance;
    }

    @Override
    public int lineHeight() {
        return lineHeight;
    }
}
