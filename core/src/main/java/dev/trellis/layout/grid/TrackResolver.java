/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.trellis.layout.grid;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.Arrays;

import dev.trellis.layout.UnitContext;
import dev.trellis.layout.UnitConverter;
import dev.trellis.style.TrackList;
import dev.trellis.style.TrackSize;

/**
 * Turns track definitions into pixel sizes.
 * <p>
 * Columns: definite tracks take their size first, the space left after them
 * and the gaps is shared between flexible tracks in proportion to their
 * factors. Content-sized tracks, and {@code minmax()} tracks without a
 * definite maximum, count as one flexible share. Rounding is downwards and
 * the truncated remainder is left unused.
 * </p>
 */
final class TrackResolver {

    private static final Logger LOG = System.getLogger(TrackResolver.class.getName());

    private TrackResolver() {
    }

    /**
     * Resolve column widths.
     *
     * @param tracks the column template, repeated cyclically; without tracks every column is {@code 1fr}
     * @param columnCount number of columns, at least the template's track count
     * @param availableWidth the container's content width
     * @param gap column gap in device pixels
     */
    static int[] resolveColumns(TrackList tracks, int columnCount, int availableWidth, int gap, UnitContext units) {
        int[] widths = new int[columnCount];
        double[] factors = new double[columnCount];
        int used = 0;
        double totalFactor = 0;

        for (int i = 0; i < columnCount; i++) {
            TrackSize track = tracks.trackFor(i);
            int definite = definiteWidth(track, availableWidth, units);
            if (definite >= 0) {
                widths[i] = definite;
                used += definite;
            }
            else {
                // minmax() and content tracks take a single share
                factors[i] = track instanceof TrackSize.Flex flex ? flex.factor() : 1;
                totalFactor += factors[i];
            }
        }

        int totalGap = Math.max(0, columnCount - 1) * gap;
        int remaining = Math.max(0, availableWidth - used - totalGap);
        int pxPerShare = totalFactor > 0 ? (int) Math.floor(remaining / totalFactor) : 0;

        for (int i = 0; i < columnCount; i++) {
            if (factors[i] > 0) {
                widths[i] = (int) Math.floor(factors[i] * pxPerShare);
            }
        }

        LOG.log(Level.DEBUG, "Resolved {0} columns for width {1}: {2}", columnCount, availableWidth, Arrays.toString(widths));
        return widths;
    }

    /**
     * Initial row heights: fixed tracks, and {@code minmax()} tracks with a
     * fixed minimum, start at that size; every other row starts at zero.
     */
    static int[] initialRowHeights(TrackList tracks, int rowCount, UnitContext units) {
        int[] heights = new int[rowCount];
        if (!tracks.isSet()) {
            return heights;
        }
        for (int i = 0; i < rowCount; i++) {
            TrackSize track = tracks.trackFor(i);
            if (track instanceof TrackSize.MinMax minMax) {
                track = minMax.min();
            }
            if (track instanceof TrackSize.Fixed fixed) {
                heights[i] = Math.max(0, UnitConverter.toDevicePixels(fixed.toLength(), units));
            }
        }
        return heights;
    }

    /**
     * Returns the width of a track that does not take part in flexible
     * sizing, or -1 for a flexible track.
     */
    private static int definiteWidth(TrackSize track, int availableWidth, UnitContext units) {
        if (track instanceof TrackSize.MinMax minMax) {
            track = minMax.max();
        }
        if (track instanceof TrackSize.Fixed fixed) {
            return Math.max(0, UnitConverter.toDevicePixels(fixed.toLength(), units));
        }
        if (track instanceof TrackSize.Percentage percentage) {
            return Math.max(0, (int) (percentage.value() * availableWidth / 100));
        }
        return -1;
    }
}
