/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.trellis.style;

import java.util.Locale;

/**
 * Computed values of the {@code position} property.
 */
public enum Position {

    STATIC,
    RELATIVE,
    ABSOLUTE,
    FIXED,
    STICKY;

    /**
     * Returns true if boxes with this position are taken out of flow.
     */
    public boolean isOutOfFlow() {
        return this == ABSOLUTE || this == FIXED;
    }

    /**
     * @return the position for a keyword, or null if unknown
     */
    public static Position fromKeyword(String keyword) {
        for (Position position : values()) {
            if (position.name().toLowerCase(Locale.ROOT).equals(keyword.toLowerCase(Locale.ROOT))) {
                return position;
            }
        }
        return null;
    }
}
