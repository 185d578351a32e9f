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
 * Units a CSS value may carry. Each unit has a stable numeric tag used by the
 * track list wire format.
 */
public enum CssUnit {

    PX(0, "px"),
    EX(1, "ex"),
    EM(2, "em"),
    IN(3, "in"),
    CM(4, "cm"),
    MM(5, "mm"),
    PT(6, "pt"),
    PC(7, "pc"),
    Q(8, "q"),
    REM(9, "rem"),
    CH(10, "ch"),
    VW(11, "vw"),
    VH(12, "vh"),
    VMIN(13, "vmin"),
    VMAX(14, "vmax"),
    PCT(15, "%"),
    FR(16, "fr"),
    MIN_CONTENT(17, null),
    MAX_CONTENT(18, null),
    MINMAX(19, null);

    private static final CssUnit[] BY_TAG = new CssUnit[values().length];

    static {
        for (CssUnit unit : values()) {
            BY_TAG[unit.tag] = unit;
        }
    }

    private final int tag;
    private final String suffix;

    CssUnit(int tag, String suffix) {
        this.tag = tag;
        this.suffix = suffix;
    }

    public int tag() {
        return tag;
    }

    /**
     * The unit as written after a number, or null for units that have no
     * textual suffix (content keywords and the minmax marker).
     */
    public String suffix() {
        return suffix;
    }

    /**
     * Returns true for units that denote a length (absolute, font relative or
     * viewport relative).
     */
    public boolean isLength() {
        return switch (this) {
            case PX, EX, EM, IN, CM, MM, PT, PC, Q, REM, CH, VW, VH, VMIN, VMAX -> true;
            case PCT, FR, MIN_CONTENT, MAX_CONTENT, MINMAX -> false;
        };
    }

    public boolean isFontRelative() {
        return this == EM || this == EX || this == REM || this == CH;
    }

    public boolean isViewportRelative() {
        return this == VW || this == VH || this == VMIN || this == VMAX;
    }

    /**
     * Looks up a unit by its tag.
     *
     * @throws IllegalArgumentException if no unit has this tag
     */
    public static CssUnit fromTag(int tag) {
        if (tag < 0 || tag >= BY_TAG.length) {
            throw new IllegalArgumentException("Unknown unit tag: " + tag);
        }
        return BY_TAG[tag];
    }

    /**
     * Looks up a dimension unit by its suffix, ignoring case.
     *
     * @return the unit, or null if the suffix is not a known dimension unit
     */
    public static CssUnit fromSuffix(String suffix) {
        String lower = suffix.toLowerCase(Locale.ROOT);
        for (CssUnit unit : values()) {
            if (unit.suffix != null && unit != PCT && unit.suffix.equals(lower)) {
                return unit;
            }
        }
        return null;
    }
}
