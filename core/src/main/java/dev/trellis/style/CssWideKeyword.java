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
 * Keywords every property accepts.
 */
public enum CssWideKeyword {

    INHERIT,
    INITIAL,
    REVERT,
    UNSET;

    /**
     * @return the keyword for an identifier, or null if it is not CSS-wide
     */
    public static CssWideKeyword fromIdent(String ident) {
        return switch (ident.toLowerCase(Locale.ROOT)) {
            case "inherit" -> INHERIT;
            case "initial" -> INITIAL;
            case "revert" -> REVERT;
            case "unset" -> UNSET;
            default -> null;
        };
    }
}
