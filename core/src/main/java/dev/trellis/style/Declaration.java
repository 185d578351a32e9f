/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.trellis.style;

/**
 * A parsed longhand declaration. Exactly one of {@code keyword} and
 * {@code value} is non-null.
 */
public record Declaration(CssProperty property, CssWideKeyword keyword, DeclaredValue value, boolean important) {

    public Declaration {
        if (property == null) {
            throw new IllegalArgumentException("Property must not be null");
        }
        if ((keyword == null) == (value == null)) {
            throw new IllegalArgumentException("Declaration of " + property.propertyName()
                    + " needs either a CSS-wide keyword or a value");
        }
    }

    public static Declaration of(CssProperty property, DeclaredValue value) {
        return new Declaration(property, null, value, false);
    }

    public static Declaration of(CssProperty property, CssWideKeyword keyword) {
        return new Declaration(property, keyword, null, false);
    }

    public Declaration asImportant() {
        return new Declaration(property, keyword, value, true);
    }
}
