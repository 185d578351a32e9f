/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.trellis.style;

/**
 * Computed value of {@code column-gap} / {@code row-gap}: either {@code normal}
 * (a null length) or a length/percentage.
 */
public record Gap(Length length) {

    public static final Gap NORMAL = new Gap(null);

    public static Gap of(Length length) {
        return new Gap(length);
    }

    public boolean isNormal() {
        return length == null;
    }

    @Override
    public String toString() {
        return length == null ? "normal" : length.toString();
    }
}
