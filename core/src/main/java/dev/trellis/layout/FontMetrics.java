/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.trellis.layout;

/**
 * Measures text for layout.
 */
public interface FontMetrics {

    /**
     * Returns the advance width of the text in device pixels.
     */
    int width(String text);

    int lineHeight();
}
