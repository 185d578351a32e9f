/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.trellis.layout;

import dev.trellis.box.Box;

/**
 * Greedy word wrapping of a text box.
 */
final class TextLayout {

    private TextLayout() {
    }

    static void layout(Box box, int contentWidth, FontMetrics metrics) {
        String[] words = words(box.text());
        box.setWidth(contentWidth);
        if (words.length == 0) {
            box.setHeight(0);
            return;
        }

        int space = metrics.width(" ");
        int lines = 1;
        int lineWidth = 0;
        for (String word : words) {
            int wordWidth = metrics.width(word);
            if (lineWidth == 0) {
                lineWidth = wordWidth;
            }
            else if (lineWidth + space + wordWidth <= contentWidth) {
                lineWidth += space + wordWidth;
            }
            else {
                lines++;
                lineWidth = wordWidth;
            }
        }
        box.setHeight(lines * metrics.lineHeight());
    }

    // min: widest word, max: all words on one line
    static void layoutMinMax(Box box, FontMetrics metrics) {
        String[] words = words(box.text());
        int min = 0;
        for (String word : words) {
            min = Math.max(min, metrics.width(word));
        }
        int max = words.length == 0 ? 0 : metrics.width(String.join(" ", words));
        box.setMinWidth(min);
        box.setMaxWidth(Math.max(min, max));
    }

    private static String[] words(String text) {
        String trimmed = text.strip();
        return trimmed.isEmpty() ? new String[0] : trimmed.split("\\s+");
    }
}
