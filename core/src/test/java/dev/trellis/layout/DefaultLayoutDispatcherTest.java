/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.trellis.layout;

import org.junit.jupiter.api.Test;

import dev.trellis.box.Box;
import dev.trellis.box.BoxTree;
import dev.trellis.css.DeclarationBlockParser;
import dev.trellis.style.ComputedStyle;
import dev.trellis.style.StyleComputer;

import static org.assertj.core.api.Assertions.assertThat;

class DefaultLayoutDispatcherTest {

    private final DeclarationBlockParser parser = new DeclarationBlockParser();
    private final LayoutContext context = LayoutContext.create().withFontMetrics(new FixedWidthFontMetrics(10, 20));
    private final BoxTree tree = new BoxTree();

    private ComputedStyle style(String css) {
        return StyleComputer.compute(parser.parse(css));
    }

    @Test
    void testTextWrapsAtAvailableWidth() throws LayoutException {
        Box text = tree.createText("aaa bbb ccc");

        context.dispatcher().layout(tree, text, 75, context);

        // "aaa bbb" is 70 wide, "ccc" wraps
        assertThat(text.width()).isEqualTo(75);
        assertThat(text.height()).isEqualTo(40);
    }

    @Test
    void testTextIntrinsicWidths() throws LayoutException {
        Box text = tree.createText("  tiny enormous  ");

        context.dispatcher().layoutMinMax(tree, text, context.fontMetrics(), context);

        assertThat(text.minWidth()).isEqualTo(80);
        assertThat(text.maxWidth()).isEqualTo(130);
    }

    @Test
    void testBlockStacksChildren() throws LayoutException {
        Box block = tree.createBox(style("display: block"));
        Box first = tree.appendBox(block, style("display: block; height: 30px; margin: 5px"));
        Box second = tree.appendBox(block, style("display: block; padding: 2px"));
        tree.appendText(second, "word");
        Box hidden = tree.appendBox(block, style("display: none; height: 100px"));

        context.dispatcher().layout(tree, block, 200, context);

        assertThat(first.x()).isEqualTo(5);
        assertThat(first.y()).isEqualTo(5);
        assertThat(first.width()).isEqualTo(190);
        assertThat(second.y()).isEqualTo(40);
        assertThat(second.width()).isEqualTo(196);
        assertThat(second.height()).isEqualTo(20);
        assertThat(hidden.height()).isZero();
        assertThat(block.height()).isEqualTo(40 + 24);
    }

    @Test
    void testBlockIntrinsicWidthsIncludeEdges() throws LayoutException {
        Box block = tree.createBox(style("display: block; padding: 0 5px"));
        Box child = tree.appendBox(block, style("display: block"));
        tree.appendText(child, "ab abcd");
        Box sized = tree.createBox(style("display: block; width: 300px; border-width: 1px"));

        context.dispatcher().layoutMinMax(tree, block, context.fontMetrics(), context);
        context.dispatcher().layoutMinMax(tree, sized, context.fontMetrics(), context);

        assertThat(block.minWidth()).isEqualTo(50);
        assertThat(block.maxWidth()).isEqualTo(80);
        assertThat(sized.minWidth()).isEqualTo(302);
        assertThat(sized.maxWidth()).isEqualTo(302);
    }
}
