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
import dev.trellis.box.Insets;
import dev.trellis.css.DeclarationBlockParser;
import dev.trellis.style.StyleComputer;

import static org.assertj.core.api.Assertions.assertThat;

class BasicDimensionResolverTest {

    private final DeclarationBlockParser parser = new DeclarationBlockParser();
    private final LayoutContext context = LayoutContext.create();

    private Box box(String css) {
        return new BoxTree().createBox(StyleComputer.compute(parser.parse(css)));
    }

    @Test
    void testAutoSizes() {
        ResolvedDimensions dimensions = BasicDimensionResolver.INSTANCE.resolve(box("display: block"), 500, context);

        assertThat(dimensions.hasWidth()).isFalse();
        assertThat(dimensions.hasHeight()).isFalse();
        assertThat(dimensions.minWidth()).isZero();
        assertThat(dimensions.maxWidth()).isEqualTo(Box.AUTO);
        assertThat(dimensions.margin()).isEqualTo(Insets.ZERO);
    }

    @Test
    void testPercentagesResolveAgainstAvailableWidth() {
        Box box = box("width: 50%; height: 50%; margin: 10%; padding: 1px 2%");

        ResolvedDimensions dimensions = BasicDimensionResolver.INSTANCE.resolve(box, 200, context);

        assertThat(dimensions.width()).isEqualTo(100);
        assertThat(dimensions.hasHeight()).isFalse();
        assertThat(dimensions.margin()).isEqualTo(new Insets(20, 20, 20, 20));
        assertThat(dimensions.padding()).isEqualTo(new Insets(1, 4, 1, 4));
        assertThat(dimensions.horizontalEdges()).isEqualTo(48);
    }

    @Test
    void testClampWidth() {
        Box box = box("min-width: 50px; max-width: 80px");

        ResolvedDimensions dimensions = BasicDimensionResolver.INSTANCE.resolve(box, 200, context);

        assertThat(dimensions.clampWidth(100)).isEqualTo(80);
        assertThat(dimensions.clampWidth(10)).isEqualTo(50);
        assertThat(dimensions.clampWidth(60)).isEqualTo(60);
    }

    @Test
    void testApplyStoresEdgesOnBox() {
        Box box = box("border-width: 2px; padding: 3px; margin: -4px");

        context.dimensionResolver().apply(box, 100, context);

        assertThat(box.border()).isEqualTo(new Insets(2, 2, 2, 2));
        assertThat(box.padding()).isEqualTo(new Insets(3, 3, 3, 3));
        assertThat(box.margin()).isEqualTo(new Insets(-4, -4, -4, -4));
    }
}
