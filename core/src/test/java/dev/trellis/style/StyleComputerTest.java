/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.trellis.style;

import java.util.List;

import org.junit.jupiter.api.Test;

import dev.trellis.css.DeclarationBlockParser;

import static org.assertj.core.api.Assertions.assertThat;

class StyleComputerTest {

    private final DeclarationBlockParser parser = new DeclarationBlockParser();

    private ComputedStyle compute(String block) {
        return StyleComputer.compute(parser.parse(block));
    }

    @Test
    void testInitialValues() {
        ComputedStyle style = compute("");

        assertThat(style.display()).isEqualTo(Display.INLINE);
        assertThat(style.gridTemplateColumns()).isEqualTo(TrackList.NONE);
        assertThat(style.gridColumnStart()).isEqualTo(GridLine.AUTO);
        assertThat(style.gridAutoFlow()).isEqualTo(GridAutoFlow.ROW);
        assertThat(style.columnGap().isNormal()).isTrue();
        assertThat(style.width()).isNull();
        assertThat(style.margin()).isEqualTo(Edges.ZERO);
    }

    @Test
    void testTrackListIsDecoded() {
        ComputedStyle style = compute("display: grid; grid-template-columns: 100px repeat(2, 1fr)");

        assertThat(style.display()).isEqualTo(Display.GRID);
        assertThat(style.gridTemplateColumns().tracks()).containsExactly(
                new TrackSize.Fixed(100, CssUnit.PX),
                new TrackSize.Flex(1),
                new TrackSize.Flex(1));
    }

    @Test
    void testHugeTrackValuesSaturate() {
        ComputedStyle style = compute("grid-template-columns: 3000000fr 1fr 3000000px");

        List<TrackSize> tracks = style.gridTemplateColumns().tracks();
        assertThat(tracks).hasSize(3);
        assertThat(((TrackSize.Flex) tracks.get(0)).factor()).isGreaterThan(2_000_000);
        assertThat(tracks.get(1)).isEqualTo(new TrackSize.Flex(1));
        assertThat(((TrackSize.Fixed) tracks.get(2)).value()).isGreaterThan(2_000_000);
    }

    @Test
    void testLaterDeclarationWins() {
        ComputedStyle style = compute("grid-auto-flow: column; grid-auto-flow: row dense");

        assertThat(style.gridAutoFlow()).isEqualTo(GridAutoFlow.ROW_DENSE);
    }

    @Test
    void testImportantWinsOverLaterNormal() {
        ComputedStyle style = compute("grid-column-start: 2 !important; grid-column-start: 3");

        assertThat(style.gridColumnStart()).isEqualTo(GridLine.line(2));
    }

    @Test
    void testInheritCopiesParentValue() {
        ComputedStyle parent = compute("grid-template-rows: 50px; grid-row: 2 / 4");

        ComputedStyle child = StyleComputer.compute(parser.parse("grid-template-rows: inherit; grid-row: inherit"), parent);

        assertThat(child.gridTemplateRows()).isEqualTo(parent.gridTemplateRows());
        assertThat(child.gridRowStart()).isEqualTo(GridLine.line(2));
        assertThat(child.gridRowEnd()).isEqualTo(GridLine.line(4));
    }

    @Test
    void testInheritWithoutParent() {
        ComputedStyle style = compute("grid-template-columns: inherit; column-gap: inherit");

        assertThat(style.gridTemplateColumns()).isEqualTo(TrackList.INHERIT);
        assertThat(style.columnGap()).isEqualTo(Gap.NORMAL);
    }

    @Test
    void testInitialAndUnsetResetValue() {
        ComputedStyle style = compute("grid-row: 3; grid-row: initial; margin: 5px; margin-left: unset");

        assertThat(style.gridRowStart()).isEqualTo(GridLine.AUTO);
        assertThat(style.margin()).isEqualTo(new Edges(Length.px(5), Length.px(5), Length.px(5), Length.ZERO));
    }

    @Test
    void testEdgesAndSizes() {
        ComputedStyle style = compute("padding: 1px 2px; border-width: medium; width: 50%; max-width: none; position: fixed");

        assertThat(style.padding()).isEqualTo(new Edges(Length.px(1), Length.px(2), Length.px(1), Length.px(2)));
        assertThat(style.borderWidth()).isEqualTo(Edges.all(Length.px(3)));
        assertThat(style.width()).isEqualTo(Length.percent(50));
        assertThat(style.maxWidth()).isNull();
        assertThat(style.isOutOfFlow()).isTrue();
    }

    @Test
    void testDeclarationsBuiltByHand() {
        ComputedStyle style = StyleComputer.compute(List.of(
                Declaration.of(CssProperty.ROW_GAP, new DeclaredValue.GapSize(Gap.of(Length.px(4)))),
                Declaration.of(CssProperty.DISPLAY, new DeclaredValue.DisplayValue(Display.INLINE_GRID))));

        assertThat(style.rowGap()).isEqualTo(Gap.of(Length.px(4)));
        assertThat(style.display()).isEqualTo(Display.INLINE_GRID);
    }
}
