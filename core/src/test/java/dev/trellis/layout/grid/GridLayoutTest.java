/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.trellis.layout.grid;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import dev.trellis.box.Box;
import dev.trellis.layout.LayoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GridLayoutTest {

    private final GridFixture fixture = new GridFixture();

    private static void assertPosition(Box box, int x, int y) {
        assertThat(box.x()).as("x of box %d", box.id()).isEqualTo(x);
        assertThat(box.y()).as("y of box %d", box.id()).isEqualTo(y);
    }

    @Test
    void testSpanningItem() throws Exception {
        Box grid = fixture.grid("grid-template-columns: repeat(4, 60px)");
        Box a = fixture.item(grid, "height: 50px");
        Box b = fixture.item(grid, "height: 50px; grid-column: span 2");
        Box c = fixture.item(grid, "height: 50px");
        Box d = fixture.item(grid, "height: 50px");
        Box e = fixture.item(grid, "height: 50px");

        fixture.layout(grid, 240);

        assertPosition(a, 0, 0);
        assertPosition(b, 60, 0);
        assertPosition(c, 180, 0);
        assertPosition(d, 0, 50);
        assertPosition(e, 60, 50);
        assertThat(b.width()).isEqualTo(120);
        assertThat(grid.width()).isEqualTo(240);
        assertThat(grid.height()).isEqualTo(100);
    }

    @ParameterizedTest
    @ValueSource(strings = { "column", "column dense" })
    void testColumnFlow(String flow) throws Exception {
        Box grid = fixture.grid("grid-template-columns: 60px 60px; grid-template-rows: repeat(4, 50px); grid-auto-flow: " + flow);
        Box a = fixture.item(grid, "");
        Box b = fixture.item(grid, "grid-row: span 2");
        Box c = fixture.item(grid, "");
        Box d = fixture.item(grid, "");
        Box e = fixture.item(grid, "");
        Box f = fixture.item(grid, "");

        fixture.layout(grid, 120);

        assertPosition(a, 0, 0);
        assertPosition(b, 0, 50);
        assertPosition(c, 0, 150);
        assertPosition(d, 60, 0);
        assertPosition(e, 60, 50);
        assertPosition(f, 60, 100);
        assertThat(b.height()).as("Stretched over two rows").isEqualTo(100);
        assertThat(grid.height()).isEqualTo(200);
    }

    @Test
    void testExplicitlyPlacedItem() throws Exception {
        Box grid = fixture.grid("grid-template-columns: 100px 100px 100px");
        Box first = fixture.item(grid, "height: 20px");
        Box placed = fixture.item(grid, "height: 20px; grid-column: 1; grid-row: 1");
        Box third = fixture.item(grid, "height: 20px");

        fixture.layout(grid, 300);

        assertPosition(placed, 0, 0);
        assertPosition(first, 100, 0);
        assertPosition(third, 200, 0);
    }

    @Test
    void testColumnLockedItemBetweenAutoItems() throws Exception {
        Box grid = fixture.grid("grid-template-columns: repeat(4, 60px)");
        Box a = fixture.item(grid, "height: 50px");
        Box b = fixture.item(grid, "height: 50px");
        Box x = fixture.item(grid, "height: 50px; grid-column-start: 4");
        Box c = fixture.item(grid, "height: 50px");
        Box d = fixture.item(grid, "height: 50px");

        fixture.layout(grid, 240);

        assertPosition(a, 0, 0);
        assertPosition(b, 60, 0);
        assertPosition(x, 180, 0);
        assertPosition(c, 0, 50);
        assertPosition(d, 60, 50);
    }

    @Test
    void testGaps() throws Exception {
        Box grid = fixture.grid("grid-template-columns: 1fr 1fr; gap: 10px 20px");
        Box[] items = fixture.items(grid, 4, "height: 30px");

        fixture.layout(grid, 220);

        assertThat(items[0].width()).isEqualTo(100);
        assertPosition(items[1], 120, 0);
        assertPosition(items[2], 0, 40);
        assertPosition(items[3], 120, 40);
        assertThat(grid.height()).isEqualTo(70);
    }

    @Test
    void testPercentageGaps() throws Exception {
        Box grid = fixture.grid("grid-template-columns: 1fr 1fr; column-gap: 10%; row-gap: 10%");
        Box[] items = fixture.items(grid, 3, "height: 30px");

        fixture.layout(grid, 210);

        assertThat(items[0].width()).isEqualTo(94);
        assertPosition(items[1], 115, 0);
        assertPosition(items[2], 0, 30);
        assertThat(grid.height()).as("Row gap percentages have no base").isEqualTo(60);
    }

    @Test
    void testAutoHeightItemsStretchToRow() throws Exception {
        Box grid = fixture.grid("grid-template-columns: 1fr 1fr 1fr");
        Box tall = fixture.item(grid, "height: 80px");
        Box plain = fixture.item(grid, "");
        Box padded = fixture.item(grid, "padding: 5px");

        fixture.layout(grid, 300);

        assertThat(tall.height()).isEqualTo(80);
        assertThat(plain.height()).isEqualTo(80);
        assertThat(padded.height()).isEqualTo(70);
        assertThat(padded.width()).isEqualTo(90);
    }

    @Test
    void testItemEdges() throws Exception {
        Box grid = fixture.grid("grid-template-columns: 100px 100px");
        fixture.item(grid, "height: 10px");
        Box item = fixture.item(grid, "margin: 10px; padding: 5px; border-width: 2px");

        fixture.layout(grid, 200);

        assertThat(item.width()).isEqualTo(66);
        assertPosition(item, 110, 10);
        assertThat(item.outerHeight()).isEqualTo(34);
        assertThat(grid.height()).isEqualTo(34);
    }

    @Test
    void testItemsFillTheirCell() throws Exception {
        Box grid = fixture.grid("grid-template-columns: 100px 100px");
        Box narrow = fixture.item(grid, "width: 40px");
        Box clamped = fixture.item(grid, "max-width: 30px; min-width: 150px; padding: 0 5px");

        fixture.layout(grid, 200);

        assertThat(narrow.width()).as("Declared width is overridden by the cell").isEqualTo(100);
        assertThat(clamped.width()).isEqualTo(90);
        assertPosition(clamped, 100, 0);
    }

    @Test
    void testTemplateRowHeights() throws Exception {
        Box grid = fixture.grid("grid-template-columns: 1fr; grid-template-rows: 100px minmax(40px, 1fr) auto");
        Box[] items = fixture.items(grid, 3, "height: 20px");

        fixture.layout(grid, 100);

        assertPosition(items[1], 0, 100);
        assertPosition(items[2], 0, 140);
        assertThat(grid.height()).isEqualTo(160);
    }

    @Test
    void testSpanningItemGrowsLastRow() throws Exception {
        Box grid = fixture.grid("grid-template-columns: 1fr 1fr");
        Box tall = fixture.item(grid, "height: 100px; grid-row: span 2");
        Box first = fixture.item(grid, "height: 30px");
        Box second = fixture.item(grid, "height: 30px");

        fixture.layout(grid, 200);

        assertPosition(tall, 0, 0);
        assertPosition(first, 100, 0);
        assertPosition(second, 100, 30);
        assertThat(grid.height()).isEqualTo(100);
    }

    @Test
    void testTextItems() throws Exception {
        Box grid = fixture.grid("grid-template-columns: 50px 50px");
        Box wrapped = fixture.tree.appendText(grid, "aaaa bbbb cccc");
        fixture.tree.appendText(grid, "  ");
        Box single = fixture.tree.appendText(grid, "x");

        fixture.layout(grid, 100);

        assertThat(wrapped.height()).isEqualTo(60);
        assertPosition(single, 50, 0);
        assertThat(single.height()).isEqualTo(60);
        assertThat(grid.height()).isEqualTo(60);
    }

    @Test
    void testHiddenAndOutOfFlowChildren() throws Exception {
        Box grid = fixture.grid("grid-template-columns: 50px 50px");
        Box hidden = fixture.item(grid, "display: none; height: 90px");
        Box absolute = fixture.item(grid, "position: absolute; width: 30px; height: 40px; margin: 3px");
        Box item = fixture.item(grid, "height: 10px");

        fixture.layout(grid, 100);

        assertThat(hidden.width()).isZero();
        assertThat(hidden.height()).isZero();
        assertPosition(absolute, 3, 3);
        assertThat(absolute.width()).isEqualTo(30);
        assertThat(absolute.height()).isEqualTo(40);
        assertPosition(item, 0, 0);
        assertThat(grid.height()).isEqualTo(10);
    }

    @Test
    void testNestedGrid() throws Exception {
        Box grid = fixture.grid("grid-template-columns: 200px 100px");
        Box inner = fixture.item(grid, "display: grid; grid-template-columns: 1fr 1fr");
        Box left = fixture.tree.appendBox(inner, fixture.style("height: 15px"));
        Box right = fixture.tree.appendBox(inner, fixture.style("height: 25px"));

        fixture.layout(grid, 300);

        assertThat(inner.width()).isEqualTo(200);
        assertThat(inner.height()).isEqualTo(25);
        assertPosition(right, 100, 0);
        assertThat(left.height()).isEqualTo(15);
    }

    @Test
    void testEmptyGrid() throws Exception {
        Box grid = fixture.grid("grid-template-rows: 20px 30px; row-gap: 5px");

        fixture.layout(grid, 100);

        assertThat(grid.width()).isEqualTo(100);
        assertThat(grid.height()).isEqualTo(55);
    }

    @Test
    void testRowLimit() {
        fixture.context = fixture.context.withMaxImplicitRows(10);
        Box grid = fixture.grid("grid-template-columns: 10px");
        fixture.items(grid, 11, "");

        assertThatThrownBy(() -> fixture.layout(grid, 10))
                .isInstanceOf(LayoutException.class)
                .hasMessageContaining("maximum of 10 rows");
    }

    @Test
    void testColumnLineBeyondLimit() {
        Box grid = fixture.grid("grid-template-columns: 1fr 1fr");
        fixture.item(grid, "grid-column: 2147483647 / span 2; grid-row: 1");

        assertThatThrownBy(() -> fixture.layout(grid, 100))
                .isInstanceOf(LayoutException.class)
                .hasMessageContaining("columns");
    }

    @Test
    void testHugeTrackSizes() throws Exception {
        Box grid = fixture.grid("grid-template-columns: 3000000px 1fr");
        Box wide = fixture.item(grid, "");
        Box narrow = fixture.item(grid, "");

        fixture.layout(grid, 3000);

        assertThat(wide.width()).isGreaterThan(2_000_000);
        assertPosition(narrow, wide.width(), 0);
        assertThat(narrow.width()).isZero();
    }

    @Test
    void testRejectsNonGridBox() {
        Box block = fixture.tree.createBox(fixture.style("display: block"));

        assertThatThrownBy(() -> fixture.layout(block, 100))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not a grid container");
    }
}
