/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.trellis.benchmarks;

import java.util.List;
import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import dev.trellis.box.Box;
import dev.trellis.box.BoxTree;
import dev.trellis.css.DeclarationBlockParser;
import dev.trellis.layout.LayoutContext;
import dev.trellis.layout.LayoutException;
import dev.trellis.layout.grid.GridLayout;
import dev.trellis.style.ComputedStyle;
import dev.trellis.style.Declaration;
import dev.trellis.style.StyleComputer;

@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Fork(value = 2, jvmArgs = { "-Xms1g", "-Xmx1g" })
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
public class GridLayoutBenchmark {

    private static final String CONTAINER_STYLE = "display: grid; grid-template-columns: 100px repeat(3, 1fr) minmax(50px, 20%); gap: 8px";

    @Param({ "100", "1000" })
    private int itemCount;

    @Param({ "row", "row dense", "column" })
    private String autoFlow;

    private final DeclarationBlockParser parser = new DeclarationBlockParser();

    private BoxTree tree;
    private Box container;
    private LayoutContext context;

    @Setup
    public void setup() {
        context = LayoutContext.create();
        tree = new BoxTree();

        ComputedStyle containerStyle = StyleComputer.compute(parser.parse(CONTAINER_STYLE + "; grid-auto-flow: " + autoFlow));
        container = tree.createBox(containerStyle);

        ComputedStyle plain = StyleComputer.compute(parser.parse("display: block; height: 20px"));
        ComputedStyle wide = StyleComputer.compute(parser.parse("display: block; grid-column: span 2"));
        ComputedStyle pinned = StyleComputer.compute(parser.parse("display: block; grid-column: 2; padding: 4px"));
        for (int i = 0; i < itemCount; i++) {
            ComputedStyle style = i % 7 == 0 ? wide : i % 11 == 0 ? pinned : plain;
            Box item = tree.appendBox(container, style);
            tree.appendText(item, "item " + i);
        }
    }

    @Benchmark
    public void layoutGrid(Blackhole blackhole) throws LayoutException {
        GridLayout.layoutGrid(tree, container, 1200, context);
        blackhole.consume(container.height());
    }

    @Benchmark
    public List<Declaration> parseDeclarations() {
        return parser.parse(CONTAINER_STYLE + "; grid-row: 2 / span 3; grid-auto-flow: column dense");
    }
}
