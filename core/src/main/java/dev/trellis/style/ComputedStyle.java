/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.trellis.style;

/**
 * Immutable computed style of one element, restricted to the properties the
 * layout engine reads. Length-valued properties use null for {@code auto}
 * ({@code none} for {@code max-width}).
 * <p>
 * Instances are produced by {@link StyleComputer} or assembled through
 * {@link #builder()}; they are never modified after construction, so decoded
 * track lists can be shared by every layout pass over the same tree.
 * </p>
 */
public final class ComputedStyle {

    private static final ComputedStyle INITIAL = builder().build();

    private final Display display;
    private final Position position;
    private final Length width;
    private final Length height;
    private final Length minWidth;
    private final Length maxWidth;
    private final Edges margin;
    private final Edges padding;
    private final Edges borderWidth;
    private final Gap columnGap;
    private final Gap rowGap;
    private final TrackList gridTemplateColumns;
    private final TrackList gridTemplateRows;
    private final GridLine gridColumnStart;
    private final GridLine gridColumnEnd;
    private final GridLine gridRowStart;
    private final GridLine gridRowEnd;
    private final GridAutoFlow gridAutoFlow;

    private ComputedStyle(Builder builder) {
        this.display = builder.display;
        this.position = builder.position;
        this.width = builder.width;
        this.height = builder.height;
        this.minWidth = builder.minWidth;
        this.maxWidth = builder.maxWidth;
        this.margin = builder.margin;
        this.padding = builder.padding;
        this.borderWidth = builder.borderWidth;
        this.columnGap = builder.columnGap;
        this.rowGap = builder.rowGap;
        this.gridTemplateColumns = builder.gridTemplateColumns;
        this.gridTemplateRows = builder.gridTemplateRows;
        this.gridColumnStart = builder.gridColumnStart;
        this.gridColumnEnd = builder.gridColumnEnd;
        this.gridRowStart = builder.gridRowStart;
        this.gridRowEnd = builder.gridRowEnd;
        this.gridAutoFlow = builder.gridAutoFlow;
    }

    /**
     * Returns the style holding every property's initial value.
     */
    public static ComputedStyle initial() {
        return INITIAL;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.display = display;
        builder.position = position;
        builder.width = width;
        builder.height = height;
        builder.minWidth = minWidth;
        builder.maxWidth = maxWidth;
        builder.margin = margin;
        builder.padding = padding;
        builder.borderWidth = borderWidth;
        builder.columnGap = columnGap;
        builder.rowGap = rowGap;
        builder.gridTemplateColumns = gridTemplateColumns;
        builder.gridTemplateRows = gridTemplateRows;
        builder.gridColumnStart = gridColumnStart;
        builder.gridColumnEnd = gridColumnEnd;
        builder.gridRowStart = gridRowStart;
        builder.gridRowEnd = gridRowEnd;
        builder.gridAutoFlow = gridAutoFlow;
        return builder;
    }

    public Display display() {
        return display;
    }

    public Position position() {
        return position;
    }

    public Length width() {
        return width;
    }

    public Length height() {
        return height;
    }

    public Length minWidth() {
        return minWidth;
    }

    public Length maxWidth() {
        return maxWidth;
    }

    public Edges margin() {
        return margin;
    }

    public Edges padding() {
        return padding;
    }

    public Edges borderWidth() {
        return borderWidth;
    }

    public Gap columnGap() {
        return columnGap;
    }

    public Gap rowGap() {
        return rowGap;
    }

    public TrackList gridTemplateColumns() {
        return gridTemplateColumns;
    }

    public TrackList gridTemplateRows() {
        return gridTemplateRows;
    }

    public GridLine gridColumnStart() {
        return gridColumnStart;
    }

    public GridLine gridColumnEnd() {
        return gridColumnEnd;
    }

    public GridLine gridRowStart() {
        return gridRowStart;
    }

    public GridLine gridRowEnd() {
        return gridRowEnd;
    }

    public GridAutoFlow gridAutoFlow() {
        return gridAutoFlow;
    }

    public boolean isOutOfFlow() {
        return position.isOutOfFlow();
    }

    @Override
    public String toString() {
        return "ComputedStyle[display=" + display.keyword()
                + ", columns=" + gridTemplateColumns
                + ", rows=" + gridTemplateRows
                + ", column=" + gridColumnStart + " / " + gridColumnEnd
                + ", row=" + gridRowStart + " / " + gridRowEnd
                + ", flow=" + gridAutoFlow + "]";
    }

    public static final class Builder {

        private Display display = Display.INLINE;
        private Position position = Position.STATIC;
        private Length width;
        private Length height;
        private Length minWidth;
        private Length maxWidth;
        private Edges margin = Edges.ZERO;
        private Edges padding = Edges.ZERO;
        private Edges borderWidth = Edges.ZERO;
        private Gap columnGap = Gap.NORMAL;
        private Gap rowGap = Gap.NORMAL;
        private TrackList gridTemplateColumns = TrackList.NONE;
        private TrackList gridTemplateRows = TrackList.NONE;
        private GridLine gridColumnStart = GridLine.AUTO;
        private GridLine gridColumnEnd = GridLine.AUTO;
        private GridLine gridRowStart = GridLine.AUTO;
        private GridLine gridRowEnd = GridLine.AUTO;
        private GridAutoFlow gridAutoFlow = GridAutoFlow.ROW;

        private Builder() {
        }

        public Builder display(Display display) {
            this.display = requireNonNull(display, "display");
            return this;
        }

        public Builder position(Position position) {
            this.position = requireNonNull(position, "position");
            return this;
        }

        public Builder width(Length width) {
            this.width = width;
            return this;
        }

        public Builder height(Length height) {
            this.height = height;
            return this;
        }

        public Builder minWidth(Length minWidth) {
            this.minWidth = minWidth;
            return this;
        }

        public Builder maxWidth(Length maxWidth) {
            this.maxWidth = maxWidth;
            return this;
        }

        public Builder margin(Edges margin) {
            this.margin = requireNonNull(margin, "margin");
            return this;
        }

        public Builder padding(Edges padding) {
            this.padding = requireNonNull(padding, "padding");
            return this;
        }

        public Builder borderWidth(Edges borderWidth) {
            this.borderWidth = requireNonNull(borderWidth, "border-width");
            return this;
        }

        public Builder columnGap(Gap columnGap) {
            this.columnGap = requireNonNull(columnGap, "column-gap");
            return this;
        }

        public Builder rowGap(Gap rowGap) {
            this.rowGap = requireNonNull(rowGap, "row-gap");
            return this;
        }

        public Builder gridTemplateColumns(TrackList tracks) {
            this.gridTemplateColumns = requireNonNull(tracks, "grid-template-columns");
            return this;
        }

        public Builder gridTemplateRows(TrackList tracks) {
            this.gridTemplateRows = requireNonNull(tracks, "grid-template-rows");
            return this;
        }

        public Builder gridColumnStart(GridLine line) {
            this.gridColumnStart = requireNonNull(line, "grid-column-start");
            return this;
        }

        public Builder gridColumnEnd(GridLine line) {
            this.gridColumnEnd = requireNonNull(line, "grid-column-end");
            return this;
        }

        public Builder gridRowStart(GridLine line) {
            this.gridRowStart = requireNonNull(line, "grid-row-start");
            return this;
        }

        public Builder gridRowEnd(GridLine line) {
            this.gridRowEnd = requireNonNull(line, "grid-row-end");
            return this;
        }

        public Builder gridColumn(GridLine start, GridLine end) {
            return gridColumnStart(start).gridColumnEnd(end);
        }

        public Builder gridRow(GridLine start, GridLine end) {
            return gridRowStart(start).gridRowEnd(end);
        }

        public Builder gridAutoFlow(GridAutoFlow flow) {
            this.gridAutoFlow = requireNonNull(flow, "grid-auto-flow");
            return this;
        }

        public ComputedStyle build() {
            return new ComputedStyle(this);
        }

        private static <T> T requireNonNull(T value, String property) {
            if (value == null) {
                throw new IllegalArgumentException("Computed value of " + property + " must not be null");
            }
            return value;
        }
    }
}
