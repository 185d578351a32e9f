/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.trellis.style;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.List;

import dev.trellis.internal.bytecode.TrackListCodec;

/**
 * Computes the style of an element from its declarations and its parent's
 * computed style.
 * <p>
 * Normal declarations are applied first and {@code !important} ones after
 * them; within each group a later declaration wins. None of the supported
 * properties is inherited, so {@code unset} and {@code revert} resolve to the
 * initial value. {@code inherit} on the root element (no parent) resolves to
 * the initial value, except for the template properties where the computed
 * track list records {@link TrackList.TemplateKind#INHERIT}.
 * </p>
 */
public final class StyleComputer {

    private static final Logger LOG = System.getLogger(StyleComputer.class.getName());

    private StyleComputer() {
    }

    /**
     * Compute a style for a root element.
     */
    public static ComputedStyle compute(List<Declaration> declarations) {
        return compute(declarations, null);
    }

    /**
     * Compute a style.
     *
     * @param declarations the declarations in source order
     * @param parent the parent's computed style, or null for the root element
     */
    public static ComputedStyle compute(List<Declaration> declarations, ComputedStyle parent) {
        ComputedStyle.Builder builder = ComputedStyle.builder();
        for (Declaration declaration : declarations) {
            if (!declaration.important()) {
                apply(declaration, parent, builder);
            }
        }
        for (Declaration declaration : declarations) {
            if (declaration.important()) {
                apply(declaration, parent, builder);
            }
        }
        return builder.build();
    }

    private static void apply(Declaration declaration, ComputedStyle parent, ComputedStyle.Builder builder) {
        CssProperty property = declaration.property();
        if (declaration.keyword() != null) {
            switch (declaration.keyword()) {
                case INHERIT -> {
                    if (parent != null) {
                        copy(property, parent, builder);
                    }
                    else if (property == CssProperty.GRID_TEMPLATE_COLUMNS) {
                        builder.gridTemplateColumns(TrackList.INHERIT);
                    }
                    else if (property == CssProperty.GRID_TEMPLATE_ROWS) {
                        builder.gridTemplateRows(TrackList.INHERIT);
                    }
                    else {
                        copy(property, ComputedStyle.initial(), builder);
                    }
                }
                case INITIAL, UNSET, REVERT -> copy(property, ComputedStyle.initial(), builder);
            }
            return;
        }
        applyValue(property, declaration.value(), builder);
    }

    private static void applyValue(CssProperty property, DeclaredValue value, ComputedStyle.Builder builder) {
        switch (property) {
            case GRID_TEMPLATE_COLUMNS -> builder.gridTemplateColumns(trackList(property, value));
            case GRID_TEMPLATE_ROWS -> builder.gridTemplateRows(trackList(property, value));
            case GRID_COLUMN_START -> builder.gridColumnStart(line(property, value));
            case GRID_COLUMN_END -> builder.gridColumnEnd(line(property, value));
            case GRID_ROW_START -> builder.gridRowStart(line(property, value));
            case GRID_ROW_END -> builder.gridRowEnd(line(property, value));
            case GRID_AUTO_FLOW -> builder.gridAutoFlow(expect(property, value, DeclaredValue.Flow.class).flow());
            case COLUMN_GAP -> builder.columnGap(expect(property, value, DeclaredValue.GapSize.class).gap());
            case ROW_GAP -> builder.rowGap(expect(property, value, DeclaredValue.GapSize.class).gap());
            case DISPLAY -> builder.display(expect(property, value, DeclaredValue.DisplayValue.class).display());
            case POSITION -> builder.position(expect(property, value, DeclaredValue.PositionValue.class).position());
            case WIDTH -> builder.width(size(property, value));
            case HEIGHT -> builder.height(size(property, value));
            case MIN_WIDTH -> builder.minWidth(size(property, value));
            case MAX_WIDTH -> builder.maxWidth(size(property, value));
            case MARGIN_TOP, MARGIN_RIGHT, MARGIN_BOTTOM, MARGIN_LEFT,
                    PADDING_TOP, PADDING_RIGHT, PADDING_BOTTOM, PADDING_LEFT,
                    BORDER_TOP_WIDTH, BORDER_RIGHT_WIDTH, BORDER_BOTTOM_WIDTH, BORDER_LEFT_WIDTH ->
                applyEdge(property, edgeLength(property, value), builder);
        }
    }

    private static TrackList trackList(CssProperty property, DeclaredValue value) {
        if (value instanceof DeclaredValue.NoTracks) {
            return TrackList.NONE;
        }
        DeclaredValue.EncodedTracks encoded = expect(property, value, DeclaredValue.EncodedTracks.class);
        TrackList tracks = TrackList.of(TrackListCodec.decode(encoded.words()));
        LOG.log(Level.DEBUG, "Computed {0}: {1}", property.propertyName(), tracks);
        return tracks;
    }

    private static GridLine line(CssProperty property, DeclaredValue value) {
        return expect(property, value, DeclaredValue.Line.class).line();
    }

    private static Length size(CssProperty property, DeclaredValue value) {
        return expect(property, value, DeclaredValue.Size.class).length();
    }

    private static Length edgeLength(CssProperty property, DeclaredValue value) {
        Length length = size(property, value);
        if (length == null) {
            throw new IllegalArgumentException(property.propertyName() + " does not accept auto");
        }
        return length;
    }

    private static <T extends DeclaredValue> T expect(CssProperty property, DeclaredValue value, Class<T> type) {
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException("Value " + value + " is not valid for " + property.propertyName());
        }
        return type.cast(value);
    }

    private static void applyEdge(CssProperty property, Length length, ComputedStyle.Builder builder) {
        ComputedStyle current = builder.build();
        Edges margin = current.margin();
        Edges padding = current.padding();
        Edges border = current.borderWidth();
        switch (property) {
            case MARGIN_TOP -> builder.margin(margin.withTop(length));
            case MARGIN_RIGHT -> builder.margin(margin.withRight(length));
            case MARGIN_BOTTOM -> builder.margin(margin.withBottom(length));
            case MARGIN_LEFT -> builder.margin(margin.withLeft(length));
            case PADDING_TOP -> builder.padding(padding.withTop(length));
            case PADDING_RIGHT -> builder.padding(padding.withRight(length));
            case PADDING_BOTTOM -> builder.padding(padding.withBottom(length));
            case PADDING_LEFT -> builder.padding(padding.withLeft(length));
            case BORDER_TOP_WIDTH -> builder.borderWidth(border.withTop(length));
            case BORDER_RIGHT_WIDTH -> builder.borderWidth(border.withRight(length));
            case BORDER_BOTTOM_WIDTH -> builder.borderWidth(border.withBottom(length));
            case BORDER_LEFT_WIDTH -> builder.borderWidth(border.withLeft(length));
            default -> throw new IllegalArgumentException("Not an edge property: " + property);
        }
    }

    private static void copy(CssProperty property, ComputedStyle from, ComputedStyle.Builder to) {
        switch (property) {
            case DISPLAY -> to.display(from.display());
            case POSITION -> to.position(from.position());
            case WIDTH -> to.width(from.width());
            case HEIGHT -> to.height(from.height());
            case MIN_WIDTH -> to.minWidth(from.minWidth());
            case MAX_WIDTH -> to.maxWidth(from.maxWidth());
            case MARGIN_TOP -> applyEdge(property, from.margin().top(), to);
            case MARGIN_RIGHT -> applyEdge(property, from.margin().right(), to);
            case MARGIN_BOTTOM -> applyEdge(property, from.margin().bottom(), to);
            case MARGIN_LEFT -> applyEdge(property, from.margin().left(), to);
            case PADDING_TOP -> applyEdge(property, from.padding().top(), to);
            case PADDING_RIGHT -> applyEdge(property, from.padding().right(), to);
            case PADDING_BOTTOM -> applyEdge(property, from.padding().bottom(), to);
            case PADDING_LEFT -> applyEdge(property, from.padding().left(), to);
            case BORDER_TOP_WIDTH -> applyEdge(property, from.borderWidth().top(), to);
            case BORDER_RIGHT_WIDTH -> applyEdge(property, from.borderWidth().right(), to);
            case BORDER_BOTTOM_WIDTH -> applyEdge(property, from.borderWidth().bottom(), to);
            case BORDER_LEFT_WIDTH -> applyEdge(property, from.borderWidth().left(), to);
            case COLUMN_GAP -> to.columnGap(from.columnGap());
            case ROW_GAP -> to.rowGap(from.rowGap());
            case GRID_TEMPLATE_COLUMNS -> to.gridTemplateColumns(from.gridTemplateColumns());
            case GRID_TEMPLATE_ROWS -> to.gridTemplateRows(from.gridTemplateRows());
            case GRID_COLUMN_START -> to.gridColumnStart(from.gridColumnStart());
            case GRID_COLUMN_END -> to.gridColumnEnd(from.gridColumnEnd());
            case GRID_ROW_START -> to.gridRowStart(from.gridRowStart());
            case GRID_ROW_END -> to.gridRowEnd(from.gridRowEnd());
            case GRID_AUTO_FLOW -> to.gridAutoFlow(from.gridAutoFlow());
        }
    }
}
