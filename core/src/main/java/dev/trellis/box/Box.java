/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.trellis.box;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import dev.trellis.style.ComputedStyle;

/**
 * A node of a {@link BoxTree}.
 * <p>
 * Style, type and text are fixed when the box is created. Geometry is written
 * by layout: {@code x} and {@code y} locate the border box relative to the
 * parent's content box, {@code width} and {@code height} are content-box
 * sizes.
 * </p>
 */
public final class Box {

    /**
     * Marks a size that is {@code auto} or not yet computed.
     */
    public static final int AUTO = Integer.MIN_VALUE;

    /**
     * Value of {@link #maxWidth()} before intrinsic widths are computed.
     */
    public static final int UNKNOWN_MAX_WIDTH = Integer.MAX_VALUE;

    private final int id;
    private final ComputedStyle style;
    private final String text;
    private final List<Integer> children = new ArrayList<>();

    private BoxType type;
    private int parent = -1;

    private int x;
    private int y;
    private int width = AUTO;
    private int height = AUTO;
    private int minWidth;
    private int maxWidth = UNKNOWN_MAX_WIDTH;
    private Insets margin = Insets.ZERO;
    private Insets padding = Insets.ZERO;
    private Insets border = Insets.ZERO;

    Box(int id, BoxType type, ComputedStyle style, String text) {
        this.id = id;
        this.type = type;
        this.style = style;
        this.text = text;
    }

    public int id() {
        return id;
    }

    public BoxType type() {
        return type;
    }

    void type(BoxType type) {
        this.type = type;
    }

    public ComputedStyle style() {
        return style;
    }

    /**
     * Returns the text of a {@link BoxType#TEXT} box, null for other boxes.
     */
    public String text() {
        return text;
    }

    /**
     * Returns the id of the parent box, or -1 for a root.
     */
    public int parent() {
        return parent;
    }

    void parent(int parent) {
        this.parent = parent;
    }

    /**
     * Returns the ids of the children in document order.
     */
    public List<Integer> children() {
        return Collections.unmodifiableList(children);
    }

    void addChild(int child) {
        children.add(child);
    }

    public int x() {
        return x;
    }

    public void setX(int x) {
        this.x = x;
    }

    public int y() {
        return y;
    }

    public void setY(int y) {
        this.y = y;
    }

    public int width() {
        return width;
    }

    public void setWidth(int width) {
        this.width = width;
    }

    public int height() {
        return height;
    }

    public void setHeight(int height) {
        this.height = height;
    }

    public int minWidth() {
        return minWidth;
    }

    public void setMinWidth(int minWidth) {
        this.minWidth = minWidth;
    }

    public int maxWidth() {
        return maxWidth;
    }

    public void setMaxWidth(int maxWidth) {
        this.maxWidth = maxWidth;
    }

    public boolean hasIntrinsicWidths() {
        return maxWidth != UNKNOWN_MAX_WIDTH;
    }

    public Insets margin() {
        return margin;
    }

    public void setMargin(Insets margin) {
        this.margin = margin;
    }

    public Insets padding() {
        return padding;
    }

    public void setPadding(Insets padding) {
        this.padding = padding;
    }

    public Insets border() {
        return border;
    }

    public void setBorder(Insets border) {
        this.border = border;
    }

    /**
     * Width of the margin box, from the content width and the resolved edges.
     */
    public int outerWidth() {
        return width + padding.horizontal() + border.horizontal() + margin.horizontal();
    }

    /**
     * Height of the margin box, from the content height and the resolved edges.
     */
    public int outerHeight() {
        return height + padding.vertical() + border.vertical() + margin.vertical();
    }

    @Override
    public String toString() {
        return "Box[id=" + id + ", type=" + type + ", x=" + x + ", y=" + y + ", width=" + width + ", height=" + height + "]";
    }
}
