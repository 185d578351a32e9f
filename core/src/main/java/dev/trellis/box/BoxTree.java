/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.trellis.box;

import java.util.ArrayList;
import java.util.List;

import dev.trellis.style.ComputedStyle;

/**
 * Arena holding the boxes of one document. Boxes are addressed by their id,
 * which is their index in the arena; parent and child links are ids.
 * <p>
 * A child appended to a grid container is blockified.
 * </p>
 */
public final class BoxTree {

    private final List<Box> boxes = new ArrayList<>();

    /**
     * Create a box whose type follows the style's {@code display}.
     */
    public Box createBox(ComputedStyle style) {
        return add(BoxType.forDisplay(style.display()), style, null);
    }

    public Box createText(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Text must not be null");
        }
        return add(BoxType.TEXT, ComputedStyle.initial(), text);
    }

    /**
     * Create a box and append it to the given parent.
     */
    public Box appendBox(Box parent, ComputedStyle style) {
        Box box = createBox(style);
        appendChild(parent, box);
        return box;
    }

    public Box appendText(Box parent, String text) {
        Box box = createText(text);
        appendChild(parent, box);
        return box;
    }

    public void appendChild(Box parent, Box child) {
        checkOwned(parent);
        checkOwned(child);
        if (child.parent() != -1) {
            throw new IllegalArgumentException("Box " + child.id() + " already has parent " + child.parent());
        }
        if (parent.type() == BoxType.TEXT) {
            throw new IllegalArgumentException("Text box " + parent.id() + " cannot have children");
        }
        if (parent.type().isGridContainer() && child.type() != BoxType.TEXT) {
            child.type(child.type().blockified());
        }
        child.parent(parent.id());
        parent.addChild(child.id());
    }

    public Box box(int id) {
        if (id < 0 || id >= boxes.size()) {
            throw new IndexOutOfBoundsException("No box with id " + id + " (size " + boxes.size() + ")");
        }
        return boxes.get(id);
    }

    /**
     * Returns the children of a box in document order.
     */
    public List<Box> children(Box parent) {
        List<Integer> ids = parent.children();
        List<Box> result = new ArrayList<>(ids.size());
        for (int id : ids) {
            result.add(boxes.get(id));
        }
        return result;
    }

    public int size() {
        return boxes.size();
    }

    private Box add(BoxType type, ComputedStyle style, String text) {
        Box box = new Box(boxes.size(), type, style, text);
        boxes.add(box);
        return box;
    }

    private void checkOwned(Box box) {
        if (box.id() >= boxes.size() || boxes.get(box.id()) != box) {
            throw new IllegalArgumentException("Box " + box.id() + " does not belong to this tree");
        }
    }
}
