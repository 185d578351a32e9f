/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.trellis.style;

import java.util.Arrays;

/**
 * Specified value of a single longhand declaration.
 */
public sealed

interface DeclaredValue
permits DeclaredValue.EncodedTracks,DeclaredValue.NoTracks,DeclaredValue.Line,DeclaredValue.Flow,DeclaredValue.Size,DeclaredValue.GapSize,DeclaredValue.DisplayValue,DeclaredValue.PositionValue
{

    /**
     * A track list in its encoded wire form; see
     * {@code dev.trellis.internal.bytecode.TrackListCodec}.
     */
    record EncodedTracks(int[] words) implements DeclaredValue {
        public EncodedTracks {
            words = words.clone();
        }

        @Override
        public int[] words() {
            return words.clone();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof EncodedTracks other && Arrays.equals(words, other.words);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(words);
        }

        @Override
        public String toString() {
            return "EncodedTracks" + Arrays.toString(words);
        }
    }

    // grid-template-*: none
    record NoTracks() implements DeclaredValue {}

    record Line(GridLine line) implements DeclaredValue {}

    record Flow(GridAutoFlow flow) implements DeclaredValue {}

    /**
     * A length-valued property; a null length stands for {@code auto} (or
     * {@code none} for {@code max-width}).
     */
    record Size(Length length) implements DeclaredValue {}

    record GapSize(Gap gap) implements DeclaredValue {}

    record DisplayValue(Display display) implements DeclaredValue {}

    record PositionValue(Position position) implements DeclaredValue {}
}
