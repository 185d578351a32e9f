/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.trellis.internal.bytecode;

import java.util.ArrayList;
import java.util.List;

import dev.trellis.style.CssUnit;
import dev.trellis.style.TrackSize;

/**
 * Encoder and decoder for the flat word stream a track list travels in from
 * declaration parsing to style computation.
 * <p>
 * Layout of the stream:
 * </p>
 * <pre>
 * count, (value, unit) x count
 * </pre>
 * Values are 22.10 fixed-point numbers, units are {@link CssUnit#tag()}s. A
 * {@code minmax()} track is written as the pair {@code (0, MINMAX)} followed by
 * {@code min_value, min_unit, max_value, max_unit}.
 */
public final class TrackListCodec {

    static final int FIXED_SHIFT = 10;

    private TrackListCodec() {
    }

    /**
     * Encode a non-empty list of tracks.
     *
     * @throws IllegalArgumentException if the list is empty
     */
    public static int[] encode(List<TrackSize> tracks) {
        if (tracks.isEmpty()) {
            throw new IllegalArgumentException("Cannot encode an empty track list");
        }
        Writer writer = new Writer();
        writer.write(tracks.size());
        for (TrackSize track : tracks) {
            if (track instanceof TrackSize.MinMax minMax) {
                writer.write(0);
                writer.write(CssUnit.MINMAX.tag());
                writeSimple(writer, minMax.min());
                writeSimple(writer, minMax.max());
            }
            else {
                writeSimple(writer, track);
            }
        }
        return writer.toArray();
    }

    /**
     * Decode a stream produced by {@link #encode(List)}.
     *
     * @throws IllegalArgumentException if the stream is truncated, has
     *         trailing words, or carries an unknown unit
     */
    public static List<TrackSize> decode(int[] words) {
        Reader reader = new Reader(words);
        int count = reader.read();
        if (count <= 0) {
            throw new IllegalArgumentException("Invalid track count: " + count);
        }
        List<TrackSize> tracks = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int value = reader.read();
            CssUnit unit = CssUnit.fromTag(reader.read());
            if (unit == CssUnit.MINMAX) {
                if (value != 0) {
                    throw new IllegalArgumentException("minmax() marker must carry value 0, got " + value);
                }
                TrackSize min = readSimple(reader);
                TrackSize max = readSimple(reader);
                tracks.add(new TrackSize.MinMax(min, max));
            }
            else {
                tracks.add(toTrack(value, unit));
            }
        }
        if (reader.remaining() != 0) {
            throw new IllegalArgumentException("Unexpected " + reader.remaining() + " trailing words in track list");
        }
        return tracks;
    }

    /**
     * Convert to 22.10 fixed point, saturating at the limits of the word.
     */
    public static int toFixed(double value) {
        long fixed = Math.round(value * (1 << FIXED_SHIFT));
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, fixed));
    }

    public static double fromFixed(int fixed) {
        return fixed / (double) (1 << FIXED_SHIFT);
    }

    private static void writeSimple(Writer writer, TrackSize track) {
        if (track instanceof TrackSize.Fixed fixed) {
            writer.write(toFixed(fixed.value()));
            writer.write(fixed.unit().tag());
        }
        else if (track instanceof TrackSize.Percentage percentage) {
            writer.write(toFixed(percentage.value()));
            writer.write(CssUnit.PCT.tag());
        }
        else if (track instanceof TrackSize.Flex flex) {
            writer.write(toFixed(flex.factor()));
            writer.write(CssUnit.FR.tag());
        }
        else if (track instanceof TrackSize.MinContent) {
            writer.write(0);
            writer.write(CssUnit.MIN_CONTENT.tag());
        }
        else if (track instanceof TrackSize.MaxContent) {
            writer.write(0);
            writer.write(CssUnit.MAX_CONTENT.tag());
        }
        else {
            throw new IllegalArgumentException("minmax() cannot be nested");
        }
    }

    private static TrackSize readSimple(Reader reader) {
        int value = reader.read();
        CssUnit unit = CssUnit.fromTag(reader.read());
        if (unit == CssUnit.MINMAX) {
            throw new IllegalArgumentException("minmax() cannot be nested");
        }
        return toTrack(value, unit);
    }

    private static TrackSize toTrack(int value, CssUnit unit) {
        return switch (unit) {
            case PCT -> new TrackSize.Percentage(fromFixed(value));
            case FR -> new TrackSize.Flex(fromFixed(value));
            case MIN_CONTENT -> new TrackSize.MinContent();
            case MAX_CONTENT -> new TrackSize.MaxContent();
            case MINMAX -> throw new IllegalStateException("minmax() is decoded by the caller");
            default -> new TrackSize.Fixed(fromFixed(value), unit);
        };
    }

    private static final class Writer {

        private int[] words = new int[16];
        private int size;

        void write(int word) {
            if (size == words.length) {
                int[] grown = new int[words.length * 2];
                System.arraycopy(words, 0, grown, 0, size);
                words = grown;
            }
            words[size++] = word;
        }

        int[] toArray() {
            int[] result = new int[size];
            System.arraycopy(words, 0, result, 0, size);
            return result;
        }
    }

    private static final class Reader {

        private final int[] words;
        private int position;

        Reader(int[] words) {
            this.words = words;
        }

        int read() {
            if (position >= words.length) {
                throw new IllegalArgumentException("Truncated track list after " + position + " words");
            }
            return words[position++];
        }

        int remaining() {
            return words.length - position;
        }
    }
}
