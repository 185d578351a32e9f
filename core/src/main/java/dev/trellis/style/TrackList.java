/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.trellis.style;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Computed value of {@code grid-template-columns} or {@code grid-template-rows}.
 * Only {@link TemplateKind#SET} carries tracks.
 */
public record TrackList(TemplateKind kind, List<TrackSize> tracks) {

    public static final TrackList NONE = new TrackList(TemplateKind.NONE, List.of());

    public static final TrackList INHERIT = new TrackList(TemplateKind.INHERIT, List.of());

    public enum TemplateKind {
        NONE,
        SET,
        INHERIT
    }

    public TrackList {
        if (kind == null) {
            throw new IllegalArgumentException("Kind must not be null");
        }
        tracks = List.copyOf(tracks);
        if (kind == TemplateKind.SET && tracks.isEmpty()) {
            throw new IllegalArgumentException("A set track list needs at least one track");
        }
        if (kind != TemplateKind.SET && !tracks.isEmpty()) {
            throw new IllegalArgumentException("Only a set track list may carry tracks");
        }
    }

    public static TrackList of(List<TrackSize> tracks) {
        return new TrackList(TemplateKind.SET, tracks);
    }

    public static TrackList of(TrackSize... tracks) {
        return of(List.of(tracks));
    }

    public boolean isSet() {
        return kind == TemplateKind.SET;
    }

    /**
     * Number of explicit tracks; zero unless the list is set.
     */
    public int trackCount() {
        return tracks.size();
    }

    /**
     * Returns the track sizing the given (possibly implicit) track index.
     * Explicit tracks repeat cyclically past the end of the list; without any
     * explicit track every index is one flexible share.
     */
    public TrackSize trackFor(int index) {
        if (tracks.isEmpty()) {
            return new TrackSize.Flex(1);
        }
        return tracks.get(index % tracks.size());
    }

    @Override
    public String toString() {
        return switch (kind) {
            case NONE -> "none";
            case INHERIT -> "inherit";
            case SET -> tracks.stream().map(Object::toString).collect(Collectors.joining(" "));
        };
    }
}
