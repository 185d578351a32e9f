/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.trellis.css;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import dev.trellis.style.CssUnit;
import dev.trellis.style.TrackList;
import dev.trellis.style.TrackSize;

/**
 * Parser for {@code grid-template-columns} and {@code grid-template-rows}.
 * <p>
 * Accepts {@code none} or a list of track sizes: {@code auto} (one flexible
 * share), {@code min-content}, {@code max-content}, {@code minmax(a, b)},
 * {@code repeat(n, tracks...)}, or a length, percentage, flex factor or
 * number. Parsing stops without error at the first token that cannot start a
 * track, or once the maximum track count is reached. A failed parse leaves
 * the cursor where it was.
 * </p>
 */
public final class TrackListParser {

    public static final String MAX_TRACKS_PROPERTY = "trellis.grid.maxTracks";

    static final int DEFAULT_MAX_TRACKS = 32;

    private static final Logger LOG = System.getLogger(TrackListParser.class.getName());

    private final int maxTracks;

    /**
     * Create a parser whose track limit comes from the
     * {@value #MAX_TRACKS_PROPERTY} system property (default 32).
     */
    public TrackListParser() {
        this(maxTracksFromSystemProperty());
    }

    public TrackListParser(int maxTracks) {
        if (maxTracks < 1) {
            throw new IllegalArgumentException("Maximum track count must be positive: " + maxTracks);
        }
        this.maxTracks = maxTracks;
    }

    public int maxTracks() {
        return maxTracks;
    }

    /**
     * Parse a track list.
     *
     * @param cursor positioned at the start of the value
     * @return the track list, or empty if no track could be parsed (cursor unchanged)
     */
    public Optional<TrackList> parse(TokenCursor cursor) {
        int start = cursor.mark();
        cursor.skipWhitespace();

        if (ValueParsers.parseKeyword(cursor, "none") != null) {
            return Optional.of(TrackList.NONE);
        }

        List<TrackSize> tracks = new ArrayList<>();
        while (tracks.size() < maxTracks) {
            cursor.skipWhitespace();
            CssToken token = cursor.peek();
            if (token == null) {
                break;
            }
            if (token.isFunction("repeat")) {
                List<TrackSize> repeated = parseRepeat(cursor);
                if (repeated == null) {
                    break;
                }
                for (int i = 0; i < repeated.size() && tracks.size() < maxTracks; i++) {
                    tracks.add(repeated.get(i));
                }
                continue;
            }
            TrackSize track = parseTrack(cursor);
            if (track == null) {
                break;
            }
            tracks.add(track);
        }

        if (tracks.isEmpty()) {
            cursor.reset(start);
            return Optional.empty();
        }
        if (tracks.size() == maxTracks) {
            LOG.log(Level.DEBUG, "Track list reached the limit of {0} tracks", maxTracks);
        }
        return Optional.of(TrackList.of(tracks));
    }

    /**
     * Parse one track size ({@code repeat()} excluded).
     *
     * @return the track, or null with the cursor unchanged
     */
    TrackSize parseTrack(TokenCursor cursor) {
        CssToken token = cursor.peek();
        if (token == null) {
            return null;
        }
        if (token.type() == CssToken.Type.IDENT) {
            TrackSize keyword = parseContentKeyword(cursor);
            if (keyword == null) {
                return null;
            }
            return keyword;
        }
        if (token.isFunction("minmax")) {
            return parseMinMax(cursor);
        }
        return parseBreadth(cursor);
    }

    private TrackSize parseMinMax(TokenCursor cursor) {
        int start = cursor.mark();
        cursor.next();
        cursor.skipWhitespace();

        TrackSize min = parseSide(cursor);
        if (min == null) {
            cursor.reset(start);
            return null;
        }

        cursor.skipWhitespace();
        CssToken token = cursor.peek();
        if (token != null && token.isDelim(',')) {
            cursor.next();
        }
        cursor.skipWhitespace();

        TrackSize max = parseSide(cursor);
        if (max == null) {
            cursor.reset(start);
            return null;
        }

        cursor.skipWhitespace();
        token = cursor.next();
        if (token == null || !token.isDelim(')')) {
            cursor.reset(start);
            return null;
        }
        return new TrackSize.MinMax(min, max);
    }

    private TrackSize parseSide(TokenCursor cursor) {
        CssToken token = cursor.peek();
        if (token == null) {
            return null;
        }
        if (token.type() == CssToken.Type.IDENT) {
            return parseContentKeyword(cursor);
        }
        return parseBreadth(cursor);
    }

    private List<TrackSize> parseRepeat(TokenCursor cursor) {
        int start = cursor.mark();
        cursor.next();
        cursor.skipWhitespace();

        Integer count = ValueParsers.parseInteger(cursor);
        if (count == null || count <= 0 || count > maxTracks) {
            cursor.reset(start);
            return null;
        }

        cursor.skipWhitespace();
        CssToken token = cursor.next();
        if (token == null || !token.isDelim(',')) {
            cursor.reset(start);
            return null;
        }

        List<TrackSize> pattern = new ArrayList<>();
        while (true) {
            cursor.skipWhitespace();
            token = cursor.peek();
            if (token != null && token.isDelim(')')) {
                cursor.next();
                break;
            }
            TrackSize track = parseTrack(cursor);
            if (track == null) {
                cursor.reset(start);
                return null;
            }
            pattern.add(track);
        }
        if (pattern.isEmpty()) {
            cursor.reset(start);
            return null;
        }

        List<TrackSize> expanded = new ArrayList<>(pattern.size() * count);
        for (int i = 0; i < count; i++) {
            expanded.addAll(pattern);
        }
        return expanded;
    }

    private static TrackSize parseContentKeyword(TokenCursor cursor) {
        String keyword = ValueParsers.parseKeyword(cursor, "auto", "min-content", "max-content");
        if (keyword == null) {
            return null;
        }
        return switch (keyword) {
            case "auto" -> new TrackSize.Flex(1);
            case "min-content" -> new TrackSize.MinContent();
            default -> new TrackSize.MaxContent();
        };
    }

    // <length> | <percentage> | <flex> | <number>, never negative
    private static TrackSize parseBreadth(TokenCursor cursor) {
        CssToken token = cursor.peek();
        if (token == null || token.number() < 0) {
            return null;
        }
        TrackSize track = switch (token.type()) {
            case NUMBER -> new TrackSize.Fixed(token.number(), CssUnit.PX);
            case PERCENTAGE -> new TrackSize.Percentage(token.number());
            case DIMENSION -> {
                CssUnit unit = CssUnit.fromSuffix(token.text());
                if (unit == CssUnit.FR) {
                    yield new TrackSize.Flex(token.number());
                }
                yield unit != null && unit.isLength() ? new TrackSize.Fixed(token.number(), unit) : null;
            }
            default -> null;
        };
        if (track != null) {
            cursor.next();
        }
        return track;
    }

    private static int maxTracksFromSystemProperty() {
        String value = System.getProperty(MAX_TRACKS_PROPERTY);
        if (value == null) {
            return DEFAULT_MAX_TRACKS;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed > 0) {
                return parsed;
            }
        }
        catch (NumberFormatException e) {
            LOG.log(Level.WARNING, "Ignoring invalid {0} value ''{1}''", MAX_TRACKS_PROPERTY, value);
            return DEFAULT_MAX_TRACKS;
        }
        LOG.log(Level.WARNING, "Ignoring non-positive {0} value ''{1}''", MAX_TRACKS_PROPERTY, value);
        return DEFAULT_MAX_TRACKS;
    }
}
