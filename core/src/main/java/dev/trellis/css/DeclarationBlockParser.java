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
import java.util.Locale;
import java.util.Optional;

import dev.trellis.internal.bytecode.TrackListCodec;
import dev.trellis.style.CssProperty;
import dev.trellis.style.CssWideKeyword;
import dev.trellis.style.Declaration;
import dev.trellis.style.DeclaredValue;
import dev.trellis.style.Display;
import dev.trellis.style.Gap;
import dev.trellis.style.GridAutoFlow;
import dev.trellis.style.GridLine;
import dev.trellis.style.Length;
import dev.trellis.style.Position;
import dev.trellis.style.TrackList;

/**
 * Parses a declaration block ({@code name: value [!important]; ...}) into
 * longhand {@link Declaration}s.
 * <p>
 * Shorthands ({@code grid-column}, {@code grid-row}, {@code gap},
 * {@code margin}, {@code padding}, {@code border-width}) expand to their
 * longhands. A declaration that is unknown or whose value does not match the
 * property grammar completely is dropped; the remaining declarations of the
 * block are unaffected.
 * </p>
 */
public final class DeclarationBlockParser {

    private static final Logger LOG = System.getLogger(DeclarationBlockParser.class.getName());

    private static final CssProperty[] GRID_COLUMN = { CssProperty.GRID_COLUMN_START, CssProperty.GRID_COLUMN_END };
    private static final CssProperty[] GRID_ROW = { CssProperty.GRID_ROW_START, CssProperty.GRID_ROW_END };
    private static final CssProperty[] GAP = { CssProperty.ROW_GAP, CssProperty.COLUMN_GAP };
    private static final CssProperty[] MARGIN = { CssProperty.MARGIN_TOP, CssProperty.MARGIN_RIGHT,
            CssProperty.MARGIN_BOTTOM, CssProperty.MARGIN_LEFT };
    private static final CssProperty[] PADDING = { CssProperty.PADDING_TOP, CssProperty.PADDING_RIGHT,
            CssProperty.PADDING_BOTTOM, CssProperty.PADDING_LEFT };
    private static final CssProperty[] BORDER_WIDTH = { CssProperty.BORDER_TOP_WIDTH, CssProperty.BORDER_RIGHT_WIDTH,
            CssProperty.BORDER_BOTTOM_WIDTH, CssProperty.BORDER_LEFT_WIDTH };

    private final TrackListParser trackListParser;

    public DeclarationBlockParser() {
        this(new TrackListParser());
    }

    public DeclarationBlockParser(TrackListParser trackListParser) {
        this.trackListParser = trackListParser;
    }

    /**
     * Parse a declaration block.
     *
     * @param block the block contents, without braces
     * @return the valid declarations, longhands only, in source order
     */
    public List<Declaration> parse(String block) {
        List<Declaration> declarations = new ArrayList<>();
        for (List<CssToken> segment : splitDeclarations(CssTokenizer.tokenize(block))) {
            parseDeclaration(segment, declarations);
        }
        return declarations;
    }

    private void parseDeclaration(List<CssToken> tokens, List<Declaration> out) {
        TokenCursor cursor = new TokenCursor(tokens);
        cursor.skipWhitespace();
        if (cursor.atEnd()) {
            return;
        }

        CssToken name = cursor.next();
        cursor.skipWhitespace();
        CssToken colon = cursor.next();
        if (name.type() != CssToken.Type.IDENT || colon == null || !colon.isDelim(':')) {
            LOG.log(Level.DEBUG, "Dropping malformed declaration {0}", tokens);
            return;
        }
        String propertyName = name.text().toLowerCase(Locale.ROOT);

        List<CssToken> valueTokens = new ArrayList<>(tokens.subList(cursor.position(), tokens.size()));
        boolean important = stripImportant(valueTokens);

        List<Declaration> parsed = parseValue(propertyName, new TokenCursor(valueTokens));
        if (parsed == null) {
            LOG.log(Level.DEBUG, "Dropping invalid declaration for {0}: {1}", propertyName, valueTokens);
            return;
        }
        for (Declaration declaration : parsed) {
            out.add(important ? declaration.asImportant() : declaration);
        }
    }

    private List<Declaration> parseValue(String propertyName, TokenCursor cursor) {
        CssProperty[] longhands = longhandsOf(propertyName);
        if (longhands == null) {
            return null;
        }

        CssWideKeyword keyword = parseWideKeyword(cursor);
        if (keyword != null) {
            List<Declaration> result = new ArrayList<>(longhands.length);
            for (CssProperty longhand : longhands) {
                result.add(Declaration.of(longhand, keyword));
            }
            return result;
        }

        List<DeclaredValue> values = parseLonghandValues(propertyName, cursor);
        if (values == null || !cursor.atEnd()) {
            return null;
        }
        List<Declaration> result = new ArrayList<>(longhands.length);
        for (int i = 0; i < longhands.length; i++) {
            result.add(Declaration.of(longhands[i], values.get(i)));
        }
        return result;
    }

    /**
     * Returns one value per longhand of the property, or null if the value is invalid.
     */
    private List<DeclaredValue> parseLonghandValues(String propertyName, TokenCursor cursor) {
        cursor.skipWhitespace();
        switch (propertyName) {
            case "grid-template-columns":
            case "grid-template-rows": {
                Optional<TrackList> tracks = trackListParser.parse(cursor);
                if (tracks.isEmpty()) {
                    return null;
                }
                TrackList list = tracks.get();
                return List.of(list.isSet()
                        ? new DeclaredValue.EncodedTracks(TrackListCodec.encode(list.tracks()))
                        : new DeclaredValue.NoTracks());
            }
            case "grid-column":
            case "grid-row": {
                GridLineParser.LinePair pair = GridLineParser.parsePair(cursor);
                if (pair == null) {
                    return null;
                }
                return List.of(new DeclaredValue.Line(pair.start()), new DeclaredValue.Line(pair.end()));
            }
            case "grid-column-start":
            case "grid-column-end":
            case "grid-row-start":
            case "grid-row-end": {
                GridLine line = GridLineParser.parse(cursor);
                return line == null ? null : List.of(new DeclaredValue.Line(line));
            }
            case "grid-auto-flow": {
                GridAutoFlow flow = AutoFlowParser.parse(cursor);
                return flow == null ? null : List.of(new DeclaredValue.Flow(flow));
            }
            case "column-gap":
            case "row-gap": {
                Gap gap = parseGap(cursor);
                return gap == null ? null : List.of(new DeclaredValue.GapSize(gap));
            }
            case "gap": {
                Gap row = parseGap(cursor);
                if (row == null) {
                    return null;
                }
                cursor.skipWhitespace();
                Gap column = cursor.atEnd() ? row : parseGap(cursor);
                if (column == null) {
                    return null;
                }
                return List.of(new DeclaredValue.GapSize(row), new DeclaredValue.GapSize(column));
            }
            case "display": {
                CssToken token = cursor.next();
                Display display = token != null && token.type() == CssToken.Type.IDENT ? Display.fromKeyword(token.text()) : null;
                return display == null ? null : List.of(new DeclaredValue.DisplayValue(display));
            }
            case "position": {
                CssToken token = cursor.next();
                Position position = token != null && token.type() == CssToken.Type.IDENT ? Position.fromKeyword(token.text()) : null;
                return position == null ? null : List.of(new DeclaredValue.PositionValue(position));
            }
            case "width":
            case "height":
            case "min-width":
                return sizeOrKeyword(cursor, "auto");
            case "max-width":
                return sizeOrKeyword(cursor, "none");
            case "margin":
                return parseEdges(cursor, DeclarationBlockParser::parseMargin);
            case "padding":
                return parseEdges(cursor, DeclarationBlockParser::parsePadding);
            case "border-width":
                return parseEdges(cursor, DeclarationBlockParser::parseBorderWidth);
            case "margin-top":
            case "margin-right":
            case "margin-bottom":
            case "margin-left":
                return single(parseMargin(cursor));
            case "padding-top":
            case "padding-right":
            case "padding-bottom":
            case "padding-left":
                return single(parsePadding(cursor));
            case "border-top-width":
            case "border-right-width":
            case "border-bottom-width":
            case "border-left-width":
                return single(parseBorderWidth(cursor));
            default:
                return null;
        }
    }

    private static CssProperty[] longhandsOf(String propertyName) {
        return switch (propertyName) {
            case "grid-column" -> GRID_COLUMN;
            case "grid-row" -> GRID_ROW;
            case "gap" -> GAP;
            case "margin" -> MARGIN;
            case "padding" -> PADDING;
            case "border-width" -> BORDER_WIDTH;
            default -> {
                CssProperty property = CssProperty.fromName(propertyName);
                yield property == null ? null : new CssProperty[]{ property };
            }
        };
    }

    private static CssWideKeyword parseWideKeyword(TokenCursor cursor) {
        int start = cursor.mark();
        cursor.skipWhitespace();
        CssToken token = cursor.next();
        if (token != null && token.type() == CssToken.Type.IDENT) {
            CssWideKeyword keyword = CssWideKeyword.fromIdent(token.text());
            if (keyword != null && cursor.atEnd()) {
                return keyword;
            }
        }
        cursor.reset(start);
        return null;
    }

    private static Gap parseGap(TokenCursor cursor) {
        cursor.skipWhitespace();
        if (ValueParsers.parseKeyword(cursor, "normal") != null) {
            return Gap.NORMAL;
        }
        Length length = ValueParsers.parseLengthPercentage(cursor, false);
        return length == null ? null : Gap.of(length);
    }

    private static List<DeclaredValue> sizeOrKeyword(TokenCursor cursor, String keyword) {
        if (ValueParsers.parseKeyword(cursor, keyword) != null) {
            return List.of(new DeclaredValue.Size(null));
        }
        Length length = ValueParsers.parseLengthPercentage(cursor, false);
        return length == null ? null : List.of(new DeclaredValue.Size(length));
    }

    private static Length parseMargin(TokenCursor cursor) {
        return ValueParsers.parseLengthPercentage(cursor, true);
    }

    private static Length parsePadding(TokenCursor cursor) {
        return ValueParsers.parseLengthPercentage(cursor, false);
    }

    private static Length parseBorderWidth(TokenCursor cursor) {
        String keyword = ValueParsers.parseKeyword(cursor, "thin", "medium", "thick");
        if (keyword != null) {
            return switch (keyword) {
                case "thin" -> Length.px(1);
                case "medium" -> Length.px(3);
                default -> Length.px(5);
            };
        }
        return ValueParsers.parseLength(cursor, false, false);
    }

    private static List<DeclaredValue> single(Length length) {
        return length == null ? null : List.of(new DeclaredValue.Size(length));
    }

    private interface EdgeParser {
        Length parse(TokenCursor cursor);
    }

    // 1 to 4 values, expanded clockwise from the top
    private static List<DeclaredValue> parseEdges(TokenCursor cursor, EdgeParser parser) {
        List<Length> values = new ArrayList<>(4);
        while (values.size() < 4) {
            cursor.skipWhitespace();
            if (cursor.atEnd()) {
                break;
            }
            Length length = parser.parse(cursor);
            if (length == null) {
                return null;
            }
            values.add(length);
        }
        if (values.isEmpty()) {
            return null;
        }

        Length top = values.get(0);
        Length right = values.size() > 1 ? values.get(1) : top;
        Length bottom = values.size() > 2 ? values.get(2) : top;
        Length left = values.size() > 3 ? values.get(3) : right;
        return List.of(new DeclaredValue.Size(top), new DeclaredValue.Size(right),
                new DeclaredValue.Size(bottom), new DeclaredValue.Size(left));
    }

    private static boolean stripImportant(List<CssToken> tokens) {
        int last = lastNonWhitespace(tokens, tokens.size() - 1);
        if (last < 0 || !tokens.get(last).isIdent("important")) {
            return false;
        }
        int bang = lastNonWhitespace(tokens, last - 1);
        if (bang < 0 || !tokens.get(bang).isDelim('!')) {
            return false;
        }
        tokens.subList(bang, tokens.size()).clear();
        return true;
    }

    private static int lastNonWhitespace(List<CssToken> tokens, int from) {
        int i = from;
        while (i >= 0 && tokens.get(i).isWhitespace()) {
            i--;
        }
        return i;
    }

    // Splits on ';' outside of parentheses
    private static List<List<CssToken>> splitDeclarations(List<CssToken> tokens) {
        List<List<CssToken>> segments = new ArrayList<>();
        List<CssToken> current = new ArrayList<>();
        int depth = 0;
        for (CssToken token : tokens) {
            if (token.type() == CssToken.Type.FUNCTION || token.isDelim('(')) {
                depth++;
            }
            else if (token.isDelim(')') && depth > 0) {
                depth--;
            }
            else if (token.isDelim(';') && depth == 0) {
                segments.add(current);
                current = new ArrayList<>();
                continue;
            }
            current.add(token);
        }
        segments.add(current);
        return segments;
    }
}
