/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.trellis.css;

import java.util.List;

/**
 * Read position over a token list. Parsers {@link #mark()} the position before
 * attempting a grammar and {@link #reset(int)} to it on failure, so a caller
 * can retry the same tokens against another grammar.
 */
public final class TokenCursor {

    private final List<CssToken> tokens;
    private int position;

    public TokenCursor(List<CssToken> tokens) {
        this.tokens = List.copyOf(tokens);
    }

    public static TokenCursor of(String text) {
        return new TokenCursor(CssTokenizer.tokenize(text));
    }

    /**
     * Returns the next token without consuming it, or null at the end.
     */
    public CssToken peek() {
        return position < tokens.size() ? tokens.get(position) : null;
    }

    /**
     * Consumes and returns the next token, or returns null at the end.
     */
    public CssToken next() {
        return position < tokens.size() ? tokens.get(position++) : null;
    }

    public boolean hasNext() {
        return position < tokens.size();
    }

    public void skipWhitespace() {
        while (position < tokens.size() && tokens.get(position).isWhitespace()) {
            position++;
        }
    }

    /**
     * Returns true if only whitespace remains.
     */
    public boolean atEnd() {
        for (int i = position; i < tokens.size(); i++) {
            if (!tokens.get(i).isWhitespace()) {
                return false;
            }
        }
        return true;
    }

    public int mark() {
        return position;
    }

    public void reset(int mark) {
        if (mark < 0 || mark > tokens.size()) {
            throw new IllegalArgumentException("Invalid cursor mark: " + mark);
        }
        position = mark;
    }

    public int position() {
        return position;
    }
}
