/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.trellis.css;

import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizer for CSS declaration text, following the token shapes of CSS
 * Syntax Level 3 closely enough for property values: identifiers, functions,
 * numbers, percentages, dimensions, strings, whitespace and single-character
 * delimiters. Comments are dropped.
 */
public final class CssTokenizer {

    private final String input;
    private int pos;

    private CssTokenizer(String input) {
        this.input = input;
    }

    /**
     * Tokenize the given text.
     */
    public static List<CssToken> tokenize(String input) {
        return new CssTokenizer(input).run();
    }

    private List<CssToken> run() {
        List<CssToken> tokens = new ArrayList<>();
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '/' && peekChar(1) == '*') {
                skipComment();
            }
            else if (isWhitespace(c)) {
                while (pos < input.length() && isWhitespace(input.charAt(pos))) {
                    pos++;
                }
                // Collapse whitespace around dropped comments into one token
                if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).isWhitespace()) {
                    tokens.add(new CssToken(CssToken.Type.WHITESPACE, " ", 0, false));
                }
            }
            else if (c == '"' || c == '\'') {
                tokens.add(readString(c));
            }
            else if (startsNumber()) {
                tokens.add(readNumeric());
            }
            else if (startsIdent(pos)) {
                String name = readName();
                if (pos < input.length() && input.charAt(pos) == '(') {
                    pos++;
                    tokens.add(CssToken.function(name));
                }
                else {
                    tokens.add(CssToken.ident(name));
                }
            }
            else {
                pos++;
                tokens.add(CssToken.delim(c));
            }
        }
        return tokens;
    }

    private void skipComment() {
        int end = input.indexOf("*/", pos + 2);
        pos = end < 0 ? input.length() : end + 2;
    }

    private CssToken readString(char quote) {
        StringBuilder sb = new StringBuilder();
        pos++;
        while (pos < input.length()) {
            char c = input.charAt(pos++);
            if (c == quote) {
                break;
            }
            if (c == '\\' && pos < input.length()) {
                c = input.charAt(pos++);
            }
            sb.append(c);
        }
        return new CssToken(CssToken.Type.STRING, sb.toString(), 0, false);
    }

    private boolean startsNumber() {
        char c = input.charAt(pos);
        if (isDigit(c)) {
            return true;
        }
        if (c == '.') {
            return isDigit(peekChar(1));
        }
        if (c == '+' || c == '-') {
            char next = peekChar(1);
            return isDigit(next) || (next == '.' && isDigit(peekChar(2)));
        }
        return false;
    }

    private CssToken readNumeric() {
        int start = pos;
        boolean integer = true;
        if (input.charAt(pos) == '+' || input.charAt(pos) == '-') {
            pos++;
        }
        while (pos < input.length() && isDigit(input.charAt(pos))) {
            pos++;
        }
        if (pos < input.length() && input.charAt(pos) == '.' && isDigit(peekChar(1))) {
            integer = false;
            pos++;
            while (pos < input.length() && isDigit(input.charAt(pos))) {
                pos++;
            }
        }
        char e = peekChar(0);
        if (e == 'e' || e == 'E') {
            char next = peekChar(1);
            int skip = (next == '+' || next == '-') ? 2 : 1;
            if (isDigit(peekChar(skip))) {
                integer = false;
                pos += skip;
                while (pos < input.length() && isDigit(input.charAt(pos))) {
                    pos++;
                }
            }
        }
        double value = Double.parseDouble(input.substring(start, pos));

        if (pos < input.length() && input.charAt(pos) == '%') {
            pos++;
            return new CssToken(CssToken.Type.PERCENTAGE, "%", value, integer);
        }
        if (startsIdent(pos)) {
            return new CssToken(CssToken.Type.DIMENSION, readName(), value, integer);
        }
        return new CssToken(CssToken.Type.NUMBER, "", value, integer);
    }

    private String readName() {
        int start = pos;
        while (pos < input.length() && isNameChar(input.charAt(pos))) {
            pos++;
        }
        return input.substring(start, pos);
    }

    private boolean startsIdent(int at) {
        if (at >= input.length()) {
            return false;
        }
        char c = input.charAt(at);
        if (c == '-') {
            char next = at + 1 < input.length() ? input.charAt(at + 1) : 0;
            return isNameStart(next) || next == '-';
        }
        return isNameStart(c);
    }

    private char peekChar(int offset) {
        int at = pos + offset;
        return at < input.length() ? input.charAt(at) : 0;
    }

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isNameStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || c >= 0x80;
    }

    private static boolean isNameChar(char c) {
        return isNameStart(c) || isDigit(c) || c == '-';
    }
}
