/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.trellis.css;

/**
 * A token produced by {@link CssTokenizer}.
 *
 * @param type the token type
 * @param text identifier or function name, unit of a dimension, string
 *        contents, or the character of a delimiter
 * @param number numeric value of number, percentage and dimension tokens
 * @param integer whether the numeric value was written without fraction or exponent
 */
public record CssToken(Type type, String text, double number, boolean integer) {

    public enum Type {
        IDENT,
        FUNCTION,
        NUMBER,
        PERCENTAGE,
        DIMENSION,
        STRING,
        WHITESPACE,
        DELIM
    }

    public static CssToken ident(String name) {
        return new CssToken(Type.IDENT, name, 0, false);
    }

    public static CssToken function(String name) {
        return new CssToken(Type.FUNCTION, name, 0, false);
    }

    public static CssToken delim(char c) {
        return new CssToken(Type.DELIM, String.valueOf(c), 0, false);
    }

    public boolean isIdent(String name) {
        return type == Type.IDENT && text.equalsIgnoreCase(name);
    }

    public boolean isFunction(String name) {
        return type == Type.FUNCTION && text.equalsIgnoreCase(name);
    }

    public boolean isDelim(char c) {
        return type == Type.DELIM && text.charAt(0) == c;
    }

    public boolean isWhitespace() {
        return type == Type.WHITESPACE;
    }

    @Override
    public String toString() {
        return switch (type) {
            case IDENT, STRING, DELIM -> type + "(" + text + ")";
            case FUNCTION -> "FUNCTION(" + text + "()";
            case NUMBER -> "NUMBER(" + number + ")";
            case PERCENTAGE -> "PERCENTAGE(" + number + "%)";
            case DIMENSION -> "DIMENSION(" + number + text + ")";
            case WHITESPACE -> "WHITESPACE";
        };
    }
}
