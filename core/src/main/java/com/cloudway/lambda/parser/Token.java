/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.lambda.parser;

import static java.util.Objects.requireNonNull;

/**
 * A lexical token. Only variable tokens carry text; all others are
 * identified by their type alone.
 */
public final class Token {
    public enum Type {
        VARIABLE("variable"),
        LAMBDA("λ"),
        DOT("."),
        LPAREN("("),
        RPAREN(")"),
        END("end of input");

        private final String name;

        Type(String name) {
            this.name = name;
        }

        public String show() {
            return name;
        }
    }

    public final Type type;
    public final String text;
    public final int column;

    private Token(Type type, String text, int column) {
        this.type = requireNonNull(type);
        this.text = text;
        this.column = column;
    }

    public static Token variable(String name, int column) {
        return new Token(Type.VARIABLE, requireNonNull(name), column);
    }

    public static Token of(Type type, int column) {
        if (type == Type.VARIABLE)
            throw new IllegalArgumentException("variable token requires a name");
        return new Token(type, null, column);
    }

    public boolean is(Type t) {
        return type == t;
    }

    /**
     * Returns the token as it should appear in diagnostics.
     */
    public String show() {
        return type == Type.VARIABLE ? "'" + text + "'"
             : type == Type.END      ? type.show()
                                     : "'" + type.show() + "'";
    }

    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof Token))
            return false;
        Token other = (Token)obj;
        return type == other.type && column == other.column
            && (text == null ? other.text == null : text.equals(other.text));
    }

    public int hashCode() {
        return (type.hashCode() * 31 + column) * 31 + (text == null ? 0 : text.hashCode());
    }

    public String toString() {
        return type + (text != null ? "(" + text + ")" : "") + "@" + column;
    }
}
