/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.lambda.parser;

import java.util.Iterator;
import java.util.NoSuchElementException;

import com.google.common.collect.ImmutableList;

import com.cloudway.lambda.LambdaError;
import com.cloudway.lambda.term.Term;

/**
 * A lexer that translates source text into a token stream. Tokens are
 * scanned lazily as the iterator advances; the stream always ends with
 * a single {@link Token.Type#END} token.
 *
 * <p>Every variable is exactly one character (one code point) wide.
 * Digits are never variables.</p>
 */
public class Lexer implements Iterator<Token> {
    private final String input;
    private int position;
    private boolean done;

    public Lexer(String input) {
        this.input = input;
    }

    /**
     * Scans the whole input eagerly.
     *
     * @throws LambdaError.Lexical if the input holds an unsupported character
     */
    public static ImmutableList<Token> tokenize(String input) {
        ImmutableList.Builder<Token> tokens = ImmutableList.builder();
        new Lexer(input).forEachRemaining(tokens::add);
        return tokens.build();
    }

    @Override
    public boolean hasNext() {
        return !done;
    }

    @Override
    public Token next() {
        if (done)
            throw new NoSuchElementException();

        skipWhitespace();

        int column = input.codePointCount(0, position) + 1;
        if (position >= input.length()) {
            done = true;
            return Token.of(Token.Type.END, column);
        }

        int c = input.codePointAt(position);
        position += Character.charCount(c);

        switch (c) {
        case Term.LAMBDA:
            return Token.of(Token.Type.LAMBDA, column);
        case '.':
            return Token.of(Token.Type.DOT, column);
        case '(':
            return Token.of(Token.Type.LPAREN, column);
        case ')':
            return Token.of(Token.Type.RPAREN, column);
        default:
            if (!isWhitespace(c) && !isDigit(c))
                return Token.variable(new String(Character.toChars(c)), column);
            throw new LambdaError.Lexical(new String(Character.toChars(c)), column);
        }
    }

    private void skipWhitespace() {
        while (position < input.length() && isWhitespace(input.codePointAt(position))) {
            position += Character.charCount(input.codePointAt(position));
        }
    }

    private static boolean isWhitespace(int c) {
        return Character.isWhitespace(c);
    }

    private static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }
}
