/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.lambda;

/**
 * The root of all errors raised while evaluating a lambda term.  The message
 * returned by {@link #getMessage()} is ready for display and always starts
 * with {@code "Error: "}.
 */
@SuppressWarnings("serial")
public class LambdaError extends RuntimeException {
    public LambdaError(String message) {
        super(message);
    }

    protected LambdaError(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getMessage() {
        return "Error: " + getRawMessage();
    }

    /**
     * Returns the message without the display prefix.
     */
    public String getRawMessage() {
        return super.getMessage();
    }

    private static String at(int column) {
        return column > 0 ? " at column " + column : "";
    }

    /**
     * An input character that does not start any token.
     */
    public static class Lexical extends LambdaError {
        public final String character;
        public final int column;

        public Lexical(String character, int column) {
            super("unexpected character '" + character + "'" + at(column));
            this.character = character;
            this.column = column;
        }
    }

    /**
     * A token sequence that does not match the term grammar.
     */
    public static class Syntax extends LambdaError {
        public final int column;

        public Syntax(String message, int column) {
            super(message + at(column));
            this.column = column;
        }
    }

    /**
     * A broken invariant inside the evaluator.
     */
    public static class Internal extends LambdaError {
        public Internal(Throwable cause) {
            super("internal error: " + cause, cause);
        }
    }

    /**
     * A term nested more deeply than the evaluator's stack can follow.
     */
    public static class TooDeep extends LambdaError {
        public TooDeep() {
            super("term nested too deeply");
        }
    }

    /**
     * The reduction did not reach a normal form within the given step limit.
     */
    public static class StepLimit extends LambdaError {
        public final int limit;

        public StepLimit(int limit) {
            super("no normal form reached within " + limit + " steps");
            this.limit = limit;
        }
    }
}
