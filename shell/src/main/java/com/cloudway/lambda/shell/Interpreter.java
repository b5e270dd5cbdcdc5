/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.lambda.shell;

import com.google.common.base.CharMatcher;

import com.cloudway.lambda.Evaluator;
import com.cloudway.lambda.Result;
import com.cloudway.lambda.term.Term;

import static java.util.Objects.requireNonNull;

/**
 * Interprets one line of shell input: either a term to evaluate, or a
 * {@code let name = term} definition whose result is labelled with its name.
 */
public class Interpreter
{
    static final String INVALID_SYNTAX = "Invalid Syntax";

    private static final String LET = "let ";
    private static final CharMatcher BLANK = CharMatcher.whitespace();

    enum InputType {
        EXPRESSION, BINDING, INVALID_BINDING
    }

    private final Evaluator evaluator;
    private Session session;

    public Interpreter(Evaluator evaluator) {
        this(evaluator, Session.empty());
    }

    public Interpreter(Evaluator evaluator, Session session) {
        this.evaluator = requireNonNull(evaluator);
        this.session = requireNonNull(session);
    }

    public Session getSession() {
        return session;
    }

    /**
     * Replaces every backslash with the lambda glyph, so that terms can be
     * typed without it.
     */
    public static String translate(String line) {
        return line.replace('\\', Term.LAMBDA);
    }

    static InputType classify(String input) {
        String text = BLANK.trimLeadingFrom(input);
        if (!text.startsWith(LET))
            return InputType.EXPRESSION;
        int eq = text.indexOf('=', LET.length());
        if (eq == -1 || bindingName(text, eq).isEmpty())
            return InputType.INVALID_BINDING;
        return InputType.BINDING;
    }

    private static String bindingName(String text, int eq) {
        return BLANK.trimFrom(text.substring(LET.length(), eq)).replace(' ', '-');
    }

    /**
     * Interprets a line that has already been translated.
     *
     * @return the text to display and whether the line succeeded
     */
    public Result interpret(String input) {
        switch (classify(input)) {
        case BINDING:
            return define(BLANK.trimLeadingFrom(input));

        case INVALID_BINDING:
            return Result.failure(INVALID_SYNTAX);

        default:
            return evaluator.evaluate(input);
        }
    }

    private Result define(String text) {
        int eq = text.indexOf('=', LET.length());
        String name = bindingName(text, eq);
        String source = text.substring(eq + 1);

        Result result = evaluator.evaluate(source);
        if (!result.isOk())
            return result;

        session = session.bind(name, source);
        return Result.ok("<" + name + "> " + result.getValue());
    }
}
