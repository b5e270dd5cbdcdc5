/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.lambda.term;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Renders terms as canonical text. Every application is wrapped in
 * parentheses, and so is an abstraction standing as the function or the
 * argument of an application, so the output reads back as the same term.
 * It is unambiguous though not the shortest.
 */
public class Printer implements Term.Visitor<Printer> {
    private final StringBuilder buffer = new StringBuilder();

    public Printer add(Term term) {
        return term.accept(this);
    }

    public Printer add(String literal) {
        buffer.append(literal);
        return this;
    }

    @Override
    public Printer visitVar(Term.Var var) {
        buffer.append(var.name);
        return this;
    }

    @Override
    public Printer visitAbs(Term.Abs abs) {
        buffer.append(Term.LAMBDA).append(abs.param).append('.');
        return add(abs.body);
    }

    @Override
    public Printer visitApp(Term.App app) {
        // f a b c is ((f a) b) c, printed without recursing into the func side
        Deque<Term> args = new ArrayDeque<>();
        Term head = app;
        while (head instanceof Term.App) {
            Term.App a = (Term.App)head;
            args.push(a.arg);
            head = a.func;
        }

        for (int i = args.size(); i > 0; i--) {
            buffer.append('(');
        }
        addOperand(head);
        for (Term arg : args) {
            buffer.append(' ');
            addOperand(arg);
            buffer.append(')');
        }
        return this;
    }

    private void addOperand(Term term) {
        if (term instanceof Term.Abs) {
            buffer.append('(');
            add(term);
            buffer.append(')');
        } else {
            add(term);
        }
    }

    public String toString() {
        return buffer.toString();
    }
}
