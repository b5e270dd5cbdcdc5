/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.lambda.term;

import static java.util.Objects.requireNonNull;

/**
 * Represents a lambda term.
 *
 * <p>A term is one of exactly three shapes: a variable reference, a
 * single-parameter abstraction, or an application. The constructor is
 * private, so the nested classes are the only subclasses and every
 * {@link Visitor} covers all of them. Terms are immutable; operations
 * that transform a term build new nodes and share unchanged subtrees.</p>
 */
public abstract class Term {
    /**
     * The glyph that introduces an abstraction.
     */
    public static final char LAMBDA = 'λ';

    private Term() {}

    /**
     * Dispatches on the shape of a term.
     *
     * @param <R> the result type
     */
    public interface Visitor<R> {
        R visitVar(Var var);
        R visitAbs(Abs abs);
        R visitApp(App app);
    }

    public abstract <R> R accept(Visitor<R> visitor);

    /**
     * Returns the canonical, fully parenthesized text of this term.
     */
    public String show() {
        Printer pr = new Printer();
        pr.add(this);
        return pr.toString();
    }

    public String toString() {
        return show();
    }

    // -----------------------------------------------------------------------
    // Constructors

    public static Var var(String name) {
        return new Var(name);
    }

    public static Abs abs(String param, Term body) {
        return new Abs(param, body);
    }

    public static App app(Term func, Term arg) {
        return new App(func, arg);
    }

    /**
     * Builds a left-nested application of a function to its arguments.
     */
    public static Term app(Term func, Term... args) {
        Term t = func;
        for (Term arg : args) {
            t = new App(t, arg);
        }
        return t;
    }

    public static final class Var extends Term {
        public final String name;

        public Var(String name) {
            this.name = requireNonNull(name);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitVar(this);
        }

        public boolean equals(Object obj) {
            if (obj == this)
                return true;
            if (!(obj instanceof Var))
                return false;
            return name.equals(((Var)obj).name);
        }

        public int hashCode() {
            return name.hashCode();
        }
    }

    public static final class Abs extends Term {
        public final String param;
        public final Term body;

        public Abs(String param, Term body) {
            this.param = requireNonNull(param);
            this.body = requireNonNull(body);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAbs(this);
        }

        public boolean equals(Object obj) {
            if (obj == this)
                return true;
            if (!(obj instanceof Abs))
                return false;
            Abs other = (Abs)obj;
            return param.equals(other.param) && body.equals(other.body);
        }

        public int hashCode() {
            return 31 * param.hashCode() + body.hashCode();
        }
    }

    public static final class App extends Term {
        public final Term func;
        public final Term arg;

        public App(Term func, Term arg) {
            this.func = requireNonNull(func);
            this.arg = requireNonNull(arg);
        }

        /**
         * Returns true if this application is a redex, that is, its
         * function position holds an abstraction.
         */
        public boolean isRedex() {
            return func instanceof Abs;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitApp(this);
        }

        public boolean equals(Object obj) {
            if (obj == this)
                return true;
            if (!(obj instanceof App))
                return false;
            App other = (App)obj;
            return func.equals(other.func) && arg.equals(other.arg);
        }

        public int hashCode() {
            return 31 * func.hashCode() + arg.hashCode() + 17;
        }
    }
}
