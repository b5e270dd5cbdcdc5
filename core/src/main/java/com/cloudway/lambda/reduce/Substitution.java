/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.lambda.reduce;

import java.util.LinkedHashSet;
import java.util.Set;

import com.google.common.collect.ImmutableSet;

import com.cloudway.lambda.term.Term;
import com.cloudway.lambda.term.Term.Abs;
import com.cloudway.lambda.term.Term.App;
import com.cloudway.lambda.term.Term.Var;

/**
 * Capture-avoiding substitution and the renaming operations it relies on.
 * None of these operations modify their input. They return new nodes, which
 * may share subtrees with the input.
 */
public final class Substitution {
    private Substitution() {}

    /**
     * Replaces every free occurrence of {@code name} in {@code term} by
     * {@code value}. A binder inside {@code term} that would capture a
     * variable of {@code value} is renamed first.
     */
    public static Term substitute(Term term, String name, Term value) {
        return term.accept(new Term.Visitor<Term>() {
            @Override
            public Term visitVar(Var var) {
                return var.name.equals(name) ? value : var;
            }

            @Override
            public Term visitAbs(Abs abs) {
                if (abs.param.equals(name)) {
                    // shadowed
                    return abs;
                }

                if (occursIn(abs.param, value)) {
                    // the new binder must capture nothing from the value or
                    // the body, and must not hide the name being replaced
                    String fresh = freshName(abs.param, value, abs.body, Term.var(name));
                    Term body = alphaConvert(abs.body, abs.param, fresh);
                    return Term.abs(fresh, body.accept(this));
                }

                return Term.abs(abs.param, abs.body.accept(this));
            }

            @Override
            public Term visitApp(App app) {
                return Term.app(app.func.accept(this), app.arg.accept(this));
            }
        });
    }

    /**
     * Renames every variable and binder named {@code oldName} to
     * {@code newName} throughout the term.
     */
    public static Term alphaConvert(Term term, String oldName, String newName) {
        return term.accept(new Term.Visitor<Term>() {
            @Override
            public Term visitVar(Var var) {
                return var.name.equals(oldName) ? Term.var(newName) : var;
            }

            @Override
            public Term visitAbs(Abs abs) {
                String param = abs.param.equals(oldName) ? newName : abs.param;
                return Term.abs(param, abs.body.accept(this));
            }

            @Override
            public Term visitApp(App app) {
                return Term.app(app.func.accept(this), app.arg.accept(this));
            }
        });
    }

    /**
     * Returns true if the name appears anywhere in the term, as a variable
     * or as a binder. Bound occurrences count too, which can only cause
     * extra renaming.
     */
    public static boolean occursIn(String name, Term term) {
        return term.accept(new Term.Visitor<Boolean>() {
            @Override
            public Boolean visitVar(Var var) {
                return var.name.equals(name);
            }

            @Override
            public Boolean visitAbs(Abs abs) {
                return abs.param.equals(name) || abs.body.accept(this);
            }

            @Override
            public Boolean visitApp(App app) {
                return app.func.accept(this) || app.arg.accept(this);
            }
        });
    }

    /**
     * Returns {@code base} if it occurs in none of the given terms, otherwise
     * the first of {@code base0}, {@code base1}, ... that occurs in none of them.
     */
    public static String freshName(String base, Term... contexts) {
        String name = base;
        for (int i = 0; occursInAny(name, contexts); i++) {
            name = base + i;
        }
        return name;
    }

    private static boolean occursInAny(String name, Term[] contexts) {
        for (Term t : contexts) {
            if (occursIn(name, t))
                return true;
        }
        return false;
    }

    /**
     * Returns the names that occur free in the term, in order of first
     * appearance from left to right.
     */
    public static ImmutableSet<String> freeVariables(Term term) {
        Set<String> free = new LinkedHashSet<>();
        collectFree(term, ImmutableSet.of(), free);
        return ImmutableSet.copyOf(free);
    }

    private static void collectFree(Term term, ImmutableSet<String> bound, Set<String> free) {
        term.accept(new Term.Visitor<Void>() {
            @Override
            public Void visitVar(Var var) {
                if (!bound.contains(var.name))
                    free.add(var.name);
                return null;
            }

            @Override
            public Void visitAbs(Abs abs) {
                ImmutableSet<String> inner = ImmutableSet.<String>builder()
                    .addAll(bound).add(abs.param).build();
                collectFree(abs.body, inner, free);
                return null;
            }

            @Override
            public Void visitApp(App app) {
                app.func.accept(this);
                app.arg.accept(this);
                return null;
            }
        });
    }
}
