/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.lambda.reduce;

import com.cloudway.lambda.LambdaError;
import com.cloudway.lambda.term.Term;
import com.cloudway.lambda.term.Term.Abs;
import com.cloudway.lambda.term.Term.App;
import com.cloudway.lambda.term.Term.Var;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Beta-reduces terms in normal order: the head redex is always contracted
 * before its sibling subterms are visited, and arguments are substituted
 * unevaluated.
 *
 * <p>The reducer holds no state besides its trace, so a single instance
 * may be shared by independent evaluations.</p>
 */
public class Reducer {
    private final Trace trace;

    public Reducer(Trace trace) {
        this.trace = requireNonNull(trace);
    }

    /**
     * Performs one reduction step. A redex is contracted; otherwise the step
     * descends into both sides of an application or into the body of an
     * abstraction. A term that is already reduced is returned as is.
     */
    public Term step(Term term) {
        return term.accept(new Term.Visitor<Term>() {
            @Override
            public Term visitVar(Var var) {
                return var;
            }

            @Override
            public Term visitAbs(Abs abs) {
                Term body = abs.body.accept(this);
                return body == abs.body ? abs : Term.abs(abs.param, body);
            }

            @Override
            public Term visitApp(App app) {
                if (app.isRedex()) {
                    Abs f = (Abs)app.func;
                    trace.reduced(f.param, app.arg);
                    return Substitution.substitute(f.body, f.param, app.arg);
                }

                Term func = app.func.accept(this);
                Term arg = app.arg.accept(this);
                return func == app.func && arg == app.arg ? app : Term.app(func, arg);
            }
        });
    }

    /**
     * Returns true if the term contains no redex.
     */
    public static boolean isReduced(Term term) {
        return term.accept(new Term.Visitor<Boolean>() {
            @Override
            public Boolean visitVar(Var var) {
                return true;
            }

            @Override
            public Boolean visitAbs(Abs abs) {
                return abs.body.accept(this);
            }

            @Override
            public Boolean visitApp(App app) {
                // walk the function spine in a loop, it can be very long
                Term t = app;
                while (t instanceof App) {
                    App a = (App)t;
                    if (a.isRedex() || !a.arg.accept(this))
                        return false;
                    t = a.func;
                }
                return t.accept(this);
            }
        });
    }

    /**
     * Reduces the term to its normal form. A term without a normal form
     * keeps this method running forever.
     */
    public Term reduce(Term term) {
        while (!isReduced(term)) {
            term = step(term);
        }
        trace.done();
        return term;
    }

    /**
     * Reduces the term to its normal form, giving up after the given number
     * of steps.
     *
     * @throws IllegalArgumentException if {@code maxSteps} is negative
     * @throws LambdaError.StepLimit if no normal form is reached in time
     */
    public Term reduce(Term term, int maxSteps) {
        checkArgument(maxSteps >= 0, "negative step limit: %s", maxSteps);

        int steps = 0;
        while (!isReduced(term)) {
            if (steps++ == maxSteps)
                throw new LambdaError.StepLimit(maxSteps);
            term = step(term);
        }
        trace.done();
        return term;
    }
}
