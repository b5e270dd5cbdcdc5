/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.lambda.reduce;

import java.io.PrintStream;

import com.cloudway.lambda.term.Printer;
import com.cloudway.lambda.term.Term;

/**
 * Receives the reduction trace, one event per contracted redex followed by
 * a single completion event.
 */
public interface Trace {
    /**
     * A redex {@code (λparam.body) argument} has been contracted.
     *
     * @param param the bound parameter being replaced
     * @param argument the unreduced argument substituted for it
     */
    void reduced(String param, Term argument);

    /**
     * The term has reached its normal form.
     */
    void done();

    /**
     * Returns a trace that prints each event as a line of text.
     */
    static Trace to(PrintStream out) {
        return new Trace() {
            @Override
            public void reduced(String param, Term argument) {
                out.println(new Printer().add("↪ β-reduce: ").add(param).add(" <- ").add(argument));
            }

            @Override
            public void done() {
                out.println("done.");
            }
        };
    }
}
