/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.lambda;

import java.util.logging.Level;
import java.util.logging.Logger;

import com.cloudway.lambda.data.Either;
import com.cloudway.lambda.parser.Parser;
import com.cloudway.lambda.reduce.Reducer;
import com.cloudway.lambda.reduce.Trace;
import com.cloudway.lambda.term.Term;

import static com.cloudway.lambda.data.Either.left;

/**
 * Parses and reduces lambda terms. This is the boundary where every error
 * raised by the lexer, the parser or the reducer is turned into a value.
 */
public class Evaluator {
    private static final Logger logger = Logger.getLogger(Evaluator.class.getName());

    private final Reducer reducer;

    /**
     * Creates an evaluator that prints its reduction trace to standard output.
     */
    public Evaluator() {
        this(Trace.to(System.out));
    }

    public Evaluator(Trace trace) {
        this.reducer = new Reducer(trace);
    }

    public Either<LambdaError, Term> parse(String input) {
        return Parser.parse(input);
    }

    /**
     * Parses the input and reduces it to normal form.
     */
    public Either<LambdaError, Term> run(String input) {
        logger.log(Level.FINE, "evaluating {0}", input);
        try {
            return parse(input).map(reducer::reduce);
        } catch (LambdaError ex) {
            return left(ex);
        } catch (RuntimeException ex) {
            return left(new LambdaError.Internal(ex));
        } catch (StackOverflowError ex) {
            return left(new LambdaError.TooDeep());
        }
    }

    /**
     * Evaluates the input and renders the outcome for display.
     */
    public Result evaluate(String input) {
        return run(input).either(this::failure, this::success);
    }

    private Result success(Term term) {
        try {
            return Result.ok(term.show());
        } catch (StackOverflowError ex) {
            return failure(new LambdaError.TooDeep());
        }
    }

    private Result failure(LambdaError err) {
        logger.log(Level.FINE, "evaluation failed: {0}", err.getRawMessage());
        return Result.failure(err.getMessage());
    }
}
