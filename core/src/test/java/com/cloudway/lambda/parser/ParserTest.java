/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.lambda.parser;

import org.junit.Test;
import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import com.cloudway.lambda.LambdaError;
import com.cloudway.lambda.data.Either;
import com.cloudway.lambda.term.Term;
import static com.cloudway.lambda.term.Term.*;

public class ParserTest {
    private static Term parse(String input) {
        return Parser.parse(input).getOrThrow(err -> new AssertionError(err.getMessage()));
    }

    private static LambdaError parseError(String input) {
        Either<LambdaError, Term> result = Parser.parse(input);
        assertTrue("expected failure for " + input, result.isLeft());
        return result.left();
    }

    @Test
    public void variable() {
        assertEquals(var("x"), parse("x"));
    }

    @Test
    public void abstraction() {
        assertEquals(abs("x", var("x")), parse("λx.x"));
    }

    @Test
    public void multi_parameter_abstraction_is_nested() {
        assertEquals(parse("λx.λy.x"), parse("λx y.x"));
        assertEquals(abs("x", abs("y", abs("z", var("y")))), parse("λx y z. y"));
    }

    @Test
    public void application_associates_left() {
        assertEquals(app(app(var("f"), var("a")), var("b")), parse("f a b"));
        assertEquals(app(var("f"), app(var("a"), var("b"))), parse("f (a b)"));
    }

    @Test
    public void abstraction_body_extends_to_the_right() {
        assertEquals(abs("x", app(var("x"), var("y"))), parse("λx.x y"));
        assertEquals(app(abs("x", var("x")), var("y")), parse("(λx.x) y"));
    }

    @Test
    public void nested_parentheses() {
        assertEquals(var("x"), parse("((x))"));
        assertEquals(app(abs("x", app(var("x"), var("x"))), abs("x", app(var("x"), var("x")))),
                     parse("(λx.x x)(λx.x x)"));
    }

    @Test
    public void lambda_without_parameters() {
        // a header with no parameters still needs the dot, and then yields its body
        assertEquals(var("x"), parse("λ.x"));
    }

    @Test
    public void missing_dot_after_lambda() {
        LambdaError err = parseError("λx");
        assertThat(err, instanceOf(LambdaError.Syntax.class));
        assertThat(err.getRawMessage(), containsString("expecting '.'"));
        assertThat(parseError("λx y z"), instanceOf(LambdaError.Syntax.class));
    }

    @Test
    public void unmatched_parenthesis() {
        LambdaError err = parseError("(x");
        assertThat(err, instanceOf(LambdaError.Syntax.class));
        assertThat(err.getRawMessage(), containsString("closing parenthesis"));
    }

    @Test
    public void bad_term_start() {
        assertThat(parseError(""), instanceOf(LambdaError.Syntax.class));
        assertThat(parseError(")"), instanceOf(LambdaError.Syntax.class));
        assertThat(parseError("( )"), instanceOf(LambdaError.Syntax.class));
        assertThat(parseError("."), instanceOf(LambdaError.Syntax.class));
    }

    @Test
    public void trailing_input_is_rejected() {
        LambdaError err = parseError("x)");
        assertThat(err, instanceOf(LambdaError.Syntax.class));
        assertEquals(2, ((LambdaError.Syntax)err).column);
        assertThat(err.getRawMessage(), containsString("expecting end of input"));
    }

    @Test
    public void lexical_errors_are_reported() {
        LambdaError err = parseError("5");
        assertThat(err, instanceOf(LambdaError.Lexical.class));
        assertThat(err.getMessage(), startsWith("Error: "));
    }
}
