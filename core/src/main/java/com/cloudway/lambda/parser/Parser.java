/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.lambda.parser;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import com.cloudway.lambda.LambdaError;
import com.cloudway.lambda.data.Either;
import com.cloudway.lambda.term.Term;

import static com.cloudway.lambda.parser.Token.Type.*;

// @formatter:off

/**
 * Recursive-descent parser for lambda terms.
 *
 * <pre>
 *   expr        := LAMBDA VAR* DOT expr | application
 *   application := term term*
 *   term        := VAR | LPAREN expr RPAREN
 * </pre>
 *
 * <p>The parser keeps exactly one token of lookahead and never backtracks.
 * An abstraction extends as far to the right as possible and application
 * associates to the left.</p>
 */
public class Parser {
    private final Iterator<Token> scanner;
    private Token token;

    public Parser(Iterator<Token> scanner) {
        this.scanner = scanner;
    }

    /**
     * Parses a complete term from source text.
     *
     * @return the term, or the lexical or syntax error that stopped parsing
     */
    public static Either<LambdaError, Term> parse(String input) {
        try {
            return Either.right(new Parser(new Lexer(input)).p_top_level());
        } catch (LambdaError ex) {
            return Either.left(ex);
        }
    }

    private void advance() {
        if (scanner.hasNext()) {
            token = scanner.next();
        } else if (token == null || !token.is(END)) {
            token = Token.of(END, token == null ? 1 : token.column);
        }
    }

    private <A> A error(String message) {
        throw new LambdaError.Syntax(message, token.column);
    }

    private <A> A expect(String name) {
        return error("unexpected " + token.show() + ", expecting " + name);
    }

    Term p_top_level() {
        advance();
        Term t = p_expression();
        if (!token.is(END))
            return expect(END.show());
        return t;
    }

    private Term p_expression() {
        if (token.is(LAMBDA)) {
            return p_abstraction();
        } else {
            return p_application();
        }
    }

    private Term p_abstraction() {
        advance(); // skip LAMBDA

        List<String> params = new ArrayList<>();
        while (token.is(VARIABLE)) {
            params.add(token.text);
            advance();
        }

        if (!token.is(DOT))
            return expect("'.' after lambda parameters");
        advance();

        // λx y z.B is λx.λy.λz.B
        Term body = p_expression();
        for (int i = params.size(); --i >= 0; ) {
            body = Term.abs(params.get(i), body);
        }
        return body;
    }

    private Term p_application() {
        Term t = p_term();
        while (token.is(VARIABLE) || token.is(LPAREN)) {
            t = Term.app(t, p_term());
        }
        return t;
    }

    private Term p_term() {
        switch (token.type) {
        case VARIABLE:
            Term v = Term.var(token.text);
            advance();
            return v;

        case LPAREN:
            advance();
            Term t = p_expression();
            if (!token.is(RPAREN))
                return expect("closing parenthesis");
            advance();
            return t;

        default:
            return expect("term");
        }
    }
}
