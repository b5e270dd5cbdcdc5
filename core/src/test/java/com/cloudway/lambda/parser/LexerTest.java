/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.lambda.parser;

import java.util.List;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import com.cloudway.lambda.LambdaError;
import static com.cloudway.lambda.parser.Token.Type.*;

public class LexerTest {
    private static List<Token.Type> types(String input) {
        ImmutableList.Builder<Token.Type> types = ImmutableList.builder();
        Lexer.tokenize(input).forEach(t -> types.add(t.type));
        return types.build();
    }

    @Test
    public void scan_all_token_kinds() {
        assertEquals(ImmutableList.of(LPAREN, LAMBDA, VARIABLE, DOT, VARIABLE, RPAREN, VARIABLE, END),
                     types("(λx.x) y"));
    }

    @Test
    public void variables_are_single_characters() {
        List<Token> tokens = Lexer.tokenize("abc");
        assertEquals(4, tokens.size());
        assertEquals(Token.variable("a", 1), tokens.get(0));
        assertEquals(Token.variable("b", 2), tokens.get(1));
        assertEquals(Token.variable("c", 3), tokens.get(2));
        assertTrue(tokens.get(3).is(END));
    }

    @Test
    public void whitespace_is_skipped() {
        List<Token> tokens = Lexer.tokenize("  \tλ x\n. x  ");
        assertEquals(ImmutableList.of(LAMBDA, VARIABLE, DOT, VARIABLE, END), types("  \tλ x\n. x  "));
        assertEquals(4, tokens.get(0).column);
    }

    @Test
    public void empty_input_yields_end_only() {
        assertEquals(ImmutableList.of(END), types(""));
        assertEquals(ImmutableList.of(END), types("   "));
    }

    @Test
    public void punctuation_is_a_variable() {
        List<Token> tokens = Lexer.tokenize("+ * _");
        assertEquals("+", tokens.get(0).text);
        assertEquals("*", tokens.get(1).text);
        assertEquals("_", tokens.get(2).text);
        assertThat(tokens.get(0).type, is(VARIABLE));
    }

    @Test
    public void supplementary_character_is_one_variable() {
        List<Token> tokens = Lexer.tokenize("𝑥 y");
        assertEquals(3, tokens.size());
        assertEquals("𝑥", tokens.get(0).text);
        assertEquals(Token.variable("y", 3), tokens.get(1));
    }

    @Test
    public void digits_are_rejected() {
        try {
            Lexer.tokenize("x 5");
            fail("digit accepted");
        } catch (LambdaError.Lexical ex) {
            assertEquals("5", ex.character);
            assertEquals(3, ex.column);
            assertThat(ex.getMessage(), startsWith("Error: unexpected character"));
        }
    }

    @Test
    public void lazy_scanning_stops_at_end() {
        Lexer lexer = new Lexer("x");
        assertTrue(lexer.hasNext());
        assertTrue(lexer.next().is(VARIABLE));
        assertTrue(lexer.next().is(END));
        assertFalse(lexer.hasNext());
    }

    @Test
    public void lazy_scanning_fails_only_when_reaching_bad_character() {
        Lexer lexer = new Lexer("x 7");
        assertEquals(Token.variable("x", 1), lexer.next());
        try {
            lexer.next();
            fail("digit accepted");
        } catch (LambdaError.Lexical ex) {
            assertEquals(3, ex.column);
        }
    }
}
