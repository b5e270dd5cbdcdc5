/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.lambda.reduce;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.junit.Test;
import static org.junit.Assert.*;

import com.cloudway.lambda.term.Term;
import static com.cloudway.lambda.reduce.Substitution.*;
import static com.cloudway.lambda.term.Term.*;

public class SubstitutionTest {
    @Test
    public void replace_matching_variable() {
        assertEquals(var("z"), substitute(var("x"), "x", var("z")));
        assertEquals(var("y"), substitute(var("y"), "x", var("z")));
    }

    @Test
    public void replace_inside_application() {
        Term t = app(var("x"), app(var("y"), var("x")));
        Term v = abs("a", var("a"));
        assertEquals(app(v, app(var("y"), v)), substitute(t, "x", v));
    }

    @Test
    public void bound_name_is_shadowed() {
        Term t = abs("x", var("x"));
        assertSame(t, substitute(t, "x", var("y")));
        assertSame(t, substitute(t, "x", app(var("x"), var("z"))));
    }

    @Test
    public void replace_under_binder_without_hazard() {
        assertEquals(abs("y", app(var("y"), var("z"))),
                     substitute(abs("y", app(var("y"), var("x"))), "x", var("z")));
    }

    @Test
    public void binder_is_renamed_to_avoid_capture() {
        Term result = substitute(abs("x", var("y")), "y", var("x"));
        assertEquals(abs("x0", var("x")), result);
        assertEquals("λx0.x", result.show());
        assertNotEquals(abs("x", var("x")), result);
    }

    @Test
    public void renamed_binder_keeps_its_own_occurrences() {
        // λx.(x y)[y := x] must keep the bound x distinct from the incoming x
        Term result = substitute(abs("x", app(var("x"), var("y"))), "y", var("x"));
        assertEquals(abs("x0", app(var("x0"), var("x"))), result);
    }

    @Test
    public void fresh_name_avoids_free_names_of_the_body() {
        // the obvious candidate y0 is free in the body and must not be captured
        Term t = abs("y", app(var("y0"), var("x")));
        Term result = substitute(t, "x", var("y"));
        assertEquals(abs("y1", app(var("y0"), var("y"))), result);
        assertEquals(ImmutableSet.of("y0", "y"), freeVariables(result));
    }

    @Test
    public void fresh_name_differs_from_replaced_name() {
        // renaming b to b0 would turn the bound b into the target b0
        Term value = abs("a", abs("b", var("a")));
        assertEquals(abs("b1", var("b1")), substitute(abs("b", var("b")), "b0", value));
    }

    @Test
    public void fresh_name_suffixes() {
        assertEquals("z", freshName("z", var("x")));
        assertEquals("x0", freshName("x", var("x")));
        assertEquals("x1", freshName("x", app(var("x"), var("x0"))));
        assertEquals("x2", freshName("x", var("x"), abs("x0", var("x1"))));
    }

    @Test
    public void occurrence_includes_binders() {
        assertTrue(occursIn("x", var("x")));
        assertFalse(occursIn("x", var("y")));
        assertTrue(occursIn("x", abs("x", var("y"))));
        assertTrue(occursIn("y", abs("x", var("y"))));
        assertTrue(occursIn("y", app(var("x"), var("y"))));
        assertFalse(occursIn("z", app(var("x"), abs("y", var("y")))));
    }

    @Test
    public void alpha_conversion_renames_variables_and_binders() {
        Term t = abs("x", app(var("x"), abs("x", var("y"))));
        assertEquals(abs("z", app(var("z"), abs("z", var("y")))), alphaConvert(t, "x", "z"));
        assertEquals(t, alphaConvert(t, "w", "z"));
    }

    @Test
    public void free_variables() {
        Term t = app(abs("x", app(var("x"), var("y"))), var("z"));
        assertEquals(ImmutableList.of("y", "z"), freeVariables(t).asList());
        assertEquals(ImmutableSet.of("x"), freeVariables(app(var("x"), abs("x", var("x")))));
        assertTrue(freeVariables(abs("x", abs("y", var("x")))).isEmpty());
    }

    @Test
    public void substitution_does_not_modify_input() {
        Term t = abs("x", app(var("x"), var("y")));
        String before = t.show();
        substitute(t, "y", var("x"));
        assertEquals(before, t.show());
    }
}
