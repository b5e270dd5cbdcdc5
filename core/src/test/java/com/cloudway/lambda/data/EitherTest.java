/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.lambda.data;

import java.util.NoSuchElementException;

import org.junit.Test;
import static org.junit.Assert.*;

public class EitherTest {
    @Test
    public void right_values_are_mapped() {
        Either<String, Integer> e = Either.right(20);
        assertTrue(e.isRight());
        assertEquals(Either.right(21), e.map(x -> x + 1));
        assertEquals(Integer.valueOf(20), e.getOrThrow(IllegalStateException::new));
    }

    @Test
    public void left_values_pass_through() {
        Either<String, Integer> e = Either.left("bad");
        assertTrue(e.isLeft());
        assertSame(e, e.map(x -> x + 1));
        assertEquals("left:bad", e.either(a -> "left:" + a, b -> "right:" + b));
    }

    @Test(expected = IllegalStateException.class)
    public void left_value_throws_on_demand() {
        Either.<String, Integer>left("bad").getOrThrow(IllegalStateException::new);
    }

    @Test(expected = NoSuchElementException.class)
    public void missing_side_throws() {
        Either.<String, Integer>right(1).left();
    }
}
