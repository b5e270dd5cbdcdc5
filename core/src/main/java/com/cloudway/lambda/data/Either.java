/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.lambda.data;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;

/**
 * The {@code Either} class represents values with two possibilities: a value of
 * type {@code Either a b} is either {@code Left a} or {@code Right b}.
 *
 * <p>By convention the 'Left' constructor holds an error value and the 'Right'
 * constructor holds a correct value (mnemonic: "right" also means "correct").
 * Evaluation results are carried outward in this form instead of unwinding
 * the stack.</p>
 *
 * @param <A> the type of the left value
 * @param <B> the type of the right value
 */
public abstract class Either<A, B> {
    private Either() {}

    private static final class Left<A, B> extends Either<A, B> {
        private final A a;

        Left(A a) {
            this.a = a;
        }

        @Override
        public boolean isLeft() {
            return true;
        }

        @Override
        public A left() {
            return a;
        }

        public boolean equals(Object obj) {
            return obj instanceof Left && Objects.equals(a, ((Left<?,?>)obj).a);
        }

        public int hashCode() {
            return Objects.hashCode(a) * 31 + 1;
        }

        public String toString() {
            return "Left(" + a + ")";
        }
    }

    private static final class Right<A, B> extends Either<A, B> {
        private final B b;

        Right(B b) {
            this.b = b;
        }

        @Override
        public boolean isRight() {
            return true;
        }

        @Override
        public B right() {
            return b;
        }

        public boolean equals(Object obj) {
            return obj instanceof Right && Objects.equals(b, ((Right<?,?>)obj).b);
        }

        public int hashCode() {
            return Objects.hashCode(b) * 31 + 2;
        }

        public String toString() {
            return "Right(" + b + ")";
        }
    }

    /**
     * Construct a 'Left' value.
     */
    public static <A, B> Either<A, B> left(A left) {
        return new Left<>(left);
    }

    /**
     * Construct a 'Right' value.
     */
    public static <A, B> Either<A, B> right(B right) {
        return new Right<>(right);
    }

    /**
     * Returns true if the given value is a 'Left'-value, false otherwise.
     */
    public boolean isLeft() {
        return false;
    }

    /**
     * Returns true if the given value is a 'Right'-value, false otherwise.
     */
    public boolean isRight() {
        return false;
    }

    /**
     * Returns the 'Left' value.
     */
    public A left() {
        throw new NoSuchElementException();
    }

    /**
     * Returns the 'Right' value.
     */
    public B right() {
        throw new NoSuchElementException();
    }

    /**
     * If the given value is 'Right', apply the provided mapping function to it,
     * otherwise return the 'Left' value.
     */
    @SuppressWarnings("unchecked")
    public <C> Either<A, C> map(Function<? super B, ? extends C> f) {
        return isLeft() ? (Either<A,C>)this
                        : right(f.apply(right()));
    }

    /**
     * Case analysis for the Either type. If the value is Left a, apply the first
     * function to a; if it is Right b, apply the second function b.
     */
    public <C> C either(Function<? super A, ? extends C> af, Function<? super B, ? extends C> bf) {
        return isLeft() ? af.apply(left()) : bf.apply(right());
    }

    /**
     * Returns the 'Right' value, if present, otherwise throw an exception
     * to be created by the provided supplier.
     */
    public <X extends Throwable> B getOrThrow(Function<? super A, ? extends X> exceptionSupplier) throws X {
        if (isRight()) {
            return right();
        } else {
            throw exceptionSupplier.apply(left());
        }
    }
}
