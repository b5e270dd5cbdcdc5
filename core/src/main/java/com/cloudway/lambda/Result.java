/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.lambda;

import static java.util.Objects.requireNonNull;

/**
 * The displayable outcome of an evaluation: either the printed normal form
 * or an error message.
 */
public final class Result {
    private final String value;
    private final boolean ok;

    private Result(String value, boolean ok) {
        this.value = requireNonNull(value);
        this.ok = ok;
    }

    public static Result ok(String value) {
        return new Result(value, true);
    }

    public static Result failure(String message) {
        return new Result(message, false);
    }

    public String getValue() {
        return value;
    }

    public boolean isOk() {
        return ok;
    }

    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof Result))
            return false;
        Result other = (Result)obj;
        return ok == other.ok && value.equals(other.value);
    }

    public int hashCode() {
        return value.hashCode() * 31 + (ok ? 1 : 0);
    }

    public String toString() {
        return (ok ? "Ok(" : "Failure(") + value + ")";
    }
}
