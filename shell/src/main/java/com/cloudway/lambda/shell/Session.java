/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.lambda.shell;

import java.util.Optional;

import com.google.common.collect.ImmutableList;

/**
 * The bindings made during an interactive session, in the order they were
 * made. A session is immutable: adding a binding returns a new session.
 */
public final class Session
{
    private static final Session EMPTY = new Session(ImmutableList.of());

    private final ImmutableList<Binding> bindings;

    private Session(ImmutableList<Binding> bindings) {
        this.bindings = bindings;
    }

    public static Session empty() {
        return EMPTY;
    }

    public Session bind(String name, String source) {
        return new Session(ImmutableList.<Binding>builder()
            .addAll(bindings)
            .add(new Binding(name, source))
            .build());
    }

    public ImmutableList<Binding> getBindings() {
        return bindings;
    }

    /**
     * Returns the most recent binding with the given name.
     */
    public Optional<Binding> lookup(String name) {
        return bindings.reverse().stream()
            .filter(b -> b.getName().equals(name))
            .findFirst();
    }

    public int size() {
        return bindings.size();
    }

    public String toString() {
        return bindings.toString();
    }
}
