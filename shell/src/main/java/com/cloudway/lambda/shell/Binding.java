/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.lambda.shell;

import java.util.Objects;

import com.google.common.base.MoreObjects;

import static java.util.Objects.requireNonNull;

/**
 * A named definition entered with {@code let}. The source text is kept as
 * typed; it only labels the output of the definition.
 */
public final class Binding
{
    private final String name;
    private final String source;

    public Binding(String name, String source) {
        this.name = requireNonNull(name);
        this.source = requireNonNull(source);
    }

    public String getName() {
        return name;
    }

    public String getSource() {
        return source;
    }

    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof Binding))
            return false;
        Binding other = (Binding)obj;
        return name.equals(other.name) && source.equals(other.source);
    }

    public int hashCode() {
        return Objects.hash(name, source);
    }

    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("name", name)
            .add("source", source)
            .toString();
    }
}
