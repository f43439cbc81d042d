package org.irscan.analyzer.recursion.common.ir;

import java.util.Objects;

/*
Module-scoped handle of a function. Two ids are the same function iff their names are equal.
 */
public record FunctionId(String name) implements Comparable<FunctionId> {

    public FunctionId {
        Objects.requireNonNull(name);
    }

    public static FunctionId of(String name) {
        return new FunctionId(name);
    }

    @Override
    public int compareTo(FunctionId other) {
        return name.compareTo(other.name);
    }

    @Override
    public String toString() {
        return name;
    }
}
