package org.irscan.analyzer.recursion.common.ir;

import java.util.Objects;
import java.util.stream.Stream;

/*
parameter, or variable bound in a block
 */
public record LocalVariable(String name) implements Expression {

    public LocalVariable {
        Objects.requireNonNull(name);
    }

    @Override
    public Stream<Expression> subExpressions() {
        return Stream.empty();
    }

    @Override
    public String toString() {
        return name;
    }
}
