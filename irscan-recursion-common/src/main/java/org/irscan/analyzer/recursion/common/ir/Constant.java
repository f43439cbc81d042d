package org.irscan.analyzer.recursion.common.ir;

import java.util.stream.Stream;

public record Constant(Object value) implements Expression {

    @Override
    public Stream<Expression> subExpressions() {
        return Stream.empty();
    }

    @Override
    public String toString() {
        return "const(" + value + ")";
    }
}
