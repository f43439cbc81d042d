package org.irscan.analyzer.recursion.common.ir;

import java.util.Objects;
import java.util.stream.Stream;

public record TupleGetItem(Expression tuple, int index) implements Expression {

    public TupleGetItem {
        Objects.requireNonNull(tuple);
        if (index < 0) {
            throw new IllegalArgumentException("Negative tuple index " + index);
        }
    }

    @Override
    public Stream<Expression> subExpressions() {
        return Stream.of(tuple);
    }

    @Override
    public String toString() {
        return tuple + "[" + index + "]";
    }
}
