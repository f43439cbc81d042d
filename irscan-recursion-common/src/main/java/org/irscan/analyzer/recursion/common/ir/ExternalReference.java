package org.irscan.analyzer.recursion.common.ir;

import java.util.Objects;
import java.util.stream.Stream;

/*
symbol provided by the runtime or another module
 */
public record ExternalReference(String symbol) implements Expression {

    public ExternalReference {
        Objects.requireNonNull(symbol);
    }

    @Override
    public Stream<Expression> subExpressions() {
        return Stream.empty();
    }

    @Override
    public String toString() {
        return "extern:" + symbol;
    }
}
