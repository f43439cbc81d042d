package org.irscan.analyzer.recursion.common.ir;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/*
Sequence of bindings, followed by the expression that is the value of the block.
 */
public record Block(List<Binding> bindings, Expression result) implements Expression {

    public Block {
        bindings = List.copyOf(bindings);
        Objects.requireNonNull(result);
    }

    @Override
    public Stream<Expression> subExpressions() {
        return Stream.concat(bindings.stream().map(Binding::value), Stream.of(result));
    }

    @Override
    public String toString() {
        return bindings.stream().map(b -> b + "; ").collect(Collectors.joining("", "{ ", "")) + result + " }";
    }
}
