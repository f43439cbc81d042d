package org.irscan.analyzer.recursion.common.ir;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public record Call(Expression callee, List<Expression> arguments) implements Expression {

    public Call {
        Objects.requireNonNull(callee);
        arguments = List.copyOf(arguments);
    }

    @Override
    public Stream<Expression> subExpressions() {
        return Stream.concat(Stream.of(callee), arguments.stream());
    }

    @Override
    public String toString() {
        return callee + arguments.stream().map(Object::toString).collect(Collectors.joining(", ", "(", ")"));
    }
}
