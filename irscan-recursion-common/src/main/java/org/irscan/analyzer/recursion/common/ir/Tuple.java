package org.irscan.analyzer.recursion.common.ir;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public record Tuple(List<Expression> fields) implements Expression {

    public Tuple {
        fields = List.copyOf(fields);
    }

    @Override
    public Stream<Expression> subExpressions() {
        return fields.stream();
    }

    @Override
    public String toString() {
        return fields.stream().map(Object::toString).collect(Collectors.joining(", ", "(", ")"));
    }
}
