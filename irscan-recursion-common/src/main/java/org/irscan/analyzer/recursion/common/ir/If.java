package org.irscan.analyzer.recursion.common.ir;

import java.util.Objects;
import java.util.stream.Stream;

public record If(Expression condition, Expression thenBranch, Expression elseBranch) implements Expression {

    public If {
        Objects.requireNonNull(condition);
        Objects.requireNonNull(thenBranch);
        Objects.requireNonNull(elseBranch);
    }

    @Override
    public Stream<Expression> subExpressions() {
        return Stream.of(condition, thenBranch, elseBranch);
    }

    @Override
    public String toString() {
        return "if " + condition + " then " + thenBranch + " else " + elseBranch;
    }
}
