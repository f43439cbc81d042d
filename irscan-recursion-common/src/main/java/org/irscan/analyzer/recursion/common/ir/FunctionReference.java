package org.irscan.analyzer.recursion.common.ir;

import java.util.Objects;
import java.util.stream.Stream;

/*
Refers to a module-level function by its id; as the callee of a call, or as a value.
Whether the id is defined in the module is not checked here.
 */
public record FunctionReference(FunctionId functionId) implements Expression {

    public FunctionReference {
        Objects.requireNonNull(functionId);
    }

    @Override
    public Stream<Expression> subExpressions() {
        return Stream.empty();
    }

    @Override
    public String toString() {
        return "@" + functionId;
    }
}
