package org.irscan.analyzer.recursion.common.ir;

import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/*
A function defined in a module. The body is null for a function that only has a signature.
 */
public record Function(FunctionId id, List<LocalVariable> parameters, Expression body) {

    public Function {
        Objects.requireNonNull(id);
        parameters = List.copyOf(parameters);
    }

    public boolean hasBody() {
        return body != null;
    }

    public void visitBody(Predicate<Expression> predicate) {
        if (body != null) {
            body.visit(predicate);
        }
    }

    @Override
    public String toString() {
        return id + parameters.toString().replace('[', '(').replace(']', ')')
               + (body == null ? "" : " = " + body);
    }
}
