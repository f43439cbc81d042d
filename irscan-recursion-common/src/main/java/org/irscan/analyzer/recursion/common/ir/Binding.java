package org.irscan.analyzer.recursion.common.ir;

import java.util.Objects;

/*
variable = value, inside a block. Not an expression itself.
 */
public record Binding(LocalVariable variable, Expression value) {

    public Binding {
        Objects.requireNonNull(variable);
        Objects.requireNonNull(value);
    }

    @Override
    public String toString() {
        return variable + " = " + value;
    }
}
