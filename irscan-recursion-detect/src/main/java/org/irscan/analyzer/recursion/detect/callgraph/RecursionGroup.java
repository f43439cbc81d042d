package org.irscan.analyzer.recursion.detect.callgraph;

import org.irscan.analyzer.recursion.common.ir.FunctionId;

import java.util.Set;
import java.util.stream.Collectors;

/*
Maximal set of functions that reach each other through the call graph: a strongly connected component with
at least two members, or a single function that refers to itself.

The set has no meaningful order; toString() sorts by name.
 */
public record RecursionGroup(Set<FunctionId> functions) {

    public RecursionGroup {
        if (functions.isEmpty()) {
            throw new IllegalArgumentException("A recursion group has at least one function");
        }
        functions = Set.copyOf(functions);
    }

    public boolean contains(FunctionId functionId) {
        return functions.contains(functionId);
    }

    public int size() {
        return functions.size();
    }

    public boolean isSelfRecursion() {
        return functions.size() == 1;
    }

    @Override
    public String toString() {
        return functions.stream().sorted().map(FunctionId::name).collect(Collectors.joining(", ", "[", "]"));
    }
}
