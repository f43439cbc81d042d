package org.irscan.analyzer.recursion.detect.callgraph;

import com.google.common.graph.ValueGraph;
import org.irscan.analyzer.recursion.common.graph.StronglyConnectedComponents;
import org.irscan.analyzer.recursion.common.ir.FunctionId;

import java.util.List;
import java.util.Set;

/*
Keep the strongly connected components that represent recursion: more than one function, or one function
with an edge to itself. Two cycles that share a function are in the same component, so they end up in the
same group.
 */
public class ComputeRecursionGroups {

    public List<RecursionGroup> go(ValueGraph<FunctionId, Long> callGraph) {
        return go(callGraph, StronglyConnectedComponents.compute(callGraph.asGraph()));
    }

    public List<RecursionGroup> go(ValueGraph<FunctionId, Long> callGraph, List<Set<FunctionId>> components) {
        return components.stream()
                .filter(component -> isRecursion(callGraph, component))
                .map(RecursionGroup::new)
                .toList();
    }

    public static boolean isRecursion(ValueGraph<FunctionId, Long> callGraph, Set<FunctionId> component) {
        return component.size() > 1 || StronglyConnectedComponents.isSelfLoop(callGraph.asGraph(), component);
    }
}
