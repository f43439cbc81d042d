package org.irscan.analyzer.recursion.detect.callgraph;

import com.google.common.graph.ValueGraph;
import org.irscan.analyzer.recursion.common.graph.StronglyConnectedComponents;
import org.irscan.analyzer.recursion.common.ir.FunctionId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/*
given the call graph, compute the linearization: the components come out of Tarjan's algorithm callee first,
so we only need to sort inside each component.
 */
public class ComputeAnalysisOrder {
    private static final Logger LOGGER = LoggerFactory.getLogger(ComputeAnalysisOrder.class);

    public AnalysisOrder go(ValueGraph<FunctionId, Long> callGraph) {
        return go(callGraph, StronglyConnectedComponents.compute(callGraph.asGraph()));
    }

    public AnalysisOrder go(ValueGraph<FunctionId, Long> callGraph, List<Set<FunctionId>> components) {
        if (components.isEmpty()) return AnalysisOrder.EMPTY_ORDER;
        List<AnalysisOrder.FunctionAndDetails> list = new ArrayList<>(callGraph.nodes().size());
        for (Set<FunctionId> component : components) {
            boolean recursive = ComputeRecursionGroups.isRecursion(callGraph, component);
            component.stream().sorted()
                    .forEach(id -> list.add(new AnalysisOrder.FunctionAndDetails(id, recursive)));
        }
        LOGGER.debug("Analysis order: {}", list);
        return new AnalysisOrder(List.copyOf(list));
    }
}
