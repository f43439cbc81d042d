package org.irscan.analyzer.recursion.detect;

import com.google.common.graph.ValueGraph;
import org.irscan.analyzer.recursion.common.graph.StronglyConnectedComponents;
import org.irscan.analyzer.recursion.common.ir.FunctionId;
import org.irscan.analyzer.recursion.common.ir.IrModule;
import org.irscan.analyzer.recursion.detect.callgraph.AnalysisOrder;
import org.irscan.analyzer.recursion.detect.callgraph.ComputeAnalysisOrder;
import org.irscan.analyzer.recursion.detect.callgraph.ComputeCallGraph;
import org.irscan.analyzer.recursion.detect.callgraph.ComputeRecursionGroups;
import org.irscan.analyzer.recursion.detect.callgraph.RecursionGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Finds the groups of mutually recursive functions of a module.
 * <p>
 * Any reference to a function of the same module is an edge of the call graph: a call, but also returning the
 * function, storing it in a tuple, or passing it as an argument. Functions outside the module do not take part.
 * <p>
 * The instance holds no state; concurrent calls are independent.
 */
public class DetectRecursion {
    private static final Logger LOGGER = LoggerFactory.getLogger(DetectRecursion.class);

    /**
     * The groups are pairwise disjoint. Neither the order of the groups, nor the order of the functions in a group,
     * carries any meaning: compare them as sets.
     *
     * @param callGraph the call graph from which the groups were computed
     * @param groups    the recursion groups
     * @param components all strongly connected components, callee first; immutable
     */
    public record Result(ValueGraph<FunctionId, Long> callGraph,
                         List<RecursionGroup> groups,
                         List<Set<FunctionId>> components) {

        public Result {
            groups = List.copyOf(groups);
            components = components.stream().map(Collections::unmodifiableSet).toList();
        }

        public Set<FunctionId> recursiveFunctions() {
            return groups.stream().flatMap(g -> g.functions().stream()).collect(Collectors.toUnmodifiableSet());
        }

        /**
         * @return null when the function is not recursive
         */
        public RecursionGroup groupOf(FunctionId functionId) {
            return groups.stream().filter(g -> g.contains(functionId)).findFirst().orElse(null);
        }

        public boolean isRecursive(FunctionId functionId) {
            return groupOf(functionId) != null;
        }

        public Set<Set<FunctionId>> groupsAsSets() {
            return groups.stream().map(RecursionGroup::functions).collect(Collectors.toUnmodifiableSet());
        }

        public AnalysisOrder analysisOrder() {
            return new ComputeAnalysisOrder().go(callGraph, components);
        }
    }

    public Result go(IrModule module) {
        LOGGER.info("Start detecting recursion in module of {} functions", module.size());
        ValueGraph<FunctionId, Long> callGraph = new ComputeCallGraph(module).go().graph();
        List<Set<FunctionId>> components = StronglyConnectedComponents.compute(callGraph.asGraph());
        List<RecursionGroup> groups = new ComputeRecursionGroups().go(callGraph, components);
        LOGGER.info("Found {} recursion group(s) in {} strongly connected components", groups.size(),
                components.size());
        if (LOGGER.isDebugEnabled()) {
            groups.forEach(g -> LOGGER.debug("Recursion group {}", g));
        }
        return new Result(callGraph, groups, components);
    }
}
