package org.irscan.analyzer.recursion.detect.callgraph;

import com.google.common.graph.ValueGraph;
import org.irscan.analyzer.recursion.common.ir.FunctionId;
import org.irscan.analyzer.recursion.common.ir.IrModule;
import org.irscan.analyzer.recursion.detect.CommonTest;
import org.irscan.analyzer.recursion.detect.DetectRecursion;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class TestAnalysisOrder extends CommonTest {

    @DisplayName("callee first, groups sorted by name")
    @Test
    public void test1() {
        IrModule module = module(
                function("main", block(call("log", y), bind(y, call("even", x)))),
                function("even", call("odd", x)),
                function("odd", ifThenElse(x, call("even", x), call("log", x))),
                function("log", x),
                function("loop", call("loop", x)));
        ValueGraph<FunctionId, Long> graph = new ComputeCallGraph(module).go().graph();
        AnalysisOrder order = new ComputeAnalysisOrder().go(graph);
        assertEquals("[log:F, even:T, odd:T, main:F, loop:T]", order.toString());
        assertEquals(List.of(id("log"), id("even"), id("odd"), id("main"), id("loop")), order.functionIds());
    }

    @DisplayName("every function after the functions it refers to, outside its own group")
    @Test
    public void test2() {
        IrModule module = module(
                function("a", block(call("e", y), bind(y, call("b", x)))),
                function("b", block(call("d", z), bind(y, call("a", x)), bind(z, call("c", y)))),
                function("c", call("b", x)),
                function("d", call("f", x)),
                function("e", x),
                function("f", tuple(ref("g"), ref("h"))),
                function("g", x),
                function("h", call("g", x)));
        DetectRecursion.Result result = new DetectRecursion().go(module);
        AnalysisOrder order = result.analysisOrder();
        assertEquals(module.size(), order.functionOrder().size());

        ValueGraph<FunctionId, Long> graph = result.callGraph();
        Set<FunctionId> done = new HashSet<>();
        for (AnalysisOrder.FunctionAndDetails fad : order.functionOrder()) {
            FunctionId from = fad.functionId();
            for (FunctionId to : graph.successors(from)) {
                boolean sameGroup = result.isRecursive(from) && result.groupOf(from).contains(to);
                assertTrue(sameGroup || done.contains(to), from + " before " + to);
            }
            done.add(from);
            assertEquals(result.isRecursive(from), fad.recursive());
        }
    }

    @Test
    public void testEmpty() {
        ValueGraph<FunctionId, Long> graph = new ComputeCallGraph(new IrModule.Builder().build()).go().graph();
        assertSame(AnalysisOrder.EMPTY_ORDER, new ComputeAnalysisOrder().go(graph));
    }
}
