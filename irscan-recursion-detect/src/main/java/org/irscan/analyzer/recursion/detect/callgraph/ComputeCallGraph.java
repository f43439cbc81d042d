package org.irscan.analyzer.recursion.detect.callgraph;

import com.google.common.graph.ElementOrder;
import com.google.common.graph.ImmutableValueGraph;
import com.google.common.graph.MutableValueGraph;
import com.google.common.graph.ValueGraph;
import com.google.common.graph.ValueGraphBuilder;
import org.irscan.analyzer.recursion.common.AnalyzerException;
import org.irscan.analyzer.recursion.common.ir.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Predicate;
import java.util.stream.Collectors;

/*
call & reference graph of the functions of one module.

direction of arrow: my body refers to you (I, from -> you, to)

The edge value records the kind(s) of reference, merged with bitwise or; it does not count them.
Every function of the module is a vertex, also when it has no edges.

Single use: create, call go(), read graph().
 */
public class ComputeCallGraph {
    private static final Logger LOGGER = LoggerFactory.getLogger(ComputeCallGraph.class);

    private static final long CALL_BITS = 16;
    public static final long CALL = 1L << CALL_BITS;
    public static final long REFERENCE = 1;

    private final IrModule module;
    private final MutableValueGraph<FunctionId, Long> builder = ValueGraphBuilder.directed()
            .allowsSelfLoops(true)
            .nodeOrder(ElementOrder.<FunctionId>insertion())
            .incidentEdgeOrder(ElementOrder.<FunctionId>stable())
            .build();
    private ValueGraph<FunctionId, Long> graph;

    public ComputeCallGraph(IrModule module) {
        this.module = module;
    }

    public static boolean isCall(long value) {
        return (value & CALL) != 0;
    }

    public static boolean isReference(long value) {
        return (value & REFERENCE) != 0;
    }

    /*
    sorted "from->kind->to" entries; nodes without edges are not printed
     */
    public static String print(ValueGraph<FunctionId, Long> graph) {
        return graph.edges().stream()
                .map(e -> e.source() + "->" + edgeValuePrinter(graph.edgeValueOrDefault(e.source(), e.target(), 0L))
                          + "->" + e.target())
                .sorted()
                .collect(Collectors.joining(", "));
    }

    public static String edgeValuePrinter(long value) {
        StringBuilder sb = new StringBuilder();
        if (isCall(value)) sb.append("C");
        if (isReference(value)) sb.append("R");
        return sb.toString();
    }

    public ComputeCallGraph go() {
        assert graph == null : "go() can only be called once";
        // first all vertices, so that their order follows the declaration order of the module
        module.functionIds().forEach(builder::addNode);
        for (Function function : module.functions()) {
            try {
                function.visitBody(new Visitor(function.id()));
            } catch (RuntimeException re) {
                LOGGER.error("Caught exception computing call graph of function {}", function.id());
                throw new AnalyzerException(function.id(), re);
            }
        }
        graph = ImmutableValueGraph.copyOf(builder);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Call graph of {} functions: {}", graph.nodes().size(), print(graph));
        }
        return this;
    }

    public ValueGraph<FunctionId, Long> graph() {
        return graph;
    }

    /*
    All sub-expressions are visited, both arms of a conditional included: the analysis does not evaluate conditions.
    Any node type not listed here aborts the computation; skipping it could hide an edge.
     */
    class Visitor implements Predicate<Expression> {
        private final FunctionId from;
        private FunctionReference calleeOfCall;

        Visitor(FunctionId from) {
            this.from = from;
        }

        @Override
        public boolean test(Expression e) {
            if (e == calleeOfCall) {
                // the callee is tested right after its call, and has been handled there
                calleeOfCall = null;
                return false;
            }
            if (e instanceof Call call) {
                if (call.callee() instanceof FunctionReference fr) {
                    handleReference(from, fr.functionId(), CALL);
                    calleeOfCall = fr;
                }
                return true; // other callees: a local variable, a projection out of a tuple, ...
            }
            if (e instanceof FunctionReference fr) {
                // returned, stored in a tuple, passed as an argument: counts as much as a call
                handleReference(from, fr.functionId(), REFERENCE);
                return false;
            }
            if (e instanceof If || e instanceof Block || e instanceof Tuple || e instanceof TupleGetItem) {
                return true;
            }
            if (e instanceof LocalVariable || e instanceof ExternalReference || e instanceof Constant) {
                return false;
            }
            throw new UnsupportedOperationException("Unknown expression type " + e.getClass().getName());
        }
    }

    private void handleReference(FunctionId from, FunctionId to, long kind) {
        if (module.contains(to)) {
            Long previous = builder.edgeValueOrDefault(from, to, null);
            builder.putEdgeValue(from, to, previous == null ? kind : previous | kind);
        } else {
            LOGGER.debug("Ignoring reference from {} to {}, not defined in this module", from, to);
        }
    }
}
