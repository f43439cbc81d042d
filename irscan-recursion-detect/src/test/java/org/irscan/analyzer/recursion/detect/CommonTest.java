package org.irscan.analyzer.recursion.detect;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.irscan.analyzer.recursion.common.ir.*;
import org.irscan.analyzer.recursion.detect.callgraph.ComputeCallGraph;
import org.junit.jupiter.api.BeforeAll;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/*
Small DSL to write modules in tests.

    function("a", call("b", x))       a(x) = b(x)
    function("a", ref("a"))           a(x) = a, returns itself
 */
public class CommonTest {
    protected static final LocalVariable x = new LocalVariable("x");
    protected static final LocalVariable y = new LocalVariable("y");
    protected static final LocalVariable z = new LocalVariable("z");

    @BeforeAll
    public static void beforeAll() {
        ((Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME)).setLevel(Level.INFO);
        ((Logger) LoggerFactory.getLogger(ComputeCallGraph.class)).setLevel(Level.DEBUG);
        ((Logger) LoggerFactory.getLogger(DetectRecursion.class)).setLevel(Level.DEBUG);
    }

    protected static FunctionId id(String name) {
        return FunctionId.of(name);
    }

    protected static Function function(String name, Expression body) {
        return new Function(id(name), List.of(x), body);
    }

    protected static IrModule module(Function... functions) {
        return IrModule.of(functions);
    }

    protected static Call call(String function, Expression... arguments) {
        return new Call(ref(function), List.of(arguments));
    }

    protected static Call call(Expression callee, Expression... arguments) {
        return new Call(callee, List.of(arguments));
    }

    protected static FunctionReference ref(String function) {
        return new FunctionReference(id(function));
    }

    protected static Tuple tuple(Expression... fields) {
        return new Tuple(List.of(fields));
    }

    protected static Binding bind(LocalVariable variable, Expression value) {
        return new Binding(variable, value);
    }

    protected static Block block(Expression result, Binding... bindings) {
        return new Block(List.of(bindings), result);
    }

    protected static If ifThenElse(Expression condition, Expression thenBranch, Expression elseBranch) {
        return new If(condition, thenBranch, elseBranch);
    }

    protected static Set<Set<FunctionId>> groups(String... groups) {
        return Arrays.stream(groups)
                .map(g -> Arrays.stream(g.split(",")).map(String::trim).map(FunctionId::of)
                        .collect(Collectors.toUnmodifiableSet()))
                .collect(Collectors.toUnmodifiableSet());
    }
}
