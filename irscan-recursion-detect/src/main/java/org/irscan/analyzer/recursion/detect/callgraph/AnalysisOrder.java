package org.irscan.analyzer.recursion.detect.callgraph;

import org.irscan.analyzer.recursion.common.ir.FunctionId;

import java.util.List;

/*
Order in which functions are to be processed by a bottom-up pass: every function comes after the functions it
refers to, unless they are part of the same recursion group.

recursive = member of a recursion group; the order inside a group is by name.
 */
public class AnalysisOrder {
    public static final AnalysisOrder EMPTY_ORDER = new AnalysisOrder(List.of());

    public record FunctionAndDetails(FunctionId functionId, boolean recursive) {
        @Override
        public String toString() {
            return functionId + ":" + (recursive ? "T" : "F");
        }
    }

    private final List<FunctionAndDetails> list;

    AnalysisOrder(List<FunctionAndDetails> list) {
        this.list = list;
    }

    public List<FunctionAndDetails> functionOrder() {
        return list;
    }

    public List<FunctionId> functionIds() {
        return list.stream().map(FunctionAndDetails::functionId).toList();
    }

    @Override
    public String toString() {
        return list.toString();
    }
}
