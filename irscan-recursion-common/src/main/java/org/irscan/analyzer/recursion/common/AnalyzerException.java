package org.irscan.analyzer.recursion.common;

import org.irscan.analyzer.recursion.common.ir.FunctionId;

public class AnalyzerException extends RuntimeException {
    private final FunctionId functionId;

    public AnalyzerException(FunctionId functionId, Throwable throwable) {
        super("Analysis of function " + functionId + " failed", throwable);
        this.functionId = functionId;
    }

    public FunctionId getFunctionId() {
        return functionId;
    }
}
