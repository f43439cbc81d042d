package org.irscan.analyzer.recursion.common.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable collection of uniquely named functions. Iteration follows declaration order.
 */
public class IrModule {
    private final Map<FunctionId, Function> functions;

    private IrModule(Map<FunctionId, Function> functions) {
        this.functions = Collections.unmodifiableMap(functions);
    }

    public static IrModule of(Function... functions) {
        Builder builder = new Builder();
        for (Function function : functions) {
            builder.addFunction(function);
        }
        return builder.build();
    }

    public Set<FunctionId> functionIds() {
        return functions.keySet();
    }

    public List<Function> functions() {
        return List.copyOf(functions.values());
    }

    /**
     * @return null when the id is not defined in this module
     */
    public Function function(FunctionId id) {
        return functions.get(id);
    }

    public boolean contains(FunctionId id) {
        return functions.containsKey(id);
    }

    public int size() {
        return functions.size();
    }

    public boolean isEmpty() {
        return functions.isEmpty();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        functions.values().forEach(f -> sb.append(f).append("\n"));
        return sb.toString();
    }

    public static class Builder {
        private final Map<FunctionId, Function> functions = new LinkedHashMap<>();

        public Builder addFunction(Function function) {
            Function previous = functions.putIfAbsent(function.id(), function);
            if (previous != null) {
                throw new IllegalArgumentException("Function " + function.id() + " is defined twice");
            }
            return this;
        }

        public IrModule build() {
            return new IrModule(new LinkedHashMap<>(functions));
        }
    }
}
