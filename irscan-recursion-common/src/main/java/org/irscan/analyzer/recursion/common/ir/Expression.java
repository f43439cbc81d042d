package org.irscan.analyzer.recursion.common.ir;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Node of a function body.
 * <p>
 * The known node types are {@link Call}, {@link If}, {@link Block}, {@link Tuple}, {@link TupleGetItem},
 * {@link FunctionReference}, {@link LocalVariable}, {@link ExternalReference} and {@link Constant}.
 */
public interface Expression {

    /**
     * The direct children of this node, in evaluation order.
     */
    Stream<Expression> subExpressions();

    /**
     * Pre-order traversal. The children of a node are visited only when the predicate returns true for that node.
     * The first child of a node is always the next node tested after it.
     * <p>
     * Uses an explicit work stack, so that the nesting depth of a body is not limited by the thread's stack.
     */
    default void visit(Predicate<Expression> predicate) {
        Deque<Expression> toDo = new ArrayDeque<>();
        toDo.push(this);
        while (!toDo.isEmpty()) {
            Expression expression = toDo.pop();
            if (predicate.test(expression)) {
                List<Expression> children = expression.subExpressions().toList();
                for (int i = children.size() - 1; i >= 0; i--) {
                    toDo.push(children.get(i));
                }
            }
        }
    }
}
