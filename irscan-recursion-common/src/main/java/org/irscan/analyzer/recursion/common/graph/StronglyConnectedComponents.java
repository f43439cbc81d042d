package org.irscan.analyzer.recursion.common.graph;

import com.google.common.collect.ImmutableSet;
import com.google.common.graph.Graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/*
Tarjan's algorithm, with an explicit work stack instead of recursion, so that long chains of nodes
do not exhaust the thread's stack.

A component is complete when its root's low-link equals its discovery index. At that point, every
component reachable from it has been emitted already: the resulting list is in reverse topological
order of the condensation.

All state lives in one Tarjan instance per call. The components are immutable sets, in the order
in which their members were popped.
 */
public class StronglyConnectedComponents {

    private StronglyConnectedComponents() {
    }

    public static <N> List<Set<N>> compute(Graph<N> graph) {
        return new Tarjan<>(graph).run();
    }

    public static <N> boolean isSelfLoop(Graph<N> graph, Set<N> component) {
        if (component.size() != 1) return false;
        N n = component.iterator().next();
        return graph.hasEdgeConnecting(n, n);
    }

    private record Frame<N>(N n, Iterator<N> successors) {
    }

    private static class Tarjan<N> {
        private final Graph<N> graph;
        private final Map<N, Integer> index = new HashMap<>();
        private final Map<N, Integer> lowLink = new HashMap<>();
        private final Deque<N> stack = new ArrayDeque<>();
        private final Set<N> onStack = new HashSet<>();
        private final List<Set<N>> components = new ArrayList<>();
        private int counter;

        Tarjan(Graph<N> graph) {
            this.graph = graph;
        }

        List<Set<N>> run() {
            for (N n : graph.nodes()) {
                if (!index.containsKey(n)) {
                    strongConnect(n);
                }
            }
            return List.copyOf(components);
        }

        private void strongConnect(N start) {
            Deque<Frame<N>> work = new ArrayDeque<>();
            discover(start, work);
            while (!work.isEmpty()) {
                Frame<N> frame = work.peek();
                N n = frame.n();
                if (frame.successors().hasNext()) {
                    N w = frame.successors().next();
                    Integer indexOfW = index.get(w);
                    if (indexOfW == null) {
                        discover(w, work);
                    } else if (onStack.contains(w)) {
                        lowLink.merge(n, indexOfW, Math::min);
                    } // else: w belongs to a component that has been completed
                } else {
                    work.pop();
                    int lowLinkOfN = lowLink.get(n);
                    if (lowLinkOfN == index.get(n)) {
                        popComponent(n);
                    }
                    Frame<N> parent = work.peek();
                    if (parent != null) {
                        lowLink.merge(parent.n(), lowLinkOfN, Math::min);
                    }
                }
            }
        }

        private void discover(N n, Deque<Frame<N>> work) {
            index.put(n, counter);
            lowLink.put(n, counter);
            ++counter;
            stack.push(n);
            onStack.add(n);
            work.push(new Frame<>(n, graph.successors(n).iterator()));
        }

        private void popComponent(N root) {
            ImmutableSet.Builder<N> component = ImmutableSet.builder();
            N w;
            do {
                w = stack.pop();
                onStack.remove(w);
                component.add(w);
            } while (!w.equals(root));
            components.add(component.build());
        }
    }
}
