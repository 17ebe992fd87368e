package org.contractquard.analyzer.cfg.analysis;

import java.util.*;
import java.util.function.Function;

/**
 * Tarjan's algorithm, with an explicit call stack. Works on any graph given as a vertex collection and a
 * successor function, so that both control flow graphs and call graphs use it.
 */
public class StronglyConnectedComponents {

    private StronglyConnectedComponents() {
    }

    private static final class Visit<T> {
        final T vertex;
        final Iterator<T> successors;

        Visit(T vertex, Iterator<T> successors) {
            this.vertex = vertex;
            this.successors = successors;
        }
    }

    /**
     * @return all strongly connected components, each in discovery order; components are emitted in
     * reverse topological order, as Tarjan's algorithm produces them
     */
    public static <T> List<List<T>> compute(Collection<T> vertices, Function<T, ? extends Collection<T>> successors) {
        Map<T, Integer> index = new HashMap<>();
        Map<T, Integer> lowLink = new HashMap<>();
        Set<T> onStack = new HashSet<>();
        Deque<T> componentStack = new ArrayDeque<>();
        List<List<T>> result = new ArrayList<>();
        int counter = 0;

        for (T root : vertices) {
            if (index.containsKey(root)) continue;
            Deque<Visit<T>> callStack = new ArrayDeque<>();
            index.put(root, counter);
            lowLink.put(root, counter);
            counter++;
            componentStack.push(root);
            onStack.add(root);
            callStack.push(new Visit<>(root, successors.apply(root).iterator()));

            while (!callStack.isEmpty()) {
                Visit<T> visit = callStack.peek();
                if (visit.successors.hasNext()) {
                    T w = visit.successors.next();
                    if (!index.containsKey(w)) {
                        index.put(w, counter);
                        lowLink.put(w, counter);
                        counter++;
                        componentStack.push(w);
                        onStack.add(w);
                        callStack.push(new Visit<>(w, successors.apply(w).iterator()));
                    } else if (onStack.contains(w)) {
                        lowLink.put(visit.vertex, Math.min(lowLink.get(visit.vertex), index.get(w)));
                    }
                } else {
                    callStack.pop();
                    T v = visit.vertex;
                    if (lowLink.get(v).equals(index.get(v))) {
                        List<T> component = new ArrayList<>();
                        T w;
                        do {
                            w = componentStack.pop();
                            onStack.remove(w);
                            component.add(w);
                        } while (!w.equals(v));
                        Collections.reverse(component);
                        result.add(component);
                    }
                    Visit<T> parent = callStack.peek();
                    if (parent != null) {
                        lowLink.put(parent.vertex, Math.min(lowLink.get(parent.vertex), lowLink.get(v)));
                    }
                }
            }
        }
        return result;
    }

    /**
     * @return the components that form a cycle: more than one vertex, or one vertex with an edge to itself
     */
    public static <T> List<List<T>> cycles(Collection<T> vertices, Function<T, ? extends Collection<T>> successors) {
        return compute(vertices, successors).stream()
                .filter(c -> c.size() > 1 || successors.apply(c.get(0)).contains(c.get(0)))
                .toList();
    }
}
