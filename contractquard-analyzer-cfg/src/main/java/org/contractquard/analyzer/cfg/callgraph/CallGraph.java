package org.contractquard.analyzer.cfg.callgraph;

import org.contractquard.analyzer.cfg.GraphEdge;
import org.contractquard.analyzer.cfg.analysis.StronglyConnectedComponents;
import org.contractquard.analyzer.ir.info.IRFunction;

import java.util.*;

/**
 * Calls between the functions of a set of modules. Vertices are keyed {@code Contract::function}, or
 * {@code ::function} for module-level functions; overloads share a vertex.
 */
public class CallGraph {
    private final Map<String, List<IRFunction>> functions;
    private final List<GraphEdge> edges;
    private final Map<String, Set<String>> callees = new HashMap<>();
    private final Map<String, Set<String>> callers = new HashMap<>();

    CallGraph(Map<String, List<IRFunction>> functions, List<GraphEdge> edges) {
        this.functions = Collections.unmodifiableMap(new LinkedHashMap<>(functions));
        this.edges = List.copyOf(edges);
        for (GraphEdge edge : edges) {
            callees.computeIfAbsent(edge.source(), k -> new LinkedHashSet<>()).add(edge.target());
            callers.computeIfAbsent(edge.target(), k -> new LinkedHashSet<>()).add(edge.source());
        }
    }

    public static String key(String contractName, String functionName) {
        return (contractName == null ? "" : contractName) + "::" + functionName;
    }

    public Set<String> vertices() {
        return functions.keySet();
    }

    public List<IRFunction> functions(String key) {
        return functions.getOrDefault(key, List.of());
    }

    public List<GraphEdge> edges() {
        return edges;
    }

    public Set<String> callees(String key) {
        return callees.getOrDefault(key, Set.of());
    }

    public Set<String> callers(String key) {
        return callers.getOrDefault(key, Set.of());
    }

    public boolean isCalled(String key) {
        Set<String> set = callers.get(key);
        return set != null && !set.isEmpty();
    }

    /**
     * @return the call cycles: mutually recursive groups, and directly recursive functions
     */
    public List<List<String>> recursiveComponents() {
        return StronglyConnectedComponents.cycles(functions.keySet(), this::callees);
    }

    @Override
    public String toString() {
        return edges.toString();
    }
}
