package org.contractquard.analyzer.cfg.analysis;

import org.contractquard.analyzer.cfg.CFGNode;
import org.contractquard.analyzer.cfg.ControlFlowGraph;
import org.contractquard.analyzer.cfg.GraphEdge;

import java.util.*;

public class CycleAnalysis {

    private CycleAnalysis() {
    }

    /**
     * Cycles of the control flow graph, every edge kind counting as a successor.
     *
     * @return node id sets, each ordered as the nodes of the graph
     */
    public static List<Set<String>> detectCycles(ControlFlowGraph cfg) {
        List<String> order = List.copyOf(cfg.nodes().keySet());
        List<List<String>> cycles = StronglyConnectedComponents.cycles(order, id -> successors(cfg, id));
        List<Set<String>> result = new ArrayList<>(cycles.size());
        for (List<String> cycle : cycles) {
            Set<String> members = new HashSet<>(cycle);
            Set<String> ordered = new LinkedHashSet<>();
            for (String id : order) {
                if (members.contains(id)) ordered.add(id);
            }
            result.add(ordered);
        }
        // Tarjan emits in reverse topological order; report in node order
        result.sort(Comparator.comparingInt(s -> order.indexOf(s.iterator().next())));
        return result;
    }

    /**
     * @return true when at least one member of the cycle has an edge leaving the cycle
     */
    public static boolean hasExitCondition(ControlFlowGraph cfg, Set<String> cycle) {
        for (String id : cycle) {
            for (GraphEdge edge : cfg.outgoing(id)) {
                if (!cycle.contains(edge.target())) return true;
            }
        }
        return false;
    }

    /**
     * @return true when a member of the cycle leaves the function, by returning or reverting
     */
    public static boolean leavesFunction(ControlFlowGraph cfg, Set<String> cycle) {
        for (String id : cycle) {
            CFGNode node = cfg.node(id);
            if (node.exit() || node.endsAbnormally()) return true;
        }
        return false;
    }

    private static List<String> successors(ControlFlowGraph cfg, String id) {
        return cfg.outgoing(id).stream().map(GraphEdge::target).toList();
    }
}
