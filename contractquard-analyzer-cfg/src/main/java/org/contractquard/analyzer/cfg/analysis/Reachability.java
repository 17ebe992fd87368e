package org.contractquard.analyzer.cfg.analysis;

import org.contractquard.analyzer.cfg.CFGNode;
import org.contractquard.analyzer.cfg.ControlFlowGraph;
import org.contractquard.analyzer.cfg.GraphEdge;

import java.util.*;

public class Reachability {

    private Reachability() {
    }

    /**
     * Depth-first traversal from the entry node along edges of any kind.
     */
    public static Set<String> reachable(ControlFlowGraph cfg) {
        return traverse(cfg, false);
    }

    /**
     * Like {@link #reachable(ControlFlowGraph)}, but a terminated block only continues along the edge to its
     * jump target. Blocks that are reachable, yet only through branches that always return or revert first,
     * are not live.
     */
    public static Set<String> live(ControlFlowGraph cfg) {
        return traverse(cfg, true);
    }

    public static List<String> unreachable(ControlFlowGraph cfg) {
        Set<String> reachable = reachable(cfg);
        return cfg.nodes().keySet().stream().filter(id -> !reachable.contains(id)).toList();
    }

    /**
     * @return the nodes that hold statements but are not live, in node order
     */
    public static List<CFGNode> deadCode(ControlFlowGraph cfg) {
        Set<String> live = live(cfg);
        return cfg.nodes().values().stream().filter(n -> !n.isEmpty() && !live.contains(n.id())).toList();
    }

    private static Set<String> traverse(ControlFlowGraph cfg, boolean respectTermination) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        stack.push(cfg.entry().id());
        while (!stack.isEmpty()) {
            String id = stack.pop();
            if (!visited.add(id)) continue;
            CFGNode node = cfg.node(id);
            for (GraphEdge edge : cfg.outgoing(id)) {
                if (respectTermination && node.terminated() && !edge.target().equals(node.jumpTarget())) continue;
                if (!visited.contains(edge.target())) stack.push(edge.target());
            }
        }
        return visited;
    }
}
