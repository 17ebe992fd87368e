package org.contractquard.analyzer.cfg;

import java.util.List;
import java.util.Map;

/**
 * Per-function control flow graph. Immutable once built.
 */
public interface ControlFlowGraph {

    String functionName();

    /**
     * @return all nodes keyed by id, in creation order
     */
    Map<String, CFGNode> nodes();

    List<GraphEdge> edges();

    CFGNode entry();

    /**
     * @return ids of the exit nodes, in creation order; empty when the function never completes normally
     */
    List<String> exitNodes();

    CFGNode node(String id);

    List<GraphEdge> outgoing(String nodeId);

    List<GraphEdge> incoming(String nodeId);

    default int nodeCount() {
        return nodes().size();
    }

    default int edgeCount() {
        return edges().size();
    }
}
