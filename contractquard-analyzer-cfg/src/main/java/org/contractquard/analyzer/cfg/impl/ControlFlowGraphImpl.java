package org.contractquard.analyzer.cfg.impl;

import org.contractquard.analyzer.cfg.CFGNode;
import org.contractquard.analyzer.cfg.ControlFlowGraph;
import org.contractquard.analyzer.cfg.GraphEdge;

import java.util.*;

public class ControlFlowGraphImpl implements ControlFlowGraph {
    private final String functionName;
    private final Map<String, CFGNode> nodes;
    private final List<GraphEdge> edges;
    private final CFGNode entry;
    private final List<String> exitNodes;
    private final Map<String, List<GraphEdge>> outgoing;
    private final Map<String, List<GraphEdge>> incoming;

    public ControlFlowGraphImpl(String functionName, List<CFGNode> nodeList, List<GraphEdge> edges) {
        this.functionName = functionName;
        Map<String, CFGNode> map = new LinkedHashMap<>();
        CFGNode e = null;
        List<String> exits = new ArrayList<>();
        for (CFGNode node : nodeList) {
            if (map.put(node.id(), node) != null) throw new IllegalArgumentException("Duplicate node " + node.id());
            if (node.entry()) {
                if (e != null) throw new IllegalArgumentException("Second entry node " + node.id());
                e = node;
            }
            if (node.exit()) exits.add(node.id());
        }
        this.entry = Objects.requireNonNull(e, "No entry node");
        this.nodes = Collections.unmodifiableMap(map);
        this.edges = List.copyOf(edges);
        this.exitNodes = List.copyOf(exits);

        Map<String, List<GraphEdge>> out = new HashMap<>();
        Map<String, List<GraphEdge>> in = new HashMap<>();
        for (GraphEdge edge : edges) {
            if (!map.containsKey(edge.source()) || !map.containsKey(edge.target())) {
                throw new IllegalArgumentException("Edge with unknown end point: " + edge);
            }
            out.computeIfAbsent(edge.source(), k -> new ArrayList<>()).add(edge);
            in.computeIfAbsent(edge.target(), k -> new ArrayList<>()).add(edge);
        }
        this.outgoing = out;
        this.incoming = in;
    }

    @Override
    public String functionName() {
        return functionName;
    }

    @Override
    public Map<String, CFGNode> nodes() {
        return nodes;
    }

    @Override
    public List<GraphEdge> edges() {
        return edges;
    }

    @Override
    public CFGNode entry() {
        return entry;
    }

    @Override
    public List<String> exitNodes() {
        return exitNodes;
    }

    @Override
    public CFGNode node(String id) {
        return nodes.get(id);
    }

    @Override
    public List<GraphEdge> outgoing(String nodeId) {
        List<GraphEdge> list = outgoing.get(nodeId);
        return list == null ? List.of() : Collections.unmodifiableList(list);
    }

    @Override
    public List<GraphEdge> incoming(String nodeId) {
        List<GraphEdge> list = incoming.get(nodeId);
        return list == null ? List.of() : Collections.unmodifiableList(list);
    }

    @Override
    public String toString() {
        return functionName + ": " + nodes.values() + " " + edges;
    }
}
