package org.contractquard.analyzer.cfg;

import java.util.Objects;

public record GraphEdge(String source, String target, EdgeKind kind) {

    public GraphEdge {
        Objects.requireNonNull(source);
        Objects.requireNonNull(target);
        Objects.requireNonNull(kind);
    }

    @Override
    public String toString() {
        return source + "-" + kind + "->" + target;
    }
}
