package org.contractquard.analyzer.ir.element;

import org.contractquard.analyzer.ir.visitor.IRVisitor;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Base of every element of the language-agnostic tree.
 * <p>
 * Nodes are immutable once built. The identifier is unique within one transformation;
 * the metadata map is open-ended and never contains {@code null} values.
 */
public abstract class IRNode {
    private final String id;
    private final SourceLocation sourceLocation;
    private final Map<String, Object> metadata;

    protected IRNode(String id, SourceLocation sourceLocation, Map<String, Object> metadata) {
        this.id = Objects.requireNonNull(id);
        this.sourceLocation = sourceLocation;
        this.metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public String id() {
        return id;
    }

    public abstract NodeKind kind();

    // may be null
    public SourceLocation sourceLocation() {
        return sourceLocation;
    }

    public Map<String, Object> metadata() {
        return metadata;
    }

    public boolean hasMetadataFlag(String key) {
        return Boolean.TRUE.equals(metadata.get(key));
    }

    /**
     * Double dispatch to the visitor callback of this node's kind.
     */
    public abstract void accept(IRVisitor visitor);

    /**
     * @return the immediately owned child nodes, in declaration order; empty for leaves.
     */
    public List<IRNode> children() {
        return List.of();
    }

    /**
     * Pre-order walk over this node and its descendants, in declaration order. The walk descends into
     * the children of a node only when the predicate returns true for that node. Uses an explicit
     * stack, so arbitrarily deep trees are safe.
     */
    public void visit(Predicate<IRNode> predicate) {
        Deque<IRNode> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            IRNode node = stack.pop();
            if (predicate.test(node)) {
                List<IRNode> children = node.children();
                for (int i = children.size() - 1; i >= 0; i--) {
                    stack.push(children.get(i));
                }
            }
        }
    }
}
