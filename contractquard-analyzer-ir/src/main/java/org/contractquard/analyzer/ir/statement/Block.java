package org.contractquard.analyzer.ir.statement;

import org.contractquard.analyzer.ir.element.IRNode;
import org.contractquard.analyzer.ir.element.SourceLocation;

import java.util.List;
import java.util.Map;

/**
 * A nested statement list. The empty block doubles as placeholder for constructs that have no
 * IR counterpart; such placeholders carry metadata {@link #METADATA_PLACEHOLDER} naming the construct.
 */
public final class Block extends IRStatement {
    public static final String METADATA_PLACEHOLDER = "placeholder";
    public static final String METADATA_UNCHECKED = "unchecked";

    private final List<IRStatement> statements;

    public Block(String id, SourceLocation sourceLocation, Map<String, Object> metadata,
                 List<IRStatement> statements) {
        super(id, sourceLocation, metadata);
        this.statements = List.copyOf(statements);
    }

    public static Block placeholder(String id, SourceLocation sourceLocation, String construct) {
        return new Block(id, sourceLocation, Map.of(METADATA_PLACEHOLDER, construct == null ? "unknown" : construct),
                List.of());
    }

    @Override
    public StatementKind statementKind() {
        return StatementKind.BLOCK;
    }

    @Override
    public List<IRNode> children() {
        return List.copyOf(statements);
    }

    public List<IRStatement> statements() {
        return statements;
    }

    public boolean isPlaceholder() {
        return metadata().containsKey(METADATA_PLACEHOLDER);
    }

    @Override
    public String toString() {
        if (isPlaceholder()) return "/* " + metadata().get(METADATA_PLACEHOLDER) + " */";
        return "{ " + statements.size() + " statement(s) }";
    }
}
