package org.contractquard.analyzer.ir.expression;

import org.contractquard.analyzer.ir.element.IRNode;
import org.contractquard.analyzer.ir.element.SourceLocation;
import org.contractquard.analyzer.ir.type.IRType;

import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class IndexAccess extends IRExpression {
    private final IRExpression base;
    private final IRExpression index;

    public IndexAccess(String id, SourceLocation sourceLocation, Map<String, Object> metadata, IRType resultType,
                       IRExpression base, IRExpression index) {
        super(id, sourceLocation, metadata, resultType);
        this.base = Objects.requireNonNull(base);
        this.index = index;
    }

    @Override
    public ExpressionKind expressionKind() {
        return ExpressionKind.ARRAY_ACCESS;
    }

    @Override
    public List<IRNode> children() {
        return index == null ? List.of(base) : List.of(base, index);
    }

    public IRExpression base() {
        return base;
    }

    // null in type expressions such as uint[]
    public IRExpression index() {
        return index;
    }

    @Override
    public String toString() {
        return base + "[" + (index == null ? "" : index) + "]";
    }
}
