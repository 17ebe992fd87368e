package org.contractquard.analyzer.ir.expression;

import org.contractquard.analyzer.ir.element.IRNode;
import org.contractquard.analyzer.ir.element.SourceLocation;
import org.contractquard.analyzer.ir.type.IRType;

import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class Cast extends IRExpression {
    private final IRType targetType;
    private final IRExpression expression;

    public Cast(String id, SourceLocation sourceLocation, Map<String, Object> metadata, IRType targetType,
                IRExpression expression) {
        super(id, sourceLocation, metadata, targetType);
        this.targetType = Objects.requireNonNull(targetType);
        this.expression = Objects.requireNonNull(expression);
    }

    @Override
    public ExpressionKind expressionKind() {
        return ExpressionKind.CAST;
    }

    @Override
    public List<IRNode> children() {
        return List.of(expression);
    }

    public IRType targetType() {
        return targetType;
    }

    public IRExpression expression() {
        return expression;
    }

    @Override
    public String toString() {
        return targetType + "(" + expression + ")";
    }
}
