package org.contractquard.analyzer.ir.expression;

import org.contractquard.analyzer.ir.element.IRNode;
import org.contractquard.analyzer.ir.element.SourceLocation;
import org.contractquard.analyzer.ir.type.IRType;

import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class BinaryOperation extends IRExpression {
    private final String operator;
    private final IRExpression left;
    private final IRExpression right;

    public BinaryOperation(String id, SourceLocation sourceLocation, Map<String, Object> metadata,
                           IRType resultType, String operator, IRExpression left, IRExpression right) {
        super(id, sourceLocation, metadata, resultType);
        this.operator = Objects.requireNonNull(operator);
        this.left = Objects.requireNonNull(left);
        this.right = Objects.requireNonNull(right);
    }

    @Override
    public ExpressionKind expressionKind() {
        return ExpressionKind.BINARY_OP;
    }

    @Override
    public List<IRNode> children() {
        return List.of(left, right);
    }

    public String operator() {
        return operator;
    }

    public IRExpression left() {
        return left;
    }

    public IRExpression right() {
        return right;
    }

    @Override
    public String toString() {
        return left + " " + operator + " " + right;
    }
}
