package org.contractquard.analyzer.ir.expression;

import org.contractquard.analyzer.ir.element.IRNode;
import org.contractquard.analyzer.ir.element.SourceLocation;
import org.contractquard.analyzer.ir.type.IRType;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Prefix or postfix operation; the position is stored in the metadata under {@link #METADATA_PREFIX}.
 */
public final class UnaryOperation extends IRExpression {
    public static final String METADATA_PREFIX = "prefix";

    private final String operator;
    private final IRExpression operand;

    public UnaryOperation(String id, SourceLocation sourceLocation, Map<String, Object> metadata,
                          IRType resultType, String operator, IRExpression operand) {
        super(id, sourceLocation, metadata, resultType);
        this.operator = Objects.requireNonNull(operator);
        this.operand = Objects.requireNonNull(operand);
    }

    @Override
    public ExpressionKind expressionKind() {
        return ExpressionKind.UNARY_OP;
    }

    @Override
    public List<IRNode> children() {
        return List.of(operand);
    }

    public String operator() {
        return operator;
    }

    public IRExpression operand() {
        return operand;
    }

    public boolean isPrefix() {
        return !Boolean.FALSE.equals(metadata().get(METADATA_PREFIX));
    }

    public boolean isIncrementOrDecrement() {
        return "++".equals(operator) || "--".equals(operator);
    }

    @Override
    public String toString() {
        if ("delete".equals(operator)) return "delete " + operand;
        return isPrefix() ? operator + operand : operand + operator;
    }
}
