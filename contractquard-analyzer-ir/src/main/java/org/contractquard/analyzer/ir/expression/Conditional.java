package org.contractquard.analyzer.ir.expression;

import org.contractquard.analyzer.ir.element.IRNode;
import org.contractquard.analyzer.ir.element.SourceLocation;
import org.contractquard.analyzer.ir.type.IRType;

import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class Conditional extends IRExpression {
    private final IRExpression condition;
    private final IRExpression ifTrue;
    private final IRExpression ifFalse;

    public Conditional(String id, SourceLocation sourceLocation, Map<String, Object> metadata, IRType resultType,
                       IRExpression condition, IRExpression ifTrue, IRExpression ifFalse) {
        super(id, sourceLocation, metadata, resultType);
        this.condition = Objects.requireNonNull(condition);
        this.ifTrue = Objects.requireNonNull(ifTrue);
        this.ifFalse = Objects.requireNonNull(ifFalse);
    }

    @Override
    public ExpressionKind expressionKind() {
        return ExpressionKind.CONDITIONAL;
    }

    @Override
    public List<IRNode> children() {
        return List.of(condition, ifTrue, ifFalse);
    }

    public IRExpression condition() {
        return condition;
    }

    public IRExpression ifTrue() {
        return ifTrue;
    }

    public IRExpression ifFalse() {
        return ifFalse;
    }

    @Override
    public String toString() {
        return condition + " ? " + ifTrue + " : " + ifFalse;
    }
}
