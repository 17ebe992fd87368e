package org.contractquard.analyzer.ir.statement;

import org.contractquard.analyzer.ir.element.IRNode;
import org.contractquard.analyzer.ir.element.SourceLocation;
import org.contractquard.analyzer.ir.expression.IRExpression;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@code target operator value}, where the operator is {@code =} or a compound form such as {@code +=}.
 * Increments and decrements used as statements are represented with operator {@code ++} or {@code --}
 * and the unary operation as value.
 */
public final class AssignmentStatement extends IRStatement {
    private final IRExpression target;
    private final IRExpression value;
    private final String operator;

    public AssignmentStatement(String id, SourceLocation sourceLocation, Map<String, Object> metadata,
                               IRExpression target, IRExpression value, String operator) {
        super(id, sourceLocation, metadata);
        this.target = Objects.requireNonNull(target);
        this.value = Objects.requireNonNull(value);
        this.operator = operator == null ? "=" : operator;
    }

    @Override
    public StatementKind statementKind() {
        return StatementKind.ASSIGNMENT;
    }

    @Override
    public List<IRNode> children() {
        return List.of(target, value);
    }

    public IRExpression target() {
        return target;
    }

    public IRExpression value() {
        return value;
    }

    public String operator() {
        return operator;
    }

    @Override
    public String toString() {
        if ("++".equals(operator) || "--".equals(operator)) return value + ";";
        return target + " " + operator + " " + value + ";";
    }
}
