package org.contractquard.analyzer.ir.statement;

import org.contractquard.analyzer.ir.element.IRNode;
import org.contractquard.analyzer.ir.element.SourceLocation;
import org.contractquard.analyzer.ir.expression.IRExpression;

import java.util.List;
import java.util.Map;

public final class ReturnStatement extends IRStatement {
    private final IRExpression value;

    public ReturnStatement(String id, SourceLocation sourceLocation, Map<String, Object> metadata,
                           IRExpression value) {
        super(id, sourceLocation, metadata);
        this.value = value;
    }

    @Override
    public StatementKind statementKind() {
        return StatementKind.RETURN;
    }

    @Override
    public boolean interruptsFlow() {
        return true;
    }

    @Override
    public List<IRNode> children() {
        return value == null ? List.of() : List.of(value);
    }

    // null for a bare return
    public IRExpression value() {
        return value;
    }

    @Override
    public String toString() {
        return value == null ? "return;" : "return " + value + ";";
    }
}
