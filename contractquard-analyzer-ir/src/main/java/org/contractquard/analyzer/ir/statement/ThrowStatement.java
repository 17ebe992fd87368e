package org.contractquard.analyzer.ir.statement;

import org.contractquard.analyzer.ir.element.IRNode;
import org.contractquard.analyzer.ir.element.SourceLocation;
import org.contractquard.analyzer.ir.expression.IRExpression;

import java.util.List;
import java.util.Map;

/**
 * Abnormal termination: {@code throw}, or {@code revert CustomError(...)} with the error call as value.
 */
public final class ThrowStatement extends IRStatement {
    private final IRExpression value;

    public ThrowStatement(String id, SourceLocation sourceLocation, Map<String, Object> metadata,
                          IRExpression value) {
        super(id, sourceLocation, metadata);
        this.value = value;
    }

    @Override
    public StatementKind statementKind() {
        return StatementKind.THROW;
    }

    @Override
    public boolean interruptsFlow() {
        return true;
    }

    @Override
    public boolean isAbnormalExit() {
        return true;
    }

    @Override
    public List<IRNode> children() {
        return value == null ? List.of() : List.of(value);
    }

    public IRExpression value() {
        return value;
    }

    @Override
    public String toString() {
        return value == null ? "throw;" : "throw " + value + ";";
    }
}
