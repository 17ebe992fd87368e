package org.contractquard.analyzer.ir.statement;

import org.contractquard.analyzer.ir.element.SourceLocation;

import java.util.Map;

public final class BreakStatement extends IRStatement {

    public BreakStatement(String id, SourceLocation sourceLocation, Map<String, Object> metadata) {
        super(id, sourceLocation, metadata);
    }

    @Override
    public StatementKind statementKind() {
        return StatementKind.BREAK;
    }

    @Override
    public boolean interruptsFlow() {
        return true;
    }

    @Override
    public String toString() {
        return "break;";
    }
}
