package org.contractquard.analyzer.ir.statement;

import org.contractquard.analyzer.ir.element.IRNode;
import org.contractquard.analyzer.ir.element.NodeKind;
import org.contractquard.analyzer.ir.element.SourceLocation;
import org.contractquard.analyzer.ir.visitor.IRVisitor;

import java.util.Map;

/**
 * Closed set of statement variants. Composite statements own their nested statements and expressions.
 */
public abstract sealed class IRStatement extends IRNode
        permits AssignmentStatement, IfElseStatement, LoopStatement, ReturnStatement, CallStatement,
        VariableDeclarationStatement, Block, BreakStatement, ContinueStatement, ThrowStatement, TryStatement {

    protected IRStatement(String id, SourceLocation sourceLocation, Map<String, Object> metadata) {
        super(id, sourceLocation, metadata);
    }

    @Override
    public final NodeKind kind() {
        return NodeKind.STATEMENT;
    }

    @Override
    public void accept(IRVisitor visitor) {
        visitor.visitStatement(this);
    }

    public abstract StatementKind statementKind();

    /**
     * @return true when control never continues with the next statement of the same statement list
     */
    public boolean interruptsFlow() {
        return false;
    }

    /**
     * @return true when this statement leaves the function abnormally (throw, revert)
     */
    public boolean isAbnormalExit() {
        return false;
    }
}
