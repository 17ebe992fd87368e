package org.contractquard.analyzer.ir.statement;

import org.contractquard.analyzer.ir.element.IRNode;
import org.contractquard.analyzer.ir.element.SourceLocation;
import org.contractquard.analyzer.ir.expression.IRExpression;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * While and for loops. A do-while loop is a {@link StatementKind#WHILE} loop carrying
 * {@link #METADATA_DO_WHILE}. A missing condition means "always true".
 */
public final class LoopStatement extends IRStatement {
    public static final String METADATA_DO_WHILE = "doWhile";

    private final StatementKind loopKind;
    private final IRStatement initialization;
    private final IRExpression condition;
    private final IRStatement update;
    private final List<IRStatement> body;

    public LoopStatement(String id, SourceLocation sourceLocation, Map<String, Object> metadata,
                         StatementKind loopKind, IRStatement initialization, IRExpression condition,
                         IRStatement update, List<IRStatement> body) {
        super(id, sourceLocation, metadata);
        if (loopKind != StatementKind.WHILE && loopKind != StatementKind.FOR) {
            throw new IllegalArgumentException("Not a loop kind: " + loopKind);
        }
        this.loopKind = loopKind;
        this.initialization = initialization;
        this.condition = condition;
        this.update = update;
        this.body = List.copyOf(body);
    }

    public static LoopStatement whileLoop(String id, SourceLocation sourceLocation, IRExpression condition,
                                          List<IRStatement> body) {
        return new LoopStatement(id, sourceLocation, null, StatementKind.WHILE, null, condition, null, body);
    }

    @Override
    public StatementKind statementKind() {
        return loopKind;
    }

    @Override
    public List<IRNode> children() {
        List<IRNode> list = new ArrayList<>(3 + body.size());
        if (initialization != null) list.add(initialization);
        if (condition != null) list.add(condition);
        if (update != null) list.add(update);
        list.addAll(body);
        return List.copyOf(list);
    }

    public IRStatement initialization() {
        return initialization;
    }

    public IRExpression condition() {
        return condition;
    }

    public IRStatement update() {
        return update;
    }

    public List<IRStatement> body() {
        return body;
    }

    public boolean isDoWhile() {
        return hasMetadataFlag(METADATA_DO_WHILE);
    }

    @Override
    public String toString() {
        return (loopKind == StatementKind.FOR ? "for" : "while") + " (" + (condition == null ? "" : condition)
               + ") {...}";
    }
}
