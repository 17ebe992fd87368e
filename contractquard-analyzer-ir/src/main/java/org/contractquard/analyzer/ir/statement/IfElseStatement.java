package org.contractquard.analyzer.ir.statement;

import org.contractquard.analyzer.ir.element.IRNode;
import org.contractquard.analyzer.ir.element.SourceLocation;
import org.contractquard.analyzer.ir.expression.IRExpression;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class IfElseStatement extends IRStatement {
    private final IRExpression condition;
    private final List<IRStatement> thenBlock;
    private final List<IRStatement> elseBlock;

    public IfElseStatement(String id, SourceLocation sourceLocation, Map<String, Object> metadata,
                           IRExpression condition, List<IRStatement> thenBlock, List<IRStatement> elseBlock) {
        super(id, sourceLocation, metadata);
        this.condition = Objects.requireNonNull(condition);
        this.thenBlock = List.copyOf(thenBlock);
        this.elseBlock = elseBlock == null ? List.of() : List.copyOf(elseBlock);
    }

    @Override
    public StatementKind statementKind() {
        return StatementKind.IF;
    }

    @Override
    public List<IRNode> children() {
        List<IRNode> list = new ArrayList<>(1 + thenBlock.size() + elseBlock.size());
        list.add(condition);
        list.addAll(thenBlock);
        list.addAll(elseBlock);
        return List.copyOf(list);
    }

    public IRExpression condition() {
        return condition;
    }

    public List<IRStatement> thenBlock() {
        return thenBlock;
    }

    // empty when there is no else branch
    public List<IRStatement> elseBlock() {
        return elseBlock;
    }

    public boolean hasElse() {
        return !elseBlock.isEmpty();
    }

    @Override
    public String toString() {
        return "if (" + condition + ") {...}" + (hasElse() ? " else {...}" : "");
    }
}
