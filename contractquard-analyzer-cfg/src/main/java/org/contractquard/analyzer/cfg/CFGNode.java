package org.contractquard.analyzer.cfg;

import org.contractquard.analyzer.ir.statement.IRStatement;
import org.contractquard.analyzer.ir.statement.ReturnStatement;

import java.util.List;
import java.util.Objects;

/**
 * Basic block.
 *
 * @param terminated true when the last statement interrupts the flow (return, break, continue, throw, revert);
 *                   the only outgoing edge such a block takes at run time is the one to {@code jumpTarget}
 * @param jumpTarget for a block ending in break or continue, the id of the block jumped to; null otherwise
 */
public record CFGNode(String id,
                      List<IRStatement> statements,
                      boolean entry,
                      boolean exit,
                      boolean branch,
                      boolean merge,
                      boolean terminated,
                      String jumpTarget) {

    public CFGNode {
        Objects.requireNonNull(id);
        statements = List.copyOf(statements);
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    public IRStatement lastStatement() {
        return statements.isEmpty() ? null : statements.get(statements.size() - 1);
    }

    public boolean containsReturn() {
        return statements.stream().anyMatch(s -> s instanceof ReturnStatement);
    }

    public boolean endsAbnormally() {
        IRStatement last = lastStatement();
        return terminated && last != null && last.isAbnormalExit();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(id).append("(").append(statements.size());
        if (entry) sb.append(",entry");
        if (exit) sb.append(",exit");
        if (branch) sb.append(",branch");
        if (merge) sb.append(",merge");
        return sb.append(")").toString();
    }
}
