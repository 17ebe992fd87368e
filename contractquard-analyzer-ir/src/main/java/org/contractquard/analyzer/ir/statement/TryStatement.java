package org.contractquard.analyzer.ir.statement;

import org.contractquard.analyzer.ir.element.IRNode;
import org.contractquard.analyzer.ir.element.SourceLocation;
import org.contractquard.analyzer.ir.expression.IRExpression;
import org.contractquard.analyzer.ir.info.IRParameter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Try-catch. The guarded expression (Solidity: the external call) may be null for languages
 * where the whole body is guarded.
 */
public final class TryStatement extends IRStatement {

    /**
     * @param errorName null for the catch-all clause
     */
    public record CatchClause(String errorName, List<IRParameter> parameters, List<IRStatement> body) {
        public CatchClause {
            parameters = parameters == null ? List.of() : List.copyOf(parameters);
            body = List.copyOf(Objects.requireNonNull(body));
        }
    }

    private final IRExpression guardedExpression;
    private final List<IRStatement> body;
    private final List<CatchClause> catchClauses;

    public TryStatement(String id, SourceLocation sourceLocation, Map<String, Object> metadata,
                        IRExpression guardedExpression, List<IRStatement> body, List<CatchClause> catchClauses) {
        super(id, sourceLocation, metadata);
        this.guardedExpression = guardedExpression;
        this.body = List.copyOf(body);
        this.catchClauses = List.copyOf(catchClauses);
    }

    @Override
    public StatementKind statementKind() {
        return StatementKind.TRY_CATCH;
    }

    @Override
    public List<IRNode> children() {
        List<IRNode> list = new ArrayList<>();
        if (guardedExpression != null) list.add(guardedExpression);
        list.addAll(body);
        for (CatchClause cc : catchClauses) {
            list.addAll(cc.body());
        }
        return List.copyOf(list);
    }

    public IRExpression guardedExpression() {
        return guardedExpression;
    }

    public List<IRStatement> body() {
        return body;
    }

    public List<CatchClause> catchClauses() {
        return catchClauses;
    }

    @Override
    public String toString() {
        return "try " + (guardedExpression == null ? "" : guardedExpression + " ") + "{...} " + catchClauses.size()
               + " catch clause(s)";
    }
}
