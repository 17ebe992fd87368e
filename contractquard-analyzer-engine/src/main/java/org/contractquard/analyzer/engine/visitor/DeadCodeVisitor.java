package org.contractquard.analyzer.engine.visitor;

import org.contractquard.analyzer.engine.FunctionContext;
import org.contractquard.analyzer.engine.finding.Finding;
import org.contractquard.analyzer.engine.finding.Severity;
import org.contractquard.analyzer.ir.element.SourceLocation;
import org.contractquard.analyzer.ir.expression.IRExpression;
import org.contractquard.analyzer.ir.statement.*;

import java.util.List;

/**
 * Statements that follow a return, break, continue, throw or revert in the same statement list. Works on the
 * IR alone; one finding per statement list, located at the first dead statement.
 */
public class DeadCodeVisitor extends FindingVisitor {
    public static final String DETECTOR = "dead_code_analyzer";

    private FunctionContext context;

    @Override
    protected void checkFunction(FunctionContext context) {
        this.context = context;
        checkList(context.function().body());
        visitChildren(context.function());
    }

    @Override
    public void visitStatement(IRStatement statement) {
        if (statement instanceof IfElseStatement ifElse) {
            checkList(ifElse.thenBlock());
            checkList(ifElse.elseBlock());
        } else if (statement instanceof LoopStatement loop) {
            checkList(loop.body());
        } else if (statement instanceof Block block) {
            checkList(block.statements());
        } else if (statement instanceof TryStatement tryStatement) {
            checkList(tryStatement.body());
            tryStatement.catchClauses().forEach(clause -> checkList(clause.body()));
        }
        visitChildren(statement);
    }

    // statements never occur below an expression
    @Override
    public void visitExpression(IRExpression expression) {
    }

    private void checkList(List<IRStatement> statements) {
        for (int i = 0; i < statements.size() - 1; i++) {
            IRStatement statement = statements.get(i);
            if (statement.interruptsFlow()) {
                report(context, statement, statements.get(i + 1), statements.size() - i - 1);
                return;
            }
        }
    }

    private void report(FunctionContext context, IRStatement terminator, IRStatement first, int count) {
        String name = context.qualifiedName();
        SourceLocation location = first.sourceLocation() != null ? first.sourceLocation() : context.location();
        findings.add(new Finding.Builder("dead_code_after_return_" + name + "_" + first.id())
                .setTitle("Dead Code After Return")
                .setDescription(count + " statement(s) after '" + terminator.toString().strip()
                                + "' in function " + name + " are never executed")
                .setSeverity(Severity.LOW)
                .setLocation(location)
                .setCategory("dead_code")
                .setDetector(DETECTOR)
                .setRecommendation("Remove the statements or move them before the " + terminator.statementKind()
                        .name().toLowerCase() + " statement")
                .putMetadata("terminator", terminator.statementKind().name())
                .putMetadata("statements", count)
                .build());
    }
}
