package org.contractquard.analyzer.ir.statement;

import org.contractquard.analyzer.ir.element.IRNode;
import org.contractquard.analyzer.ir.element.SourceLocation;
import org.contractquard.analyzer.ir.expression.IRExpression;
import org.contractquard.analyzer.ir.info.IRVariable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Declaration of one or more local variables, with an optional initial value shared by all of them
 * (a tuple when there is more than one variable).
 */
public final class VariableDeclarationStatement extends IRStatement {
    private final List<IRVariable> variables;
    private final IRExpression initialValue;

    public VariableDeclarationStatement(String id, SourceLocation sourceLocation, Map<String, Object> metadata,
                                        List<IRVariable> variables, IRExpression initialValue) {
        super(id, sourceLocation, metadata);
        this.variables = List.copyOf(variables);
        this.initialValue = initialValue;
    }

    @Override
    public StatementKind statementKind() {
        return StatementKind.VARIABLE_DECLARATION;
    }

    @Override
    public List<IRNode> children() {
        List<IRNode> list = new ArrayList<>(variables);
        if (initialValue != null) list.add(initialValue);
        return List.copyOf(list);
    }

    public List<IRVariable> variables() {
        return variables;
    }

    public IRExpression initialValue() {
        return initialValue;
    }

    @Override
    public String toString() {
        String vars = variables.size() == 1 ? variables.get(0).toString() : variables.toString();
        return vars + (initialValue == null ? "" : " = " + initialValue) + ";";
    }
}
