package org.contractquard.analyzer.ir.expression;

import org.contractquard.analyzer.ir.element.IRNode;
import org.contractquard.analyzer.ir.element.NodeKind;
import org.contractquard.analyzer.ir.element.SourceLocation;
import org.contractquard.analyzer.ir.type.IRType;
import org.contractquard.analyzer.ir.visitor.IRVisitor;

import java.util.Map;

/**
 * Closed set of expression variants. {@link #toString()} renders a compact, source-like form which
 * analyses use for textual matching ({@code msg.sender}, call targets).
 */
public abstract sealed class IRExpression extends IRNode
        permits Literal, Identifier, BinaryOperation, UnaryOperation, FunctionCall, MemberAccess, IndexAccess,
        Conditional, Cast {

    private final IRType resultType;

    protected IRExpression(String id, SourceLocation sourceLocation, Map<String, Object> metadata,
                           IRType resultType) {
        super(id, sourceLocation, metadata);
        this.resultType = resultType;
    }

    @Override
    public final NodeKind kind() {
        return NodeKind.EXPRESSION;
    }

    @Override
    public void accept(IRVisitor visitor) {
        visitor.visitExpression(this);
    }

    public abstract ExpressionKind expressionKind();

    // may be null
    public IRType resultType() {
        return resultType;
    }
}
