package org.contractquard.analyzer.ir.expression;

import org.contractquard.analyzer.ir.element.IRNode;
import org.contractquard.analyzer.ir.element.SourceLocation;
import org.contractquard.analyzer.ir.type.IRType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A call. For a member call {@code base.f(args)} the base expression is kept as {@link #base()},
 * the call is {@link #external()}, and the target contract is the rendered base expression.
 */
public final class FunctionCall extends IRExpression {
    private final String functionName;
    private final IRExpression base;
    private final List<IRExpression> arguments;
    private final boolean external;
    private final String targetContract;

    public FunctionCall(String id, SourceLocation sourceLocation, Map<String, Object> metadata, IRType resultType,
                        String functionName, IRExpression base, List<IRExpression> arguments, boolean external,
                        String targetContract) {
        super(id, sourceLocation, metadata, resultType);
        this.functionName = Objects.requireNonNull(functionName);
        this.base = base;
        this.arguments = List.copyOf(arguments);
        this.external = external;
        this.targetContract = targetContract;
    }

    public static FunctionCall internal(String id, SourceLocation sourceLocation, String functionName,
                                        List<IRExpression> arguments) {
        return new FunctionCall(id, sourceLocation, null, null, functionName, null, arguments, false, null);
    }

    @Override
    public ExpressionKind expressionKind() {
        return ExpressionKind.FUNCTION_CALL;
    }

    @Override
    public List<IRNode> children() {
        List<IRNode> list = new ArrayList<>(1 + arguments.size());
        if (base != null) list.add(base);
        list.addAll(arguments);
        return List.copyOf(list);
    }

    public String functionName() {
        return functionName;
    }

    // null for a call by plain name
    public IRExpression base() {
        return base;
    }

    public List<IRExpression> arguments() {
        return arguments;
    }

    public boolean external() {
        return external;
    }

    public String targetContract() {
        return targetContract;
    }

    @Override
    public String toString() {
        String args = arguments.stream().map(Object::toString).collect(Collectors.joining(", "));
        return (base == null ? "" : base + ".") + functionName + "(" + args + ")";
    }
}
