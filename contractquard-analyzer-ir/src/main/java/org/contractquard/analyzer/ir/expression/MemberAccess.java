package org.contractquard.analyzer.ir.expression;

import org.contractquard.analyzer.ir.element.IRNode;
import org.contractquard.analyzer.ir.element.SourceLocation;
import org.contractquard.analyzer.ir.type.IRType;

import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class MemberAccess extends IRExpression {
    private final IRExpression base;
    private final String member;

    public MemberAccess(String id, SourceLocation sourceLocation, Map<String, Object> metadata, IRType resultType,
                        IRExpression base, String member) {
        super(id, sourceLocation, metadata, resultType);
        this.base = Objects.requireNonNull(base);
        this.member = Objects.requireNonNull(member);
    }

    @Override
    public ExpressionKind expressionKind() {
        return ExpressionKind.MEMBER_ACCESS;
    }

    @Override
    public List<IRNode> children() {
        return List.of(base);
    }

    public IRExpression base() {
        return base;
    }

    public String member() {
        return member;
    }

    @Override
    public String toString() {
        return base + "." + member;
    }
}
