package org.contractquard.analyzer.ir.expression;

import org.contractquard.analyzer.ir.element.SourceLocation;
import org.contractquard.analyzer.ir.type.IRType;

import java.util.Map;
import java.util.Objects;

public final class Literal extends IRExpression {
    private final String value;
    private final String literalType;

    public Literal(String id, SourceLocation sourceLocation, Map<String, Object> metadata, IRType resultType,
                   String value, String literalType) {
        super(id, sourceLocation, metadata, resultType);
        this.value = Objects.requireNonNull(value);
        this.literalType = literalType == null ? "unknown" : literalType;
    }

    @Override
    public ExpressionKind expressionKind() {
        return ExpressionKind.LITERAL;
    }

    public String value() {
        return value;
    }

    // e.g. "number", "bool", "string"
    public String literalType() {
        return literalType;
    }

    public boolean isTrue() {
        return "true".equals(value);
    }

    @Override
    public String toString() {
        return "string".equals(literalType) ? "\"" + value + "\"" : value;
    }
}
