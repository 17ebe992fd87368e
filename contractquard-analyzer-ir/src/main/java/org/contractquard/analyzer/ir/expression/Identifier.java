package org.contractquard.analyzer.ir.expression;

import org.contractquard.analyzer.ir.element.SourceLocation;
import org.contractquard.analyzer.ir.type.IRType;

import java.util.Map;
import java.util.Objects;

public final class Identifier extends IRExpression {
    public static final String UNKNOWN = "unknown";

    private final String name;

    public Identifier(String id, SourceLocation sourceLocation, Map<String, Object> metadata, IRType resultType,
                      String name) {
        super(id, sourceLocation, metadata, resultType);
        this.name = Objects.requireNonNull(name);
    }

    public static Identifier unknown(String id, SourceLocation sourceLocation, String construct) {
        return new Identifier(id, sourceLocation, construct == null ? null : Map.<String, Object>of("placeholder", construct),
                null, UNKNOWN);
    }

    @Override
    public ExpressionKind expressionKind() {
        return ExpressionKind.IDENTIFIER;
    }

    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}
