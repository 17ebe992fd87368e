package org.contractquard.analyzer.ir.expression;

public enum ExpressionKind {
    LITERAL, IDENTIFIER, BINARY_OP, UNARY_OP, FUNCTION_CALL, MEMBER_ACCESS, ARRAY_ACCESS, CONDITIONAL, CAST
}
