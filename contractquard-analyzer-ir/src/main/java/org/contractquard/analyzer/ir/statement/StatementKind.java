package org.contractquard.analyzer.ir.statement;

public enum StatementKind {
    ASSIGNMENT, IF, WHILE, FOR, RETURN, FUNCTION_CALL, VARIABLE_DECLARATION, BLOCK, BREAK, CONTINUE, THROW, TRY_CATCH
}
