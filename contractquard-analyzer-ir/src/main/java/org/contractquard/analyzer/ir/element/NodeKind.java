package org.contractquard.analyzer.ir.element;

public enum NodeKind {
    MODULE, CONTRACT, FUNCTION, VARIABLE, STATEMENT, EXPRESSION, TYPE, PARAMETER
}
