package org.contractquard.analyzer.ir;

import org.contractquard.analyzer.ir.element.IRNode;

public class AnalyzerException extends RuntimeException {
    private final IRNode node;

    public AnalyzerException(IRNode node, Throwable throwable) {
        super(throwable);
        this.node = node;
    }

    public AnalyzerException(IRNode node, String message) {
        super(message);
        this.node = node;
    }

    public IRNode getNode() {
        return node;
    }
}
