package org.contractquard.analyzer.cfg;

public enum EdgeKind {
    CONTROL_FLOW, CONDITIONAL_TRUE, CONDITIONAL_FALSE, LOOP_BACK, CALL, EXCEPTION
}
