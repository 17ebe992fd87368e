package org.contractquard.analyzer.cfg;

import org.contractquard.analyzer.ir.info.IRFunction;

public interface ControlFlowGraphBuilder {

    ControlFlowGraph build(IRFunction function);
}
