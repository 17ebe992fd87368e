package org.contractquard.analyzer.cfg.analysis;

import org.contractquard.analyzer.cfg.CFGNode;
import org.contractquard.analyzer.cfg.ControlFlowGraph;
import org.contractquard.analyzer.ir.info.IRFunction;

import java.util.List;

public class MissingReturn {

    private MissingReturn() {
    }

    /**
     * For a function that declares a return type, the exit nodes without a return statement.
     * Functions with named return values assign instead of returning, and are not checked.
     */
    public static List<CFGNode> exitNodesWithoutReturn(IRFunction function, ControlFlowGraph cfg) {
        if (function.returnType() == null || !function.isImplemented()
            || function.hasMetadataFlag(IRFunction.METADATA_NAMED_RETURN)) {
            return List.of();
        }
        return cfg.exitNodes().stream().map(cfg::node).filter(n -> !n.containsReturn()).toList();
    }
}
