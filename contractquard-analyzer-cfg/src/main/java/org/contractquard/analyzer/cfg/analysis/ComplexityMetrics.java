package org.contractquard.analyzer.cfg.analysis;

import org.contractquard.analyzer.cfg.ControlFlowGraph;
import org.contractquard.analyzer.ir.info.IRFunction;
import org.contractquard.analyzer.ir.statement.*;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

public class ComplexityMetrics {

    private ComplexityMetrics() {
    }

    /**
     * Edges minus nodes plus two; the graph is assumed to be one connected component.
     */
    public static int cyclomaticComplexity(ControlFlowGraph cfg) {
        return cfg.edgeCount() - cfg.nodeCount() + 2;
    }

    private record Level(List<IRStatement> statements, int depth) {
    }

    /**
     * Deepest nesting of if and loop bodies; a function without nested conditionals has depth 0.
     * Plain blocks and try bodies do not add a level, nor do empty if and loop bodies.
     */
    public static int maxNestingDepth(IRFunction function) {
        int max = 0;
        Deque<Level> stack = new ArrayDeque<>();
        stack.push(new Level(function.body(), 0));
        while (!stack.isEmpty()) {
            Level level = stack.pop();
            if (!level.statements.isEmpty()) max = Math.max(max, level.depth);
            for (IRStatement statement : level.statements) {
                int depth = level.depth;
                if (statement instanceof IfElseStatement ifElse) {
                    stack.push(new Level(ifElse.thenBlock(), depth + 1));
                    stack.push(new Level(ifElse.elseBlock(), depth + 1));
                } else if (statement instanceof LoopStatement loop) {
                    stack.push(new Level(loop.body(), depth + 1));
                } else if (statement instanceof Block block) {
                    stack.push(new Level(block.statements(), depth));
                } else if (statement instanceof TryStatement tryStatement) {
                    stack.push(new Level(tryStatement.body(), depth));
                    for (TryStatement.CatchClause clause : tryStatement.catchClauses()) {
                        stack.push(new Level(clause.body(), depth));
                    }
                }
            }
        }
        return max;
    }
}
