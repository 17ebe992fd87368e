package org.contractquard.analyzer.engine.controlflow;

import org.contractquard.analyzer.cfg.CFGNode;
import org.contractquard.analyzer.cfg.ControlFlowGraph;
import org.contractquard.analyzer.cfg.ControlFlowGraphBuilder;
import org.contractquard.analyzer.cfg.analysis.ComplexityMetrics;
import org.contractquard.analyzer.cfg.analysis.CycleAnalysis;
import org.contractquard.analyzer.cfg.analysis.MissingReturn;
import org.contractquard.analyzer.cfg.analysis.Reachability;
import org.contractquard.analyzer.engine.FunctionContext;
import org.contractquard.analyzer.engine.finding.Finding;
import org.contractquard.analyzer.engine.finding.Severity;
import org.contractquard.analyzer.engine.statistics.FunctionStatistics;
import org.contractquard.analyzer.ir.element.SourceLocation;
import org.contractquard.analyzer.ir.info.IRFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Findings that need the control flow graph of a function: unreachable blocks, loops that can never be
 * left, paths without a return value, and functions above the complexity or nesting thresholds.
 */
public class ControlFlowAnalyzer {
    private static final Logger LOGGER = LoggerFactory.getLogger(ControlFlowAnalyzer.class);

    public static final String DETECTOR = "control_flow_analyzer";
    public static final String METADATA_REASON = "reason";
    public static final String REASON_AFTER_TERMINATION = "after_terminating_statement";
    public static final String REASON_NO_LIVE_PATH = "no_live_path";

    private final ControlFlowGraphBuilder builder;
    private final int complexityThreshold;
    private final int nestingThreshold;

    /**
     * @param statistics null when no graph was built, for functions without implementation
     */
    public record Result(List<Finding> findings, FunctionStatistics statistics) {
    }

    public ControlFlowAnalyzer(ControlFlowGraphBuilder builder, int complexityThreshold, int nestingThreshold) {
        this.builder = builder;
        this.complexityThreshold = complexityThreshold;
        this.nestingThreshold = nestingThreshold;
    }

    public Result analyze(FunctionContext context) {
        IRFunction function = context.function();
        if (!function.isImplemented()) {
            return new Result(List.of(), null);
        }
        ControlFlowGraph cfg = builder.build(function);
        String name = context.qualifiedName();
        List<Finding> findings = new ArrayList<>();

        for (CFGNode node : Reachability.deadCode(cfg)) {
            boolean afterTermination = cfg.incoming(node.id()).isEmpty();
            findings.add(new Finding.Builder("unreachable_code_" + name + "_" + node.id())
                    .setTitle("Unreachable Code")
                    .setDescription("Code block in function " + name + " is unreachable")
                    .setSeverity(Severity.MEDIUM)
                    .setLocation(location(node, context))
                    .setCategory("dead_code")
                    .setDetector(DETECTOR)
                    .setRecommendation("Remove the unreachable statements, or fix the control flow that skips them")
                    .putMetadata(METADATA_REASON, afterTermination ? REASON_AFTER_TERMINATION : REASON_NO_LIVE_PATH)
                    .putMetadata("statements", node.statements().size())
                    .build());
        }

        for (Set<String> cycle : CycleAnalysis.detectCycles(cfg)) {
            if (!CycleAnalysis.hasExitCondition(cfg, cycle) && !CycleAnalysis.leavesFunction(cfg, cycle)) {
                String first = cycle.iterator().next();
                findings.add(new Finding.Builder("infinite_loop_" + name + "_" + first)
                        .setTitle("Potential Infinite Loop")
                        .setDescription("Function " + name + " contains a loop that can never be left")
                        .setSeverity(Severity.HIGH)
                        .setLocation(location(cfg.node(first), context))
                        .setCategory("infinite_loop")
                        .setDetector(DETECTOR)
                        .setConfidence(0.8)
                        .setRecommendation("Add a reachable exit condition or a break statement to the loop")
                        .putMetadata("nodes", List.copyOf(cycle))
                        .build());
            }
        }

        for (CFGNode exit : MissingReturn.exitNodesWithoutReturn(function, cfg)) {
            findings.add(new Finding.Builder("missing_return_" + name + "_" + exit.id())
                    .setTitle("Missing Return Statement")
                    .setDescription("Function " + name + " has an execution path without return statement")
                    .setSeverity(Severity.MEDIUM)
                    .setLocation(context.location())
                    .setCategory("missing_return")
                    .setDetector(DETECTOR)
                    .setRecommendation("Return a value on every path")
                    .build());
        }

        int complexity = ComplexityMetrics.cyclomaticComplexity(cfg);
        if (complexity > complexityThreshold) {
            findings.add(new Finding.Builder("high_complexity_" + name)
                    .setTitle("High Cyclomatic Complexity")
                    .setDescription("Function " + name + " has high cyclomatic complexity (" + complexity + ")")
                    .setSeverity(Severity.LOW)
                    .setLocation(context.location())
                    .setCategory("code_quality")
                    .setDetector(DETECTOR)
                    .setRecommendation("Split the function into smaller functions")
                    .putMetadata("complexity", complexity)
                    .putMetadata("threshold", complexityThreshold)
                    .build());
        }
        int nesting = ComplexityMetrics.maxNestingDepth(function);
        if (nesting > nestingThreshold) {
            findings.add(new Finding.Builder("deep_nesting_" + name)
                    .setTitle("Deep Nesting")
                    .setDescription("Function " + name + " has deep nesting level (" + nesting + ")")
                    .setSeverity(Severity.LOW)
                    .setLocation(context.location())
                    .setCategory("code_quality")
                    .setDetector(DETECTOR)
                    .setRecommendation("Use early returns or extract nested blocks into functions")
                    .putMetadata("nesting", nesting)
                    .putMetadata("threshold", nestingThreshold)
                    .build());
        }

        FunctionStatistics statistics = new FunctionStatistics(name, cfg.nodeCount(), cfg.edgeCount(), complexity,
                nesting, Reachability.unreachable(cfg).size());
        LOGGER.debug("{}: {}, {} findings", name, statistics, findings.size());
        return new Result(findings, statistics);
    }

    private static SourceLocation location(CFGNode node, FunctionContext context) {
        if (!node.isEmpty() && node.statements().get(0).sourceLocation() != null) {
            return node.statements().get(0).sourceLocation();
        }
        return context.location();
    }
}
