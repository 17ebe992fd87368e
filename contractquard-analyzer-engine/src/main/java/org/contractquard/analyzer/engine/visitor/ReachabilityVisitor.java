package org.contractquard.analyzer.engine.visitor;

import org.contractquard.analyzer.cfg.callgraph.CallGraph;
import org.contractquard.analyzer.engine.FunctionContext;
import org.contractquard.analyzer.engine.finding.Finding;
import org.contractquard.analyzer.engine.finding.Severity;
import org.contractquard.analyzer.ir.info.IRFunction;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Uses the call graph: private and internal functions nobody calls, and functions that take part in
 * (mutual) recursion.
 */
public class ReachabilityVisitor extends FindingVisitor {
    public static final String DETECTOR = "reachability_analyzer";

    private final CallGraph callGraph;
    private final Map<String, List<String>> recursiveComponentOf = new HashMap<>();

    public ReachabilityVisitor(CallGraph callGraph) {
        this.callGraph = callGraph;
        for (List<String> component : callGraph.recursiveComponents()) {
            for (String key : component) {
                recursiveComponentOf.put(key, component);
            }
        }
    }

    @Override
    protected void checkFunction(FunctionContext context) {
        IRFunction function = context.function();
        if (function.isModifier() || function.isConstructor() || function.isFallback()
            || function.hasMetadataFlag(IRFunction.METADATA_RECEIVE)) {
            return;
        }
        String key = CallGraph.key(context.contract() == null ? null : context.contractName(), function.name());
        String name = context.qualifiedName();
        if (function.visibility().isHidden() && function.isImplemented() && !callGraph.isCalled(key)) {
            findings.add(new Finding.Builder("unused_function_" + name)
                    .setTitle("Unused Private Function")
                    .setDescription(function.visibility().name().toLowerCase() + " function " + name
                                    + " is never called")
                    .setSeverity(Severity.LOW)
                    .setLocation(context.location())
                    .setCategory("dead_code")
                    .setDetector(DETECTOR)
                    .setRecommendation("Remove the function, or call it where it was meant to be used")
                    .build());
        }
        List<String> component = recursiveComponentOf.get(key);
        if (component != null) {
            findings.add(new Finding.Builder("recursive_call_" + name)
                    .setTitle("Recursive Call")
                    .setDescription(component.size() == 1
                            ? "Function " + name + " calls itself"
                            : "Function " + name + " is part of a call cycle: " + String.join(" -> ", component))
                    .setSeverity(Severity.INFO)
                    .setLocation(context.location())
                    .setCategory("recursion")
                    .setDetector(DETECTOR)
                    .setRecommendation("Make sure the recursion depth is bounded; gas and stack depth are limited")
                    .putMetadata("cycle", component)
                    .build());
        }
    }
}
