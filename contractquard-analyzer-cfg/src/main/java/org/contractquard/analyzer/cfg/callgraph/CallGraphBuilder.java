package org.contractquard.analyzer.cfg.callgraph;

import org.contractquard.analyzer.cfg.EdgeKind;
import org.contractquard.analyzer.cfg.GraphEdge;
import org.contractquard.analyzer.ir.expression.FunctionCall;
import org.contractquard.analyzer.ir.expression.Identifier;
import org.contractquard.analyzer.ir.info.IRContract;
import org.contractquard.analyzer.ir.info.IRFunction;
import org.contractquard.analyzer.ir.info.IRModule;
import org.contractquard.analyzer.ir.statement.IRStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * A call {@code f(...)} or {@code this.f(...)} inside a contract resolves to a function or modifier named
 * {@code f} of that contract, then of its base contracts (looked up by name over all modules, nearest base
 * first), and finally to a module-level function of the same module. {@code super.f(...)} skips the calling
 * contract itself; {@code C.f(...)} resolves in contract or library {@code C}. A member call on any other
 * base counts as a call to every library function named {@code f}, the way {@code using L for T} attaches
 * them. Remaining member calls are external and do not produce edges. A modifier invocation counts as a call
 * from the function to the modifier.
 */
public class CallGraphBuilder {
    private static final Logger LOGGER = LoggerFactory.getLogger(CallGraphBuilder.class);

    public CallGraph build(List<IRModule> modules) {
        Map<String, IRContract> contractsByName = new HashMap<>();
        for (IRModule module : modules) {
            for (IRContract contract : module.contracts()) {
                contractsByName.putIfAbsent(contract.name(), contract);
            }
        }
        Map<String, List<IRFunction>> vertices = new LinkedHashMap<>();
        for (IRModule module : modules) {
            for (IRFunction function : module.functions()) {
                vertices.computeIfAbsent(CallGraph.key(null, function.name()), k -> new ArrayList<>()).add(function);
            }
            for (IRContract contract : module.contracts()) {
                for (IRFunction function : contract.modifiers()) {
                    vertices.computeIfAbsent(CallGraph.key(contract.name(), function.name()), k -> new ArrayList<>())
                            .add(function);
                }
                for (IRFunction function : contract.functions()) {
                    vertices.computeIfAbsent(CallGraph.key(contract.name(), function.name()), k -> new ArrayList<>())
                            .add(function);
                }
            }
        }
        Set<GraphEdge> edges = new LinkedHashSet<>();
        for (IRModule module : modules) {
            Set<String> moduleFunctions = new HashSet<>();
            module.functions().forEach(f -> moduleFunctions.add(f.name()));
            for (IRFunction function : module.functions()) {
                addCalls(CallGraph.key(null, function.name()), function, null, contractsByName, moduleFunctions,
                        edges);
            }
            for (IRContract contract : module.contracts()) {
                List<IRFunction> all = new ArrayList<>(contract.modifiers());
                all.addAll(contract.functions());
                for (IRFunction function : all) {
                    String from = CallGraph.key(contract.name(), function.name());
                    addCalls(from, function, contract, contractsByName, moduleFunctions, edges);
                }
            }
        }
        CallGraph callGraph = new CallGraph(vertices, new ArrayList<>(edges));
        LOGGER.debug("Call graph: {} vertices, {} edges", vertices.size(), edges.size());
        return callGraph;
    }

    private static void addCalls(String from, IRFunction function, IRContract contract,
                                 Map<String, IRContract> contractsByName, Set<String> moduleFunctions,
                                 Set<GraphEdge> edges) {
        for (String modifier : function.modifiers()) {
            String to = resolve(modifier, contract, contractsByName, moduleFunctions);
            if (to != null) edges.add(new GraphEdge(from, to, EdgeKind.CALL));
        }
        for (IRStatement statement : function.body()) {
            statement.visit(node -> {
                if (node instanceof FunctionCall call) {
                    for (String to : targets(call, contract, contractsByName, moduleFunctions)) {
                        edges.add(new GraphEdge(from, to, EdgeKind.CALL));
                    }
                }
                return true;
            });
        }
    }

    private static List<String> targets(FunctionCall call, IRContract contract,
                                        Map<String, IRContract> contractsByName, Set<String> moduleFunctions) {
        String name = call.functionName();
        String baseName = call.base() instanceof Identifier id ? id.name() : null;
        if (call.base() == null || "this".equals(baseName)) {
            String to = resolve(name, contract, contractsByName, moduleFunctions);
            return to == null ? List.of() : List.of(to);
        }
        if ("super".equals(baseName)) {
            if (contract == null) return List.of();
            String to = resolveInHierarchy(name, bases(contract, contractsByName), contractsByName);
            return to == null ? List.of() : List.of(to);
        }
        IRContract named = baseName == null ? null : contractsByName.get(baseName);
        if (named != null) {
            String to = resolveInHierarchy(name, List.of(named), contractsByName);
            return to == null ? List.of() : List.of(to);
        }
        return contractsByName.values().stream()
                .filter(c -> c.isLibrary() && declares(c, name))
                .map(c -> CallGraph.key(c.name(), name))
                .sorted()
                .toList();
    }

    private static String resolve(String name, IRContract contract, Map<String, IRContract> contractsByName,
                                  Set<String> moduleFunctions) {
        if (contract != null) {
            String to = resolveInHierarchy(name, List.of(contract), contractsByName);
            if (to != null) return to;
        }
        if (moduleFunctions.contains(name)) return CallGraph.key(null, name);
        return null;
    }

    private static String resolveInHierarchy(String name, List<IRContract> start,
                                             Map<String, IRContract> contractsByName) {
        Set<String> seen = new HashSet<>();
        Deque<IRContract> queue = new ArrayDeque<>(start);
        while (!queue.isEmpty()) {
            IRContract c = queue.poll();
            if (!seen.add(c.name())) continue;
            if (declares(c, name)) return CallGraph.key(c.name(), name);
            queue.addAll(bases(c, contractsByName));
        }
        return null;
    }

    // linearization puts the most derived base last
    private static List<IRContract> bases(IRContract contract, Map<String, IRContract> contractsByName) {
        List<IRContract> bases = new ArrayList<>();
        List<String> names = new ArrayList<>(contract.inheritance());
        Collections.reverse(names);
        for (String base : names) {
            IRContract b = contractsByName.get(base);
            if (b != null) bases.add(b);
        }
        return bases;
    }

    private static boolean declares(IRContract contract, String name) {
        return contract.functions().stream().anyMatch(f -> f.name().equals(name))
               || contract.modifiers().stream().anyMatch(m -> m.name().equals(name));
    }
}
