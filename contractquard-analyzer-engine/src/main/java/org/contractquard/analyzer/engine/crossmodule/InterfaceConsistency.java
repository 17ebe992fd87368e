package org.contractquard.analyzer.engine.crossmodule;

import org.contractquard.analyzer.engine.finding.Finding;
import org.contractquard.analyzer.engine.finding.Severity;
import org.contractquard.analyzer.ir.element.SourceLocation;
import org.contractquard.analyzer.ir.info.IRContract;
import org.contractquard.analyzer.ir.info.IRFunction;
import org.contractquard.analyzer.ir.info.IRModule;
import org.contractquard.analyzer.ir.info.IRParameter;
import org.contractquard.analyzer.ir.type.IRType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Exposed functions that share a {@code Contract::function} key across modules must agree on their
 * signature. Types are compared by name, without any unification between languages.
 */
public class InterfaceConsistency {
    private static final Logger LOGGER = LoggerFactory.getLogger(InterfaceConsistency.class);

    public static final String DETECTOR = "ir_analyzer";

    private record Declaration(IRModule module, IRFunction function) {
    }

    private InterfaceConsistency() {
    }

    /**
     * @return at most one finding per key; the first declaration encountered is the reference
     */
    public static List<Finding> check(List<IRModule> modules) {
        Map<String, Declaration> first = new HashMap<>();
        Set<String> reported = new HashSet<>();
        List<Finding> findings = new ArrayList<>();
        for (IRModule module : modules) {
            for (IRContract contract : module.contracts()) {
                for (IRFunction function : contract.functions()) {
                    if (!function.visibility().isExposed()) continue;
                    String key = contract.name() + "::" + function.name();
                    Declaration reference = first.putIfAbsent(key, new Declaration(module, function));
                    if (reference == null || reference.module == module || reported.contains(key)) continue;
                    if (!compatible(reference.function, function)) {
                        reported.add(key);
                        LOGGER.debug("Interface mismatch {}: {} in {} vs {} in {}", key, reference.function,
                                reference.module.name(), function, module.name());
                        findings.add(new Finding.Builder("interface_mismatch_" + key)
                                .setTitle("Interface Mismatch")
                                .setDescription("Function " + key + " has incompatible signatures across modules: "
                                                + reference.function + " in " + reference.module.name() + ", "
                                                + function + " in " + module.name())
                                .setSeverity(Severity.HIGH)
                                .setLocation(function.sourceLocation() != null ? function.sourceLocation()
                                        : SourceLocation.unknown(module.name()))
                                .setCategory("interface_consistency")
                                .setDetector(DETECTOR)
                                .setRecommendation("Keep the parameter and return types of shared functions in sync")
                                .putMetadata("modules", List.of(reference.module.name(), module.name()))
                                .build());
                    }
                }
            }
        }
        return findings;
    }

    /**
     * Same number of parameters, same type names position by position, and the same return type name, or
     * no return type on both sides.
     */
    public static boolean compatible(IRFunction f1, IRFunction f2) {
        List<IRParameter> p1 = f1.parameters();
        List<IRParameter> p2 = f2.parameters();
        if (p1.size() != p2.size()) return false;
        for (int i = 0; i < p1.size(); i++) {
            if (!typeName(p1.get(i).type()).equals(typeName(p2.get(i).type()))) return false;
        }
        IRType r1 = f1.returnType();
        IRType r2 = f2.returnType();
        if (r1 == null || r2 == null) return r1 == r2;
        return typeName(r1).equals(typeName(r2));
    }

    private static String typeName(IRType type) {
        return type == null ? "" : type.name();
    }
}
