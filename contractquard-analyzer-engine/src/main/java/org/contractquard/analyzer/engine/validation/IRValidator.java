package org.contractquard.analyzer.engine.validation;

import org.contractquard.analyzer.ir.info.IRContract;
import org.contractquard.analyzer.ir.info.IRFunction;
import org.contractquard.analyzer.ir.info.IRModule;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class IRValidator {

    private IRValidator() {
    }

    /**
     * Structural problems that do not stop the analysis: contract names declared in more than one module,
     * and functions without implementation in contracts that are neither abstract nor interfaces.
     */
    public static List<String> validate(List<IRModule> modules) {
        List<String> messages = new ArrayList<>();
        Map<String, String> contractToModule = new HashMap<>();
        for (IRModule module : modules) {
            for (IRContract contract : module.contracts()) {
                String previous = contractToModule.putIfAbsent(contract.name(), module.name());
                if (previous != null) {
                    messages.add("Contract " + contract.name() + " is declared in both " + previous + " and "
                                 + module.name());
                }
                if (contract.isInterface() || contract.isAbstract()) continue;
                for (IRFunction function : contract.functions()) {
                    if (!function.isImplemented() && !function.isConstructor()) {
                        messages.add("Function " + contract.name() + "::" + function.name()
                                     + " has no implementation in non-abstract contract " + contract.name());
                    }
                }
            }
        }
        return messages;
    }
}
