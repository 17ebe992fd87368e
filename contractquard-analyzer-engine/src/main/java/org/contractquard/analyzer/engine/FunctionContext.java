package org.contractquard.analyzer.engine;

import org.contractquard.analyzer.ir.element.SourceLocation;
import org.contractquard.analyzer.ir.info.IRContract;
import org.contractquard.analyzer.ir.info.IRFunction;
import org.contractquard.analyzer.ir.info.IRModule;

import java.util.Objects;

/**
 * A function together with its owners.
 *
 * @param contract null for a module-level function
 */
public record FunctionContext(IRModule module, IRContract contract, IRFunction function) {

    public FunctionContext {
        Objects.requireNonNull(module);
        Objects.requireNonNull(function);
    }

    public String contractName() {
        return contract == null ? "" : contract.name();
    }

    /**
     * {@code Contract::name(paramTypes)}; distinguishes overloads, and is used in finding identifiers.
     */
    public String qualifiedName() {
        return contractName() + "::" + function;
    }

    public SourceLocation location() {
        SourceLocation location = function.sourceLocation();
        return location != null ? location : SourceLocation.unknown(module.name());
    }

    @Override
    public String toString() {
        return qualifiedName();
    }
}
