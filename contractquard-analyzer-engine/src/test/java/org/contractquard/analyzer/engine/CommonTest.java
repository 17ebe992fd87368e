package org.contractquard.analyzer.engine;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.contractquard.analyzer.engine.finding.Finding;
import org.contractquard.analyzer.ir.IRFactory;
import org.contractquard.analyzer.ir.info.IRContract;
import org.contractquard.analyzer.ir.info.IRFunction;
import org.contractquard.analyzer.ir.info.IRModule;
import org.contractquard.analyzer.ir.info.Visibility;
import org.contractquard.analyzer.ir.statement.IRStatement;
import org.contractquard.analyzer.ir.type.IRType;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;

public class CommonTest {
    protected static final IRType UINT256 = IRType.primitive("uint256");
    protected static final IRType ADDRESS = IRType.primitive("address");

    protected IRFactory f;

    @BeforeAll
    public static void beforeAll() {
        ((Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME)).setLevel(Level.INFO);
        ((Logger) LoggerFactory.getLogger("org.contractquard.analyzer.engine")).setLevel(Level.DEBUG);
    }

    @BeforeEach
    public void beforeEach() {
        f = new IRFactory().at("Token.sol", 1);
    }

    protected IRFunction function(String name, IRStatement... statements) {
        return f.newFunctionBuilder(name).addStatements(List.of(statements)).build();
    }

    protected IRFunction function(String name, Visibility visibility, IRStatement... statements) {
        return f.newFunctionBuilder(name).setVisibility(visibility).addStatements(List.of(statements)).build();
    }

    protected IRContract contract(String name, IRFunction... functions) {
        IRContract.Builder builder = f.newContractBuilder(name);
        for (IRFunction function : functions) {
            if (function.isModifier()) builder.addModifier(function);
            else builder.addFunction(function);
        }
        return builder.build();
    }

    protected IRModule module(String name, IRContract... contracts) {
        IRModule.Builder builder = f.newModuleBuilder(name);
        for (IRContract contract : contracts) builder.addContract(contract);
        return builder.build();
    }

    protected FunctionContext context(IRModule module, IRContract contract, IRFunction function) {
        return new FunctionContext(module, contract, function);
    }

    // the module holding exactly the one contract, and the function at the given index
    protected FunctionContext context(IRContract contract, int functionIndex) {
        return new FunctionContext(module("Token.sol", contract), contract, contract.functions().get(functionIndex));
    }

    protected static List<String> ids(Collection<Finding> findings) {
        return findings.stream().map(Finding::id).toList();
    }
}
