package org.contractquard.analyzer.engine.impl;

import org.contractquard.analyzer.cfg.ControlFlowGraphBuilder;
import org.contractquard.analyzer.cfg.impl.ControlFlowGraphBuilderImpl;
import org.contractquard.analyzer.engine.AnalysisEngine;
import org.contractquard.analyzer.engine.CommonTest;
import org.contractquard.analyzer.engine.controlflow.ControlFlowAnalyzer;
import org.contractquard.analyzer.engine.finding.Finding;
import org.contractquard.analyzer.engine.finding.Findings;
import org.contractquard.analyzer.engine.finding.Severity;
import org.contractquard.analyzer.engine.statistics.Statistics;
import org.contractquard.analyzer.engine.visitor.AccessControlVisitor;
import org.contractquard.analyzer.ir.AnalyzerException;
import org.contractquard.analyzer.ir.info.*;
import org.contractquard.analyzer.transform.Transformers;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.contractquard.analyzer.engine.AnalysisEngine.*;
import static org.junit.jupiter.api.Assertions.*;

public class TestAnalysisEngine extends CommonTest {

    /*
    contract Token {
        uint x;
        function withdraw() public { balances[msg.sender] = 0; return; x = 1; }
        function helper() private { }
        function spin() public onlyOwner { while (true) { x = x + 1; } }
        function total() public view returns (uint256) { return x; }
    }
     */
    private IRModule tokenModule() {
        IRFunction withdraw = function("withdraw",
                f.assign(f.index(f.identifier("balances"), f.msgSender()), f.number(0)),
                f.returnStatement(null),
                f.assign(f.identifier("x"), f.number(1)));
        IRFunction helper = function("helper", Visibility.PRIVATE);
        IRFunction spin = f.newFunctionBuilder("spin").addModifier("onlyOwner")
                .addStatement(f.whileLoop(f.bool(true), List.of(f.assign(f.identifier("x"),
                        f.binary(f.identifier("x"), "+", f.number(1)))))).build();
        IRFunction total = f.newFunctionBuilder("total").setView(true).setReturnType(UINT256)
                .addStatement(f.returnStatement(f.identifier("x"))).build();
        IRContract token = f.newContractBuilder("Token")
                .addVariable(f.newVariableBuilder("x", UINT256).build())
                .addFunction(withdraw).addFunction(helper).addFunction(spin).addFunction(total).build();
        return module("Token.sol", token);
    }

    private static AnalysisEngineImpl.ConfigurationBuilder configuration() {
        return new AnalysisEngineImpl.ConfigurationBuilder();
    }

    @Test
    @DisplayName("all analyses on one contract, merged and ordered")
    public void test1() {
        AnalysisEngine engine = new AnalysisEngineImpl(configuration().build());
        Output output = engine.analyze(List.of(tokenModule()));
        assertTrue(output.errors().isEmpty());
        assertTrue(output.warnings().isEmpty(), () -> "Got " + output.warnings());
        assertTrue(output.analyzerExceptions().isEmpty());
        assertFalse(output.timedOut());

        List<String> ids = ids(output.findings());
        assertEquals(Set.of("infinite_loop_Token::spin()_bb1", "unreachable_code_Token::withdraw()_bb1",
                "missing_access_control_Token::withdraw()", "dead_code_after_return_Token::withdraw()_"
                                                            + deadStatementId(output),
                "unused_function_Token::helper()"), Set.copyOf(ids));
        assertEquals(5, ids.size());
        assertEquals(Severity.HIGH, output.findings().get(0).severity());
        for (int i = 1; i < output.findings().size(); i++) {
            assertTrue(Findings.ORDER.compare(output.findings().get(i - 1), output.findings().get(i)) <= 0);
        }
    }

    private static String deadStatementId(Output output) {
        return output.findings().stream().map(Finding::id)
                .filter(id -> id.startsWith("dead_code_after_return_"))
                .map(id -> id.substring(id.lastIndexOf('_') + 1))
                .findFirst().orElseThrow();
    }

    @Test
    @DisplayName("statistics")
    public void test2() {
        AnalysisEngine engine = new AnalysisEngineImpl(configuration().build());
        IRModule rust = new IRModule.Builder("m").setName("lib.rs").build();
        Statistics statistics = engine.analyze(List.of(tokenModule(), rust)).statistics();
        assertEquals(2, statistics.modules());
        assertEquals(1, statistics.contracts());
        assertEquals(4, statistics.functions());
        assertEquals(1, statistics.variables());
        assertEquals(Set.of("solidity", "rust"), statistics.languages());
        assertEquals(ALL_ANALYSES, statistics.analysesRun());
        assertEquals(4, statistics.functionStatistics().size());
        // withdraw 0: the block after the return is not connected; helper, spin, total 1
        assertEquals(3, statistics.totalComplexity());
        assertEquals(0, statistics.minComplexity());
        assertEquals(1, statistics.maxComplexity());
        assertEquals(0.75, statistics.averageComplexity(), 1e-9);
        assertFalse(statistics.elapsed().isNegative());

        Statistics empty = engine.analyze(List.of()).statistics();
        assertEquals(0, empty.functions());
        assertEquals(0, empty.maxComplexity());
        assertEquals(0.0, empty.averageComplexity());
    }

    @Test
    @DisplayName("FAST mode runs control flow and access control only")
    public void test3() {
        AnalysisEngine engine = new AnalysisEngineImpl(configuration().setMode(AnalysisMode.FAST).build());
        Output output = engine.analyze(List.of(tokenModule()));
        assertEquals(Set.of(ControlFlowAnalyzer.DETECTOR, AccessControlVisitor.DETECTOR),
                Set.copyOf(output.findings().stream().map(Finding::detector).toList()));
    }

    @Test
    @DisplayName("a failing function does not stop the others")
    public void test4() {
        ControlFlowGraphBuilder delegate = new ControlFlowGraphBuilderImpl();
        ControlFlowGraphBuilder failing = function -> {
            if ("withdraw".equals(function.name())) throw new IllegalStateException("cannot build graph");
            return delegate.build(function);
        };
        AnalysisEngine engine = new AnalysisEngineImpl(configuration().build(), Transformers.defaults(), failing);
        Output output = engine.analyze(List.of(tokenModule()));

        assertEquals(1, output.analyzerExceptions().size());
        AnalyzerException exception = output.analyzerExceptions().get(0);
        assertInstanceOf(IllegalStateException.class, exception.getCause());
        assertEquals("withdraw", ((IRFunction) exception.getNode()).name());

        List<String> ids = ids(output.findings());
        assertTrue(ids.contains("analysis_error_Token::withdraw()"));
        assertTrue(ids.contains("infinite_loop_Token::spin()_bb1"));
        assertTrue(ids.contains("unused_function_Token::helper()"));
        Finding error = output.findings().stream().filter(fi -> fi.id().startsWith("analysis_error_"))
                .findFirst().orElseThrow();
        assertEquals(Severity.LOW, error.severity());
        assertEquals(AnalysisEngineImpl.DETECTOR, error.detector());
        assertEquals(3, output.statistics().functionStatistics().size());
    }

    @Test
    @DisplayName("parallel and sequential runs agree")
    public void test5() {
        List<IRModule> modules = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            IRContract.Builder builder = f.newContractBuilder("C" + i);
            for (int j = 0; j < 10; j++) {
                builder.addFunction(function("f" + j, Visibility.PRIVATE,
                        f.ifThen(f.identifier("c"), List.of(f.returnStatement(null))),
                        f.callStatement(f.call("f" + ((j + 1) % 10))),
                        f.returnStatement(null), f.assign(f.identifier("x"), f.number(j))));
            }
            modules.add(module("m" + i + ".sol", builder.build()));
        }
        Output sequential = new AnalysisEngineImpl(configuration().build()).analyze(modules);
        Output parallel = new AnalysisEngineImpl(configuration().setParallel(true).build()).analyze(modules);
        assertFalse(sequential.findings().isEmpty());
        assertEquals(sequential.findings(), parallel.findings());
        assertEquals(sequential.statistics().functionStatistics(), parallel.statistics().functionStatistics());
    }

    @Test
    @DisplayName("time budget exceeded")
    public void test6() {
        AnalysisEngine engine = new AnalysisEngineImpl(configuration().setMaxAnalysisTime(Duration.ofNanos(1))
                .build());
        Output output = engine.analyze(List.of(tokenModule()));
        assertTrue(output.timedOut());
        assertTrue(output.findings().isEmpty());
        assertEquals(1, output.warnings().size());
        assertTrue(output.warnings().get(0).contains("analyzed 0 of 4 functions"), output.warnings().get(0));
    }

    @Test
    @DisplayName("differing signatures of one function in two modules: one interface mismatch")
    public void test7() {
        IRFunction transfer2 = f.newFunctionBuilder("transfer").addParameter(new IRParameter("to", ADDRESS))
                .addParameter(new IRParameter("amount", UINT256)).setView(true).build();
        IRFunction transfer1 = f.newFunctionBuilder("transfer").addParameter(new IRParameter("to", ADDRESS))
                .setView(true).build();
        List<IRModule> modules = List.of(module("a.sol", contract("Token", transfer2)),
                module("b.sol", contract("Token", transfer1)));

        Output output = new AnalysisEngineImpl(configuration().build()).analyze(modules);
        List<Finding> mismatches = output.findings().stream()
                .filter(fi -> fi.id().startsWith("interface_mismatch_")).toList();
        assertEquals(1, mismatches.size());
        assertEquals("interface_mismatch_Token::transfer", mismatches.get(0).id());
        assertEquals(List.of("Contract Token is declared in both a.sol and b.sol"), output.warnings());

        Output off = new AnalysisEngineImpl(configuration().setCrossModuleAnalysis(false).build()).analyze(modules);
        assertTrue(off.findings().stream().noneMatch(fi -> fi.id().startsWith("interface_mismatch_")));
    }
}
