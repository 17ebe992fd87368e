package org.contractquard.analyzer.cfg.analysis;

import org.contractquard.analyzer.cfg.CFGNode;
import org.contractquard.analyzer.cfg.CommonTest;
import org.contractquard.analyzer.cfg.ControlFlowGraph;
import org.contractquard.analyzer.ir.info.IRFunction;
import org.contractquard.analyzer.ir.type.IRType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class TestGraphAnalyses extends CommonTest {

    @Test
    @DisplayName("while(true) forms a cycle without exit edge")
    public void test1() {
        IRFunction spin = function("spin", f.whileLoop(f.bool(true), List.of(increment("x"))));
        ControlFlowGraph cfg = builder.build(spin);
        List<Set<String>> cycles = CycleAnalysis.detectCycles(cfg);
        assertEquals(1, cycles.size());
        Set<String> cycle = cycles.get(0);
        assertEquals(Set.of("bb1", "bb2"), cycle);
        assertFalse(CycleAnalysis.hasExitCondition(cfg, cycle));
        assertFalse(CycleAnalysis.leavesFunction(cfg, cycle));
    }

    @Test
    @DisplayName("a bounded loop has an exit edge; a loop left by return leaves the function")
    public void test2() {
        IRFunction bounded = function("bounded", f.whileLoop(f.binary(f.identifier("i"), "<", f.number(10)),
                List.of(increment("i"))));
        ControlFlowGraph cfg = builder.build(bounded);
        Set<String> cycle = CycleAnalysis.detectCycles(cfg).get(0);
        assertTrue(CycleAnalysis.hasExitCondition(cfg, cycle));

        IRFunction returns = returning("search", f.whileLoop(f.bool(true),
                List.of(f.ifThen(f.identifier("found"), List.of(f.returnStatement(f.identifier("i")))),
                        increment("i"))));
        ControlFlowGraph cfg2 = builder.build(returns);
        Set<String> cycle2 = CycleAnalysis.detectCycles(cfg2).get(0);
        assertTrue(CycleAnalysis.leavesFunction(cfg2, cycle2));
    }

    @Test
    @DisplayName("unreachable statements after return; the function itself stays reachable")
    public void test3() {
        IRFunction function = returning("h", f.assign(f.identifier("y"), f.number(0)),
                f.returnStatement(f.number(1)), f.assign(f.identifier("x"), f.number(2)));
        ControlFlowGraph cfg = builder.build(function);
        assertEquals(Set.of("bb0"), Reachability.reachable(cfg));
        assertEquals(List.of("bb1"), Reachability.unreachable(cfg));
        List<CFGNode> dead = Reachability.deadCode(cfg);
        assertEquals(1, dead.size());
        assertEquals("x = 2;", dead.get(0).statements().get(0).toString());
    }

    @Test
    @DisplayName("merge block after two returning branches is dead when it holds statements")
    public void test4() {
        IRFunction function = returning("both", f.ifThenElse(f.identifier("c"),
                        List.of(f.returnStatement(f.number(1))), List.of(f.returnStatement(f.number(2)))),
                f.assign(f.identifier("x"), f.number(3)));
        ControlFlowGraph cfg = builder.build(function);
        assertTrue(Reachability.unreachable(cfg).isEmpty());
        List<CFGNode> dead = Reachability.deadCode(cfg);
        assertEquals(1, dead.size());
        assertEquals("bb3", dead.get(0).id());
        assertEquals(List.of("bb1", "bb2"), cfg.exitNodes());
    }

    @Test
    @DisplayName("cyclomatic complexity of nested branches")
    public void test5() {
        IRFunction function = function("nested", f.ifThen(f.identifier("a"),
                        List.of(f.ifThen(f.identifier("b"), List.of(increment("x"))))),
                f.ifThen(f.identifier("c"), List.of(increment("y"))));
        ControlFlowGraph cfg = builder.build(function);
        // 3 decisions
        assertEquals(4, ComplexityMetrics.cyclomaticComplexity(cfg));
        assertEquals(cfg.edgeCount() - cfg.nodeCount() + 2, ComplexityMetrics.cyclomaticComplexity(cfg));
        assertEquals(2, ComplexityMetrics.maxNestingDepth(function));
    }

    @Test
    @DisplayName("nesting depth counts if and loop bodies, not plain blocks")
    public void test6() {
        IRFunction flat = function("flat", increment("x"), f.block(List.of(increment("y"))));
        assertEquals(0, ComplexityMetrics.maxNestingDepth(flat));

        IRFunction deep = function("deep", f.block(List.of(f.ifThenElse(f.identifier("a"), List.of(),
                List.of(f.whileLoop(f.identifier("b"), List.of(f.forLoop(null, f.identifier("c"), null,
                        List.of(f.ifThen(f.identifier("d"), List.of(increment("x"))))))))))));
        assertEquals(4, ComplexityMetrics.maxNestingDepth(deep));

        IRFunction hollow = function("hollow", f.ifThenElse(f.identifier("a"), List.of(), List.of()),
                f.whileLoop(f.identifier("b"), List.of()),
                f.ifThen(f.identifier("c"), List.of(f.whileLoop(f.identifier("d"), List.of()))));
        assertEquals(1, ComplexityMetrics.maxNestingDepth(hollow));
    }

    @Test
    @DisplayName("exit nodes without a return are reported for non-void functions only")
    public void test7() {
        IRFunction partial = returning("partial", f.ifThen(f.identifier("c"),
                List.of(f.returnStatement(f.number(1)))));
        ControlFlowGraph cfg = builder.build(partial);
        List<CFGNode> missing = MissingReturn.exitNodesWithoutReturn(partial, cfg);
        assertEquals(1, missing.size());
        assertEquals("bb2", missing.get(0).id());

        IRFunction named = f.newFunctionBuilder("named").setReturnType(IRType.primitive("uint256"))
                .putMetadata(IRFunction.METADATA_NAMED_RETURN, true)
                .addStatement(f.assign(f.identifier("result"), f.number(1))).build();
        assertTrue(MissingReturn.exitNodesWithoutReturn(named, builder.build(named)).isEmpty());

        IRFunction noReturnType = function("v", increment("x"));
        assertTrue(MissingReturn.exitNodesWithoutReturn(noReturnType, builder.build(noReturnType)).isEmpty());

        IRFunction declared = f.newFunctionBuilder("declared").setReturnType(IRType.primitive("bool"))
                .setImplemented(false).build();
        assertTrue(MissingReturn.exitNodesWithoutReturn(declared, builder.build(declared)).isEmpty());
    }
}
