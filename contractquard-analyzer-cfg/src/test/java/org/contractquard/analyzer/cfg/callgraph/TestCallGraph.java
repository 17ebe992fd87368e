package org.contractquard.analyzer.cfg.callgraph;

import org.contractquard.analyzer.cfg.CommonTest;
import org.contractquard.analyzer.cfg.EdgeKind;
import org.contractquard.analyzer.cfg.GraphEdge;
import org.contractquard.analyzer.ir.info.IRContract;
import org.contractquard.analyzer.ir.info.IRFunction;
import org.contractquard.analyzer.ir.info.IRModule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class TestCallGraph extends CommonTest {

    /*
    function helper() {}
    contract Token is Base {
        modifier onlyOwner() { require(msg.sender == owner); _; }
        function a() { b(); e(); }
        function b() { a(); this.c(); }
        function c() { c(); helper(); token.transfer(); }
        function d() onlyOwner { }
    }
    // Base.sol
    contract Base { function e() { } }
     */
    private List<IRModule> modules() {
        IRFunction helper = function("helper");
        IRFunction onlyOwner = f.newFunctionBuilder("onlyOwner").putMetadata(IRFunction.METADATA_MODIFIER, true)
                .addStatement(f.require(f.binary(f.msgSender(), "==", f.identifier("owner")))).build();
        IRFunction a = function("a", f.callStatement(f.call("b")), f.callStatement(f.call("e")));
        IRFunction b = function("b", f.callStatement(f.call("a")),
                f.callStatement(f.memberCall(f.identifier("this"), "c")));
        IRFunction c = function("c", f.callStatement(f.call("c")), f.callStatement(f.call("helper")),
                f.callStatement(f.memberCall(f.identifier("token"), "transfer")));
        IRFunction d = f.newFunctionBuilder("d").addModifier("onlyOwner").build();
        IRContract token = f.newContractBuilder("Token").addInheritance("Base").addModifier(onlyOwner)
                .addFunction(a).addFunction(b).addFunction(c).addFunction(d).build();
        IRModule tokenModule = f.newModuleBuilder("Token.sol").addFunction(helper).addContract(token).build();

        IRContract base = f.newContractBuilder("Base").addFunction(function("e")).build();
        IRModule baseModule = f.newModuleBuilder("Base.sol").addContract(base).build();
        return List.of(tokenModule, baseModule);
    }

    @Test
    @DisplayName("vertices and resolved call edges")
    public void test1() {
        CallGraph callGraph = new CallGraphBuilder().build(modules());
        assertEquals(List.of("::helper", "Token::onlyOwner", "Token::a", "Token::b", "Token::c", "Token::d",
                "Base::e"), List.copyOf(callGraph.vertices()));
        assertEquals(Set.of("Token::b", "Base::e"), callGraph.callees("Token::a"));
        assertEquals(Set.of("Token::a", "Token::c"), callGraph.callees("Token::b"));
        assertEquals(Set.of("Token::c", "::helper"), callGraph.callees("Token::c"));
        assertEquals(Set.of("Token::onlyOwner"), callGraph.callees("Token::d"));
        assertTrue(callGraph.edges().stream().allMatch(e -> e.kind() == EdgeKind.CALL));
        assertTrue(callGraph.edges().contains(new GraphEdge("Token::d", "Token::onlyOwner", EdgeKind.CALL)));

        assertTrue(callGraph.isCalled("Base::e"));
        assertFalse(callGraph.isCalled("Token::d"));
        assertEquals(Set.of("Token::b"), callGraph.callers("Token::a"));
        assertEquals(1, callGraph.functions("Token::a").size());
        assertTrue(callGraph.functions("Token::transfer").isEmpty());
    }

    @Test
    @DisplayName("mutual and direct recursion")
    public void test2() {
        CallGraph callGraph = new CallGraphBuilder().build(modules());
        List<List<String>> recursive = callGraph.recursiveComponents();
        assertEquals(2, recursive.size());
        Set<Set<String>> asSets = new HashSet<>();
        recursive.forEach(component -> asSets.add(Set.copyOf(component)));
        assertEquals(Set.of(Set.of("Token::a", "Token::b"), Set.of("Token::c")), asSets);
    }

    @Test
    @DisplayName("no modules, no vertices")
    public void test3() {
        CallGraph callGraph = new CallGraphBuilder().build(List.of());
        assertTrue(callGraph.vertices().isEmpty());
        assertTrue(callGraph.recursiveComponents().isEmpty());
    }

    /*
    library SafeMath { function add(a, b) { } function sub(a, b) { } }
    contract Base { function hook() { } function step() { } }
    contract Child is Base {
        using SafeMath for uint256;
        function hook() { super.hook(); }
        function run(a, b) { SafeMath.add(a, b); a.sub(b); Base.step(); hook(); }
    }
     */
    @Test
    @DisplayName("super, contract-qualified and library member calls")
    public void test4() {
        IRContract safeMath = f.newContractBuilder("SafeMath")
                .putMetadata(IRContract.METADATA_CONTRACT_KIND, IRContract.LIBRARY)
                .addFunction(function("add")).addFunction(function("sub")).build();
        IRContract base = f.newContractBuilder("Base").addFunction(function("hook")).addFunction(function("step"))
                .build();
        IRFunction hook = function("hook", f.callStatement(f.memberCall(f.identifier("super"), "hook")));
        IRFunction run = function("run",
                f.callStatement(f.memberCall(f.identifier("SafeMath"), "add", f.identifier("a"), f.identifier("b"))),
                f.callStatement(f.memberCall(f.identifier("a"), "sub", f.identifier("b"))),
                f.callStatement(f.memberCall(f.identifier("Base"), "step")),
                f.callStatement(f.call("hook")));
        IRContract child = f.newContractBuilder("Child").addInheritance("Base").addFunction(hook).addFunction(run)
                .build();
        IRModule module = f.newModuleBuilder("Child.sol").addContract(safeMath).addContract(base).addContract(child)
                .build();

        assertTrue(safeMath.isLibrary());
        assertFalse(child.isLibrary());
        CallGraph callGraph = new CallGraphBuilder().build(List.of(module));
        assertEquals(Set.of("Base::hook"), callGraph.callees("Child::hook"));
        assertEquals(Set.of("SafeMath::add", "SafeMath::sub", "Base::step", "Child::hook"),
                callGraph.callees("Child::run"));
        assertTrue(callGraph.isCalled("SafeMath::add"));
        assertTrue(callGraph.isCalled("Base::hook"));
        assertTrue(callGraph.recursiveComponents().isEmpty());
    }

    @Test
    @DisplayName("member calls on a variable ignore functions of ordinary contracts")
    public void test5() {
        IRContract vault = f.newContractBuilder("Vault").addFunction(function("transfer")).build();
        IRContract user = f.newContractBuilder("User")
                .addFunction(function("pay", f.callStatement(f.memberCall(f.identifier("vault"), "transfer"))))
                .build();
        IRModule module = f.newModuleBuilder("User.sol").addContract(vault).addContract(user).build();
        CallGraph callGraph = new CallGraphBuilder().build(List.of(module));
        assertTrue(callGraph.callees("User::pay").isEmpty());
        assertFalse(callGraph.isCalled("Vault::transfer"));
    }
}
