package org.contractquard.analyzer.engine.crossmodule;

import org.contractquard.analyzer.engine.CommonTest;
import org.contractquard.analyzer.engine.finding.Finding;
import org.contractquard.analyzer.engine.finding.Severity;
import org.contractquard.analyzer.ir.info.IRFunction;
import org.contractquard.analyzer.ir.info.IRModule;
import org.contractquard.analyzer.ir.info.IRParameter;
import org.contractquard.analyzer.ir.info.Visibility;
import org.contractquard.analyzer.ir.type.IRType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TestInterfaceConsistency extends CommonTest {

    private IRFunction transfer(IRType... parameterTypes) {
        IRFunction.Builder builder = f.newFunctionBuilder("transfer").setReturnType(IRType.primitive("bool"));
        for (int i = 0; i < parameterTypes.length; i++) {
            builder.addParameter(new IRParameter("p" + i, parameterTypes[i]));
        }
        return builder.build();
    }

    @Test
    @DisplayName("differing parameter counts: exactly one finding for the key")
    public void test1() {
        IRModule a = module("a.sol", contract("Token", transfer(ADDRESS, UINT256)));
        IRModule b = module("b.sol", contract("Token", transfer(ADDRESS)));
        IRModule c = module("c.sol", contract("Token", transfer()));
        List<Finding> findings = InterfaceConsistency.check(List.of(a, b, c));
        assertEquals(1, findings.size());
        Finding finding = findings.get(0);
        assertEquals("interface_mismatch_Token::transfer", finding.id());
        assertEquals(Severity.HIGH, finding.severity());
        assertEquals("interface_consistency", finding.category());
        assertEquals(InterfaceConsistency.DETECTOR, finding.detector());
        assertEquals(List.of("a.sol", "b.sol"), finding.metadata().get("modules"));
    }

    @Test
    @DisplayName("same signatures, overloads within one module, hidden functions: no finding")
    public void test2() {
        IRModule a = module("a.sol", contract("Token", transfer(ADDRESS, UINT256), transfer(ADDRESS)));
        IRModule b = module("b.sol", contract("Token", transfer(ADDRESS, UINT256)));
        assertTrue(InterfaceConsistency.check(List.of(a, b)).isEmpty());

        IRFunction hidden = f.newFunctionBuilder("transfer").setVisibility(Visibility.INTERNAL).build();
        IRModule c = module("c.sol", contract("Token", hidden));
        assertTrue(InterfaceConsistency.check(List.of(a, c)).isEmpty());
    }

    @Test
    @DisplayName("type names are compared literally")
    public void test3() {
        IRFunction u256 = transfer(UINT256);
        IRFunction u128 = transfer(IRType.primitive("u128"));
        assertFalse(InterfaceConsistency.compatible(u256, u128));
        assertTrue(InterfaceConsistency.compatible(u256, transfer(IRType.primitive("uint256"))));

        IRFunction noReturn = f.newFunctionBuilder("transfer").addParameter(new IRParameter("p0", UINT256)).build();
        assertFalse(InterfaceConsistency.compatible(u256, noReturn));
        assertTrue(InterfaceConsistency.compatible(noReturn, noReturn));
    }
}
