package org.contractquard.analyzer.ir.visitor;

import org.contractquard.analyzer.ir.CommonTest;
import org.contractquard.analyzer.ir.element.IRNode;
import org.contractquard.analyzer.ir.expression.IRExpression;
import org.contractquard.analyzer.ir.expression.Identifier;
import org.contractquard.analyzer.ir.info.IRFunction;
import org.contractquard.analyzer.ir.info.IRModule;
import org.contractquard.analyzer.ir.info.IRVariable;
import org.contractquard.analyzer.ir.statement.IRStatement;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class TestIRVisitor extends CommonTest {

    @Test
    @DisplayName("default callbacks recurse in declaration order")
    public void test1() {
        IRModule module = tokenModule();
        List<String> seen = new ArrayList<>();
        module.accept(new IRVisitor() {
            @Override
            public void visitFunction(IRFunction function) {
                seen.add("f:" + function.name());
                visitChildren(function);
            }

            @Override
            public void visitVariable(IRVariable variable) {
                seen.add("v:" + variable.name());
            }

            @Override
            public void visitExpression(IRExpression expression) {
                if (expression instanceof Identifier id) seen.add("i:" + id.name());
                visitChildren(expression);
            }
        });
        assertEquals("[v:total, f:mint, i:amount, i:total, i:amount, f:get, i:total]", seen.toString());
    }

    @Test
    @DisplayName("an override without visitChildren stops the descent")
    public void test2() {
        IRModule module = tokenModule();
        List<String> functions = new ArrayList<>();
        int[] statements = new int[1];
        module.accept(new IRVisitor() {
            @Override
            public void visitFunction(IRFunction function) {
                functions.add(function.name());
            }

            @Override
            public void visitStatement(IRStatement statement) {
                statements[0]++;
            }
        });
        assertEquals(List.of("mint", "get"), functions);
        assertEquals(0, statements[0]);
    }

    @Test
    @DisplayName("iterative walk handles very deep trees")
    public void test3() {
        IRExpression e = f.identifier("x");
        for (int i = 0; i < 100_000; i++) {
            e = f.binary(e, "+", f.number(1));
        }
        int[] count = new int[1];
        IRNode root = e;
        root.visit(n -> {
            count[0]++;
            return true;
        });
        assertEquals(200_001, count[0]);
    }
}
