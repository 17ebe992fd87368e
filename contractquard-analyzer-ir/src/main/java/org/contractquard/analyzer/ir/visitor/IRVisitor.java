package org.contractquard.analyzer.ir.visitor;

import org.contractquard.analyzer.ir.element.IRNode;
import org.contractquard.analyzer.ir.expression.IRExpression;
import org.contractquard.analyzer.ir.info.IRContract;
import org.contractquard.analyzer.ir.info.IRFunction;
import org.contractquard.analyzer.ir.info.IRModule;
import org.contractquard.analyzer.ir.info.IRVariable;
import org.contractquard.analyzer.ir.statement.IRStatement;

/**
 * One callback per node kind, reached through {@link IRNode#accept(IRVisitor)}. Every default
 * implementation descends into the children in declaration order, so an implementation only
 * overrides the callbacks it is interested in; an override that still wants the children visited
 * calls {@link #visitChildren(IRNode)}.
 */
public interface IRVisitor {

    default void visitModule(IRModule module) {
        visitChildren(module);
    }

    default void visitContract(IRContract contract) {
        visitChildren(contract);
    }

    default void visitFunction(IRFunction function) {
        visitChildren(function);
    }

    default void visitVariable(IRVariable variable) {
        visitChildren(variable);
    }

    default void visitStatement(IRStatement statement) {
        visitChildren(statement);
    }

    default void visitExpression(IRExpression expression) {
        visitChildren(expression);
    }

    default void visitChildren(IRNode node) {
        for (IRNode child : node.children()) {
            child.accept(this);
        }
    }
}
