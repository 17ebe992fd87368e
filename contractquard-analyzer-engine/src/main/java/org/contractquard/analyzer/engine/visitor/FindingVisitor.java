package org.contractquard.analyzer.engine.visitor;

import org.contractquard.analyzer.engine.FunctionContext;
import org.contractquard.analyzer.engine.finding.Finding;
import org.contractquard.analyzer.ir.info.IRFunction;
import org.contractquard.analyzer.ir.visitor.IRVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * Base of the IR-level analyses. {@link #analyze(FunctionContext)} dispatches the function through
 * {@link IRFunction#accept(IRVisitor)}; {@link #visitFunction(IRFunction)} then hands it, together with its
 * owners, to {@link #checkFunction(FunctionContext)}. Analyses that walk the body override the statement or
 * expression callbacks and descend with {@link #visitChildren}.
 * <p>
 * Instances collect findings and are not thread-safe; use one per task.
 */
public abstract class FindingVisitor implements IRVisitor {
    protected final List<Finding> findings = new ArrayList<>();
    private FunctionContext owners;

    @Override
    public void visitFunction(IRFunction function) {
        if (owners == null) {
            throw new IllegalStateException("Function " + function + " visited outside analyze()");
        }
        checkFunction(new FunctionContext(owners.module(), owners.contract(), function));
    }

    protected abstract void checkFunction(FunctionContext context);

    public List<Finding> analyze(FunctionContext context) {
        owners = context;
        try {
            context.function().accept(this);
        } finally {
            owners = null;
        }
        return findings();
    }

    public List<Finding> findings() {
        return List.copyOf(findings);
    }
}
