package org.contractquard.analyzer.ir.statement;

import org.contractquard.analyzer.ir.element.IRNode;
import org.contractquard.analyzer.ir.element.SourceLocation;
import org.contractquard.analyzer.ir.expression.FunctionCall;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A function call evaluated for its effect. Event emission is a call statement with metadata
 * {@link #METADATA_EMIT}. A call to {@code revert} leaves the function abnormally.
 */
public final class CallStatement extends IRStatement {
    public static final String METADATA_EMIT = "emit";

    private final FunctionCall call;

    public CallStatement(String id, SourceLocation sourceLocation, Map<String, Object> metadata, FunctionCall call) {
        super(id, sourceLocation, metadata);
        this.call = Objects.requireNonNull(call);
    }

    @Override
    public StatementKind statementKind() {
        return StatementKind.FUNCTION_CALL;
    }

    @Override
    public boolean interruptsFlow() {
        return isAbnormalExit();
    }

    @Override
    public boolean isAbnormalExit() {
        return !call.external() && "revert".equals(call.functionName());
    }

    @Override
    public List<IRNode> children() {
        return List.of(call);
    }

    public FunctionCall call() {
        return call;
    }

    public boolean isEmit() {
        return hasMetadataFlag(METADATA_EMIT);
    }

    @Override
    public String toString() {
        return (isEmit() ? "emit " : "") + call + ";";
    }
}
