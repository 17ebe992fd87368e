package org.contractquard.analyzer.ir.info;

import org.contractquard.analyzer.ir.element.NodeKind;
import org.contractquard.analyzer.ir.expression.IRExpression;
import org.contractquard.analyzer.ir.type.IRType;

import java.util.List;
import java.util.Objects;

/**
 * @param defaultValue may be null
 * @param annotations  language specific markers, e.g. a data location or {@code indexed}
 */
public record IRParameter(String name, IRType type, boolean mutable, IRExpression defaultValue,
                          List<String> annotations) {

    public IRParameter {
        Objects.requireNonNull(name);
        Objects.requireNonNull(type);
        annotations = annotations == null ? List.of() : List.copyOf(annotations);
    }

    public IRParameter(String name, IRType type) {
        this(name, type, true, null, List.of());
    }

    public NodeKind kind() {
        return NodeKind.PARAMETER;
    }
}
