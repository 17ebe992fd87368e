package org.contractquard.analyzer.ir.info;

import org.contractquard.analyzer.ir.element.IRNode;
import org.contractquard.analyzer.ir.element.NodeKind;
import org.contractquard.analyzer.ir.element.SourceLocation;
import org.contractquard.analyzer.ir.expression.IRExpression;
import org.contractquard.analyzer.ir.type.IRType;
import org.contractquard.analyzer.ir.visitor.IRVisitor;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class IRVariable extends IRNode {
    private final String name;
    private final IRType type;
    private final Visibility visibility;
    private final boolean mutable;
    private final boolean constant;
    private final boolean isStatic;
    private final IRExpression initialValue;

    private IRVariable(Builder b) {
        super(b.id, b.sourceLocation, b.metadata);
        this.name = Objects.requireNonNull(b.name);
        this.type = b.type == null ? IRType.UNKNOWN : b.type;
        this.visibility = b.visibility;
        this.mutable = b.mutable;
        this.constant = b.constant;
        this.isStatic = b.isStatic;
        this.initialValue = b.initialValue;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.VARIABLE;
    }

    @Override
    public void accept(IRVisitor visitor) {
        visitor.visitVariable(this);
    }

    @Override
    public List<IRNode> children() {
        return initialValue == null ? List.of() : List.of(initialValue);
    }

    public String name() {
        return name;
    }

    public IRType type() {
        return type;
    }

    public Visibility visibility() {
        return visibility;
    }

    public boolean isMutable() {
        return mutable;
    }

    public boolean isConstant() {
        return constant;
    }

    public boolean isStatic() {
        return isStatic;
    }

    public IRExpression initialValue() {
        return initialValue;
    }

    @Override
    public String toString() {
        return type + " " + name;
    }

    public static class Builder {
        private final String id;
        private String name;
        private IRType type;
        private Visibility visibility = Visibility.INTERNAL;
        private boolean mutable = true;
        private boolean constant;
        private boolean isStatic;
        private IRExpression initialValue;
        private SourceLocation sourceLocation;
        private final Map<String, Object> metadata = new HashMap<>();

        public Builder(String id) {
            this.id = id;
        }

        public Builder setName(String name) {
            this.name = name;
            return this;
        }

        public Builder setType(IRType type) {
            this.type = type;
            return this;
        }

        public Builder setVisibility(Visibility visibility) {
            this.visibility = visibility;
            return this;
        }

        public Builder setMutable(boolean mutable) {
            this.mutable = mutable;
            return this;
        }

        public Builder setConstant(boolean constant) {
            this.constant = constant;
            return this;
        }

        public Builder setStatic(boolean isStatic) {
            this.isStatic = isStatic;
            return this;
        }

        public Builder setInitialValue(IRExpression initialValue) {
            this.initialValue = initialValue;
            return this;
        }

        public Builder setSourceLocation(SourceLocation sourceLocation) {
            this.sourceLocation = sourceLocation;
            return this;
        }

        public Builder putMetadata(String key, Object value) {
            if (value != null) metadata.put(key, value);
            return this;
        }

        public IRVariable build() {
            return new IRVariable(this);
        }
    }
}
