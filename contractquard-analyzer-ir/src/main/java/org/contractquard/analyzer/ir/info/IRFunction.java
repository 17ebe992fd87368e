package org.contractquard.analyzer.ir.info;

import org.contractquard.analyzer.ir.element.IRNode;
import org.contractquard.analyzer.ir.element.NodeKind;
import org.contractquard.analyzer.ir.element.SourceLocation;
import org.contractquard.analyzer.ir.statement.IRStatement;
import org.contractquard.analyzer.ir.type.IRType;
import org.contractquard.analyzer.ir.visitor.IRVisitor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A function, constructor, fallback, or modifier. Modifiers carry the metadata flag
 * {@link #METADATA_MODIFIER}.
 * <p>
 * A function without an implementation (interface member, abstract declaration) has an empty body
 * and {@link #isImplemented()} false; an implemented function may still have an empty body.
 */
public final class IRFunction extends IRNode {
    public static final String METADATA_MODIFIER = "modifier";
    public static final String METADATA_RECEIVE = "receive";
    public static final String METADATA_NAMED_RETURN = "namedReturn";

    private final String name;
    private final List<IRParameter> parameters;
    private final IRType returnType;
    private final Visibility visibility;
    private final List<IRStatement> body;
    private final boolean implemented;
    private final boolean constructor;
    private final boolean fallback;
    private final boolean payable;
    private final boolean view;
    private final boolean pure;
    private final List<String> modifiers;

    private IRFunction(Builder b) {
        super(b.id, b.sourceLocation, b.metadata);
        this.name = Objects.requireNonNull(b.name);
        this.parameters = List.copyOf(b.parameters);
        this.returnType = b.returnType;
        this.visibility = b.visibility;
        this.body = List.copyOf(b.body);
        this.implemented = b.implemented;
        this.constructor = b.constructor;
        this.fallback = b.fallback;
        this.payable = b.payable;
        this.view = b.view;
        this.pure = b.pure;
        this.modifiers = List.copyOf(b.modifiers);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FUNCTION;
    }

    @Override
    public void accept(IRVisitor visitor) {
        visitor.visitFunction(this);
    }

    @Override
    public List<IRNode> children() {
        return List.copyOf(body);
    }

    public String name() {
        return name;
    }

    public List<IRParameter> parameters() {
        return parameters;
    }

    // null when the function returns nothing
    public IRType returnType() {
        return returnType;
    }

    public Visibility visibility() {
        return visibility;
    }

    public List<IRStatement> body() {
        return body;
    }

    public boolean isImplemented() {
        return implemented;
    }

    public boolean isConstructor() {
        return constructor;
    }

    public boolean isFallback() {
        return fallback;
    }

    public boolean isPayable() {
        return payable;
    }

    public boolean isView() {
        return view;
    }

    public boolean isPure() {
        return pure;
    }

    public boolean isModifier() {
        return hasMetadataFlag(METADATA_MODIFIER);
    }

    public List<String> modifiers() {
        return modifiers;
    }

    @Override
    public String toString() {
        return name + "(" + parameters.stream().map(p -> p.type().toString()).reduce((a, b) -> a + "," + b)
                .orElse("") + ")";
    }

    public static class Builder {
        private final String id;
        private String name;
        private final List<IRParameter> parameters = new ArrayList<>();
        private IRType returnType;
        private Visibility visibility = Visibility.PUBLIC;
        private final List<IRStatement> body = new ArrayList<>();
        private boolean implemented = true;
        private boolean constructor;
        private boolean fallback;
        private boolean payable;
        private boolean view;
        private boolean pure;
        private final List<String> modifiers = new ArrayList<>();
        private SourceLocation sourceLocation;
        private final Map<String, Object> metadata = new HashMap<>();

        public Builder(String id) {
            this.id = id;
        }

        public Builder setName(String name) {
            this.name = name;
            return this;
        }

        public Builder addParameter(IRParameter parameter) {
            parameters.add(parameter);
            return this;
        }

        public Builder setReturnType(IRType returnType) {
            this.returnType = returnType;
            return this;
        }

        public Builder setVisibility(Visibility visibility) {
            this.visibility = visibility;
            return this;
        }

        public Builder addStatement(IRStatement statement) {
            body.add(statement);
            return this;
        }

        public Builder addStatements(List<? extends IRStatement> statements) {
            body.addAll(statements);
            return this;
        }

        public Builder setImplemented(boolean implemented) {
            this.implemented = implemented;
            return this;
        }

        public Builder setConstructor(boolean constructor) {
            this.constructor = constructor;
            return this;
        }

        public Builder setFallback(boolean fallback) {
            this.fallback = fallback;
            return this;
        }

        public Builder setPayable(boolean payable) {
            this.payable = payable;
            return this;
        }

        public Builder setView(boolean view) {
            this.view = view;
            return this;
        }

        public Builder setPure(boolean pure) {
            this.pure = pure;
            return this;
        }

        public Builder addModifier(String modifier) {
            modifiers.add(modifier);
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

        public IRFunction build() {
            return new IRFunction(this);
        }
    }
}
