package org.contractquard.analyzer.ir.info;

import org.contractquard.analyzer.ir.element.IRNode;
import org.contractquard.analyzer.ir.element.NodeKind;
import org.contractquard.analyzer.ir.element.SourceLocation;
import org.contractquard.analyzer.ir.visitor.IRVisitor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A contract, interface or library. Modifier definitions are kept apart from the functions so that
 * function-level analyses do not treat them as callable entry points.
 */
public final class IRContract extends IRNode {
    public static final String METADATA_CONTRACT_KIND = "contractKind";
    public static final String LIBRARY = "library";

    private final String name;
    private final List<IRFunction> functions;
    private final List<IRFunction> modifiers;
    private final List<IRVariable> variables;
    private final List<String> inheritance;
    private final List<String> interfaces;
    private final boolean isAbstract;
    private final boolean isInterface;

    private IRContract(Builder b) {
        super(b.id, b.sourceLocation, b.metadata);
        this.name = Objects.requireNonNull(b.name);
        this.functions = List.copyOf(b.functions);
        this.modifiers = List.copyOf(b.modifiers);
        this.variables = List.copyOf(b.variables);
        this.inheritance = List.copyOf(b.inheritance);
        this.interfaces = List.copyOf(b.interfaces);
        this.isAbstract = b.isAbstract;
        this.isInterface = b.isInterface;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CONTRACT;
    }

    @Override
    public void accept(IRVisitor visitor) {
        visitor.visitContract(this);
    }

    @Override
    public List<IRNode> children() {
        List<IRNode> list = new ArrayList<>(variables.size() + functions.size() + modifiers.size());
        list.addAll(variables);
        list.addAll(modifiers);
        list.addAll(functions);
        return List.copyOf(list);
    }

    public String name() {
        return name;
    }

    public List<IRFunction> functions() {
        return functions;
    }

    public List<IRFunction> modifiers() {
        return modifiers;
    }

    public Optional<IRFunction> findModifier(String modifierName) {
        return modifiers.stream().filter(m -> m.name().equals(modifierName)).findFirst();
    }

    public List<IRVariable> variables() {
        return variables;
    }

    public List<String> inheritance() {
        return inheritance;
    }

    public List<String> interfaces() {
        return interfaces;
    }

    public boolean isAbstract() {
        return isAbstract;
    }

    public boolean isInterface() {
        return isInterface;
    }

    public boolean isLibrary() {
        return LIBRARY.equals(metadata().get(METADATA_CONTRACT_KIND));
    }

    @Override
    public String toString() {
        return name;
    }

    public static class Builder {
        private final String id;
        private String name;
        private final List<IRFunction> functions = new ArrayList<>();
        private final List<IRFunction> modifiers = new ArrayList<>();
        private final List<IRVariable> variables = new ArrayList<>();
        private final List<String> inheritance = new ArrayList<>();
        private final List<String> interfaces = new ArrayList<>();
        private boolean isAbstract;
        private boolean isInterface;
        private SourceLocation sourceLocation;
        private final Map<String, Object> metadata = new HashMap<>();

        public Builder(String id) {
            this.id = id;
        }

        public Builder setName(String name) {
            this.name = name;
            return this;
        }

        public Builder addFunction(IRFunction function) {
            functions.add(function);
            return this;
        }

        public Builder addModifier(IRFunction modifier) {
            modifiers.add(modifier);
            return this;
        }

        public Builder addVariable(IRVariable variable) {
            variables.add(variable);
            return this;
        }

        public Builder addInheritance(String baseName) {
            inheritance.add(baseName);
            return this;
        }

        public Builder addInterface(String interfaceName) {
            interfaces.add(interfaceName);
            return this;
        }

        public Builder setAbstract(boolean isAbstract) {
            this.isAbstract = isAbstract;
            return this;
        }

        public Builder setInterface(boolean isInterface) {
            this.isInterface = isInterface;
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

        public IRContract build() {
            return new IRContract(this);
        }
    }
}
