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

/**
 * Top-level owner: one module per source file. The name is the file path.
 */
public final class IRModule extends IRNode {
    private final String name;
    private final List<IRContract> contracts;
    private final List<IRFunction> functions;
    private final List<IRVariable> variables;
    private final List<String> imports;
    private final List<String> exports;

    private IRModule(Builder b) {
        super(b.id, b.sourceLocation, b.metadata);
        this.name = Objects.requireNonNull(b.name);
        this.contracts = List.copyOf(b.contracts);
        this.functions = List.copyOf(b.functions);
        this.variables = List.copyOf(b.variables);
        this.imports = List.copyOf(b.imports);
        this.exports = List.copyOf(b.exports);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.MODULE;
    }

    @Override
    public void accept(IRVisitor visitor) {
        visitor.visitModule(this);
    }

    @Override
    public List<IRNode> children() {
        List<IRNode> list = new ArrayList<>(contracts.size() + functions.size() + variables.size());
        list.addAll(contracts);
        list.addAll(functions);
        list.addAll(variables);
        return List.copyOf(list);
    }

    public String name() {
        return name;
    }

    public List<IRContract> contracts() {
        return contracts;
    }

    public List<IRFunction> functions() {
        return functions;
    }

    public List<IRVariable> variables() {
        return variables;
    }

    public List<String> imports() {
        return imports;
    }

    public List<String> exports() {
        return exports;
    }

    @Override
    public String toString() {
        return name;
    }

    public static class Builder {
        private final String id;
        private String name;
        private final List<IRContract> contracts = new ArrayList<>();
        private final List<IRFunction> functions = new ArrayList<>();
        private final List<IRVariable> variables = new ArrayList<>();
        private final List<String> imports = new ArrayList<>();
        private final List<String> exports = new ArrayList<>();
        private SourceLocation sourceLocation;
        private final Map<String, Object> metadata = new HashMap<>();

        public Builder(String id) {
            this.id = id;
        }

        public Builder setName(String name) {
            this.name = name;
            return this;
        }

        public Builder addContract(IRContract contract) {
            contracts.add(contract);
            return this;
        }

        public Builder addFunction(IRFunction function) {
            functions.add(function);
            return this;
        }

        public Builder addVariable(IRVariable variable) {
            variables.add(variable);
            return this;
        }

        public Builder addImport(String importName) {
            imports.add(importName);
            return this;
        }

        public Builder addExport(String exportName) {
            exports.add(exportName);
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

        public IRModule build() {
            return new IRModule(this);
        }
    }
}
