package org.contractquard.analyzer.ir.type;

import org.contractquard.analyzer.ir.element.NodeKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Structural type descriptor. Element, key and value types are owned by value, so a type is
 * always a tree.
 *
 * @param arraySize   fixed length of an array type, {@code null} for dynamic arrays and non-arrays
 * @param structFields field name to field type, in declaration order; empty unless {@code struct}
 */
public record IRType(String name,
                     boolean primitive,
                     boolean array,
                     Integer arraySize,
                     IRType elementType,
                     boolean mapping,
                     IRType keyType,
                     IRType valueType,
                     boolean struct,
                     Map<String, IRType> structFields,
                     boolean nullable) {

    public static final IRType UNKNOWN = named("unknown");

    public IRType {
        Objects.requireNonNull(name);
        structFields = structFields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(structFields));
    }

    public NodeKind kind() {
        return NodeKind.TYPE;
    }

    public static IRType primitive(String name) {
        return new IRType(name, true, false, null, null, false, null, null, false, null, false);
    }

    public static IRType named(String name) {
        return new IRType(name, false, false, null, null, false, null, null, false, null, false);
    }

    public static IRType arrayOf(IRType elementType, Integer size) {
        Objects.requireNonNull(elementType);
        String name = elementType.name() + "[" + (size == null ? "" : size) + "]";
        return new IRType(name, false, true, size, elementType, false, null, null, false, null, false);
    }

    public static IRType mappingOf(IRType keyType, IRType valueType) {
        Objects.requireNonNull(keyType);
        Objects.requireNonNull(valueType);
        String name = "mapping(" + keyType + " => " + valueType + ")";
        return new IRType(name, false, false, null, null, true, keyType, valueType, false, null, false);
    }

    public static IRType struct(String name, Map<String, IRType> fields) {
        return new IRType(name, false, false, null, null, false, null, null, true, fields, false);
    }

    public IRType withNullable(boolean nullable) {
        return new IRType(name, primitive, array, arraySize, elementType, mapping, keyType, valueType, struct,
                structFields, nullable);
    }

    @Override
    public String toString() {
        if (array && elementType != null) {
            return elementType + "[" + (arraySize == null ? "" : arraySize) + "]";
        }
        if (mapping && keyType != null && valueType != null) {
            return "mapping(" + keyType + " => " + valueType + ")";
        }
        if (struct && !structFields.isEmpty()) {
            return "struct " + name + " { " + structFields.entrySet().stream()
                    .map(e -> e.getKey() + ": " + e.getValue())
                    .collect(Collectors.joining(", ")) + " }";
        }
        return name;
    }
}
