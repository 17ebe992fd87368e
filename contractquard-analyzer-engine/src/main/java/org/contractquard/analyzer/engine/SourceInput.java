package org.contractquard.analyzer.engine;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * One source file as delivered by a front-end: its parse tree, and optionally its text for line numbers.
 */
public record SourceInput(String filePath, JsonNode parseTree, String sourceText) {

    public SourceInput {
        Objects.requireNonNull(filePath);
    }

    public SourceInput(String filePath, JsonNode parseTree) {
        this(filePath, parseTree, null);
    }
}
