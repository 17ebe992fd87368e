package org.contractquard.analyzer.transform;

import com.fasterxml.jackson.databind.JsonNode;
import org.contractquard.analyzer.ir.info.IRModule;

/**
 * Maps the parse tree of one source file, as produced by the language front-end, onto an {@link IRModule}.
 * <p>
 * Implementations keep no state between calls, and never throw on malformed or partial input: constructs
 * they cannot map become placeholder nodes, and an unusable tree yields a module without contracts.
 */
public interface Transformer {

    SourceLanguage language();

    /**
     * @param sourceText the text of the file; when present, character offsets in the parse tree are
     *                   translated to line and column numbers. May be null.
     */
    IRModule transform(JsonNode parseTree, String filePath, String sourceText);

    default IRModule transform(JsonNode parseTree, String filePath) {
        return transform(parseTree, filePath, null);
    }
}
