package org.contractquard.analyzer.transform;

import com.fasterxml.jackson.databind.JsonNode;
import org.contractquard.analyzer.ir.element.NodeIdGenerator;
import org.contractquard.analyzer.ir.element.SourceLocation;
import org.contractquard.analyzer.ir.info.IRModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Transformer for languages whose front-end output is not mapped yet: the result is an empty module,
 * marked with {@link #METADATA_NOT_TRANSFORMED}, so that the rest of a run still sees the file.
 */
public class PlaceholderTransformer implements Transformer {
    private static final Logger LOGGER = LoggerFactory.getLogger(PlaceholderTransformer.class);
    public static final String METADATA_NOT_TRANSFORMED = "notTransformed";
    public static final String METADATA_LANGUAGE = "language";

    private final SourceLanguage language;

    public PlaceholderTransformer(SourceLanguage language) {
        this.language = Objects.requireNonNull(language);
    }

    @Override
    public SourceLanguage language() {
        return language;
    }

    @Override
    public IRModule transform(JsonNode parseTree, String filePath, String sourceText) {
        LOGGER.debug("No {} transformation available, empty module for {}", language, filePath);
        return new IRModule.Builder(new NodeIdGenerator().next("module"))
                .setName(filePath)
                .setSourceLocation(SourceLocation.unknown(filePath))
                .putMetadata(METADATA_LANGUAGE, language.name())
                .putMetadata(METADATA_NOT_TRANSFORMED, true)
                .build();
    }
}
