package org.contractquard.analyzer.transform;

import org.contractquard.analyzer.transform.solidity.SolidityTransformer;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * An immutable selection of transformers, one per language, assembled once and handed to whoever
 * needs to transform files.
 */
public record Transformers(Map<SourceLanguage, Transformer> byLanguage) {

    public Transformers {
        byLanguage = Map.copyOf(byLanguage);
    }

    public static Transformers defaults() {
        Map<SourceLanguage, Transformer> map = new EnumMap<>(SourceLanguage.class);
        map.put(SourceLanguage.SOLIDITY, new SolidityTransformer());
        map.put(SourceLanguage.RUST, new PlaceholderTransformer(SourceLanguage.RUST));
        map.put(SourceLanguage.GO, new PlaceholderTransformer(SourceLanguage.GO));
        return new Transformers(map);
    }

    public Optional<Transformer> forLanguage(SourceLanguage language) {
        return Optional.ofNullable(byLanguage.get(language));
    }

    public Optional<Transformer> forFile(String filePath) {
        return SourceLanguage.fromFilePath(filePath).flatMap(this::forLanguage);
    }
}
