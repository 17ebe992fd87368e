package org.contractquard.analyzer.transform;

import java.util.Optional;

public enum SourceLanguage {
    SOLIDITY(".sol"), RUST(".rs"), GO(".go");

    private final String extension;

    SourceLanguage(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    public static Optional<SourceLanguage> fromFilePath(String filePath) {
        if (filePath == null) return Optional.empty();
        String lower = filePath.toLowerCase();
        for (SourceLanguage language : values()) {
            if (lower.endsWith(language.extension)) return Optional.of(language);
        }
        return Optional.empty();
    }
}
