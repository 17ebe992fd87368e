package org.contractquard.analyzer.ir.element;

import java.util.Objects;

/**
 * Position of an IR element in its source file. Lines are 1-based; line 0 means "unknown",
 * which is what transformers produce when they have character offsets but no source text.
 */
public record SourceLocation(String filePath, int lineStart, int lineEnd, int columnStart, int columnEnd) {

    public SourceLocation {
        Objects.requireNonNull(filePath);
    }

    public static SourceLocation of(String filePath, int line) {
        return new SourceLocation(filePath, line, line, 0, 0);
    }

    public static SourceLocation unknown(String filePath) {
        return new SourceLocation(filePath, 0, 0, 0, 0);
    }

    public boolean lineKnown() {
        return lineStart > 0;
    }

    @Override
    public String toString() {
        if (lineEnd != lineStart) {
            return filePath + ":" + lineStart + "-" + lineEnd;
        }
        return filePath + ":" + lineStart;
    }
}
