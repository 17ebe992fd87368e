package org.contractquard.analyzer.transform.solidity;

import org.contractquard.analyzer.ir.element.SourceLocation;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Translates solc {@code src} attributes ({@code start:length:fileIndex}, byte offsets into the UTF-8
 * encoded source) into line and column numbers. Both are 1-based.
 */
public class LineIndex {
    private final String filePath;
    private final int[] lineStarts;
    private final int size;

    public LineIndex(String filePath, String sourceText) {
        this.filePath = filePath;
        byte[] bytes = sourceText == null ? null : sourceText.getBytes(StandardCharsets.UTF_8);
        if (bytes == null) {
            lineStarts = null;
            size = 0;
        } else {
            int[] starts = new int[16];
            int n = 0;
            starts[n++] = 0;
            for (int i = 0; i < bytes.length; i++) {
                if (bytes[i] == '\n') {
                    if (n == starts.length) starts = Arrays.copyOf(starts, n * 2);
                    starts[n++] = i + 1;
                }
            }
            lineStarts = Arrays.copyOf(starts, n);
            size = bytes.length;
        }
    }

    public boolean hasSourceText() {
        return lineStarts != null;
    }

    public SourceLocation location(String src) {
        if (lineStarts == null || src == null || src.isEmpty()) return SourceLocation.unknown(filePath);
        String[] parts = src.split(":");
        int start;
        int length;
        try {
            start = Integer.parseInt(parts[0]);
            length = parts.length > 1 ? Integer.parseInt(parts[1]) : 0;
        } catch (NumberFormatException nfe) {
            return SourceLocation.unknown(filePath);
        }
        if (start < 0 || start > size) return SourceLocation.unknown(filePath);
        int end = (int) Math.min(size, (long) start + Math.max(0, length));
        int lineStart = line(start);
        int lineEnd = line(end);
        return new SourceLocation(filePath, lineStart + 1, lineEnd + 1,
                start - lineStarts[lineStart] + 1, end - lineStarts[lineEnd] + 1);
    }

    private int line(int offset) {
        int pos = Arrays.binarySearch(lineStarts, offset);
        return pos >= 0 ? pos : -pos - 2;
    }
}
