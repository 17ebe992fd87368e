package org.contractquard.analyzer.ir.info;

public enum Visibility {
    PUBLIC, PRIVATE, INTERNAL, EXTERNAL, PROTECTED;

    public boolean isExposed() {
        return this == PUBLIC || this == EXTERNAL;
    }

    public boolean isHidden() {
        return this == PRIVATE || this == INTERNAL;
    }

    public static Visibility from(String s, Visibility defaultValue) {
        if (s == null || s.isBlank()) return defaultValue;
        for (Visibility v : values()) {
            if (v.name().equalsIgnoreCase(s)) return v;
        }
        return defaultValue;
    }
}
