package org.contractquard.analyzer.engine.finding;

public enum Severity {
    CRITICAL(0), HIGH(1), MEDIUM(2), LOW(3), INFO(4);

    private final int rank;

    Severity(int rank) {
        this.rank = rank;
    }

    // 0 is the most severe
    public int rank() {
        return rank;
    }

    public boolean isMoreSevereThan(Severity other) {
        return rank < other.rank;
    }
}
