package org.contractquard.analyzer.engine.statistics;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Aggregate numbers of one run. Complexity figures cover the functions for which a control flow graph was
 * built; they are 0 when there are none.
 */
public record Statistics(int modules,
                         int contracts,
                         int functions,
                         int variables,
                         Set<String> languages,
                         List<FunctionStatistics> functionStatistics,
                         Set<String> analysesRun,
                         Duration elapsed) {

    public Statistics {
        languages = Set.copyOf(languages);
        functionStatistics = List.copyOf(functionStatistics);
        analysesRun = Set.copyOf(analysesRun);
    }

    public int totalComplexity() {
        return functionStatistics.stream().mapToInt(FunctionStatistics::cyclomaticComplexity).sum();
    }

    public double averageComplexity() {
        return functionStatistics.stream().mapToInt(FunctionStatistics::cyclomaticComplexity).average().orElse(0);
    }

    public int minComplexity() {
        return functionStatistics.stream().mapToInt(FunctionStatistics::cyclomaticComplexity).min().orElse(0);
    }

    public int maxComplexity() {
        return functionStatistics.stream().mapToInt(FunctionStatistics::cyclomaticComplexity).max().orElse(0);
    }
}
