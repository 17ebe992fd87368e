package org.contractquard.analyzer.engine.statistics;

public record FunctionStatistics(String qualifiedName,
                                 int nodeCount,
                                 int edgeCount,
                                 int cyclomaticComplexity,
                                 int nestingDepth,
                                 int unreachableNodes) {
}
