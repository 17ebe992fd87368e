package org.contractquard.analyzer.engine.finding;

import java.util.*;

public class Findings {

    private Findings() {
    }

    public static final Comparator<Finding> ORDER = Comparator
            .comparingInt((Finding finding) -> finding.severity().rank())
            .thenComparing(Finding::title);

    /**
     * One finding per identifier; on a collision the more severe one wins, the first one on a tie.
     * The result is sorted by severity, most severe first, then by title. The sort is stable, so findings
     * that agree on both keep their input order.
     */
    public static List<Finding> deduplicateAndSort(List<Finding> findings) {
        Map<String, Finding> unique = new LinkedHashMap<>();
        for (Finding finding : findings) {
            unique.merge(finding.id(), finding,
                    (existing, added) -> added.severity().isMoreSevereThan(existing.severity()) ? added : existing);
        }
        List<Finding> result = new ArrayList<>(unique.values());
        result.sort(ORDER);
        return result;
    }
}
