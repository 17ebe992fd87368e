package org.contractquard.analyzer.engine;

import org.contractquard.analyzer.engine.finding.Finding;
import org.contractquard.analyzer.engine.statistics.Statistics;
import org.contractquard.analyzer.ir.AnalyzerException;
import org.contractquard.analyzer.ir.info.IRModule;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Runs the configured analyses over every function of a set of modules, and merges the results into one
 * deduplicated, ordered list of findings.
 */
public interface AnalysisEngine {

    String CONTROL_FLOW = "control_flow";
    String REACHABILITY = "reachability";
    String DEAD_CODE = "dead_code";
    String ACCESS_CONTROL = "access_control";

    Set<String> ALL_ANALYSES = Set.of(CONTROL_FLOW, REACHABILITY, DEAD_CODE, ACCESS_CONTROL);

    enum AnalysisMode {
        FAST, STANDARD, CUSTOM
    }

    interface Configuration {
        AnalysisMode mode();

        // empty: determined by the mode
        Set<String> enabledAnalyses();

        int complexityThreshold();

        int nestingThreshold();

        Duration maxAnalysisTime();

        boolean crossModuleAnalysis();

        boolean parallel();

        /**
         * @return the analyses that will run: the explicitly enabled ones when there are any, otherwise
         * the preset of the mode
         */
        Set<String> effectiveAnalyses();

        /**
         * @return human-readable problems; empty when the configuration can be used
         */
        List<String> validate();
    }

    interface Output {
        List<Finding> findings();

        // configuration problems; when present, nothing was analyzed
        List<String> errors();

        // IR validation messages, unsupported files, time-out
        List<String> warnings();

        List<AnalyzerException> analyzerExceptions();

        Statistics statistics();

        boolean timedOut();
    }

    Configuration configuration();

    Output analyze(List<IRModule> modules);

    /**
     * Transforms every input with the transformer for its language, then analyzes the resulting modules.
     */
    Output analyzeSources(List<SourceInput> sources);
}
