package org.contractquard.analyzer.engine.impl;

import org.contractquard.analyzer.cfg.ControlFlowGraphBuilder;
import org.contractquard.analyzer.cfg.callgraph.CallGraph;
import org.contractquard.analyzer.cfg.callgraph.CallGraphBuilder;
import org.contractquard.analyzer.cfg.impl.ControlFlowGraphBuilderImpl;
import org.contractquard.analyzer.engine.AnalysisEngine;
import org.contractquard.analyzer.engine.FunctionContext;
import org.contractquard.analyzer.engine.SourceInput;
import org.contractquard.analyzer.engine.controlflow.ControlFlowAnalyzer;
import org.contractquard.analyzer.engine.crossmodule.InterfaceConsistency;
import org.contractquard.analyzer.engine.finding.Finding;
import org.contractquard.analyzer.engine.finding.Findings;
import org.contractquard.analyzer.engine.finding.Severity;
import org.contractquard.analyzer.engine.statistics.FunctionStatistics;
import org.contractquard.analyzer.engine.statistics.Statistics;
import org.contractquard.analyzer.engine.validation.IRValidator;
import org.contractquard.analyzer.engine.visitor.AccessControlVisitor;
import org.contractquard.analyzer.engine.visitor.DeadCodeVisitor;
import org.contractquard.analyzer.engine.visitor.ReachabilityVisitor;
import org.contractquard.analyzer.ir.AnalyzerException;
import org.contractquard.analyzer.ir.info.IRContract;
import org.contractquard.analyzer.ir.info.IRFunction;
import org.contractquard.analyzer.ir.info.IRModule;
import org.contractquard.analyzer.transform.SourceLanguage;
import org.contractquard.analyzer.transform.Transformer;
import org.contractquard.analyzer.transform.Transformers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

public class AnalysisEngineImpl implements AnalysisEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(AnalysisEngineImpl.class);

    public static final String DETECTOR = "analysis_engine";

    private final Configuration configuration;
    private final Transformers transformers;
    private final ControlFlowGraphBuilder controlFlowGraphBuilder;

    public AnalysisEngineImpl(Configuration configuration) {
        this(configuration, Transformers.defaults(), new ControlFlowGraphBuilderImpl());
    }

    public AnalysisEngineImpl(Configuration configuration, Transformers transformers,
                              ControlFlowGraphBuilder controlFlowGraphBuilder) {
        this.configuration = Objects.requireNonNull(configuration);
        this.transformers = transformers;
        this.controlFlowGraphBuilder = controlFlowGraphBuilder;
    }

    public record ConfigurationImpl(AnalysisMode mode,
                                    Set<String> enabledAnalyses,
                                    int complexityThreshold,
                                    int nestingThreshold,
                                    Duration maxAnalysisTime,
                                    boolean crossModuleAnalysis,
                                    boolean parallel) implements Configuration {

        public ConfigurationImpl {
            enabledAnalyses = Set.copyOf(enabledAnalyses);
        }

        @Override
        public Set<String> effectiveAnalyses() {
            if (!enabledAnalyses.isEmpty()) return enabledAnalyses;
            return switch (mode) {
                case FAST -> Set.of(CONTROL_FLOW, ACCESS_CONTROL);
                case STANDARD -> ALL_ANALYSES;
                case CUSTOM -> Set.of();
            };
        }

        @Override
        public List<String> validate() {
            List<String> messages = new ArrayList<>();
            enabledAnalyses.stream().filter(a -> !ALL_ANALYSES.contains(a)).sorted()
                    .forEach(a -> messages.add("Unknown analysis: " + a));
            if (complexityThreshold <= 0) {
                messages.add("Complexity threshold must be positive, was " + complexityThreshold);
            }
            if (nestingThreshold <= 0) {
                messages.add("Nesting threshold must be positive, was " + nestingThreshold);
            }
            if (maxAnalysisTime == null || maxAnalysisTime.isNegative() || maxAnalysisTime.isZero()) {
                messages.add("Maximum analysis time must be positive, was " + maxAnalysisTime);
            }
            if (mode == AnalysisMode.CUSTOM && enabledAnalyses.isEmpty()) {
                messages.add("Custom mode requires at least one enabled analysis");
            }
            return messages;
        }
    }

    public static class ConfigurationBuilder {
        private AnalysisMode mode = AnalysisMode.STANDARD;
        private final Set<String> enabledAnalyses = new HashSet<>();
        private int complexityThreshold = 15;
        private int nestingThreshold = 6;
        private Duration maxAnalysisTime = Duration.ofSeconds(300);
        private boolean crossModuleAnalysis = true;
        private boolean parallel;

        public ConfigurationBuilder setMode(AnalysisMode mode) {
            this.mode = mode;
            return this;
        }

        public ConfigurationBuilder addEnabledAnalyses(String... analyses) {
            enabledAnalyses.addAll(Arrays.asList(analyses));
            return this;
        }

        public ConfigurationBuilder setComplexityThreshold(int complexityThreshold) {
            this.complexityThreshold = complexityThreshold;
            return this;
        }

        public ConfigurationBuilder setNestingThreshold(int nestingThreshold) {
            this.nestingThreshold = nestingThreshold;
            return this;
        }

        public ConfigurationBuilder setMaxAnalysisTime(Duration maxAnalysisTime) {
            this.maxAnalysisTime = maxAnalysisTime;
            return this;
        }

        public ConfigurationBuilder setCrossModuleAnalysis(boolean crossModuleAnalysis) {
            this.crossModuleAnalysis = crossModuleAnalysis;
            return this;
        }

        public ConfigurationBuilder setParallel(boolean parallel) {
            this.parallel = parallel;
            return this;
        }

        public Configuration build() {
            return new ConfigurationImpl(mode, enabledAnalyses, complexityThreshold, nestingThreshold,
                    maxAnalysisTime, crossModuleAnalysis, parallel);
        }
    }

    public record OutputImpl(List<Finding> findings,
                             List<String> errors,
                             List<String> warnings,
                             List<AnalyzerException> analyzerExceptions,
                             Statistics statistics,
                             boolean timedOut) implements Output {
        public OutputImpl {
            findings = List.copyOf(findings);
            errors = List.copyOf(errors);
            warnings = List.copyOf(warnings);
            analyzerExceptions = List.copyOf(analyzerExceptions);
        }
    }

    private record FunctionResult(List<Finding> findings,
                                  FunctionStatistics statistics,
                                  AnalyzerException exception,
                                  boolean analyzed) {
        static final FunctionResult SKIPPED = new FunctionResult(List.of(), null, null, false);
    }

    @Override
    public Configuration configuration() {
        return configuration;
    }

    @Override
    public Output analyzeSources(List<SourceInput> sources) {
        List<IRModule> modules = new ArrayList<>(sources.size());
        List<String> warnings = new ArrayList<>();
        for (SourceInput source : sources) {
            Optional<Transformer> transformer = transformers.forFile(source.filePath());
            if (transformer.isEmpty()) {
                LOGGER.warn("No transformer for {}, skipping", source.filePath());
                warnings.add("No transformer for " + source.filePath());
                continue;
            }
            modules.add(transformer.get().transform(source.parseTree(), source.filePath(), source.sourceText()));
        }
        Output output = analyze(modules);
        if (warnings.isEmpty()) return output;
        List<String> allWarnings = new ArrayList<>(warnings);
        allWarnings.addAll(output.warnings());
        return new OutputImpl(output.findings(), output.errors(), allWarnings, output.analyzerExceptions(),
                output.statistics(), output.timedOut());
    }

    @Override
    public Output analyze(List<IRModule> modules) {
        long start = System.nanoTime();
        List<String> problems = configuration.validate();
        if (!problems.isEmpty()) {
            LOGGER.warn("Invalid configuration, not analyzing: {}", problems);
            return new OutputImpl(List.of(), problems, List.of(), List.of(),
                    statistics(modules, List.of(), Set.of(), start), false);
        }
        Set<String> analyses = configuration.effectiveAnalyses();
        LOGGER.info("Analyzing {} modules, analyses {}, parallel? {}", modules.size(), new TreeSet<>(analyses),
                configuration.parallel());
        List<String> warnings = new ArrayList<>(IRValidator.validate(modules));

        CallGraph callGraph = analyses.contains(REACHABILITY) ? new CallGraphBuilder().build(modules) : null;
        ControlFlowAnalyzer controlFlowAnalyzer = new ControlFlowAnalyzer(controlFlowGraphBuilder,
                configuration.complexityThreshold(), configuration.nestingThreshold());
        List<FunctionContext> tasks = functions(modules);
        long deadline = start + configuration.maxAnalysisTime().toNanos();
        AtomicBoolean timedOut = new AtomicBoolean();

        Stream<FunctionContext> stream = configuration.parallel() ? tasks.parallelStream() : tasks.stream();
        List<FunctionResult> results = stream
                .map(task -> analyzeFunction(task, analyses, modules, callGraph, controlFlowAnalyzer, deadline,
                        timedOut))
                .toList();

        // merge in declaration order
        List<Finding> findings = new ArrayList<>();
        List<FunctionStatistics> functionStatistics = new ArrayList<>();
        List<AnalyzerException> analyzerExceptions = new ArrayList<>();
        int analyzed = 0;
        for (FunctionResult result : results) {
            findings.addAll(result.findings);
            if (result.statistics != null) functionStatistics.add(result.statistics);
            if (result.exception != null) analyzerExceptions.add(result.exception);
            if (result.analyzed) analyzed++;
        }
        if (configuration.crossModuleAnalysis() && !timedOut.get()) {
            List<Finding> crossModule = InterfaceConsistency.check(modules);
            LOGGER.info("Cross-module analysis found {} issues", crossModule.size());
            findings.addAll(crossModule);
        }
        if (timedOut.get()) {
            String message = "Analysis time budget of " + configuration.maxAnalysisTime() + " exceeded; analyzed "
                             + analyzed + " of " + tasks.size() + " functions";
            LOGGER.warn(message);
            warnings.add(message);
        }
        List<Finding> merged = Findings.deduplicateAndSort(findings);
        Statistics statistics = statistics(modules, functionStatistics, analyses, start);
        LOGGER.info("Analysis completed in {} ms with {} findings", statistics.elapsed().toMillis(), merged.size());
        return new OutputImpl(merged, List.of(), warnings, analyzerExceptions, statistics, timedOut.get());
    }

    private static List<FunctionContext> functions(List<IRModule> modules) {
        List<FunctionContext> list = new ArrayList<>();
        for (IRModule module : modules) {
            for (IRFunction function : module.functions()) {
                list.add(new FunctionContext(module, null, function));
            }
            for (IRContract contract : module.contracts()) {
                for (IRFunction modifier : contract.modifiers()) {
                    list.add(new FunctionContext(module, contract, modifier));
                }
                for (IRFunction function : contract.functions()) {
                    list.add(new FunctionContext(module, contract, function));
                }
            }
        }
        return list;
    }

    private FunctionResult analyzeFunction(FunctionContext context,
                                           Set<String> analyses,
                                           List<IRModule> modules,
                                           CallGraph callGraph,
                                           ControlFlowAnalyzer controlFlowAnalyzer,
                                           long deadline,
                                           AtomicBoolean timedOut) {
        if (timedOut.get() || System.nanoTime() > deadline) {
            timedOut.set(true);
            return FunctionResult.SKIPPED;
        }
        try {
            List<Finding> findings = new ArrayList<>();
            FunctionStatistics statistics = null;
            if (analyses.contains(CONTROL_FLOW)) {
                ControlFlowAnalyzer.Result result = controlFlowAnalyzer.analyze(context);
                findings.addAll(result.findings());
                statistics = result.statistics();
            }
            if (analyses.contains(DEAD_CODE)) {
                findings.addAll(new DeadCodeVisitor().analyze(context));
            }
            if (analyses.contains(ACCESS_CONTROL)) {
                findings.addAll(new AccessControlVisitor(modules).analyze(context));
            }
            if (analyses.contains(REACHABILITY)) {
                findings.addAll(new ReachabilityVisitor(callGraph).analyze(context));
            }
            return new FunctionResult(findings, statistics, null, true);
        } catch (RuntimeException re) {
            LOGGER.warn("Caught exception analyzing {} @{}", context, context.location(), re);
            AnalyzerException exception = re instanceof AnalyzerException ae ? ae
                    : new AnalyzerException(context.function(), re);
            String name = context.qualifiedName();
            Finding finding = new Finding.Builder("analysis_error_" + name)
                    .setTitle("Analysis Error")
                    .setDescription("Failed to analyze function " + name + ": " + re.getMessage())
                    .setSeverity(Severity.LOW)
                    .setLocation(context.location())
                    .setCategory("analysis_error")
                    .setDetector(DETECTOR)
                    .putMetadata("exception", re.getClass().getSimpleName())
                    .build();
            return new FunctionResult(List.of(finding), null, exception, true);
        }
    }

    private static Statistics statistics(List<IRModule> modules,
                                         List<FunctionStatistics> functionStatistics,
                                         Set<String> analyses,
                                         long start) {
        int contracts = 0;
        int functions = 0;
        int variables = 0;
        Set<String> languages = new TreeSet<>();
        for (IRModule module : modules) {
            contracts += module.contracts().size();
            functions += module.functions().size();
            variables += module.variables().size();
            for (IRContract contract : module.contracts()) {
                functions += contract.functions().size();
                variables += contract.variables().size();
            }
            SourceLanguage.fromFilePath(module.name()).ifPresent(l -> languages.add(l.name().toLowerCase()));
        }
        return new Statistics(modules.size(), contracts, functions, variables, languages, functionStatistics,
                analyses, Duration.ofNanos(System.nanoTime() - start));
    }
}
