package org.contractquard.analyzer.engine.impl;

import org.contractquard.analyzer.engine.AnalysisEngine;
import org.contractquard.analyzer.engine.CommonTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.contractquard.analyzer.engine.AnalysisEngine.*;
import static org.junit.jupiter.api.Assertions.*;

public class TestConfiguration extends CommonTest {

    @Test
    @DisplayName("defaults")
    public void test1() {
        Configuration configuration = new AnalysisEngineImpl.ConfigurationBuilder().build();
        assertEquals(AnalysisMode.STANDARD, configuration.mode());
        assertEquals(15, configuration.complexityThreshold());
        assertEquals(6, configuration.nestingThreshold());
        assertEquals(Duration.ofSeconds(300), configuration.maxAnalysisTime());
        assertTrue(configuration.crossModuleAnalysis());
        assertFalse(configuration.parallel());
        assertEquals(ALL_ANALYSES, configuration.effectiveAnalyses());
        assertTrue(configuration.validate().isEmpty());
    }

    @Test
    @DisplayName("modes and explicit selections")
    public void test2() {
        Configuration fast = new AnalysisEngineImpl.ConfigurationBuilder().setMode(AnalysisMode.FAST).build();
        assertEquals(Set.of(CONTROL_FLOW, ACCESS_CONTROL), fast.effectiveAnalyses());

        Configuration explicit = new AnalysisEngineImpl.ConfigurationBuilder().setMode(AnalysisMode.FAST)
                .addEnabledAnalyses(DEAD_CODE).build();
        assertEquals(Set.of(DEAD_CODE), explicit.effectiveAnalyses());

        Configuration custom = new AnalysisEngineImpl.ConfigurationBuilder().setMode(AnalysisMode.CUSTOM)
                .addEnabledAnalyses(REACHABILITY, CONTROL_FLOW).build();
        assertEquals(Set.of(REACHABILITY, CONTROL_FLOW), custom.effectiveAnalyses());
        assertTrue(custom.validate().isEmpty());

        Configuration emptyCustom = new AnalysisEngineImpl.ConfigurationBuilder().setMode(AnalysisMode.CUSTOM)
                .build();
        assertTrue(emptyCustom.effectiveAnalyses().isEmpty());
        assertEquals(1, emptyCustom.validate().size());
    }

    @Test
    @DisplayName("invalid configuration: errors, nothing analyzed")
    public void test3() {
        Configuration configuration = new AnalysisEngineImpl.ConfigurationBuilder()
                .addEnabledAnalyses("taint", CONTROL_FLOW)
                .setComplexityThreshold(0)
                .setNestingThreshold(-1)
                .setMaxAnalysisTime(Duration.ZERO)
                .build();
        List<String> problems = configuration.validate();
        assertEquals(4, problems.size());
        assertEquals("Unknown analysis: taint", problems.get(0));

        AnalysisEngine engine = new AnalysisEngineImpl(configuration);
        Output output = engine.analyze(List.of(module("Token.sol", contract("Token",
                function("f", f.returnStatement(null), f.assign(f.identifier("x"), f.number(1)))))));
        assertEquals(problems, output.errors());
        assertTrue(output.findings().isEmpty());
        assertTrue(output.statistics().functionStatistics().isEmpty());
        assertEquals(1, output.statistics().functions());
        assertFalse(output.timedOut());

        Configuration noTime = new AnalysisEngineImpl.ConfigurationBuilder().setMaxAnalysisTime(null).build();
        assertEquals(1, noTime.validate().size());
    }
}
