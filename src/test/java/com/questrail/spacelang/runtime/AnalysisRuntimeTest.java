package com.questrail.spacelang.runtime;

import com.questrail.spacelang.api.Rule;
import com.questrail.spacelang.api.Word;
import com.questrail.spacelang.graph.AttractorAnalyzer;
import com.questrail.spacelang.graph.ConfigurationGraph;
import com.questrail.spacelang.graph.SccDecomposition;
import com.questrail.spacelang.macro.LiftingReport;
import com.questrail.spacelang.observability.CandidateProposedEvent;
import com.questrail.spacelang.observability.RecordingObservabilitySink;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class AnalysisRuntimeTest
{
    private static final List<Rule> TOGGLE = List.of(Rule.of("00", "0|"), Rule.of("0|", "00"));

    @Test
    void fullPipelineOverSmallGraph()
    {
        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        try (AnalysisRuntime runtime = AnalysisRuntime.builder()
                .withRules(TOGGLE)
                .withParallelism(2)
                .withObservabilitySink(sink)
                .build()) {

            ConfigurationGraph graph = runtime.graphBuilder().buildGraph(4);
            assertEquals(31, graph.vertexCount());

            SccDecomposition d = runtime.decompose(graph);
            AttractorAnalyzer analyzer = runtime.attractorAnalyzer(d);
            assertFalse(analyzer.attractors().isEmpty());
            assertTrue(analyzer.findBasin(analyzer.attractors().get(0)).containsAll(
                    analyzer.attractors().get(0).vertices()));

            List<LiftingReport> reports = runtime.macroLifter().liftAll(d);
            int admitted = reports.stream().mapToInt(r -> r.admitted().size()).sum();
            assertEquals(1 + admitted, runtime.dictionary().version());
            assertTrue(sink.hasEventOfType(CandidateProposedEvent.class));
        }
    }

    @Test
    void rulesAreRequired()
    {
        assertThrows(NullPointerException.class, () -> AnalysisRuntime.builder().build());
    }

    @Test
    void parallelismMustBePositive()
    {
        assertThrows(IllegalArgumentException.class, () -> AnalysisRuntime.builder().withRules(TOGGLE).withParallelism(0).build());
    }

    @Test
    void coverageReflectsDictionary()
    {
        try (AnalysisRuntime runtime = AnalysisRuntime.builder().withRules(TOGGLE).build()) {
            assertEquals(0.0, runtime.coverage().coverage(List.of(Word.of("00"))));
        }
    }
}
