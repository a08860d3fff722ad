package com.questrail.spacelang.graph;

import com.questrail.spacelang.api.Alphabet;
import com.questrail.spacelang.api.Rule;
import com.questrail.spacelang.api.Word;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

final class AttractorAnalyzerTest
{
    private static Word w(String s) {
        return Word.of(s);
    }

    /**
     * {@code 0} feeds both the cycle {@code 00 <-> 0|} and the sink {@code |}.
     */
    private static SccDecomposition forkedGraph() {
        ConfigurationGraph.Builder b = ConfigurationGraph.builder();
        b.addVertex(w("0"));
        b.addVertex(w("00"));
        b.addVertex(w("0|"));
        b.addVertex(w("|"));
        b.addEdge(w("0"), w("00"));
        b.addEdge(w("0"), w("|"));
        b.addEdge(w("00"), w("0|"));
        b.addEdge(w("0|"), w("00"));
        return new TarjanScc(b.build()).findSccs();
    }

    @Test
    void basinContainsAttractorAndItsPredecessors()
    {
        SccDecomposition d = forkedGraph();
        AttractorAnalyzer analyzer = new AttractorAnalyzer(d);
        Scc cycle = d.componentOf(w("00"));

        Set<Word> basin = analyzer.findBasin(cycle);
        assertTrue(basin.containsAll(cycle.vertices()));
        assertEquals(Set.of(w("0"), w("00"), w("0|")), basin);
    }

    @Test
    void basinIsSupersetOfAttractorOnGeneratedGraph()
    {
        List<Rule> rules = List.of(Rule.of("00", "0|"), Rule.of("0|", "00"), Rule.of("|", "0"));
        ConfigurationGraph g = new GraphBuilder(rules, Alphabet.binary()).buildGraph(4);
        AttractorAnalyzer analyzer = new AttractorAnalyzer(new TarjanScc(g).findSccs());

        for (Scc a : analyzer.attractors()) {
            assertTrue(analyzer.findBasin(a).containsAll(a.vertices()));
        }
    }

    @Test
    void ambiguousVertexGoesToFirstAttractorInEmissionOrder()
    {
        SccDecomposition d = forkedGraph();
        AttractorAnalyzer analyzer = new AttractorAnalyzer(d);
        Scc cycle = d.componentOf(w("00"));
        Scc sink = d.componentOf(w("|"));

        assertEquals(List.of(cycle, sink), analyzer.attractors());

        Map<Word, Optional<Scc>> labels = analyzer.classifyVertices();
        assertSame(cycle, labels.get(w("0")).orElseThrow());
        assertSame(sink, labels.get(w("|")).orElseThrow());
        assertEquals(List.of(cycle, sink), analyzer.basinsContaining(w("0")));
    }

    @Test
    void classificationIsStableAcrossRuns()
    {
        Map<Word, Optional<Scc>> first = new AttractorAnalyzer(forkedGraph()).classifyVertices();
        Map<Word, Optional<Scc>> second = new AttractorAnalyzer(forkedGraph()).classifyVertices();

        for (Word v : first.keySet()) {
            assertEquals(first.get(v).orElseThrow().vertices(), second.get(v).orElseThrow().vertices());
        }
    }

    @Test
    void rejectsNonAttractor()
    {
        SccDecomposition d = forkedGraph();
        AttractorAnalyzer analyzer = new AttractorAnalyzer(d);
        assertThrows(IllegalArgumentException.class, () -> analyzer.findBasin(d.componentOf(w("0"))));
    }

    @Test
    void parallelBasinsMatchSequentialBasins()
    {
        List<Rule> rules = List.of(Rule.of("0|", "|0"), Rule.of("00", "0"), Rule.of("||", "|"));
        ConfigurationGraph g = new GraphBuilder(rules, Alphabet.binary()).buildGraph(6);
        SccDecomposition d = new TarjanScc(g).findSccs();

        AttractorAnalyzer sequential = new AttractorAnalyzer(d);
        AttractorAnalyzer parallel = new AttractorAnalyzer(d);
        ExecutorService pool = Executors.newFixedThreadPool(3);
        try {
            parallel.computeBasins(pool);
        } finally {
            pool.shutdownNow();
        }

        for (Scc a : d.attractors()) {
            assertEquals(sequential.findBasin(a), parallel.findBasin(a));
        }
        assertEquals(sequential.classifyVertices(), parallel.classifyVertices());
    }
}
