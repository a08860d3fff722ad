package com.questrail.spacelang.graph;

import com.questrail.spacelang.api.Alphabet;
import com.questrail.spacelang.api.Rule;
import com.questrail.spacelang.api.Word;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

final class GraphBuilderTest
{
    private static final List<Rule> TOGGLE = List.of(Rule.of("00", "0|"), Rule.of("0|", "00"));

    @Test
    void generateStringsEnumeratesAllWordsShortestFirst()
    {
        GraphBuilder builder = new GraphBuilder(TOGGLE, Alphabet.binary());
        List<Word> words = builder.generateStrings(2);

        assertEquals(List.of(Word.empty(), Word.of("0"), Word.of("|"),
                Word.of("00"), Word.of("0|"), Word.of("|0"), Word.of("||")), words);
        assertEquals(15, builder.generateStrings(3).size());
        assertEquals(15, new HashSet<>(builder.generateStrings(3)).size());
    }

    @Test
    void generateStringsRejectsNegativeLength()
    {
        GraphBuilder builder = new GraphBuilder(TOGGLE, Alphabet.binary());
        assertThrows(IllegalArgumentException.class, () -> builder.generateStrings(-1));
    }

    @Test
    void buildGraphAddsOneStepEdges()
    {
        ConfigurationGraph g = new GraphBuilder(TOGGLE, Alphabet.binary()).buildGraph(2);

        assertEquals(7, g.vertexCount());
        assertEquals(2, g.edgeCount());
        assertTrue(g.hasEdge(Word.of("00"), Word.of("0|")));
        assertTrue(g.hasEdge(Word.of("0|"), Word.of("00")));
    }

    @Test
    void buildGraphDropsSuccessorsBeyondLengthBound()
    {
        ConfigurationGraph g = new GraphBuilder(List.of(Rule.of("0", "00")), Alphabet.binary()).buildGraph(2);

        assertEquals(1, g.edgeCount());
        assertTrue(g.hasEdge(Word.of("0"), Word.of("00")));
        assertFalse(g.contains(Word.of("000")));
    }

    @Test
    void parallelBuildMatchesSequentialBuild()
    {
        List<Rule> rules = List.of(Rule.of("0|", "|0"), Rule.of("00", "0|"), Rule.of("||", "0"));
        ConfigurationGraph sequential = new GraphBuilder(rules, Alphabet.binary()).buildGraph(9);

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            ConfigurationGraph parallel = new GraphBuilder(rules, Alphabet.binary(), pool).buildGraph(9);
            assertEquals(sequential.vertices(), parallel.vertices());
            for (int v = 0; v < sequential.vertexCount(); v++) {
                assertArrayEquals(sequential.successorIds(v), parallel.successorIds(v));
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void buildIncrementalExploresFromSeeds()
    {
        GraphBuilder builder = new GraphBuilder(List.of(Rule.of("0", "00")), Alphabet.binary());
        ConfigurationGraph g = builder.buildIncremental(List.of(Word.of("0")), 2);

        assertEquals(Set.of(Word.of("0"), Word.of("00"), Word.of("000")), new HashSet<>(g.vertices()));
        assertEquals(2, g.edgeCount());
    }

    @Test
    void buildIncrementalKeepsEdgesIntoVisitedVertices()
    {
        GraphBuilder builder = new GraphBuilder(TOGGLE, Alphabet.binary());
        ConfigurationGraph g = builder.buildIncremental(List.of(Word.of("00")), 5);

        assertEquals(2, g.vertexCount());
        assertTrue(g.hasEdge(Word.of("0|"), Word.of("00")));
    }
}
