package com.questrail.spacelang.graph;

import com.questrail.spacelang.api.Alphabet;
import com.questrail.spacelang.api.Rule;
import com.questrail.spacelang.api.Symbol;
import com.questrail.spacelang.api.Word;
import com.questrail.spacelang.rewriting.RewritingEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * GraphBuilder
 * -----------------------------------------------------------------------------
 * Materializes {@link ConfigurationGraph}s from a rule list.
 *
 * <h2>Full graph G<sub>L</sub></h2>
 * {@link #buildGraph(int)} enumerates every word of length {@code 0..L} by
 * construction and adds an edge for every one-step successor whose length is
 * also at most {@code L}. Successors beyond the bound are dropped from the
 * graph (not from the rewriting relation); this truncation is what keeps the
 * graph finite. Enumeration is exponential in {@code L}: callers bound it tightly.
 *
 * <h2>Incremental graph</h2>
 * {@link #buildIncremental(Collection, int)} explores breadth-first from a seed
 * set instead, adding every vertex and every edge encountered, including edges
 * into vertices at the depth cutoff that are never expanded themselves.
 *
 * <h2>Parallelism</h2>
 * Per-vertex successor computation is independent. It is submitted in chunks
 * to the supplied {@link Executor} and merged in vertex order, so the
 * resulting graph is identical to a sequential build.
 */
public final class GraphBuilder
{
    private static final Logger log = LoggerFactory.getLogger(GraphBuilder.class);

    private static final int CHUNK_SIZE = 256;

    private final RewritingEngine engine;
    private final Alphabet alphabet;
    private final Executor executor;

    /**
     * Creates a builder that computes edges on the calling thread.
     */
    public GraphBuilder(List<Rule> rules, Alphabet alphabet) {
        this(rules, alphabet, Runnable::run);
    }

    public GraphBuilder(List<Rule> rules, Alphabet alphabet, Executor executor) {
        this.engine = new RewritingEngine(rules);
        this.alphabet = Objects.requireNonNull(alphabet, "alphabet");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public RewritingEngine engine() {
        return engine;
    }

    public Alphabet alphabet() {
        return alphabet;
    }

    /**
     * Enumerates every word of length {@code 0..maxLength}, shortest first and,
     * within one length, in alphabet order.
     */
    public List<Word> generateStrings(int maxLength) {
        if (maxLength < 0) {
            throw new IllegalArgumentException("maxLength must be non-negative");
        }

        List<Word> out = new ArrayList<>();
        List<Word> layer = List.of(Word.empty());
        out.addAll(layer);

        for (int len = 1; len <= maxLength; len++) {
            List<Word> next = new ArrayList<>(layer.size() * alphabet.size());
            for (Word prefix : layer) {
                for (Symbol s : alphabet.symbols()) {
                    next.add(prefix.concat(Word.of(s)));
                }
            }
            out.addAll(next);
            layer = next;
        }
        return out;
    }

    /**
     * Builds G<sub>L</sub> for {@code L = maxLength}.
     */
    public ConfigurationGraph buildGraph(int maxLength) {
        List<Word> words = generateStrings(maxLength);
        log.info("Generated {} words of length <= {}", words.size(), maxLength);

        ConfigurationGraph.Builder builder = ConfigurationGraph.builder();
        for (Word w : words) {
            builder.addVertex(w);
        }

        List<List<Word>> successorLists = computeSuccessors(words);
        int edges = 0;
        for (int i = 0; i < words.size(); i++) {
            for (Word next : successorLists.get(i)) {
                if (next.length() <= maxLength) {
                    builder.addEdge(words.get(i), next);
                    edges++;
                }
            }
        }

        ConfigurationGraph graph = builder.build();
        log.info("Built G_{}: {} vertices, {} edges ({} applications kept)",
                maxLength, graph.vertexCount(), graph.edgeCount(), edges);
        return graph;
    }

    /**
     * Builds the graph reachable from {@code seeds} within {@code depth} steps.
     */
    public ConfigurationGraph buildIncremental(Collection<Word> seeds, int depth) {
        Objects.requireNonNull(seeds, "seeds");
        if (depth < 0) {
            throw new IllegalArgumentException("depth must be non-negative");
        }

        ConfigurationGraph.Builder builder = ConfigurationGraph.builder();
        Set<Word> visited = new HashSet<>();
        Deque<Word> queue = new ArrayDeque<>();
        Deque<Integer> levels = new ArrayDeque<>();

        for (Word s : seeds) {
            builder.addVertex(s);
            if (visited.add(s)) {
                queue.add(s);
                levels.add(0);
            }
        }

        while (!queue.isEmpty()) {
            Word current = queue.poll();
            int level = levels.poll();
            if (level >= depth) {
                continue;
            }

            for (Word next : engine.successors(current)) {
                builder.addEdge(current, next);
                if (visited.add(next)) {
                    queue.add(next);
                    levels.add(level + 1);
                }
            }
        }

        ConfigurationGraph graph = builder.build();
        log.info("Built incremental graph from {} seeds at depth {}: {} vertices, {} edges",
                seeds.size(), depth, graph.vertexCount(), graph.edgeCount());
        return graph;
    }

    private List<List<Word>> computeSuccessors(List<Word> words) {
        List<CompletableFuture<List<List<Word>>>> chunks = new ArrayList<>();
        for (int from = 0; from < words.size(); from += CHUNK_SIZE) {
            List<Word> slice = words.subList(from, Math.min(words.size(), from + CHUNK_SIZE));
            chunks.add(CompletableFuture.supplyAsync(() -> {
                List<List<Word>> out = new ArrayList<>(slice.size());
                for (Word w : slice) {
                    out.add(engine.successors(w));
                }
                return out;
            }, executor));
        }

        List<List<Word>> merged = new ArrayList<>(words.size());
        for (CompletableFuture<List<List<Word>>> chunk : chunks) {
            try {
                merged.addAll(chunk.join());
            } catch (CompletionException e) {
                if (e.getCause() instanceof RuntimeException re) {
                    throw re;
                }
                throw e;
            }
        }
        return merged;
    }
}
