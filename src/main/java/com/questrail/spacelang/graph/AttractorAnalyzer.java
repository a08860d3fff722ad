package com.questrail.spacelang.graph;

import com.questrail.spacelang.api.Word;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * AttractorAnalyzer
 * -----------------------------------------------------------------------------
 * Basins of attraction over an {@link SccDecomposition}.
 *
 * <h2>Basins</h2>
 * The basin of an attractor is its vertex set closed under backward
 * reachability: every vertex from which the attractor can be reached. It is
 * computed by a breadth-first search over the predecessor lists the graph
 * already materializes, and cached per attractor.
 *
 * <h2>Classification and tie-break</h2>
 * A vertex may lie in the basins of several attractors. {@link #classifyVertices()}
 * assigns it to the first such attractor in Tarjan emission order, which is
 * deterministic for a given graph. {@link #basinsContaining(Word)} exposes the
 * full multi-membership when the single label is not enough.
 *
 * <h2>Thread safety</h2>
 * Basin computation for distinct attractors is independent;
 * {@link #computeBasins(Executor)} fills the cache in parallel. The cache is
 * guarded by this instance's monitor.
 */
public final class AttractorAnalyzer
{
    private final SccDecomposition decomposition;
    private final ConfigurationGraph graph;
    private final List<Scc> attractors;
    private final Map<Scc, Set<Word>> basins = new IdentityHashMap<>();

    public AttractorAnalyzer(SccDecomposition decomposition) {
        this.decomposition = Objects.requireNonNull(decomposition, "decomposition");
        this.graph = decomposition.graph();
        this.attractors = List.copyOf(decomposition.attractors());
    }

    public List<Scc> attractors() {
        return attractors;
    }

    /**
     * Returns every vertex from which {@code attractor} is reachable, the
     * attractor's own vertices included.
     */
    public Set<Word> findBasin(Scc attractor) {
        Objects.requireNonNull(attractor, "attractor");
        synchronized (this) {
            Set<Word> cached = basins.get(attractor);
            if (cached != null) {
                return cached;
            }
        }
        Set<Word> basin = computeBasin(attractor);
        synchronized (this) {
            Set<Word> raced = basins.putIfAbsent(attractor, basin);
            return raced != null ? raced : basin;
        }
    }

    /**
     * Computes the basin of every attractor on {@code executor} and waits for all of them.
     */
    public void computeBasins(Executor executor) {
        Objects.requireNonNull(executor, "executor");
        List<CompletableFuture<Set<Word>>> futures = new ArrayList<>();
        for (Scc a : attractors) {
            futures.add(CompletableFuture.supplyAsync(() -> findBasin(a), executor));
        }
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw e;
        }
    }

    /**
     * Maps every vertex to the first attractor (in emission order) whose basin
     * contains it, or to {@link Optional#empty()} if none does.
     */
    public Map<Word, Optional<Scc>> classifyVertices() {
        Map<Word, Optional<Scc>> out = new LinkedHashMap<>();
        for (Word v : graph.vertices()) {
            Scc owner = null;
            for (Scc a : attractors) {
                if (findBasin(a).contains(v)) {
                    owner = a;
                    break;
                }
            }
            out.put(v, Optional.ofNullable(owner));
        }
        return out;
    }

    /**
     * Returns every attractor whose basin contains {@code word}, in emission order.
     */
    public List<Scc> basinsContaining(Word word) {
        List<Scc> out = new ArrayList<>();
        for (Scc a : attractors) {
            if (findBasin(a).contains(word)) {
                out.add(a);
            }
        }
        return out;
    }

    private Set<Word> computeBasin(Scc attractor) {
        if (!attractor.isAttractor()) {
            throw new IllegalArgumentException("Not an attractor: " + attractor);
        }

        boolean[] visited = new boolean[graph.vertexCount()];
        Deque<Integer> queue = new ArrayDeque<>();
        Set<Word> basin = new LinkedHashSet<>();

        for (Word w : attractor.vertices()) {
            int id = graph.idOf(w);
            visited[id] = true;
            queue.add(id);
            basin.add(w);
        }

        while (!queue.isEmpty()) {
            int current = queue.poll();
            for (int pred : graph.predecessorsUnsafe(current)) {
                if (!visited[pred]) {
                    visited[pred] = true;
                    basin.add(graph.vertex(pred));
                    queue.add(pred);
                }
            }
        }
        return Collections.unmodifiableSet(basin);
    }

    public SccDecomposition decomposition() {
        return decomposition;
    }
}
