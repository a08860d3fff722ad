package com.questrail.spacelang.graph;

import com.questrail.spacelang.api.Word;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * ConfigurationGraph
 * -----------------------------------------------------------------------------
 * The transition graph induced by a rewriting system on a finite word set.
 *
 * <h2>Representation</h2>
 * Vertices live in an arena: each word gets a stable, dense, 0-based id in
 * insertion order, and adjacency is stored as {@code int[]} successor lists.
 * Multi-edges are collapsed: a successor appears at most once per vertex, in
 * the order it was first added.
 *
 * <p>The reverse adjacency (predecessor lists) is materialized once at
 * {@link Builder#build()} so that backward searches do not rebuild it.</p>
 *
 * <h2>Mutability</h2>
 * Instances are immutable and safe to share between threads. All mutation
 * happens in the {@link Builder}.
 */
public final class ConfigurationGraph
{
    private final List<Word> vertices;
    private final Map<Word, Integer> ids;
    private final int[][] successors;
    private final int[][] predecessors;
    private final int edgeCount;

    private ConfigurationGraph(List<Word> vertices, Map<Word, Integer> ids, int[][] successors) {
        this.vertices = Collections.unmodifiableList(vertices);
        this.ids = Collections.unmodifiableMap(ids);
        this.successors = successors;

        int[] inDegree = new int[vertices.size()];
        int edges = 0;
        for (int[] out : successors) {
            edges += out.length;
            for (int v : out) {
                inDegree[v]++;
            }
        }
        this.edgeCount = edges;

        int[][] preds = new int[vertices.size()][];
        for (int v = 0; v < preds.length; v++) {
            preds[v] = new int[inDegree[v]];
        }
        int[] fill = new int[vertices.size()];
        for (int u = 0; u < successors.length; u++) {
            for (int v : successors[u]) {
                preds[v][fill[v]++] = u;
            }
        }
        this.predecessors = preds;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int vertexCount() {
        return vertices.size();
    }

    public int edgeCount() {
        return edgeCount;
    }

    /**
     * Returns all vertices in id order.
     */
    public List<Word> vertices() {
        return vertices;
    }

    public Word vertex(int id) {
        return vertices.get(id);
    }

    public boolean contains(Word word) {
        return ids.containsKey(word);
    }

    /**
     * Returns the arena id of {@code word}.
     *
     * @throws IllegalArgumentException if the word is not a vertex of this graph
     */
    public int idOf(Word word) {
        Objects.requireNonNull(word, "word");
        Integer id = ids.get(word);
        if (id == null) {
            throw new IllegalArgumentException("Not a vertex: " + word);
        }
        return id;
    }

    public int outDegree(int id) {
        return successors[id].length;
    }

    /**
     * Returns the {@code k}-th successor id of vertex {@code id}.
     */
    public int successor(int id, int k) {
        return successors[id][k];
    }

    public int[] successorIds(int id) {
        return successors[id].clone();
    }

    public int[] predecessorIds(int id) {
        return predecessors[id].clone();
    }

    int[] predecessorsUnsafe(int id) {
        return predecessors[id];
    }

    /**
     * Returns the successors of {@code word}; an unknown word has none.
     */
    public List<Word> successors(Word word) {
        Integer id = ids.get(word);
        if (id == null) {
            return List.of();
        }
        List<Word> out = new ArrayList<>(successors[id].length);
        for (int v : successors[id]) {
            out.add(vertices.get(v));
        }
        return out;
    }

    public boolean hasEdge(Word from, Word to) {
        Integer u = ids.get(from);
        Integer v = ids.get(to);
        if (u == null || v == null) {
            return false;
        }
        for (int s : successors[u]) {
            if (s == v) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "ConfigurationGraph[vertices=" + vertexCount() + ", edges=" + edgeCount + "]";
    }

    /**
     * Mutable assembly of a {@link ConfigurationGraph}. Not thread-safe.
     */
    public static final class Builder
    {
        private final List<Word> vertices = new ArrayList<>();
        private final Map<Word, Integer> ids = new HashMap<>();
        private final List<Set<Integer>> successors = new ArrayList<>();

        private Builder() {}

        /**
         * Adds {@code word} if absent and returns its id.
         */
        public int addVertex(Word word) {
            Objects.requireNonNull(word, "word");
            Integer existing = ids.get(word);
            if (existing != null) {
                return existing;
            }
            int id = vertices.size();
            vertices.add(word);
            ids.put(word, id);
            successors.add(new LinkedHashSet<>());
            return id;
        }

        /**
         * Adds the edge {@code from -> to}, adding either endpoint if absent.
         * Repeated edges are collapsed.
         */
        public Builder addEdge(Word from, Word to) {
            int u = addVertex(from);
            int v = addVertex(to);
            successors.get(u).add(v);
            return this;
        }

        public int vertexCount() {
            return vertices.size();
        }

        public ConfigurationGraph build() {
            int[][] adjacency = new int[vertices.size()][];
            for (int u = 0; u < adjacency.length; u++) {
                adjacency[u] = successors.get(u).stream().mapToInt(Integer::intValue).toArray();
            }
            return new ConfigurationGraph(new ArrayList<>(vertices), new HashMap<>(ids), adjacency);
        }
    }
}
