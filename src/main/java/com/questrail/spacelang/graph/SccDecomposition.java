package com.questrail.spacelang.graph;

import com.questrail.spacelang.api.Word;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * SccDecomposition
 * -----------------------------------------------------------------------------
 * The partition of a {@link ConfigurationGraph} into strongly connected
 * components, in the order Tarjan's algorithm closed them.
 *
 * <p>Every vertex belongs to exactly one component; {@link #componentOf(Word)}
 * is the inverse of that partition.</p>
 */
public final class SccDecomposition
{
    private final ConfigurationGraph graph;
    private final List<Scc> components;
    private final int[] componentByVertex;

    SccDecomposition(ConfigurationGraph graph, List<Scc> components, int[] componentByVertex) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.components = Collections.unmodifiableList(new ArrayList<>(components));
        this.componentByVertex = componentByVertex;
    }

    public ConfigurationGraph graph() {
        return graph;
    }

    /**
     * Returns all components in emission order.
     */
    public List<Scc> components() {
        return components;
    }

    /**
     * Returns the attractor components, in emission order.
     */
    public List<Scc> attractors() {
        List<Scc> out = new ArrayList<>();
        for (Scc c : components) {
            if (c.isAttractor()) {
                out.add(c);
            }
        }
        return out;
    }

    public Scc componentOf(Word word) {
        return components.get(componentByVertex[graph.idOf(word)]);
    }

    public int componentIndexOf(int vertexId) {
        return componentByVertex[vertexId];
    }

    public int size() {
        return components.size();
    }

    public Scc largest() {
        Scc best = null;
        for (Scc c : components) {
            if (best == null || c.size() > best.size()) {
                best = c;
            }
        }
        return best;
    }
}
