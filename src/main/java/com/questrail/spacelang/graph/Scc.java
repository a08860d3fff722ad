package com.questrail.spacelang.graph;

import com.questrail.spacelang.api.Word;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A strongly connected component.
 *
 * <p>{@code attractor} is true iff no member has an edge to a vertex outside
 * the component. A singleton without a self-loop is still a component; it is
 * an attractor exactly when it is a normal form of the graph.</p>
 *
 * <p>Components compare by identity: the same vertex set never occurs twice
 * within one decomposition.</p>
 */
public final class Scc
{
    private final Set<Word> vertices;
    private final boolean attractor;

    public Scc(Collection<Word> vertices, boolean attractor) {
        Objects.requireNonNull(vertices, "vertices");
        if (vertices.isEmpty()) {
            throw new IllegalArgumentException("A component has at least one vertex");
        }
        this.vertices = Collections.unmodifiableSet(new LinkedHashSet<>(vertices));
        this.attractor = attractor;
    }

    public Set<Word> vertices() {
        return vertices;
    }

    public boolean isAttractor() {
        return attractor;
    }

    public int size() {
        return vertices.size();
    }

    public boolean contains(Word word) {
        return vertices.contains(word);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Scc(");
        int shown = 0;
        for (Word w : vertices) {
            if (shown == 3) {
                sb.append(", ... (+").append(vertices.size() - 3).append(')');
                break;
            }
            if (shown > 0) {
                sb.append(", ");
            }
            sb.append(w);
            shown++;
        }
        sb.append(')');
        if (attractor) {
            sb.append(" [ATTRACTOR]");
        }
        return sb.toString();
    }
}
