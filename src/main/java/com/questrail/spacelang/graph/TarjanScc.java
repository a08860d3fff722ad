package com.questrail.spacelang.graph;

import com.questrail.spacelang.api.Word;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * TarjanScc
 * -----------------------------------------------------------------------------
 * Tarjan's strongly connected components algorithm, O(V + E).
 *
 * <h2>Iterative traversal</h2>
 * The depth-first search is driven by an explicit work stack of
 * {@code (vertex, next child position)} frames instead of recursion, so graph
 * size is not limited by the thread's stack. A component is closed exactly
 * when a vertex finishes with {@code lowlink == index}.
 *
 * <h2>Attractor classification</h2>
 * After the partition is known, one pass over every edge marks each component
 * that has an edge leaving it; the unmarked components are attractors.
 *
 * <h2>Determinism</h2>
 * Roots are taken in vertex id order and children in adjacency order, so the
 * emission order of components is a pure function of the graph.
 */
public final class TarjanScc
{
    private static final Logger log = LoggerFactory.getLogger(TarjanScc.class);

    private static final int UNVISITED = -1;

    private final ConfigurationGraph graph;

    public TarjanScc(ConfigurationGraph graph) {
        this.graph = Objects.requireNonNull(graph, "graph");
    }

    public SccDecomposition findSccs() {
        final int n = graph.vertexCount();

        int[] index = new int[n];
        int[] lowlink = new int[n];
        boolean[] onStack = new boolean[n];
        Arrays.fill(index, UNVISITED);

        int[] stack = new int[n];
        int stackTop = 0;

        // work stack frames: vertex and position of the next child to visit
        int[] frameVertex = new int[n];
        int[] frameNext = new int[n];
        int frameTop = 0;

        int[] componentByVertex = new int[n];
        List<int[]> members = new ArrayList<>();
        int counter = 0;

        for (int root = 0; root < n; root++) {
            if (index[root] != UNVISITED) {
                continue;
            }

            index[root] = lowlink[root] = counter++;
            stack[stackTop++] = root;
            onStack[root] = true;
            frameVertex[frameTop] = root;
            frameNext[frameTop] = 0;
            frameTop++;

            while (frameTop > 0) {
                int v = frameVertex[frameTop - 1];

                if (frameNext[frameTop - 1] < graph.outDegree(v)) {
                    int w = graph.successor(v, frameNext[frameTop - 1]++);
                    if (index[w] == UNVISITED) {
                        index[w] = lowlink[w] = counter++;
                        stack[stackTop++] = w;
                        onStack[w] = true;
                        frameVertex[frameTop] = w;
                        frameNext[frameTop] = 0;
                        frameTop++;
                    } else if (onStack[w]) {
                        lowlink[v] = Math.min(lowlink[v], index[w]);
                    }
                    continue;
                }

                frameTop--;

                if (lowlink[v] == index[v]) {
                    int componentId = members.size();
                    int start = stackTop;
                    do {
                        start--;
                    } while (stack[start] != v);

                    int[] component = Arrays.copyOfRange(stack, start, stackTop);
                    for (int u : component) {
                        onStack[u] = false;
                        componentByVertex[u] = componentId;
                    }
                    stackTop = start;
                    members.add(component);
                }

                if (frameTop > 0) {
                    int parent = frameVertex[frameTop - 1];
                    lowlink[parent] = Math.min(lowlink[parent], lowlink[v]);
                }
            }
        }

        boolean[] leaks = new boolean[members.size()];
        for (int u = 0; u < n; u++) {
            int cu = componentByVertex[u];
            for (int k = 0; k < graph.outDegree(u) && !leaks[cu]; k++) {
                if (componentByVertex[graph.successor(u, k)] != cu) {
                    leaks[cu] = true;
                }
            }
        }

        List<Scc> components = new ArrayList<>(members.size());
        int attractors = 0;
        for (int c = 0; c < members.size(); c++) {
            List<Word> words = new ArrayList<>(members.get(c).length);
            for (int u : members.get(c)) {
                words.add(graph.vertex(u));
            }
            components.add(new Scc(words, !leaks[c]));
            if (!leaks[c]) {
                attractors++;
            }
        }

        log.debug("Found {} components ({} attractors) in {}", components.size(), attractors, graph);
        return new SccDecomposition(graph, components, componentByVertex);
    }
}
