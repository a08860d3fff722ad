package com.questrail.spacelang.overlap;

import com.questrail.spacelang.api.Symbol;
import com.questrail.spacelang.api.Word;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * AhoCorasick
 * -----------------------------------------------------------------------------
 * Multi-pattern matcher over {@link Symbol} sequences.
 *
 * <h2>Construction</h2>
 * Patterns are inserted into a prefix trie; {@link #build()} then computes, in
 * breadth-first order, each node's failure link (the longest proper suffix of
 * its prefix that is itself a trie prefix) and appends the failure target's
 * outputs to the node's own. After that a node reports every pattern that
 * ends at it, directly or through its failure chain.
 *
 * <h2>Search</h2>
 * {@link #search(Word)} is one left-to-right pass. It reports every
 * {@code (end position, pattern)} hit, overlapping and nested ones included,
 * in O(n + z) for a text of length n with z hits.
 *
 * <h2>Lifecycle</h2>
 * Patterns may only be added before the automaton is built. A built automaton
 * is read-only and may be searched from several threads.
 */
public final class AhoCorasick
{
    private static final int ROOT = 0;

    private final List<Map<Symbol, Integer>> transitions = new ArrayList<>();
    private final List<List<Word>> outputs = new ArrayList<>();
    private int[] failure = new int[0];
    private final List<Word> patterns = new ArrayList<>();
    private volatile boolean built;

    public AhoCorasick() {
        newNode();
    }

    /**
     * Creates and builds an automaton over {@code patterns}.
     */
    public static AhoCorasick of(Collection<Word> patterns) {
        AhoCorasick ac = new AhoCorasick();
        for (Word p : patterns) {
            ac.addPattern(p);
        }
        return ac.build();
    }

    public AhoCorasick addPattern(Word pattern) {
        Objects.requireNonNull(pattern, "pattern");
        if (built) {
            throw new IllegalStateException("Automaton already built");
        }
        if (pattern.isEmpty()) {
            throw new IllegalArgumentException("Empty pattern");
        }

        int node = ROOT;
        for (Symbol s : pattern) {
            Integer next = transitions.get(node).get(s);
            if (next == null) {
                next = newNode();
                transitions.get(node).put(s, next);
            }
            node = next;
        }
        if (!outputs.get(node).contains(pattern)) {
            outputs.get(node).add(pattern);
            patterns.add(pattern);
        }
        return this;
    }

    public AhoCorasick build() {
        if (built) {
            return this;
        }
        failure = new int[transitions.size()];
        Deque<Integer> queue = new ArrayDeque<>();

        for (int child : transitions.get(ROOT).values()) {
            failure[child] = ROOT;
            queue.add(child);
        }

        while (!queue.isEmpty()) {
            int node = queue.poll();
            for (Map.Entry<Symbol, Integer> e : transitions.get(node).entrySet()) {
                Symbol s = e.getKey();
                int child = e.getValue();
                queue.add(child);

                int f = failure[node];
                while (f != ROOT && !transitions.get(f).containsKey(s)) {
                    f = failure[f];
                }
                Integer target = transitions.get(f).get(s);
                failure[child] = (target != null && target != child) ? target : ROOT;
                outputs.get(child).addAll(outputs.get(failure[child]));
            }
        }
        built = true;
        return this;
    }

    public List<Word> patterns() {
        return List.copyOf(patterns);
    }

    /**
     * Returns every match in {@code text}, ordered by end position.
     */
    public List<Match> search(Word text) {
        Objects.requireNonNull(text, "text");
        requireBuilt();

        List<Match> matches = new ArrayList<>();
        int node = ROOT;
        for (int i = 0; i < text.length(); i++) {
            node = step(node, text.symbolAt(i));
            for (Word p : outputs.get(node)) {
                matches.add(new Match(i, p));
            }
        }
        return matches;
    }

    /**
     * Returns true if any pattern occurs in {@code text}. Stops at the first hit.
     */
    public boolean matchesAny(Word text) {
        Objects.requireNonNull(text, "text");
        requireBuilt();

        int node = ROOT;
        for (int i = 0; i < text.length(); i++) {
            node = step(node, text.symbolAt(i));
            if (!outputs.get(node).isEmpty()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Groups the start positions of every match by pattern, in insertion order
     * of the patterns. Patterns with no match map to an empty list.
     */
    public Map<Word, List<Integer>> findAllPositions(Word text) {
        Map<Word, List<Integer>> out = new LinkedHashMap<>();
        for (Word p : patterns) {
            out.put(p, new ArrayList<>());
        }
        for (Match m : search(text)) {
            out.get(m.pattern()).add(m.startPosition());
        }
        for (List<Integer> positions : out.values()) {
            positions.sort(null);
        }
        return out;
    }

    private int step(int node, Symbol s) {
        while (node != ROOT && !transitions.get(node).containsKey(s)) {
            node = failure[node];
        }
        Integer next = transitions.get(node).get(s);
        return next == null ? ROOT : next;
    }

    private int newNode() {
        transitions.add(new HashMap<>());
        outputs.add(new ArrayList<>());
        return transitions.size() - 1;
    }

    private void requireBuilt() {
        if (!built) {
            throw new IllegalStateException("Automaton not built");
        }
    }

    @Override
    public String toString() {
        return "AhoCorasick[patterns=" + patterns.size() + ", states=" + transitions.size() + "]";
    }
}
