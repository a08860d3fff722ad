package com.questrail.spacelang.rewriting;

import com.questrail.spacelang.api.Rule;
import com.questrail.spacelang.api.Word;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * RewritingEngine
 * -----------------------------------------------------------------------------
 * Nondeterministic, position-exhaustive application of a fixed rule list.
 *
 * <h2>Semantics</h2>
 * The one-step image of a word is every {@code (rule, position)} pair whose
 * left-hand side matches at that position, overlapping matches included, each
 * producing the word with {@code right} spliced in place of {@code left}.
 *
 * <h2>Ordering</h2>
 * Applications are returned in rule order, then position order. The order is
 * part of the contract: width-bounded exploration and several verification
 * checks sample "the first" applications, and must be reproducible.
 *
 * <h2>Failure semantics</h2>
 * "No rule applies" is the normal-form condition and is reported as an empty
 * application list. Rules are not validated; an empty left-hand side is a
 * caller error.
 *
 * <p>The engine is stateless apart from its immutable rule list and is safe to
 * share between threads.</p>
 */
public final class RewritingEngine
{
    /** Trailing window returned by {@link #omegaLimit} when no cycle is found. */
    static final int OMEGA_WINDOW = 100;

    private final List<Rule> rules;

    public RewritingEngine(List<Rule> rules) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
    }

    public List<Rule> rules() {
        return rules;
    }

    /**
     * Returns every start index where {@code pattern} occurs in {@code word},
     * including overlapping occurrences.
     */
    public List<Integer> findPositions(Word word, Word pattern) {
        List<Integer> positions = new ArrayList<>();
        int last = word.length() - pattern.length();
        for (int i = 0; i <= last; i++) {
            if (word.matchesAt(pattern, i)) {
                positions.add(i);
            }
        }
        return positions;
    }

    /**
     * Substitutes {@code rule.right()} for the left-hand side matched at {@code position}.
     * The match itself is not re-checked.
     */
    public Word applyRule(Word word, Rule rule, int position) {
        return word.splice(position, rule.left().length(), rule.right());
    }

    /**
     * Returns the full one-step image of {@code word}, in rule-then-position order.
     */
    public List<Application> allApplications(Word word) {
        Objects.requireNonNull(word, "word");
        List<Application> out = new ArrayList<>();
        for (Rule rule : rules) {
            for (int pos : findPositions(word, rule.left())) {
                out.add(new Application(word, rule, pos, applyRule(word, rule, pos)));
            }
        }
        return out;
    }

    /**
     * Returns the distinct one-step successors of {@code word}, in application order.
     */
    public List<Word> successors(Word word) {
        Set<Word> out = new LinkedHashSet<>();
        for (Application a : allApplications(word)) {
            out.add(a.result());
        }
        return new ArrayList<>(out);
    }

    public boolean isNormalForm(Word word) {
        for (Rule rule : rules) {
            if (!findPositions(word, rule.left()).isEmpty()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Breadth-first exploration up to {@code depth} levels with no width bound.
     */
    public ReachLevels boundedReach(Word start, int depth) {
        return boundedReach(start, depth, Integer.MAX_VALUE);
    }

    /**
     * Breadth-first exploration of the one-step relation.
     *
     * <p>At each expanded word only the first {@code width} applications (in
     * engine order) are followed. This is a sampling bound: the result is a
     * subset of what is actually reachable whenever a word has more than
     * {@code width} applications. Words already reached are never added again,
     * so cycles end the exploration on their own.</p>
     *
     * @param start the level-0 word
     * @param depth number of levels to expand
     * @param width maximum applications followed per word
     * @return newly reached words per level
     */
    public ReachLevels boundedReach(Word start, int depth, int width) {
        Objects.requireNonNull(start, "start");
        requireBounds(depth, width);

        Map<Integer, Set<Word>> levels = new LinkedHashMap<>();
        levels.computeIfAbsent(0, k -> new LinkedHashSet<>()).add(start);

        Set<Word> visited = new HashSet<>();
        visited.add(start);

        Deque<Frontier> queue = new ArrayDeque<>();
        queue.add(new Frontier(start, 0));

        while (!queue.isEmpty()) {
            Frontier current = queue.poll();
            if (current.level() >= depth) {
                continue;
            }

            for (Application a : sample(allApplications(current.word()), width)) {
                if (visited.add(a.result())) {
                    int next = current.level() + 1;
                    levels.computeIfAbsent(next, k -> new LinkedHashSet<>()).add(a.result());
                    queue.add(new Frontier(a.result(), next));
                }
            }
        }
        return new ReachLevels(levels);
    }

    public PathSearch reachable(Word start, Word target, int depth) {
        return reachable(start, target, depth, Integer.MAX_VALUE);
    }

    /**
     * Same exploration as {@link #boundedReach(Word, int, int)}, stopping at the
     * first application that produces {@code target}.
     *
     * @return the first discovered path, or {@link PathSearch.NotFound} once the
     *         budget is exhausted
     */
    public PathSearch reachable(Word start, Word target, int depth, int width) {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(target, "target");
        requireBounds(depth, width);

        if (start.equals(target)) {
            return new PathSearch.Found(List.of(start));
        }

        Map<Word, Word> parent = new HashMap<>();
        parent.put(start, null);

        Deque<Frontier> queue = new ArrayDeque<>();
        queue.add(new Frontier(start, 0));

        while (!queue.isEmpty()) {
            Frontier current = queue.poll();
            if (current.level() >= depth) {
                continue;
            }

            for (Application a : sample(allApplications(current.word()), width)) {
                Word next = a.result();
                if (next.equals(target)) {
                    return new PathSearch.Found(pathTo(parent, current.word(), target));
                }
                if (!parent.containsKey(next)) {
                    parent.put(next, current.word());
                    queue.add(new Frontier(next, current.level() + 1));
                }
            }
        }
        return new PathSearch.NotFound(depth, parent.size());
    }

    /**
     * Follows the deterministic trajectory that always takes the first
     * application, until a word repeats, a normal form is reached, or
     * {@code maxSteps} words have been visited.
     */
    public OmegaLimit omegaLimit(Word start, int maxSteps) {
        Objects.requireNonNull(start, "start");
        if (maxSteps < 0) {
            throw new IllegalArgumentException("maxSteps must be non-negative");
        }

        List<Word> trajectory = new ArrayList<>();
        Map<Word, Integer> firstSeen = new HashMap<>();
        Word current = start;

        for (int step = 0; step < maxSteps; step++) {
            firstSeen.putIfAbsent(current, trajectory.size());
            trajectory.add(current);

            List<Application> apps = allApplications(current);
            if (apps.isEmpty()) {
                return new OmegaLimit(OmegaLimit.Kind.NORMAL_FORM, Set.of(current), step);
            }

            current = apps.get(0).result();

            Integer cycleStart = firstSeen.get(current);
            if (cycleStart != null) {
                return new OmegaLimit(OmegaLimit.Kind.CYCLE,
                        new LinkedHashSet<>(trajectory.subList(cycleStart, trajectory.size())),
                        step + 1);
            }
        }

        int window = Math.min(OMEGA_WINDOW, trajectory.size());
        return new OmegaLimit(OmegaLimit.Kind.APPROXIMATE,
                new LinkedHashSet<>(trajectory.subList(trajectory.size() - window, trajectory.size())),
                maxSteps);
    }

    private static List<Application> sample(List<Application> apps, int width) {
        return apps.size() > width ? apps.subList(0, width) : apps;
    }

    private static List<Word> pathTo(Map<Word, Word> parent, Word last, Word target) {
        List<Word> path = new ArrayList<>();
        path.add(target);
        for (Word w = last; w != null; w = parent.get(w)) {
            path.add(w);
        }
        Collections.reverse(path);
        return path;
    }

    private static void requireBounds(int depth, int width) {
        if (depth < 0) {
            throw new IllegalArgumentException("depth must be non-negative");
        }
        if (width < 1) {
            throw new IllegalArgumentException("width must be positive");
        }
    }

    private record Frontier(Word word, int level) {}
}
