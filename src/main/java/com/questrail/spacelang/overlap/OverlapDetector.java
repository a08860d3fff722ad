package com.questrail.spacelang.overlap;

import com.questrail.spacelang.api.Rule;
import com.questrail.spacelang.api.Word;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * OverlapDetector
 * -----------------------------------------------------------------------------
 * Structural analysis of how rule left-hand sides can overlap one another.
 *
 * <h2>Overlap</h2>
 * The overlap of {@code s1} onto {@code s2} is the longest proper-or-full
 * suffix of {@code s1} that is also a prefix of {@code s2}. Candidates are
 * tried from the longest possible length down to 1, so the first hit is the
 * maximum.
 *
 * <h2>m-locality</h2>
 * A rule set is m-local when no two distinct rules have left-hand sides
 * overlapping by more than {@code m} symbols. Rules are told apart by
 * position, so two rules sharing a left-hand side overlap by its full
 * length. The property is monotone in {@code m}.
 *
 * <p>Stateless; all methods are static.</p>
 */
public final class OverlapDetector
{
    private OverlapDetector() {}

    public static Optional<Overlap> findSuffixPrefixOverlap(Word s1, Word s2) {
        Objects.requireNonNull(s1, "s1");
        Objects.requireNonNull(s2, "s2");

        for (int len = Math.min(s1.length(), s2.length()); len >= 1; len--) {
            if (s2.matchesAt(s1.subword(s1.length() - len, s1.length()), 0)) {
                return Optional.of(new Overlap(s1, s2, len));
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the maximal overlap of every ordered pair of patterns at
     * distinct indices whose overlap is at least {@code minLength}. Equal
     * patterns at different indices are compared with each other.
     */
    public static List<Overlap> findAllOverlaps(Collection<Word> patterns, int minLength) {
        List<Word> indexed = List.copyOf(Objects.requireNonNull(patterns, "patterns"));
        List<Overlap> out = new ArrayList<>();
        for (int i = 0; i < indexed.size(); i++) {
            for (int j = 0; j < indexed.size(); j++) {
                if (i == j) {
                    continue;
                }
                findSuffixPrefixOverlap(indexed.get(i), indexed.get(j))
                        .filter(o -> o.length() >= minLength)
                        .ifPresent(out::add);
            }
        }
        return out;
    }

    /**
     * Returns the longest overlap between the left-hand sides of any two
     * distinct rules, or 0.
     */
    public static int maxOverlap(List<Rule> rules) {
        int max = 0;
        for (Overlap o : findAllOverlaps(lefts(rules), 1)) {
            max = Math.max(max, o.length());
        }
        return max;
    }

    public static boolean checkMLocality(List<Rule> rules, int m) {
        if (m < 0) {
            throw new IllegalArgumentException("m must be non-negative");
        }
        return maxOverlap(rules) <= m;
    }

    /**
     * Returns the superposition word of every overlapping pair of distinct
     * left-hand sides, in pair order and without duplicates. These are the
     * shortest words in which two left-hand sides match at overlapping positions.
     */
    public static List<Word> superpositions(List<Rule> rules) {
        Set<Word> out = new LinkedHashSet<>();
        for (Overlap o : findAllOverlaps(lefts(rules), 1)) {
            out.add(o.superposition());
        }
        return new ArrayList<>(out);
    }

    /**
     * Finds every pair where one rule's right-hand side contains another
     * rule's left-hand side. One automaton over the left-hand sides is
     * searched through each right-hand side.
     */
    public static List<RuleInteraction> ruleInteractions(List<Rule> rules) {
        Map<Word, List<Rule>> byLeft = new LinkedHashMap<>();
        for (Rule r : rules) {
            if (!r.left().isEmpty()) {
                byLeft.computeIfAbsent(r.left(), k -> new ArrayList<>()).add(r);
            }
        }
        if (byLeft.isEmpty()) {
            return List.of();
        }

        AhoCorasick automaton = AhoCorasick.of(byLeft.keySet());
        List<RuleInteraction> out = new ArrayList<>();
        for (Rule producer : rules) {
            for (Match m : automaton.search(producer.right())) {
                for (Rule consumer : byLeft.get(m.pattern())) {
                    out.add(new RuleInteraction(producer, consumer, m.startPosition()));
                }
            }
        }
        return out;
    }

    private static List<Word> lefts(List<Rule> rules) {
        Objects.requireNonNull(rules, "rules");
        List<Word> out = new ArrayList<>(rules.size());
        for (Rule r : rules) {
            out.add(r.left());
        }
        return out;
    }
}
