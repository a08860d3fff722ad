package com.questrail.spacelang.macro;

import com.questrail.spacelang.api.Word;
import com.questrail.spacelang.graph.Scc;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * FrequencyAnalyzer
 * -----------------------------------------------------------------------------
 * Mines an SCC for subwords worth lifting into macros.
 *
 * <p>Every contiguous subword of every member with length in
 * {@code [minLength, maxLength]} is counted, overlapping occurrences
 * included. Patterns seen fewer than twice are dropped. The rest are scored
 * by {@code frequency * stability * (1 + 0.1 * length)} and returned best
 * first; equal scores keep first-seen order.</p>
 */
public final class FrequencyAnalyzer
{
    static final int MIN_FREQUENCY = 2;

    private FrequencyAnalyzer() {}

    public static List<PatternCandidate> analyzeScc(Scc scc, int minLength, int maxLength) {
        Objects.requireNonNull(scc, "scc");
        if (minLength < 1 || maxLength < minLength) {
            throw new IllegalArgumentException("Invalid length range [" + minLength + ", " + maxLength + "]");
        }

        Map<Word, Integer> counts = new LinkedHashMap<>();
        for (Word member : scc.vertices()) {
            for (Word sub : substrings(member, minLength, maxLength)) {
                counts.merge(sub, 1, Integer::sum);
            }
        }

        List<PatternCandidate> candidates = new ArrayList<>();
        for (Map.Entry<Word, Integer> e : counts.entrySet()) {
            int frequency = e.getValue();
            if (frequency < MIN_FREQUENCY) {
                continue;
            }
            Word pattern = e.getKey();
            int containing = 0;
            for (Word member : scc.vertices()) {
                if (member.contains(pattern)) {
                    containing++;
                }
            }
            double stability = (double) containing / scc.size();
            double score = frequency * stability * (1 + 0.1 * pattern.length());
            candidates.add(new PatternCandidate(pattern, frequency, stability, score));
        }

        // List.sort is stable
        candidates.sort(Comparator.comparingDouble(PatternCandidate::score).reversed());
        return candidates;
    }

    /**
     * Returns every subword of {@code word} with length in the range, by length then start index.
     */
    static List<Word> substrings(Word word, int minLength, int maxLength) {
        List<Word> out = new ArrayList<>();
        for (int len = minLength; len <= maxLength; len++) {
            for (int i = 0; i + len <= word.length(); i++) {
                out.add(word.subword(i, i + len));
            }
        }
        return out;
    }
}
