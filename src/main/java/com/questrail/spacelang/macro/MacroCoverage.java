package com.questrail.spacelang.macro;

import com.questrail.spacelang.api.Word;
import com.questrail.spacelang.overlap.AhoCorasick;
import com.questrail.spacelang.overlap.Match;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Measures how much of a word set the admitted macro definitions cover.
 * Built over a snapshot of the definitions; later admissions are not seen.
 */
public final class MacroCoverage
{
    private final AhoCorasick automaton;

    public MacroCoverage(MacroDictionary dictionary) {
        Objects.requireNonNull(dictionary, "dictionary");
        List<Word> definitions = new ArrayList<>();
        for (Macro m : dictionary.macros()) {
            definitions.add(m.definition());
        }
        this.automaton = definitions.isEmpty() ? null : AhoCorasick.of(definitions);
    }

    /**
     * Returns every occurrence of a macro definition in {@code word}.
     */
    public List<Match> occurrences(Word word) {
        return automaton == null ? List.of() : automaton.search(word);
    }

    public boolean covers(Word word) {
        return automaton != null && automaton.matchesAny(word);
    }

    /**
     * Fraction of {@code words} containing at least one macro definition;
     * 0 for an empty collection.
     */
    public double coverage(Collection<Word> words) {
        Objects.requireNonNull(words, "words");
        if (words.isEmpty()) {
            return 0.0;
        }
        int covered = 0;
        for (Word w : words) {
            if (covers(w)) {
                covered++;
            }
        }
        return (double) covered / words.size();
    }
}
