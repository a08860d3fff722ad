package com.questrail.spacelang.macro;

import com.questrail.spacelang.api.Word;

import java.util.Objects;

/**
 * Result of a bounded macro expansion.
 *
 * @param word       the expanded word
 * @param iterations substitution passes that changed the word
 * @param complete   false if the pass budget ran out while macro symbols remained
 */
public record Expansion(Word word, int iterations, boolean complete)
{
    public Expansion {
        Objects.requireNonNull(word, "word");
    }
}
