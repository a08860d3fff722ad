package com.questrail.spacelang.api;

import java.util.Objects;

/**
 * Context
 * -----------------------------------------------------------------------------
 * A word seen at one application position, together with the rule applied
 * there. Used by overlap and critical-pair analysis to describe where two
 * rewrites diverge; never persisted.
 *
 * @param word     the word the rule is applied to
 * @param position start index of the matched left-hand side
 * @param rule     the applied rule
 */
public record Context(Word word, int position, Rule rule)
{
    public Context {
        Objects.requireNonNull(word, "word");
        Objects.requireNonNull(rule, "rule");
        if (position < 0 || position > word.length()) {
            throw new IllegalArgumentException("position " + position + " outside word of length " + word.length());
        }
    }

    /**
     * Returns the subword covered by the rule's left-hand side.
     */
    public Word match() {
        int end = Math.min(word.length(), position + rule.left().length());
        return word.subword(position, end);
    }

    /**
     * Returns up to {@code radius} symbols immediately left of the match.
     */
    public Word leftContext(int radius) {
        return word.subword(Math.max(0, position - radius), position);
    }

    /**
     * Returns up to {@code radius} symbols immediately right of the match.
     */
    public Word rightContext(int radius) {
        int end = Math.min(word.length(), position + rule.left().length());
        return word.subword(end, Math.min(word.length(), end + radius));
    }

    @Override
    public String toString() {
        return "Context[" + position + "](" + word + ", " + rule + ")";
    }
}
