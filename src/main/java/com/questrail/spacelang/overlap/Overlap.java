package com.questrail.spacelang.overlap;

import com.questrail.spacelang.api.Word;

import java.util.Objects;

/**
 * A suffix of {@code first} equal to a prefix of {@code second}, of the given length.
 *
 * @param first  the word contributing the suffix
 * @param second the word contributing the prefix
 * @param length overlap length, at least 1
 */
public record Overlap(Word first, Word second, int length)
{
    public Overlap {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");
        if (length < 1 || length > first.length() || length > second.length()) {
            throw new IllegalArgumentException("Invalid overlap length " + length);
        }
    }

    /**
     * Returns the shared symbols.
     */
    public Word shared() {
        return second.subword(0, length);
    }

    /**
     * Returns the shortest word in which {@code first} and {@code second}
     * occur with this overlap: {@code first + second[length:]}.
     */
    public Word superposition() {
        return first.concat(second.subword(length, second.length()));
    }
}
