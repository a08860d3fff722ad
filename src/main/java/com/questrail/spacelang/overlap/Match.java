package com.questrail.spacelang.overlap;

import com.questrail.spacelang.api.Word;

import java.util.Objects;

/**
 * One automaton hit: {@code pattern} ends at index {@code endPosition} (inclusive).
 */
public record Match(int endPosition, Word pattern)
{
    public Match {
        Objects.requireNonNull(pattern, "pattern");
    }

    public int startPosition() {
        return endPosition - pattern.length() + 1;
    }
}
