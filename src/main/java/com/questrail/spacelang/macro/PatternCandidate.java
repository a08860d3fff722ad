package com.questrail.spacelang.macro;

import com.questrail.spacelang.api.Word;

import java.util.Locale;
import java.util.Objects;

/**
 * A recurring subword of an SCC, ranked for lifting.
 *
 * @param pattern   the subword
 * @param frequency total occurrences across all SCC members, overlapping ones counted
 * @param stability fraction of SCC members containing the pattern, in {@code (0, 1]}
 * @param score     {@code frequency * stability * (1 + 0.1 * length)}
 */
public record PatternCandidate(Word pattern, int frequency, double stability, double score)
{
    public PatternCandidate {
        Objects.requireNonNull(pattern, "pattern");
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "'%s' (freq=%d, stab=%.2f, score=%.2f)",
                pattern, frequency, stability, score);
    }
}
