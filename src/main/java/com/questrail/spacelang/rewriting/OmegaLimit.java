package com.questrail.spacelang.rewriting;

import com.questrail.spacelang.api.Word;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * OmegaLimit
 * -----------------------------------------------------------------------------
 * The limit set of the deterministic "first application" trajectory.
 *
 * <ul>
 *   <li>{@link Kind#CYCLE}: a revisited word was found; {@code states} is the
 *       cycle from the first occurrence of that word onward.</li>
 *   <li>{@link Kind#NORMAL_FORM}: the trajectory stopped at a word no rule
 *       applies to; {@code states} is that single word.</li>
 *   <li>{@link Kind#APPROXIMATE}: neither happened within the step budget;
 *       {@code states} is the trailing window of visited words and must be
 *       treated as a heuristic.</li>
 * </ul>
 */
public record OmegaLimit(Kind kind, Set<Word> states, int steps)
{
    public enum Kind {
        CYCLE,
        NORMAL_FORM,
        APPROXIMATE
    }

    public OmegaLimit {
        Objects.requireNonNull(kind, "kind");
        states = Collections.unmodifiableSet(new LinkedHashSet<>(Objects.requireNonNull(states, "states")));
    }

    public boolean isExact() {
        return kind != Kind.APPROXIMATE;
    }
}
