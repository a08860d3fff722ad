package com.questrail.spacelang.observability;

import com.questrail.spacelang.api.Symbol;
import com.questrail.spacelang.api.Word;

import java.time.Instant;

/**
 * A frequent pattern was proposed as the definition of a fresh macro symbol.
 */
public record CandidateProposedEvent(
    Instant timestamp,
    Symbol symbol,
    Word definition,
    double score
) {
}
