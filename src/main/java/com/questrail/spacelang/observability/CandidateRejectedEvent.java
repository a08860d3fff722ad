package com.questrail.spacelang.observability;

import com.questrail.spacelang.api.Symbol;
import com.questrail.spacelang.api.Word;

import java.time.Instant;

/**
 * A candidate was discarded. {@code stage} names the check that failed.
 */
public record CandidateRejectedEvent(
    Instant timestamp,
    Symbol symbol,
    Word definition,
    String stage,
    String reason
) {
}
