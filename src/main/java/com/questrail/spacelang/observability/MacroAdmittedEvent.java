package com.questrail.spacelang.observability;

import com.questrail.spacelang.api.Symbol;
import com.questrail.spacelang.api.Word;

import java.time.Instant;

/**
 * A macro passed verification and was admitted at {@code version}.
 */
public record MacroAdmittedEvent(
    Instant timestamp,
    Symbol symbol,
    Word definition,
    int version
) {
}
