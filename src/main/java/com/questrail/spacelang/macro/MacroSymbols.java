package com.questrail.spacelang.macro;

import com.questrail.spacelang.api.Symbol;

import java.util.Objects;
import java.util.Set;

/**
 * Allocates fresh macro symbols: letters in code point order starting at
 * {@code 'A'}, skipping base symbols and every symbol in the taken set.
 */
public final class MacroSymbols
{
    private static final int FIRST = 'A';

    private MacroSymbols() {}

    public static Symbol next(Set<Symbol> taken) {
        Objects.requireNonNull(taken, "taken");
        for (int cp = FIRST; cp <= Character.MAX_CODE_POINT; cp++) {
            if (!Character.isLetter(cp)) {
                continue;
            }
            Symbol candidate = Symbol.of(cp);
            if (!candidate.isBase() && !taken.contains(candidate)) {
                return candidate;
            }
        }
        throw new IllegalStateException("No free macro symbol left");
    }
}
