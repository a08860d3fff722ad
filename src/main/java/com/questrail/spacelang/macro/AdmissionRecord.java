package com.questrail.spacelang.macro;

import com.questrail.spacelang.api.Symbol;

import java.util.Objects;

/**
 * One entry of the dictionary's append-only history.
 *
 * @param version the dictionary version after the action
 * @param action  action tag, {@link #ADD} for admissions
 * @param macro   human-readable macro description, e.g. {@code A := 00 ✓}
 * @param symbol  the macro symbol
 */
public record AdmissionRecord(int version, String action, String macro, Symbol symbol)
{
    public static final String ADD = "add";

    public AdmissionRecord {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(macro, "macro");
        Objects.requireNonNull(symbol, "symbol");
    }
}
