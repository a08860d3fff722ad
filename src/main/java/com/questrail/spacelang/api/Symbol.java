package com.questrail.spacelang.api;

import java.util.Objects;

/**
 * Symbol
 * -----------------------------------------------------------------------------
 * An atomic alphabet element.
 *
 * <p>A symbol is a single Unicode code point. The base alphabet consists of
 * {@link #ZERO} (the unit) and {@link #SEPARATOR}; synthesized macro symbols
 * extend it. Restricting symbols to one code point keeps the flat textual form
 * of a {@link Word} unambiguous, which the macro dictionary relies on when it
 * persists definitions.</p>
 */
public record Symbol(String value)
{
    public static final Symbol ZERO = new Symbol("0");
    public static final Symbol SEPARATOR = new Symbol("|");

    public Symbol {
        Objects.requireNonNull(value, "value");
        if (value.codePointCount(0, value.length()) != 1) {
            throw new IllegalArgumentException("Symbol must be exactly one code point: '" + value + "'");
        }
    }

    public static Symbol of(String value) {
        return new Symbol(value);
    }

    public static Symbol of(int codePoint) {
        return new Symbol(new String(Character.toChars(codePoint)));
    }

    /**
     * Returns true for the two symbols of the base alphabet.
     */
    public boolean isBase() {
        return equals(ZERO) || equals(SEPARATOR);
    }

    public int codePoint() {
        return value.codePointAt(0);
    }

    @Override
    public String toString() {
        return value;
    }
}
