package com.questrail.spacelang.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Alphabet
 * -----------------------------------------------------------------------------
 * An ordered, immutable set of symbols.
 *
 * <p>Order matters: the graph builder enumerates words by construction in
 * alphabet order, and downstream checks rely on that enumeration being
 * reproducible.</p>
 */
public final class Alphabet
{
    private static final Alphabet BINARY = new Alphabet(List.of(Symbol.ZERO, Symbol.SEPARATOR));

    private final List<Symbol> symbols;
    private final Set<Symbol> lookup;

    private Alphabet(List<Symbol> symbols) {
        this.symbols = List.copyOf(symbols);
        this.lookup = Collections.unmodifiableSet(new LinkedHashSet<>(symbols));
        if (lookup.size() != this.symbols.size()) {
            throw new IllegalArgumentException("Duplicate symbol in alphabet: " + symbols);
        }
    }

    /**
     * The base alphabet {@code {0, |}}.
     */
    public static Alphabet binary() {
        return BINARY;
    }

    public static Alphabet of(Symbol... symbols) {
        Objects.requireNonNull(symbols, "symbols");
        return new Alphabet(List.of(symbols));
    }

    /**
     * Returns an alphabet extended with {@code symbol}, or this alphabet if it
     * already contains it.
     */
    public Alphabet withSymbol(Symbol symbol) {
        Objects.requireNonNull(symbol, "symbol");
        if (lookup.contains(symbol)) {
            return this;
        }
        List<Symbol> extended = new ArrayList<>(symbols);
        extended.add(symbol);
        return new Alphabet(extended);
    }

    public boolean contains(Symbol symbol) {
        return lookup.contains(symbol);
    }

    /**
     * Returns true if every symbol of {@code word} belongs to this alphabet.
     */
    public boolean accepts(Word word) {
        for (Symbol s : word) {
            if (!lookup.contains(s)) {
                return false;
            }
        }
        return true;
    }

    public List<Symbol> symbols() {
        return symbols;
    }

    public int size() {
        return symbols.size();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Alphabet other && symbols.equals(other.symbols);
    }

    @Override
    public int hashCode() {
        return symbols.hashCode();
    }

    @Override
    public String toString() {
        return "Alphabet" + symbols;
    }
}
