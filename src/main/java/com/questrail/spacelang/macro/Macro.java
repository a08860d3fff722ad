package com.questrail.spacelang.macro;

import com.questrail.spacelang.api.Rule;
import com.questrail.spacelang.api.Symbol;
import com.questrail.spacelang.api.Word;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Macro
 * -----------------------------------------------------------------------------
 * A fresh symbol standing for a fixed definition word.
 *
 * <p>A macro adds two rules to a system: the introduction rule
 * {@code symbol -> definition}, which unfolds the symbol, and the elimination
 * rule {@code definition -> symbol}, which folds the pattern. The
 * definition may mention previously admitted macro symbols but never the
 * macro's own symbol.</p>
 *
 * <p>Instances are immutable; {@link #asVerified()} returns a copy.</p>
 */
public record Macro(
        Symbol symbol,
        Word definition,
        Rule introduction,
        Rule elimination,
        boolean verified,
        Map<String, Object> metadata
) {
    public Macro {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(definition, "definition");
        Objects.requireNonNull(introduction, "introduction");
        Objects.requireNonNull(elimination, "elimination");
        metadata = Map.copyOf(Objects.requireNonNull(metadata, "metadata"));
        if (definition.isEmpty()) {
            throw new IllegalArgumentException("Macro definition must not be empty");
        }
        if (definition.contains(symbol)) {
            throw new IllegalArgumentException("Macro " + symbol + " refers to itself: " + definition);
        }
    }

    /**
     * Creates an unverified macro {@code symbol := definition} with its two rules.
     *
     * @throws IllegalArgumentException if the definition is empty or contains {@code symbol}
     */
    public static Macro propose(Symbol symbol, Word definition, Map<String, Object> metadata) {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(definition, "definition");
        Word self = Word.of(symbol);
        return new Macro(symbol, definition,
                new Rule(self, definition),
                new Rule(definition, self),
                false,
                metadata);
    }

    public static Macro propose(Symbol symbol, Word definition) {
        return propose(symbol, definition, Map.of());
    }

    public Macro asVerified() {
        return verified ? this : new Macro(symbol, definition, introduction, elimination, true, metadata);
    }

    /**
     * Returns the introduction and elimination rules, in that order.
     */
    public List<Rule> rules() {
        return List.of(introduction, elimination);
    }

    @Override
    public String toString() {
        return symbol + " := " + definition + (verified ? " ✓" : " ?");
    }
}
