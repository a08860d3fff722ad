package com.questrail.spacelang.macro;

import com.questrail.spacelang.api.Rule;
import com.questrail.spacelang.api.Symbol;
import com.questrail.spacelang.api.Word;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * MacroDictionary
 * -----------------------------------------------------------------------------
 * The versioned, append-only set of admitted macros.
 *
 * <h2>Versioning</h2>
 * A fresh dictionary is at version 1. Every admission increments the version
 * by one and appends an {@link AdmissionRecord} carrying the new version.
 * Nothing is ever removed; {@link #restore(Snapshot)} replaces the whole state
 * at once and is meant for loading persisted dictionaries. A restored snapshot
 * must satisfy the admission rules below, replayed in its macro order.
 *
 * <h2>Single mutation point</h2>
 * All state changes go through the synchronized admission methods, so
 * concurrent writers are serialized and no two admissions share a version.
 * {@link #admitIfVersion(int, Macro)} lets a writer that verified against a
 * known version append only if nobody else appended in the meantime.
 *
 * <h2>Admission rules</h2>
 * <ul>
 *   <li>the macro must be verified;</li>
 *   <li>its symbol must not be a base symbol;</li>
 *   <li>its symbol must not already be defined, nor occur in any admitted
 *       definition;</li>
 *   <li>its definition may mention previously admitted symbols only.</li>
 * </ul>
 * The last two together keep the definition graph acyclic, so
 * {@link #expand(Word)} always terminates before its pass cap.
 */
public final class MacroDictionary
{
    public static final int INITIAL_VERSION = 1;
    public static final int DEFAULT_EXPANSION_CAP = 100;

    private final int expansionCap;

    private final List<Macro> macros = new ArrayList<>();
    private final List<AdmissionRecord> history = new ArrayList<>();
    private int version = INITIAL_VERSION;

    public MacroDictionary() {
        this(DEFAULT_EXPANSION_CAP);
    }

    public MacroDictionary(int expansionCap) {
        if (expansionCap < 1) {
            throw new IllegalArgumentException("expansionCap must be positive");
        }
        this.expansionCap = expansionCap;
    }

    public synchronized int version() {
        return version;
    }

    public synchronized List<Macro> macros() {
        return List.copyOf(macros);
    }

    public synchronized List<AdmissionRecord> history() {
        return List.copyOf(history);
    }

    public synchronized int size() {
        return macros.size();
    }

    public synchronized Optional<Macro> macro(Symbol symbol) {
        Objects.requireNonNull(symbol, "symbol");
        for (Macro m : macros) {
            if (m.symbol().equals(symbol)) {
                return Optional.of(m);
            }
        }
        return Optional.empty();
    }

    public synchronized Set<Symbol> symbols() {
        Set<Symbol> out = new LinkedHashSet<>();
        for (Macro m : macros) {
            out.add(m.symbol());
        }
        return out;
    }

    /**
     * Returns true if an admitted macro already has {@code definition}.
     */
    public synchronized boolean definesPattern(Word definition) {
        for (Macro m : macros) {
            if (m.definition().equals(definition)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the introduction and elimination rules of every admitted macro, in admission order.
     */
    public synchronized List<Rule> rules() {
        List<Rule> out = new ArrayList<>(macros.size() * 2);
        for (Macro m : macros) {
            out.addAll(m.rules());
        }
        return out;
    }

    /**
     * Appends {@code macro} and returns its history record.
     *
     * @throws IllegalStateException if the macro violates an admission rule
     */
    public synchronized AdmissionRecord admit(Macro macro) {
        Objects.requireNonNull(macro, "macro");
        requireAdmissible(macro);

        macros.add(macro);
        version++;
        AdmissionRecord record = new AdmissionRecord(version, AdmissionRecord.ADD, macro.toString(), macro.symbol());
        history.add(record);
        return record;
    }

    /**
     * Appends {@code macro} only if the dictionary is still at {@code expectedVersion}.
     *
     * @return the history record, or empty if another admission happened first
     * @throws IllegalStateException if the versions match but the macro violates an admission rule
     */
    public synchronized Optional<AdmissionRecord> admitIfVersion(int expectedVersion, Macro macro) {
        if (version != expectedVersion) {
            return Optional.empty();
        }
        return Optional.of(admit(macro));
    }

    /**
     * Expands every macro symbol in {@code word} down to base symbols.
     * Reaching the pass cap returns the partially expanded word; use
     * {@link #expandBounded(Word, int)} to tell the two apart.
     */
    public Word expand(Word word) {
        return expandBounded(word, expansionCap).word();
    }

    /**
     * Runs at most {@code maxPasses} substitution passes. One pass replaces,
     * for each macro in admission order, every occurrence of its symbol by its
     * definition.
     */
    public synchronized Expansion expandBounded(Word word, int maxPasses) {
        Objects.requireNonNull(word, "word");
        if (maxPasses < 0) {
            throw new IllegalArgumentException("maxPasses must be non-negative");
        }

        Word current = word;
        int passes = 0;
        while (passes < maxPasses) {
            Word next = substitutePass(current);
            if (next.equals(current)) {
                break;
            }
            current = next;
            passes++;
        }
        return new Expansion(current, passes, !containsMacroSymbol(current));
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(version, macros, history);
    }

    /**
     * Replaces the whole state with {@code snapshot}. The current state is
     * left untouched if the snapshot is rejected.
     *
     * @throws IllegalArgumentException if a macro in the snapshot, admitted in
     *         order, would violate an admission rule
     */
    public synchronized void restore(Snapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        List<Macro> replayed = new ArrayList<>(snapshot.macros().size());
        for (Macro m : snapshot.macros()) {
            String violation = admissionViolation(replayed, m);
            if (violation != null) {
                throw new IllegalArgumentException("Snapshot macro " + (replayed.size() + 1) + ": " + violation);
            }
            replayed.add(m);
        }
        macros.clear();
        macros.addAll(snapshot.macros());
        history.clear();
        history.addAll(snapshot.history());
        version = snapshot.version();
    }

    private void requireAdmissible(Macro macro) {
        String violation = admissionViolation(macros, macro);
        if (violation != null) {
            throw new IllegalStateException(violation);
        }
    }

    /**
     * Returns why {@code macro} cannot follow {@code admitted}, or null if it can.
     */
    private static String admissionViolation(List<Macro> admitted, Macro macro) {
        Symbol symbol = macro.symbol();
        if (!macro.verified()) {
            return "Macro not verified: " + macro;
        }
        if (symbol.isBase()) {
            return "Base symbol cannot be a macro: " + symbol;
        }
        Set<Symbol> defined = new LinkedHashSet<>();
        for (Macro m : admitted) {
            if (m.symbol().equals(symbol)) {
                return "Symbol already defined: " + symbol;
            }
            if (m.definition().contains(symbol)) {
                return "Symbol " + symbol + " already used in " + m;
            }
            defined.add(m.symbol());
        }
        for (Symbol s : macro.definition()) {
            if (!s.isBase() && !defined.contains(s)) {
                return "Definition of " + symbol + " uses undefined symbol " + s;
            }
        }
        return null;
    }

    private Word substitutePass(Word word) {
        Word current = word;
        for (Macro m : macros) {
            if (!current.contains(m.symbol())) {
                continue;
            }
            List<Symbol> out = new ArrayList<>();
            for (Symbol s : current) {
                if (s.equals(m.symbol())) {
                    out.addAll(m.definition().symbols());
                } else {
                    out.add(s);
                }
            }
            current = Word.of(out);
        }
        return current;
    }

    private boolean containsMacroSymbol(Word word) {
        for (Macro m : macros) {
            if (word.contains(m.symbol())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Immutable copy of the dictionary state.
     */
    public record Snapshot(int version, List<Macro> macros, List<AdmissionRecord> history) {
        public Snapshot {
            macros = List.copyOf(Objects.requireNonNull(macros, "macros"));
            history = List.copyOf(Objects.requireNonNull(history, "history"));
            if (version < INITIAL_VERSION) {
                throw new IllegalArgumentException("version must be >= " + INITIAL_VERSION);
            }
        }
    }
}
