package com.questrail.spacelang.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Word
 * -----------------------------------------------------------------------------
 * An immutable, finite sequence of {@link Symbol}s.
 *
 * <h2>Two readings of the same content</h2>
 * A word over {@code {0, |}} can be read
 * <ul>
 *   <li><b>syntactically</b>, as the symbol sequence itself, which is what the
 *       rewriting engine matches and splices, and</li>
 *   <li><b>arithmetically</b>, as its {@linkplain #blocks() blocks}: the run
 *       lengths of {@code 0} between separators ({@code 00|000|0 -> [2, 3, 1]}).</li>
 * </ul>
 *
 * <h2>Value semantics</h2>
 * Equality and hashing are structural. Content never changes after
 * construction, so the hash and the block view are computed once and cached.
 */
public final class Word implements Iterable<Symbol>
{
    private static final Word EMPTY = new Word(new Symbol[0]);

    private final Symbol[] symbols;
    private int hash;
    private List<Integer> blocks;

    private Word(Symbol[] symbols) {
        this.symbols = symbols;
    }

    public static Word empty() {
        return EMPTY;
    }

    /**
     * Parses a flat textual word, one symbol per code point.
     */
    public static Word of(String text) {
        Objects.requireNonNull(text, "text");
        if (text.isEmpty()) {
            return EMPTY;
        }
        return new Word(text.codePoints().mapToObj(Symbol::of).toArray(Symbol[]::new));
    }

    public static Word of(Symbol... symbols) {
        Objects.requireNonNull(symbols, "symbols");
        if (symbols.length == 0) {
            return EMPTY;
        }
        Symbol[] copy = Arrays.copyOf(symbols, symbols.length);
        for (int i = 0; i < copy.length; i++) {
            Objects.requireNonNull(copy[i], "symbol at index " + i);
        }
        return new Word(copy);
    }

    public static Word of(List<Symbol> symbols) {
        return of(symbols.toArray(new Symbol[0]));
    }

    /**
     * Builds {@code 0^b1 | 0^b2 | ... | 0^bn} from a list of block lengths.
     *
     * <p>This inverts {@link #blocks()} only when the last length is positive.
     * The block view drops a trailing empty block, so a list ending in 0 does
     * not come back: {@code [0]} builds the empty word, whose blocks are
     * {@code []}, and {@code [1, 0]} builds {@code 0|}, whose blocks are
     * {@code [1]}.</p>
     */
    public static Word fromBlocks(List<Integer> blocks) {
        Objects.requireNonNull(blocks, "blocks");
        List<Symbol> out = new ArrayList<>();
        for (int i = 0; i < blocks.size(); i++) {
            int b = blocks.get(i);
            if (b < 0) {
                throw new IllegalArgumentException("Block length must be non-negative: " + b);
            }
            if (i > 0) {
                out.add(Symbol.SEPARATOR);
            }
            for (int k = 0; k < b; k++) {
                out.add(Symbol.ZERO);
            }
        }
        return out.isEmpty() ? EMPTY : new Word(out.toArray(new Symbol[0]));
    }

    public int length() {
        return symbols.length;
    }

    public boolean isEmpty() {
        return symbols.length == 0;
    }

    public Symbol symbolAt(int index) {
        return symbols[index];
    }

    public List<Symbol> symbols() {
        return Collections.unmodifiableList(Arrays.asList(symbols));
    }

    /**
     * Returns the subword {@code [from, to)}.
     */
    public Word subword(int from, int to) {
        Objects.checkFromToIndex(from, to, symbols.length);
        if (from == 0 && to == symbols.length) {
            return this;
        }
        return from == to ? EMPTY : new Word(Arrays.copyOfRange(symbols, from, to));
    }

    public Word concat(Word other) {
        Objects.requireNonNull(other, "other");
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        Symbol[] out = Arrays.copyOf(symbols, symbols.length + other.symbols.length);
        System.arraycopy(other.symbols, 0, out, symbols.length, other.symbols.length);
        return new Word(out);
    }

    /**
     * Returns true if {@code pattern} occurs in this word starting at {@code position}.
     */
    public boolean matchesAt(Word pattern, int position) {
        Objects.requireNonNull(pattern, "pattern");
        if (position < 0 || position + pattern.symbols.length > symbols.length) {
            return false;
        }
        for (int i = 0; i < pattern.symbols.length; i++) {
            if (!symbols[position + i].equals(pattern.symbols[i])) {
                return false;
            }
        }
        return true;
    }

    public boolean contains(Word pattern) {
        for (int i = 0; i + pattern.length() <= symbols.length; i++) {
            if (matchesAt(pattern, i)) {
                return true;
            }
        }
        return false;
    }

    public boolean contains(Symbol symbol) {
        for (Symbol s : symbols) {
            if (s.equals(symbol)) {
                return true;
            }
        }
        return false;
    }

    public int count(Symbol symbol) {
        int n = 0;
        for (Symbol s : symbols) {
            if (s.equals(symbol)) {
                n++;
            }
        }
        return n;
    }

    /**
     * Replaces {@code length} symbols starting at {@code position} with {@code replacement}.
     * The result has length {@code length() - length + replacement.length()}.
     */
    public Word splice(int position, int length, Word replacement) {
        Objects.checkFromIndexSize(position, length, symbols.length);
        Objects.requireNonNull(replacement, "replacement");

        Symbol[] out = new Symbol[symbols.length - length + replacement.symbols.length];
        System.arraycopy(symbols, 0, out, 0, position);
        System.arraycopy(replacement.symbols, 0, out, position, replacement.symbols.length);
        System.arraycopy(symbols, position + length, out,
                position + replacement.symbols.length, symbols.length - position - length);
        return out.length == 0 ? EMPTY : new Word(out);
    }

    /**
     * Returns the block view: lengths of maximal {@code 0} runs delimited by
     * {@code |}. Adjacent separators yield a zero-length block
     * ({@code 0||0 -> [1, 0, 1]}); a trailing separator does not open a new
     * block. Symbols outside the base alphabet are skipped.
     */
    public List<Integer> blocks() {
        List<Integer> cached = blocks;
        if (cached != null) {
            return cached;
        }

        List<Integer> out = new ArrayList<>();
        int current = 0;
        for (Symbol s : symbols) {
            if (s.equals(Symbol.ZERO)) {
                current++;
            } else if (s.equals(Symbol.SEPARATOR)) {
                out.add(current);
                current = 0;
            }
        }
        if (current > 0 || (symbols.length > 0 && !symbols[symbols.length - 1].equals(Symbol.SEPARATOR))) {
            out.add(current);
        }

        cached = Collections.unmodifiableList(out);
        blocks = cached;
        return cached;
    }

    @Override
    public Iterator<Symbol> iterator() {
        return symbols().iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Word other)) {
            return false;
        }
        return Arrays.equals(symbols, other.symbols);
    }

    @Override
    public int hashCode() {
        int h = hash;
        if (h == 0 && symbols.length > 0) {
            h = Arrays.hashCode(symbols);
            hash = h;
        }
        return h;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(symbols.length);
        for (Symbol s : symbols) {
            sb.append(s.value());
        }
        return sb.toString();
    }
}
