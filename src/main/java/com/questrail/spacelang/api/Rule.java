package com.questrail.spacelang.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Rule
 * -----------------------------------------------------------------------------
 * A rewrite rule {@code left -> right}.
 *
 * <p>Two rules are equal iff their {@code (left, right)} pair matches; the id
 * is derived from that pair and the metadata map (provenance, frequency
 * statistics, ...) does not take part in equality.</p>
 *
 * <p>Well-formedness (a non-empty left-hand side) is the caller's
 * responsibility. The rewriting engine does not validate rules.</p>
 */
public final class Rule
{
    public static final String REVERSIBLE = "reversible";
    public static final String INVERSE_OF = "inverse_of";

    private final Word left;
    private final Word right;
    private final String id;
    private final Map<String, Object> metadata;

    public Rule(Word left, Word right) {
        this(left, right, null, Map.of());
    }

    public Rule(Word left, Word right, Map<String, Object> metadata) {
        this(left, right, null, metadata);
    }

    private Rule(Word left, Word right, String id, Map<String, Object> metadata) {
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
        this.id = id != null ? id : left + "→" + right;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(metadata, "metadata")));
    }

    public static Rule of(String left, String right) {
        return new Rule(Word.of(left), Word.of(right));
    }

    public Word left() {
        return left;
    }

    public Word right() {
        return right;
    }

    public String id() {
        return id;
    }

    public Map<String, Object> metadata() {
        return metadata;
    }

    public boolean isReversible() {
        return Boolean.TRUE.equals(metadata.get(REVERSIBLE));
    }

    /**
     * Returns {@code right -> left}. The inverse is never assumed to be part of
     * a rule set; callers add it explicitly.
     */
    public Rule inverse() {
        Map<String, Object> md = new LinkedHashMap<>(metadata);
        md.put(INVERSE_OF, id);
        return new Rule(right, left, "inv_" + id, md);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Rule other)) {
            return false;
        }
        return left.equals(other.left) && right.equals(other.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, right);
    }

    @Override
    public String toString() {
        return left + " → " + right;
    }
}
