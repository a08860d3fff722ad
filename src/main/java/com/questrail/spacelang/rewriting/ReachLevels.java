package com.questrail.spacelang.rewriting;

import com.questrail.spacelang.api.Word;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * ReachLevels
 * -----------------------------------------------------------------------------
 * Result of a bounded breadth-first exploration: for every level, the words
 * first reached at exactly that level.
 *
 * <p>A word appears in at most one level. A level at which nothing new was
 * reached is absent, so {@link #deepestLevel()} can be smaller than the
 * requested depth.</p>
 */
public final class ReachLevels
{
    private final SortedMap<Integer, Set<Word>> levels;

    ReachLevels(Map<Integer, Set<Word>> levels) {
        TreeMap<Integer, Set<Word>> copy = new TreeMap<>();
        levels.forEach((k, v) -> copy.put(k, Collections.unmodifiableSet(new LinkedHashSet<>(v))));
        this.levels = Collections.unmodifiableSortedMap(copy);
    }

    /**
     * Returns the words first reached at {@code level}, or an empty set if
     * that level is absent.
     */
    public Set<Word> level(int level) {
        return levels.getOrDefault(level, Set.of());
    }

    public boolean hasLevel(int level) {
        return levels.containsKey(level);
    }

    public SortedMap<Integer, Set<Word>> asMap() {
        return levels;
    }

    public int deepestLevel() {
        return levels.isEmpty() ? -1 : levels.lastKey();
    }

    /**
     * Returns every reached word, in level order.
     */
    public Set<Word> allReached() {
        Set<Word> all = new LinkedHashSet<>();
        levels.values().forEach(all::addAll);
        return Collections.unmodifiableSet(all);
    }

    @Override
    public String toString() {
        return "ReachLevels" + levels;
    }
}
