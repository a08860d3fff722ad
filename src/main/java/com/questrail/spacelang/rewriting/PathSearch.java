package com.questrail.spacelang.rewriting;

import com.questrail.spacelang.api.Word;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a bounded reachability query. Exhausting the search budget is a
 * normal negative answer, not an error.
 */
public sealed interface PathSearch
        permits PathSearch.Found, PathSearch.NotFound
{
    boolean isFound();

    /**
     * A path from the start word to the target, both inclusive.
     */
    record Found(List<Word> path) implements PathSearch {
        public Found {
            path = List.copyOf(Objects.requireNonNull(path, "path"));
            if (path.isEmpty()) {
                throw new IllegalArgumentException("path must contain at least the start word");
            }
        }

        public int steps() {
            return path.size() - 1;
        }

        @Override
        public boolean isFound() {
            return true;
        }
    }

    record NotFound(int depth, int visited) implements PathSearch {
        @Override
        public boolean isFound() {
            return false;
        }
    }
}
