package com.questrail.spacelang.macro;

import com.questrail.spacelang.api.Context;
import com.questrail.spacelang.api.Word;

import java.util.Objects;

/**
 * Outcome of a local confluence check. Failing to join two branches within
 * the search budget is a normal negative answer.
 */
public sealed interface ConfluenceResult
        permits ConfluenceResult.Joinable, ConfluenceResult.Divergent
{
    boolean isConfluent();

    /**
     * Every diverging critical word that was tested had a common descendant.
     *
     * @param tested number of critical words examined
     */
    record Joinable(int tested) implements ConfluenceResult {
        @Override
        public boolean isConfluent() {
            return true;
        }
    }

    /**
     * {@code word} rewrites two ways whose bounded closures never meet.
     */
    record Divergent(Word word, Context first, Context second) implements ConfluenceResult {
        public Divergent {
            Objects.requireNonNull(word, "word");
            Objects.requireNonNull(first, "first");
            Objects.requireNonNull(second, "second");
        }

        @Override
        public boolean isConfluent() {
            return false;
        }
    }
}
