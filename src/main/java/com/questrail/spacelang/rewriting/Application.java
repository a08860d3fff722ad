package com.questrail.spacelang.rewriting;

import com.questrail.spacelang.api.Context;
import com.questrail.spacelang.api.Rule;
import com.questrail.spacelang.api.Word;

/**
 * One element of the one-step image: {@code rule} applied to {@code source}
 * at {@code position} produces {@code result}.
 */
public record Application(Word source, Rule rule, int position, Word result)
{
    public Context context() {
        return new Context(source, position, rule);
    }
}
