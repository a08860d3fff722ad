package com.questrail.spacelang.overlap;

import com.questrail.spacelang.api.Rule;

import java.util.Objects;

/**
 * {@code producer}'s right-hand side contains {@code consumer}'s left-hand
 * side at {@code position}, so applying the producer can enable the consumer.
 */
public record RuleInteraction(Rule producer, Rule consumer, int position)
{
    public RuleInteraction {
        Objects.requireNonNull(producer, "producer");
        Objects.requireNonNull(consumer, "consumer");
    }
}
