package com.questrail.spacelang.macro;

import com.questrail.spacelang.api.Word;

import java.util.Objects;
import java.util.Set;

/**
 * Outcome of a bounded bisimulation check.
 */
public sealed interface BisimulationResult
        permits BisimulationResult.Bisimilar, BisimulationResult.Diverged
{
    boolean isBisimilar();

    record Bisimilar(int tested) implements BisimulationResult {
        @Override
        public boolean isBisimilar() {
            return true;
        }
    }

    /**
     * On {@code testWord} the final reach levels of the old and new systems
     * differ by more than the tolerance allows.
     */
    record Diverged(Word testWord, Set<Word> oldFinal, Set<Word> newFinal) implements BisimulationResult {
        public Diverged {
            Objects.requireNonNull(testWord, "testWord");
            oldFinal = Set.copyOf(oldFinal);
            newFinal = Set.copyOf(newFinal);
        }

        public int symmetricDifference() {
            int diff = 0;
            for (Word w : oldFinal) {
                if (!newFinal.contains(w)) {
                    diff++;
                }
            }
            for (Word w : newFinal) {
                if (!oldFinal.contains(w)) {
                    diff++;
                }
            }
            return diff;
        }

        @Override
        public boolean isBisimilar() {
            return false;
        }
    }
}
