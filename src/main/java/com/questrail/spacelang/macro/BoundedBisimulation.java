package com.questrail.spacelang.macro;

import com.questrail.spacelang.api.Rule;
import com.questrail.spacelang.api.Word;
import com.questrail.spacelang.config.VerificationBounds;
import com.questrail.spacelang.rewriting.RewritingEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * BoundedBisimulation
 * -----------------------------------------------------------------------------
 * Compares a system with and without a macro's rules on a fixed sample of
 * short test words.
 *
 * <p>For each test word both systems explore to exactly {@code maxDepth}
 * levels with the same width bound, and their final levels are compared. The
 * check fails on the first word whose symmetric difference exceeds
 * {@link VerificationBounds#divergenceTolerance()} times the size of the old
 * final level. Note that an empty old level tolerates no difference at all.</p>
 *
 * <p>This samples behaviour; it does not prove equivalence.</p>
 */
public final class BoundedBisimulation
{
    private static final Logger log = LoggerFactory.getLogger(BoundedBisimulation.class);

    static final int MAX_TEST_LENGTH = 5;

    private final VerificationBounds bounds;

    public BoundedBisimulation(VerificationBounds bounds) {
        this.bounds = Objects.requireNonNull(bounds, "bounds");
    }

    public BisimulationResult check(List<Rule> originalRules, Macro macro, int maxLength, int maxDepth) {
        Objects.requireNonNull(originalRules, "originalRules");
        Objects.requireNonNull(macro, "macro");
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be non-negative");
        }

        RewritingEngine oldEngine = new RewritingEngine(originalRules);
        List<Rule> combined = new ArrayList<>(originalRules);
        combined.addAll(macro.rules());
        RewritingEngine newEngine = new RewritingEngine(combined);

        List<Word> words = testWords(maxLength);
        int tested = 0;
        for (Word w : words.subList(0, Math.min(words.size(), bounds.maxTestWords()))) {
            tested++;
            Set<Word> oldFinal = oldEngine.boundedReach(w, maxDepth, bounds.bisimulationWidth()).level(maxDepth);
            Set<Word> newFinal = newEngine.boundedReach(w, maxDepth, bounds.bisimulationWidth()).level(maxDepth);

            BisimulationResult.Diverged candidate = new BisimulationResult.Diverged(w, oldFinal, newFinal);
            if (candidate.symmetricDifference() > oldFinal.size() * bounds.divergenceTolerance()) {
                log.debug("{}: diverged on {} (old {}, new {})", macro, w, oldFinal, newFinal);
                return candidate;
            }
        }
        log.debug("{}: bisimilar on {} test words", macro, tested);
        return new BisimulationResult.Bisimilar(tested);
    }

    /**
     * Returns the test words for {@code maxLength}: for each length up to
     * {@code min(maxLength, 5)}, a run of zeros and, from length 2, the
     * alternating {@code 0|0|...} prefix of that length. Duplicates are dropped.
     */
    public static List<Word> testWords(int maxLength) {
        Set<Word> out = new LinkedHashSet<>();
        for (int len = 1; len <= Math.min(maxLength, MAX_TEST_LENGTH); len++) {
            out.add(Word.of("0".repeat(len)));
            if (len >= 2) {
                String alternating = "0|".repeat(len / 2);
                out.add(Word.of(alternating.substring(0, Math.min(len, alternating.length()))));
            }
        }
        return new ArrayList<>(out);
    }
}
