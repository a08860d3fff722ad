package com.questrail.spacelang.macro;

import com.questrail.spacelang.api.Rule;
import com.questrail.spacelang.api.Word;
import com.questrail.spacelang.config.VerificationBounds;
import com.questrail.spacelang.overlap.OverlapDetector;
import com.questrail.spacelang.rewriting.Application;
import com.questrail.spacelang.rewriting.RewritingEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * LocalConfluenceChecker
 * -----------------------------------------------------------------------------
 * Tests whether adding a macro's two rules keeps a system locally confluent.
 *
 * <h2>Critical words</h2>
 * The words tested are a syntactic over-approximation of the true critical
 * pairs of the combined rule set, in this order:
 * <ol>
 *   <li>every concatenation {@code l1 + l2} of two left-hand sides,</li>
 *   <li>every left-hand side on its own,</li>
 *   <li>every superposition of two distinct overlapping left-hand sides.</li>
 * </ol>
 * Duplicates are dropped and at most {@link VerificationBounds#maxCriticalWords()}
 * words are tested.
 *
 * <h2>Joinability</h2>
 * For each word whose first two applications produce different results, the
 * width-bounded reach sets of both results are computed to the given depth,
 * and they must intersect. One word without a common descendant rejects the
 * macro. Only the first two applications are sampled.
 */
public final class LocalConfluenceChecker
{
    private static final Logger log = LoggerFactory.getLogger(LocalConfluenceChecker.class);

    private final VerificationBounds bounds;

    public LocalConfluenceChecker(VerificationBounds bounds) {
        this.bounds = Objects.requireNonNull(bounds, "bounds");
    }

    public ConfluenceResult check(List<Rule> originalRules, Macro macro, int searchDepth) {
        Objects.requireNonNull(originalRules, "originalRules");
        Objects.requireNonNull(macro, "macro");
        if (searchDepth < 0) {
            throw new IllegalArgumentException("searchDepth must be non-negative");
        }

        List<Rule> combined = new ArrayList<>(originalRules);
        combined.addAll(macro.rules());
        RewritingEngine engine = new RewritingEngine(combined);

        List<Word> words = criticalWords(combined);
        int tested = 0;
        for (Word w : words.subList(0, Math.min(words.size(), bounds.maxCriticalWords()))) {
            tested++;
            List<Application> apps = engine.allApplications(w);
            if (apps.size() < 2) {
                continue;
            }
            Application a = apps.get(0);
            Application b = apps.get(1);
            if (a.result().equals(b.result())) {
                continue;
            }

            Set<Word> left = engine.boundedReach(a.result(), searchDepth, bounds.confluenceWidth()).allReached();
            Set<Word> right = engine.boundedReach(b.result(), searchDepth, bounds.confluenceWidth()).allReached();
            if (Collections.disjoint(left, right)) {
                log.debug("{}: critical word {} does not join ({} vs {})", macro, w, a.result(), b.result());
                return new ConfluenceResult.Divergent(w, a.context(), b.context());
            }
        }
        log.debug("{}: {} critical words joinable", macro, tested);
        return new ConfluenceResult.Joinable(tested);
    }

    /**
     * Returns the deduplicated critical words of {@code rules}, in test order, uncapped.
     */
    public static List<Word> criticalWords(List<Rule> rules) {
        Set<Word> out = new LinkedHashSet<>();
        for (Rule r1 : rules) {
            for (Rule r2 : rules) {
                out.add(r1.left().concat(r2.left()));
            }
        }
        for (Rule r : rules) {
            out.add(r.left());
        }
        out.addAll(OverlapDetector.superpositions(rules));
        return new ArrayList<>(out);
    }
}
