package com.questrail.spacelang.macro;

import com.questrail.spacelang.graph.Scc;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of lifting one SCC.
 *
 * @param source            the mined component
 * @param candidates        ranked patterns found in it, before truncation
 * @param outcomes          one outcome per verified candidate, in rank order
 * @param dictionaryVersion dictionary version after the last admission
 */
public record LiftingReport(
        Scc source,
        List<PatternCandidate> candidates,
        List<CandidateOutcome> outcomes,
        int dictionaryVersion
) {
    public LiftingReport {
        Objects.requireNonNull(source, "source");
        candidates = List.copyOf(candidates);
        outcomes = List.copyOf(outcomes);
    }

    public List<CandidateOutcome.Admitted> admitted() {
        List<CandidateOutcome.Admitted> out = new ArrayList<>();
        for (CandidateOutcome o : outcomes) {
            if (o instanceof CandidateOutcome.Admitted a) {
                out.add(a);
            }
        }
        return out;
    }

    public List<CandidateOutcome.Rejected> rejected() {
        List<CandidateOutcome.Rejected> out = new ArrayList<>();
        for (CandidateOutcome o : outcomes) {
            if (o instanceof CandidateOutcome.Rejected r) {
                out.add(r);
            }
        }
        return out;
    }
}
