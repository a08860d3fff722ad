package com.questrail.spacelang.macro;

import java.util.Objects;

/**
 * Final result for one lifted candidate.
 */
public sealed interface CandidateOutcome
        permits CandidateOutcome.Admitted, CandidateOutcome.Rejected
{
    PatternCandidate candidate();

    Macro macro();

    record Admitted(PatternCandidate candidate, Macro macro, AdmissionRecord record) implements CandidateOutcome {
        public Admitted {
            Objects.requireNonNull(candidate, "candidate");
            Objects.requireNonNull(macro, "macro");
            Objects.requireNonNull(record, "record");
        }
    }

    /**
     * @param failedAt the last stage reached before rejection
     */
    record Rejected(PatternCandidate candidate, Macro macro, MacroVerification.Stage failedAt, String reason)
            implements CandidateOutcome {
        public Rejected {
            Objects.requireNonNull(candidate, "candidate");
            Objects.requireNonNull(macro, "macro");
            Objects.requireNonNull(failedAt, "failedAt");
            Objects.requireNonNull(reason, "reason");
        }
    }
}
