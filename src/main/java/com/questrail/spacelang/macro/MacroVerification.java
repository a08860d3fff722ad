package com.questrail.spacelang.macro;

import java.util.Objects;

/**
 * MacroVerification
 * -----------------------------------------------------------------------------
 * The lifecycle of one macro candidate.
 *
 * <pre>
 * PROPOSED -> CONFLUENCE_CHECKED -> BISIMULATION_CHECKED -> ADMITTED
 *     \               \                     \
 *      `---------------`---------------------`--> REJECTED
 * </pre>
 *
 * <p>Transitions only move forward. A failed check moves the candidate to
 * {@link Stage#REJECTED} and records the stage it failed at. Any attempt to
 * re-enter an earlier stage or to leave a terminal one throws
 * {@link IllegalStateException}.</p>
 *
 * <p>Not thread-safe. One verification is driven by one thread at a time.</p>
 */
public final class MacroVerification
{
    public enum Stage {
        PROPOSED,
        CONFLUENCE_CHECKED,
        BISIMULATION_CHECKED,
        ADMITTED,
        REJECTED;

        public boolean isTerminal() {
            return this == ADMITTED || this == REJECTED;
        }
    }

    private final PatternCandidate candidate;
    private final Macro macro;

    private Stage stage = Stage.PROPOSED;
    private Stage failedAt;
    private String reason;
    private ConfluenceResult confluence;
    private BisimulationResult bisimulation;

    public MacroVerification(PatternCandidate candidate, Macro macro) {
        this.candidate = Objects.requireNonNull(candidate, "candidate");
        this.macro = Objects.requireNonNull(macro, "macro");
    }

    public PatternCandidate candidate() {
        return candidate;
    }

    public Macro macro() {
        return macro;
    }

    public Stage stage() {
        return stage;
    }

    /**
     * The last stage reached before rejection, or null if not rejected.
     */
    public Stage failedAt() {
        return failedAt;
    }

    public String reason() {
        return reason;
    }

    public ConfluenceResult confluence() {
        return confluence;
    }

    public BisimulationResult bisimulation() {
        return bisimulation;
    }

    public void recordConfluence(ConfluenceResult result) {
        Objects.requireNonNull(result, "result");
        require(Stage.PROPOSED);
        this.confluence = result;
        if (result instanceof ConfluenceResult.Divergent d) {
            reject("no common descendant for critical word " + d.word());
        } else {
            stage = Stage.CONFLUENCE_CHECKED;
        }
    }

    public void recordBisimulation(BisimulationResult result) {
        Objects.requireNonNull(result, "result");
        require(Stage.CONFLUENCE_CHECKED);
        this.bisimulation = result;
        if (result instanceof BisimulationResult.Diverged d) {
            reject("dynamics diverged on " + d.testWord() + " (symmetric difference "
                    + d.symmetricDifference() + ")");
        } else {
            stage = Stage.BISIMULATION_CHECKED;
        }
    }

    public void markAdmitted() {
        require(Stage.BISIMULATION_CHECKED);
        stage = Stage.ADMITTED;
    }

    public void reject(String reason) {
        Objects.requireNonNull(reason, "reason");
        if (stage.isTerminal()) {
            throw new IllegalStateException("Candidate " + macro + " already " + stage);
        }
        this.failedAt = stage;
        this.reason = reason;
        this.stage = Stage.REJECTED;
    }

    private void require(Stage expected) {
        if (stage != expected) {
            throw new IllegalStateException("Candidate " + macro + " is " + stage + ", expected " + expected);
        }
    }

    @Override
    public String toString() {
        return "MacroVerification[" + macro + ", " + stage + "]";
    }
}
