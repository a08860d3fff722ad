package com.questrail.spacelang.config;

/**
 * VerificationBounds
 * -----------------------------------------------------------------------------
 * Computational budgets for macro verification and expansion.
 *
 * <p>Every value here is a hard budget, not a timeout. Hitting one never
 * raises; the affected check works on the sample it has.</p>
 *
 * <h2>Parameters</h2>
 * <ul>
 *   <li><b>confluenceWidth</b>: applications followed per word when closing
 *       the two branches of a critical word.</li>
 *   <li><b>maxCriticalWords</b>: number of critical words tested per candidate.</li>
 *   <li><b>bisimulationWidth</b>: applications followed per word when comparing
 *       old and new reach sets.</li>
 *   <li><b>maxTestWords</b>: number of generated test words compared.</li>
 *   <li><b>divergenceTolerance</b>: the bisimulation check fails when the
 *       symmetric difference of the final levels exceeds this fraction of the
 *       old level's size.</li>
 *   <li><b>expansionCap</b>: maximum substitution passes in
 *       {@code MacroDictionary.expand}.</li>
 * </ul>
 */
public record VerificationBounds(
        int confluenceWidth,
        int maxCriticalWords,
        int bisimulationWidth,
        int maxTestWords,
        double divergenceTolerance,
        int expansionCap
) {
    public VerificationBounds {
        if (confluenceWidth < 1) {
            throw new IllegalArgumentException("confluenceWidth must be positive");
        }
        if (maxCriticalWords < 1) {
            throw new IllegalArgumentException("maxCriticalWords must be positive");
        }
        if (bisimulationWidth < 1) {
            throw new IllegalArgumentException("bisimulationWidth must be positive");
        }
        if (maxTestWords < 1) {
            throw new IllegalArgumentException("maxTestWords must be positive");
        }
        if (!(divergenceTolerance >= 0.0) || Double.isInfinite(divergenceTolerance)) {
            throw new IllegalArgumentException("divergenceTolerance must be a non-negative finite number");
        }
        if (expansionCap < 1) {
            throw new IllegalArgumentException("expansionCap must be positive");
        }
    }

    /**
     * Default budgets: width 50, 20 critical words, width 30, 10 test words,
     * tolerance 0.5, 100 expansion passes.
     */
    public static VerificationBounds defaults() {
        return new VerificationBounds(50, 20, 30, 10, 0.5, 100);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final VerificationBounds d = defaults();
        private int confluenceWidth = d.confluenceWidth();
        private int maxCriticalWords = d.maxCriticalWords();
        private int bisimulationWidth = d.bisimulationWidth();
        private int maxTestWords = d.maxTestWords();
        private double divergenceTolerance = d.divergenceTolerance();
        private int expansionCap = d.expansionCap();

        public Builder withConfluenceWidth(int confluenceWidth) {
            this.confluenceWidth = confluenceWidth;
            return this;
        }

        public Builder withMaxCriticalWords(int maxCriticalWords) {
            this.maxCriticalWords = maxCriticalWords;
            return this;
        }

        public Builder withBisimulationWidth(int bisimulationWidth) {
            this.bisimulationWidth = bisimulationWidth;
            return this;
        }

        public Builder withMaxTestWords(int maxTestWords) {
            this.maxTestWords = maxTestWords;
            return this;
        }

        public Builder withDivergenceTolerance(double divergenceTolerance) {
            this.divergenceTolerance = divergenceTolerance;
            return this;
        }

        public Builder withExpansionCap(int expansionCap) {
            this.expansionCap = expansionCap;
            return this;
        }

        public VerificationBounds build() {
            return new VerificationBounds(confluenceWidth, maxCriticalWords, bisimulationWidth,
                    maxTestWords, divergenceTolerance, expansionCap);
        }
    }
}
