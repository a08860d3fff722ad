package com.questrail.spacelang.config;

import java.util.Objects;

/**
 * Aggregated configuration for the macro lifting pipeline.
 */
public record LiftingConfig(
        int minPatternLength,
        int maxPatternLength,
        int maxCandidates,
        int minAttractorSize,
        int confluenceDepth,
        int bisimulationMaxLength,
        int bisimulationDepth,
        VerificationBounds bounds
) {
    public LiftingConfig {
        Objects.requireNonNull(bounds, "bounds");
        if (minPatternLength < 1) {
            throw new IllegalArgumentException("minPatternLength must be positive");
        }
        if (maxPatternLength < minPatternLength) {
            throw new IllegalArgumentException("maxPatternLength must be >= minPatternLength");
        }
        if (maxCandidates < 1) {
            throw new IllegalArgumentException("maxCandidates must be positive");
        }
        if (minAttractorSize < 1) {
            throw new IllegalArgumentException("minAttractorSize must be positive");
        }
        if (confluenceDepth < 0 || bisimulationDepth < 0) {
            throw new IllegalArgumentException("depths must be non-negative");
        }
        if (bisimulationMaxLength < 1) {
            throw new IllegalArgumentException("bisimulationMaxLength must be positive");
        }
    }

    public static LiftingConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int minPatternLength = 2;
        private int maxPatternLength = 4;
        private int maxCandidates = 5;
        private int minAttractorSize = 2;
        private int confluenceDepth = 5;
        private int bisimulationMaxLength = 6;
        private int bisimulationDepth = 3;
        private VerificationBounds bounds = VerificationBounds.defaults();

        public Builder withPatternLengths(int min, int max) {
            this.minPatternLength = min;
            this.maxPatternLength = max;
            return this;
        }

        public Builder withMaxCandidates(int maxCandidates) {
            this.maxCandidates = maxCandidates;
            return this;
        }

        public Builder withMinAttractorSize(int minAttractorSize) {
            this.minAttractorSize = minAttractorSize;
            return this;
        }

        public Builder withConfluenceDepth(int confluenceDepth) {
            this.confluenceDepth = confluenceDepth;
            return this;
        }

        public Builder withBisimulation(int maxLength, int depth) {
            this.bisimulationMaxLength = maxLength;
            this.bisimulationDepth = depth;
            return this;
        }

        public Builder withBounds(VerificationBounds bounds) {
            this.bounds = bounds;
            return this;
        }

        public LiftingConfig build() {
            return new LiftingConfig(minPatternLength, maxPatternLength, maxCandidates,
                    minAttractorSize, confluenceDepth, bisimulationMaxLength, bisimulationDepth, bounds);
        }
    }
}
