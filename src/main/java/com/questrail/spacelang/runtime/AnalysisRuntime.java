package com.questrail.spacelang.runtime;

import com.questrail.spacelang.api.Alphabet;
import com.questrail.spacelang.api.Rule;
import com.questrail.spacelang.config.LiftingConfig;
import com.questrail.spacelang.graph.AttractorAnalyzer;
import com.questrail.spacelang.graph.ConfigurationGraph;
import com.questrail.spacelang.graph.GraphBuilder;
import com.questrail.spacelang.graph.SccDecomposition;
import com.questrail.spacelang.graph.TarjanScc;
import com.questrail.spacelang.macro.MacroCoverage;
import com.questrail.spacelang.macro.MacroDictionary;
import com.questrail.spacelang.macro.MacroLifter;
import com.questrail.spacelang.observability.NullObservabilitySink;
import com.questrail.spacelang.observability.LiftingObservabilitySink;
import com.questrail.spacelang.rewriting.RewritingEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * AnalysisRuntime
 * =============================================================================
 * Composition root and lifecycle owner for one rewriting system.
 *
 * <p>Owns the worker pool used by graph construction, basin computation and
 * macro verification, and the {@link MacroDictionary} the lifter admits into.
 * {@link #close()} shuts the pool down; components handed out before that
 * must not be used afterwards.</p>
 */
public final class AnalysisRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AnalysisRuntime.class);

    private final List<Rule> rules;
    private final Alphabet alphabet;
    private final LiftingConfig config;
    private final ExecutorService workers;
    private final LiftingObservabilitySink observabilitySink;
    private final Clock clock;

    private final RewritingEngine engine;
    private final GraphBuilder graphBuilder;
    private final MacroDictionary dictionary;
    private final MacroLifter lifter;

    private AnalysisRuntime(Builder b, ExecutorService workers) {
        this.rules = List.copyOf(b.rules);
        this.alphabet = b.alphabet;
        this.config = b.config;
        this.workers = workers;
        this.observabilitySink = b.observabilitySink;
        this.clock = b.clock;

        this.engine = new RewritingEngine(rules);
        this.graphBuilder = new GraphBuilder(rules, alphabet, workers);
        this.dictionary = b.dictionary != null
                ? b.dictionary
                : new MacroDictionary(config.bounds().expansionCap());
        this.lifter = new MacroLifter(rules, dictionary, config, workers, observabilitySink, clock);
    }

    public List<Rule> rules() {
        return rules;
    }

    public Alphabet alphabet() {
        return alphabet;
    }

    public LiftingConfig config() {
        return config;
    }

    public RewritingEngine engine() {
        return engine;
    }

    public GraphBuilder graphBuilder() {
        return graphBuilder;
    }

    public MacroDictionary dictionary() {
        return dictionary;
    }

    public MacroLifter macroLifter() {
        return lifter;
    }

    public SccDecomposition decompose(ConfigurationGraph graph) {
        return new TarjanScc(graph).findSccs();
    }

    /**
     * Returns an analyzer whose basins are already computed on the worker pool.
     */
    public AttractorAnalyzer attractorAnalyzer(SccDecomposition decomposition) {
        AttractorAnalyzer analyzer = new AttractorAnalyzer(decomposition);
        analyzer.computeBasins(workers);
        return analyzer;
    }

    public MacroCoverage coverage() {
        return new MacroCoverage(dictionary);
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.debug("Analysis runtime closed");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private List<Rule> rules;
        private Alphabet alphabet = Alphabet.binary();
        private LiftingConfig config = LiftingConfig.defaults();
        private int parallelism = Runtime.getRuntime().availableProcessors();
        private LiftingObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private Clock clock = Clock.systemUTC();
        private MacroDictionary dictionary;

        public Builder withRules(List<Rule> rules) {
            this.rules = rules;
            return this;
        }

        public Builder withAlphabet(Alphabet alphabet) {
            this.alphabet = alphabet;
            return this;
        }

        public Builder withConfig(LiftingConfig config) {
            this.config = config;
            return this;
        }

        public Builder withParallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder withObservabilitySink(LiftingObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Uses an existing dictionary, for example one loaded from disk.
         */
        public Builder withDictionary(MacroDictionary dictionary) {
            this.dictionary = dictionary;
            return this;
        }

        public AnalysisRuntime build() {
            Objects.requireNonNull(rules, "rules");
            Objects.requireNonNull(alphabet, "alphabet");
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(clock, "clock");
            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be positive");
            }

            ExecutorService workers = Executors.newFixedThreadPool(parallelism, new WorkerThreadFactory());
            log.info("Starting analysis runtime: {} rules, {} workers", rules.size(), parallelism);
            return new AnalysisRuntime(this, workers);
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "spacelang-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
