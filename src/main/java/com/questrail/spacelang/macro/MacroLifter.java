package com.questrail.spacelang.macro;

import com.questrail.spacelang.api.Rule;
import com.questrail.spacelang.api.Symbol;
import com.questrail.spacelang.api.Word;
import com.questrail.spacelang.config.LiftingConfig;
import com.questrail.spacelang.graph.Scc;
import com.questrail.spacelang.graph.SccDecomposition;
import com.questrail.spacelang.observability.CandidateProposedEvent;
import com.questrail.spacelang.observability.CandidateRejectedEvent;
import com.questrail.spacelang.observability.LiftingErrorEvent;
import com.questrail.spacelang.observability.LiftingObservabilitySink;
import com.questrail.spacelang.observability.MacroAdmittedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * MacroLifter
 * -----------------------------------------------------------------------------
 * Drives candidates from SCC mining to dictionary admission.
 *
 * <h2>Pipeline</h2>
 * <ol>
 *   <li><b>Propose</b>: rank patterns with {@link FrequencyAnalyzer}, skip
 *       patterns the dictionary already defines, keep the best
 *       {@link LiftingConfig#maxCandidates()} and give each a fresh symbol.</li>
 *   <li><b>Verify</b>: run the confluence check, then (if it passed) the
 *       bisimulation check. Candidates are independent and verified
 *       concurrently on the executor.</li>
 *   <li><b>Admit</b>: in rank order, on the calling thread, append every
 *       candidate that passed both checks.</li>
 * </ol>
 *
 * <h2>Reference system</h2>
 * Every candidate is verified against the base rules given at construction,
 * never against rules of previously admitted macros.
 *
 * <h2>Failure semantics</h2>
 * A failed check is a rejection, reported through the sink and in the
 * {@link LiftingReport}. An exception thrown during verification is reported
 * to {@link LiftingObservabilitySink#onError} and rethrown; candidates already
 * admitted stay admitted.
 */
public final class MacroLifter
{
    private static final Logger log = LoggerFactory.getLogger(MacroLifter.class);

    private final List<Rule> rules;
    private final MacroDictionary dictionary;
    private final LiftingConfig config;
    private final Executor executor;
    private final LiftingObservabilitySink sink;
    private final Clock clock;

    private final LocalConfluenceChecker confluence;
    private final BoundedBisimulation bisimulation;

    public MacroLifter(List<Rule> rules,
                       MacroDictionary dictionary,
                       LiftingConfig config,
                       Executor executor,
                       LiftingObservabilitySink sink,
                       Clock clock) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
        this.dictionary = Objects.requireNonNull(dictionary, "dictionary");
        this.config = Objects.requireNonNull(config, "config");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.confluence = new LocalConfluenceChecker(config.bounds());
        this.bisimulation = new BoundedBisimulation(config.bounds());
    }

    public MacroDictionary dictionary() {
        return dictionary;
    }

    /**
     * Mines, verifies and admits macros from one component.
     */
    public LiftingReport lift(Scc scc) {
        Objects.requireNonNull(scc, "scc");

        List<PatternCandidate> ranked = FrequencyAnalyzer.analyzeScc(
                scc, config.minPatternLength(), config.maxPatternLength());
        List<MacroVerification> proposals = propose(scc, ranked);

        List<CompletableFuture<MacroVerification>> futures = new ArrayList<>(proposals.size());
        for (MacroVerification v : proposals) {
            futures.add(CompletableFuture.supplyAsync(() -> verify(v), executor));
        }

        List<CandidateOutcome> outcomes = new ArrayList<>(proposals.size());
        for (CompletableFuture<MacroVerification> f : futures) {
            MacroVerification v = await(f);
            outcomes.add(admitOrReject(v));
        }

        LiftingReport report = new LiftingReport(scc, ranked, outcomes, dictionary.version());
        log.info("Lifted {}: {} candidates, {} admitted, dictionary at version {}",
                scc, ranked.size(), report.admitted().size(), report.dictionaryVersion());
        return report;
    }

    /**
     * Lifts every attractor of at least {@link LiftingConfig#minAttractorSize()}
     * vertices, in emission order.
     */
    public List<LiftingReport> liftAll(SccDecomposition decomposition) {
        Objects.requireNonNull(decomposition, "decomposition");
        List<LiftingReport> reports = new ArrayList<>();
        for (Scc attractor : decomposition.attractors()) {
            if (attractor.size() >= config.minAttractorSize()) {
                reports.add(lift(attractor));
            }
        }
        return reports;
    }

    private List<MacroVerification> propose(Scc scc, List<PatternCandidate> ranked) {
        Set<Symbol> taken = new HashSet<>(dictionary.symbols());
        for (Rule r : rules) {
            r.left().forEach(taken::add);
            r.right().forEach(taken::add);
        }

        List<MacroVerification> out = new ArrayList<>();
        for (PatternCandidate c : ranked) {
            if (out.size() >= config.maxCandidates()) {
                break;
            }
            if (dictionary.definesPattern(c.pattern())) {
                continue;
            }
            Symbol symbol = MacroSymbols.next(taken);
            taken.add(symbol);

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("source", "frequency_analysis");
            metadata.put("scc_size", scc.size());
            metadata.put("frequency", c.frequency());
            metadata.put("score", c.score());

            Macro macro = Macro.propose(symbol, c.pattern(), metadata);
            out.add(new MacroVerification(c, macro));
            sink.onCandidateProposed(new CandidateProposedEvent(clock.instant(), symbol, c.pattern(), c.score()));
        }
        return out;
    }

    private MacroVerification verify(MacroVerification v) {
        v.recordConfluence(confluence.check(rules, v.macro(), config.confluenceDepth()));
        if (v.stage() == MacroVerification.Stage.CONFLUENCE_CHECKED) {
            v.recordBisimulation(bisimulation.check(
                    rules, v.macro(), config.bisimulationMaxLength(), config.bisimulationDepth()));
        }
        return v;
    }

    private CandidateOutcome admitOrReject(MacroVerification v) {
        if (v.stage() == MacroVerification.Stage.BISIMULATION_CHECKED) {
            Macro verified = v.macro().asVerified();
            AdmissionRecord record;
            try {
                record = dictionary.admit(verified);
            } catch (IllegalStateException e) {
                // another writer took the symbol or pattern since proposal
                v.reject(e.getMessage());
                return rejected(v);
            }
            v.markAdmitted();
            sink.onMacroAdmitted(new MacroAdmittedEvent(
                    clock.instant(), verified.symbol(), verified.definition(), record.version()));
            return new CandidateOutcome.Admitted(v.candidate(), verified, record);
        }
        return rejected(v);
    }

    private CandidateOutcome rejected(MacroVerification v) {
        Word definition = v.macro().definition();
        sink.onCandidateRejected(new CandidateRejectedEvent(
                clock.instant(), v.macro().symbol(), definition, v.failedAt().name(), v.reason()));
        return new CandidateOutcome.Rejected(v.candidate(), v.macro(), v.failedAt(), v.reason());
    }

    private MacroVerification await(CompletableFuture<MacroVerification> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            sink.onError(new LiftingErrorEvent(clock.instant(), "Macro verification failed", cause));
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw e;
        }
    }
}
