package com.questrail.spacelang.macro;

import com.questrail.spacelang.api.Rule;
import com.questrail.spacelang.api.Symbol;
import com.questrail.spacelang.api.Word;
import com.questrail.spacelang.config.LiftingConfig;
import com.questrail.spacelang.graph.ConfigurationGraph;
import com.questrail.spacelang.graph.Scc;
import com.questrail.spacelang.graph.SccDecomposition;
import com.questrail.spacelang.graph.TarjanScc;
import com.questrail.spacelang.observability.CandidateProposedEvent;
import com.questrail.spacelang.observability.CandidateRejectedEvent;
import com.questrail.spacelang.observability.MacroAdmittedEvent;
import com.questrail.spacelang.observability.RecordingObservabilitySink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * MacroLifterTest
 * -----------------------------------------------------------------------------
 * End-to-end propose / verify / admit runs of {@link MacroLifter}.
 *
 * <p>The mined component {@code {000, 00|}} yields the single candidate
 * {@code 00}. Over the commuting rule {@code 0| -> |0} the macro is admitted;
 * over the toggle {@code 00 <-> 0|} it changes the dynamics and is rejected.</p>
 */
final class MacroLifterTest
{
    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");
    private static final LiftingConfig CONFIG = LiftingConfig.builder().withPatternLengths(2, 2).build();

    private ExecutorService pool;
    private RecordingObservabilitySink sink;

    @BeforeEach
    void setUp()
    {
        pool = Executors.newFixedThreadPool(2);
        sink = new RecordingObservabilitySink();
    }

    @AfterEach
    void tearDown()
    {
        pool.shutdownNow();
    }

    private MacroLifter lifter(List<Rule> rules, MacroDictionary dictionary) {
        return new MacroLifter(rules, dictionary, CONFIG, pool, sink, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Scc mined() {
        return new Scc(List.of(Word.of("000"), Word.of("00|")), true);
    }

    @Test
    void verifiedCandidateIsAdmitted()
    {
        MacroDictionary dictionary = new MacroDictionary();
        LiftingReport report = lifter(List.of(Rule.of("0|", "|0")), dictionary).lift(mined());

        assertEquals(1, report.admitted().size());
        CandidateOutcome.Admitted admitted = report.admitted().get(0);
        assertEquals(Symbol.of("A"), admitted.macro().symbol());
        assertEquals(Word.of("00"), admitted.macro().definition());
        assertTrue(admitted.macro().verified());
        assertEquals(2, admitted.record().version());
        assertEquals(2, dictionary.version());
        assertEquals(2, report.dictionaryVersion());

        assertEquals(1, sink.getEvents(CandidateProposedEvent.class).size());
        MacroAdmittedEvent event = sink.getEvents(MacroAdmittedEvent.class).get(0);
        assertEquals(NOW, event.timestamp());
        assertEquals(2, event.version());
        assertFalse(sink.hasEventOfType(CandidateRejectedEvent.class));
    }

    @Test
    void eventsFollowPipelineOrder()
    {
        lifter(List.of(Rule.of("0|", "|0")), new MacroDictionary()).lift(mined());

        List<Object> events = sink.getAllEvents();
        assertEquals(2, events.size());
        assertInstanceOf(CandidateProposedEvent.class, events.get(0));
        assertInstanceOf(MacroAdmittedEvent.class, events.get(1));
    }

    @Test
    void candidateChangingDynamicsIsRejected()
    {
        MacroDictionary dictionary = new MacroDictionary();
        List<Rule> toggle = List.of(Rule.of("00", "0|"), Rule.of("0|", "00"));
        LiftingReport report = lifter(toggle, dictionary).lift(mined());

        assertTrue(report.admitted().isEmpty());
        CandidateOutcome.Rejected rejected = report.rejected().get(0);
        assertEquals(MacroVerification.Stage.CONFLUENCE_CHECKED, rejected.failedAt());
        assertEquals(1, dictionary.version());

        CandidateRejectedEvent event = sink.getEvents(CandidateRejectedEvent.class).get(0);
        assertEquals("CONFLUENCE_CHECKED", event.stage());
        assertFalse(sink.hasEventOfType(MacroAdmittedEvent.class));
    }

    @Test
    void alreadyDefinedPatternIsNotProposedAgain()
    {
        MacroDictionary dictionary = new MacroDictionary();
        MacroLifter lifter = lifter(List.of(Rule.of("0|", "|0")), dictionary);

        lifter.lift(mined());
        LiftingReport second = lifter.lift(mined());

        assertTrue(second.outcomes().isEmpty());
        assertEquals(1, second.candidates().size());
        assertEquals(2, dictionary.version());
    }

    @Test
    void freshSymbolsAvoidDictionaryAndRuleSymbols()
    {
        MacroDictionary dictionary = new MacroDictionary();
        dictionary.admit(Macro.propose(Symbol.of("A"), Word.of("||")).asVerified());
        List<Rule> rules = List.of(Rule.of("0|", "|0"), Rule.of("B", "B"));

        LiftingReport report = lifter(rules, dictionary).lift(mined());

        assertEquals(Symbol.of("C"), report.outcomes().get(0).macro().symbol());
    }

    @Test
    void liftAllMinesAttractorsOfMinimumSize()
    {
        ConfigurationGraph g = ConfigurationGraph.builder()
                .addEdge(Word.of("000"), Word.of("00|"))
                .addEdge(Word.of("00|"), Word.of("000"))
                .addEdge(Word.of("|"), Word.of("||"))
                .build();
        SccDecomposition d = new TarjanScc(g).findSccs();
        MacroDictionary dictionary = new MacroDictionary();

        List<LiftingReport> reports = lifter(List.of(Rule.of("0|", "|0")), dictionary).liftAll(d);

        assertEquals(1, reports.size());
        assertEquals(1 + reports.get(0).admitted().size(), dictionary.version());
    }
}
