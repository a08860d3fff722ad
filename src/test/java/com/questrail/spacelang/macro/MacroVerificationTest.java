package com.questrail.spacelang.macro;

import com.questrail.spacelang.api.Context;
import com.questrail.spacelang.api.Rule;
import com.questrail.spacelang.api.Symbol;
import com.questrail.spacelang.api.Word;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class MacroVerificationTest
{
    private static MacroVerification fresh() {
        PatternCandidate c = new PatternCandidate(Word.of("00"), 3, 1.0, 3.6);
        return new MacroVerification(c, Macro.propose(Symbol.of("A"), Word.of("00")));
    }

    @Test
    void passingChecksReachAdmission()
    {
        MacroVerification v = fresh();
        v.recordConfluence(new ConfluenceResult.Joinable(4));
        v.recordBisimulation(new BisimulationResult.Bisimilar(7));
        v.markAdmitted();

        assertEquals(MacroVerification.Stage.ADMITTED, v.stage());
        assertNull(v.failedAt());
    }

    @Test
    void failedCheckRejectsAndRemembersStage()
    {
        MacroVerification v = fresh();
        v.recordConfluence(new ConfluenceResult.Joinable(4));
        v.recordBisimulation(new BisimulationResult.Diverged(Word.of("0000"), Set.of(), Set.of(Word.of("A"))));

        assertEquals(MacroVerification.Stage.REJECTED, v.stage());
        assertEquals(MacroVerification.Stage.CONFLUENCE_CHECKED, v.failedAt());
        assertTrue(v.reason().contains("0000"));
    }

    @Test
    void stagesCannotBeSkippedOrRepeated()
    {
        MacroVerification v = fresh();
        assertThrows(IllegalStateException.class, () -> v.recordBisimulation(new BisimulationResult.Bisimilar(1)));
        assertThrows(IllegalStateException.class, v::markAdmitted);

        v.recordConfluence(new ConfluenceResult.Joinable(1));
        assertThrows(IllegalStateException.class, () -> v.recordConfluence(new ConfluenceResult.Joinable(1)));
    }

    @Test
    void terminalStagesAreFinal()
    {
        MacroVerification v = fresh();
        Rule r = Rule.of("0|", "||");
        v.recordConfluence(new ConfluenceResult.Divergent(Word.of("0|"),
                new Context(Word.of("0|"), 0, Rule.of("0|", "|0")),
                new Context(Word.of("0|"), 0, r)));

        assertEquals(MacroVerification.Stage.REJECTED, v.stage());
        assertEquals(MacroVerification.Stage.PROPOSED, v.failedAt());
        assertThrows(IllegalStateException.class, () -> v.reject("again"));
        assertThrows(IllegalStateException.class, () -> v.recordBisimulation(new BisimulationResult.Bisimilar(1)));
    }
}
