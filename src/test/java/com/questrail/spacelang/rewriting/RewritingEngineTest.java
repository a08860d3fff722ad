package com.questrail.spacelang.rewriting;

import com.questrail.spacelang.api.Rule;
import com.questrail.spacelang.api.Word;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RewritingEngineTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link RewritingEngine}.
 *
 * <p>The two-rule system {@code 00 -> 0|, 0| -> 00} is used throughout: it
 * cycles between {@code 00} and {@code 0|}.</p>
 */
final class RewritingEngineTest
{
    private static final List<Rule> TOGGLE = List.of(Rule.of("00", "0|"), Rule.of("0|", "00"));

    private static Word w(String s) {
        return Word.of(s);
    }

    // ---------------------------------------------------------------------
    // Matching and application
    // ---------------------------------------------------------------------

    @Test
    void findPositionsReportsEveryOccurrence()
    {
        RewritingEngine engine = new RewritingEngine(TOGGLE);
        assertEquals(List.of(0, 3), engine.findPositions(w("00|00"), w("00")));
    }

    @Test
    void findPositionsIncludesOverlaps()
    {
        RewritingEngine engine = new RewritingEngine(TOGGLE);
        assertEquals(List.of(0, 1, 2), engine.findPositions(w("0000"), w("00")));
        assertEquals(List.of(), engine.findPositions(w("0"), w("00")));
    }

    @Test
    void applyRuleSplicesRightHandSide()
    {
        RewritingEngine engine = new RewritingEngine(TOGGLE);
        Rule grow = Rule.of("0", "000");
        Word out = engine.applyRule(w("|0|"), grow, 1);
        assertEquals(w("|000|"), out);
        assertEquals(3 - 1 + 3, out.length());
    }

    @Test
    void allApplicationsFollowRuleThenPositionOrder()
    {
        RewritingEngine engine = new RewritingEngine(List.of(Rule.of("0|", "|0"), Rule.of("00", "0")));
        List<Application> apps = engine.allApplications(w("00|0|"));

        assertEquals(3, apps.size());
        assertEquals(List.of(1, 3, 0), apps.stream().map(Application::position).toList());
        assertEquals(Rule.of("00", "0"), apps.get(2).rule());
        assertEquals(w("0|00|"), apps.get(0).result());
        assertEquals(w("00||0"), apps.get(1).result());
        assertEquals(w("0|0|"), apps.get(2).result());
    }

    @Test
    void noApplicationsMeansNormalForm()
    {
        RewritingEngine engine = new RewritingEngine(TOGGLE);
        assertTrue(engine.allApplications(w("||")).isEmpty());
        assertTrue(engine.isNormalForm(w("||")));
        assertFalse(engine.isNormalForm(w("0|")));
    }

    @Test
    void successorsAreDistinct()
    {
        RewritingEngine engine = new RewritingEngine(List.of(Rule.of("0", "|")));
        assertEquals(List.of(w("|0"), w("0|")), engine.successors(w("00")));
        RewritingEngine collapsing = new RewritingEngine(List.of(Rule.of("0", ""), Rule.of("0", "")));
        assertEquals(List.of(w("0")), collapsing.successors(w("00")));
    }

    // ---------------------------------------------------------------------
    // Bounded reach
    // ---------------------------------------------------------------------

    @Test
    void boundedReachStopsOnVisitedCycle()
    {
        RewritingEngine engine = new RewritingEngine(TOGGLE);
        ReachLevels levels = engine.boundedReach(w("00"), 2, 10);

        assertEquals(Set.of(w("00")), levels.level(0));
        assertEquals(Set.of(w("0|")), levels.level(1));
        assertFalse(levels.hasLevel(2));
        assertEquals(1, levels.deepestLevel());
    }

    @Test
    void boundedReachWidthSamplesFirstApplications()
    {
        RewritingEngine engine = new RewritingEngine(List.of(Rule.of("0", "|")));
        ReachLevels levels = engine.boundedReach(w("000"), 2, 1);

        assertEquals(Set.of(w("|00")), levels.level(1));
        assertEquals(Set.of(w("||0")), levels.level(2));

        ReachLevels full = engine.boundedReach(w("000"), 2);
        assertEquals(3, full.level(1).size());
        assertEquals(3, full.level(2).size());
    }

    @Test
    void boundedReachDepthZeroIsStartOnly()
    {
        RewritingEngine engine = new RewritingEngine(TOGGLE);
        assertEquals(Set.of(w("00")), engine.boundedReach(w("00"), 0).allReached());
    }

    @Test
    void boundedReachRejectsInvalidBounds()
    {
        RewritingEngine engine = new RewritingEngine(TOGGLE);
        assertThrows(IllegalArgumentException.class, () -> engine.boundedReach(w("00"), -1, 1));
        assertThrows(IllegalArgumentException.class, () -> engine.boundedReach(w("00"), 1, 0));
    }

    // ---------------------------------------------------------------------
    // Reachability
    // ---------------------------------------------------------------------

    @Test
    void reachableReturnsPathFromStartToTarget()
    {
        RewritingEngine engine = new RewritingEngine(List.of(Rule.of("0", "|")));
        PathSearch result = engine.reachable(w("00"), w("||"), 3, 10);

        PathSearch.Found found = assertInstanceOf(PathSearch.Found.class, result);
        assertEquals(w("00"), found.path().get(0));
        assertEquals(w("||"), found.path().get(found.path().size() - 1));
        assertEquals(2, found.steps());
    }

    @Test
    void reachableStartIsTrivialPath()
    {
        RewritingEngine engine = new RewritingEngine(TOGGLE);
        PathSearch.Found found = assertInstanceOf(PathSearch.Found.class, engine.reachable(w("00"), w("00"), 0));
        assertEquals(0, found.steps());
    }

    @Test
    void unreachableTargetIsNotFound()
    {
        RewritingEngine engine = new RewritingEngine(TOGGLE);
        PathSearch result = engine.reachable(w("00"), w("||"), 5, 10);
        assertFalse(result.isFound());
        PathSearch.NotFound nf = assertInstanceOf(PathSearch.NotFound.class, result);
        assertEquals(2, nf.visited());
    }

    @Test
    void depthBudgetLimitsSearch()
    {
        RewritingEngine engine = new RewritingEngine(List.of(Rule.of("0", "|")));
        assertFalse(engine.reachable(w("000"), w("|||"), 2).isFound());
        assertTrue(engine.reachable(w("000"), w("|||"), 3).isFound());
    }

    // ---------------------------------------------------------------------
    // Omega limit
    // ---------------------------------------------------------------------

    @Test
    void omegaLimitDetectsCycle()
    {
        RewritingEngine engine = new RewritingEngine(TOGGLE);
        OmegaLimit limit = engine.omegaLimit(w("00"), 50);

        assertEquals(OmegaLimit.Kind.CYCLE, limit.kind());
        assertEquals(Set.of(w("00"), w("0|")), limit.states());
        assertTrue(limit.isExact());
    }

    @Test
    void omegaLimitReachesNormalForm()
    {
        RewritingEngine engine = new RewritingEngine(List.of(Rule.of("00", "0")));
        OmegaLimit limit = engine.omegaLimit(w("000"), 50);

        assertEquals(OmegaLimit.Kind.NORMAL_FORM, limit.kind());
        assertEquals(Set.of(w("0")), limit.states());
    }

    @Test
    void omegaLimitWithoutCycleIsApproximate()
    {
        RewritingEngine engine = new RewritingEngine(List.of(Rule.of("0", "00")));
        OmegaLimit limit = engine.omegaLimit(w("0"), 5);

        assertEquals(OmegaLimit.Kind.APPROXIMATE, limit.kind());
        assertFalse(limit.isExact());
        assertEquals(5, limit.states().size());
    }

    @Test
    void omegaLimitApproximationKeepsTrailingWindow()
    {
        RewritingEngine engine = new RewritingEngine(List.of(Rule.of("0", "00")));
        OmegaLimit limit = engine.omegaLimit(w("0"), 150);

        assertEquals(RewritingEngine.OMEGA_WINDOW, limit.states().size());
        assertFalse(limit.states().contains(w("0")));
    }
}
