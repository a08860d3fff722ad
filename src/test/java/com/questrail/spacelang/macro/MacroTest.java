package com.questrail.spacelang.macro;

import com.questrail.spacelang.api.Rule;
import com.questrail.spacelang.api.Symbol;
import com.questrail.spacelang.api.Word;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class MacroTest
{
    @Test
    void proposeBuildsIntroductionAndElimination()
    {
        Macro m = Macro.propose(Symbol.of("A"), Word.of("00"));

        assertEquals(List.of(Rule.of("A", "00"), Rule.of("00", "A")), m.rules());
        assertFalse(m.verified());
        assertEquals("A := 00 ?", m.toString());
        assertEquals("A := 00 ✓", m.asVerified().toString());
    }

    @Test
    void rejectsSelfReference()
    {
        assertThrows(IllegalArgumentException.class, () -> Macro.propose(Symbol.of("A"), Word.of("0A")));
        assertThrows(IllegalArgumentException.class, () -> Macro.propose(Symbol.of("A"), Word.empty()));
    }

    @Test
    void freshSymbolsSkipTakenOnes()
    {
        assertEquals(Symbol.of("A"), MacroSymbols.next(Set.of()));
        assertEquals(Symbol.of("C"), MacroSymbols.next(Set.of(Symbol.of("A"), Symbol.of("B"))));
        assertEquals(Symbol.of("a"), MacroSymbols.next(alphabetUpperCase()));
    }

    private static Set<Symbol> alphabetUpperCase() {
        Set<Symbol> out = new HashSet<>();
        for (char c = 'A'; c <= 'Z'; c++) {
            out.add(Symbol.of(String.valueOf(c)));
        }
        return out;
    }
}
