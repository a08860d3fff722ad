package com.questrail.spacelang.observability;

import com.questrail.spacelang.api.Symbol;
import com.questrail.spacelang.api.Word;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

final class Slf4jLiftingObservabilitySinkTest
{
    @Test
    void acceptsEveryEventKind()
    {
        LiftingObservabilitySink sink = new Slf4jLiftingObservabilitySink();
        Instant now = Instant.EPOCH;
        Symbol a = Symbol.of("A");
        Word def = Word.of("00");

        assertDoesNotThrow(() -> {
            sink.onCandidateProposed(new CandidateProposedEvent(now, a, def, 3.6));
            sink.onMacroAdmitted(new MacroAdmittedEvent(now, a, def, 2));
            sink.onCandidateRejected(new CandidateRejectedEvent(now, a, def, "PROPOSED", "diverged"));
            sink.onError(new LiftingErrorEvent(now, "boom", new IllegalStateException("boom")));
        });
    }

    @Test
    void nullSinkIsSingleton()
    {
        assertSame(NullObservabilitySink.INSTANCE, NullObservabilitySink.INSTANCE);
        assertDoesNotThrow(() -> NullObservabilitySink.INSTANCE.onError(new LiftingErrorEvent(Instant.EPOCH, "x", null)));
    }
}
