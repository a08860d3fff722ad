package com.questrail.spacelang.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of LiftingObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jLiftingObservabilitySink implements LiftingObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jLiftingObservabilitySink.class);

    @Override
    public void onCandidateProposed(CandidateProposedEvent event) {
        log.debug("Candidate {} := {} (score {})", event.symbol(), event.definition(), event.score());
    }

    @Override
    public void onMacroAdmitted(MacroAdmittedEvent event) {
        log.info("Admitted macro {} := {} at version {}",
            event.symbol(), event.definition(), event.version());
    }

    @Override
    public void onCandidateRejected(CandidateRejectedEvent event) {
        log.info("Rejected macro {} := {} at {}: {}",
            event.symbol(), event.definition(), event.stage(), event.reason());
    }

    @Override
    public void onError(LiftingErrorEvent event) {
        log.error("Lifting error: {}", event.message(), event.cause());
    }
}
