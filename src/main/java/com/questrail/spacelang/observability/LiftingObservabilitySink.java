package com.questrail.spacelang.observability;

/**
 * Receives macro lifting lifecycle events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface LiftingObservabilitySink {
    /**
     * Called when a pattern is turned into a macro candidate, before verification.
     * @param event the proposal details
     */
    void onCandidateProposed(CandidateProposedEvent event);

    /**
     * Called after a verified macro was appended to the dictionary.
     * @param event the admission details, including the new dictionary version
     */
    void onMacroAdmitted(MacroAdmittedEvent event);

    /**
     * Called when a candidate fails a verification stage or loses the admission race.
     * @param event the rejection details
     */
    void onCandidateRejected(CandidateRejectedEvent event);

    /**
     * Called when verification or admission fails unexpectedly.
     * @param event the error event
     */
    void onError(LiftingErrorEvent event);
}
