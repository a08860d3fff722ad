package com.questrail.spacelang.observability;

/**
 * No-op implementation of LiftingObservabilitySink.
 */
public final class NullObservabilitySink implements LiftingObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onCandidateProposed(CandidateProposedEvent event) {}

    @Override
    public void onMacroAdmitted(MacroAdmittedEvent event) {}

    @Override
    public void onCandidateRejected(CandidateRejectedEvent event) {}

    @Override
    public void onError(LiftingErrorEvent event) {}
}
