package com.ecvi.riskengine.verify.model;

public enum SourceOutcome {
    EVALUATED,
    /** Adapter skipped because none of its input fields were present. */
    NOT_EVALUATED,
    TIMED_OUT,
    UNAVAILABLE;

    public boolean hasEvidence() {
        return this == EVALUATED;
    }
}
