package com.tutorpolicy.context;

/**
 * Decides what happens to an attempt's error and retry counters after an explanation is viewed.
 * Policies are pure and versioned; the active policy's id and version become part of the
 * policy semantics version stamped on every decision.
 */
public interface ErrorResetPolicy {

    /** Unique policy identifier, e.g. "reset-on-explanation". */
    String policyId();

    /** Policy version, e.g. "v1". */
    String policyVersion();

    Counters afterExplanation(Counters current);

    record Counters(int errorCount, int retryCount) {}
}
