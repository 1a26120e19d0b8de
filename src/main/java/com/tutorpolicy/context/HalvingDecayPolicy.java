package com.tutorpolicy.context;

/**
 * Halves both counters (rounding down) instead of clearing them.
 */
public class HalvingDecayPolicy implements ErrorResetPolicy {

    public static final String ID = "halve-on-explanation";

    @Override
    public String policyId() {
        return ID;
    }

    @Override
    public String policyVersion() {
        return "v1";
    }

    @Override
    public Counters afterExplanation(Counters current) {
        return new Counters(current.errorCount() / 2, current.retryCount() / 2);
    }
}
