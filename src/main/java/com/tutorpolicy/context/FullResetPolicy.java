package com.tutorpolicy.context;

/**
 * Clears both counters so the following error starts a new escalation round.
 */
public class FullResetPolicy implements ErrorResetPolicy {

    public static final String ID = "reset-on-explanation";

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
        return new Counters(0, 0);
    }
}
