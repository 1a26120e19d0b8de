package com.tutorpolicy.context;

public class UnknownResetPolicyException extends RuntimeException {

    public UnknownResetPolicyException(String policyId) {
        super("unknown reset policy: " + policyId);
    }
}
