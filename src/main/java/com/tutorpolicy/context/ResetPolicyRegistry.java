package com.tutorpolicy.context;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ResetPolicyRegistry {

    private final Map<String, ErrorResetPolicy> policies = new LinkedHashMap<>();

    public ResetPolicyRegistry(List<ErrorResetPolicy> policies) {
        for (ErrorResetPolicy policy : policies) {
            if (this.policies.putIfAbsent(policy.policyId(), policy) != null) {
                throw new IllegalArgumentException("duplicate reset policy id: " + policy.policyId());
            }
        }
    }

    public ErrorResetPolicy resolve(String policyId) {
        ErrorResetPolicy policy = policyId == null ? null : policies.get(policyId);
        if (policy == null) {
            throw new UnknownResetPolicyException(policyId);
        }
        return policy;
    }

    public List<String> policyIds() {
        return List.copyOf(policies.keySet());
    }
}
