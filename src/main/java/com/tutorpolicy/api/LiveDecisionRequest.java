package com.tutorpolicy.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record LiveDecisionRequest(
    @JsonProperty("learner_id") String learnerId,
    @JsonProperty("problem_id") String problemId,
    @JsonProperty("auto_escalation_mode") String autoEscalationMode,
    @JsonProperty("reset_policy") String resetPolicy
) {}
