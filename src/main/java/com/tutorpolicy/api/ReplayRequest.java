package com.tutorpolicy.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tutorpolicy.contract.InteractionEvent;
import com.tutorpolicy.contract.LearnerProfile;

import java.util.List;

/**
 * Ad hoc replay of a trace that is not in the event store, e.g. an imported research trace.
 * Malformed rows in {@code trace} are skipped, not rejected.
 */
public record ReplayRequest(
    @JsonProperty("profile") LearnerProfile profile,
    @JsonProperty("trace") List<InteractionEvent> trace,
    @JsonProperty("strategy") String strategy,
    @JsonProperty("auto_escalation_mode") String autoEscalationMode,
    @JsonProperty("reset_policy") String resetPolicy
) {}
