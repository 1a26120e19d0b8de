package com.tutorpolicy.replay;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tutorpolicy.rules.Decision;
import com.tutorpolicy.rules.RuleId;

public record DecisionDiff(
    @JsonProperty("index") int index,
    @JsonProperty("event_id") String eventId,
    @JsonProperty("baseline_decision") Decision baselineDecision,
    @JsonProperty("baseline_rule_fired") RuleId baselineRuleFired,
    @JsonProperty("candidate_decision") Decision candidateDecision,
    @JsonProperty("candidate_rule_fired") RuleId candidateRuleFired,
    @JsonProperty("changed") boolean changed
) {}
