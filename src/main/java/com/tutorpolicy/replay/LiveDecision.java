package com.tutorpolicy.replay;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tutorpolicy.context.DecisionContext;
import com.tutorpolicy.rules.Decision;
import com.tutorpolicy.rules.RuleId;

/**
 * Single decision handed to the tutoring runtime. {@code eventId} is the event the decision
 * was made at, or {@code null} when the problem has no decision point yet.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LiveDecision(
    @JsonProperty("learner_id") String learnerId,
    @JsonProperty("problem_id") String problemId,
    @JsonProperty("event_id") String eventId,
    @JsonProperty("strategy") String strategy,
    @JsonProperty("decision") Decision decision,
    @JsonProperty("rule_fired") RuleId ruleFired,
    @JsonProperty("reasoning") String reasoning,
    @JsonProperty("context") DecisionContext context,
    @JsonProperty("policy_version") String policyVersion,
    @JsonProperty("policy_semantics_version") String policySemanticsVersion
) {}
