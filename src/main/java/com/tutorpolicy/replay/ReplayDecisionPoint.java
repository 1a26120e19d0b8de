package com.tutorpolicy.replay;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tutorpolicy.context.DecisionContext;
import com.tutorpolicy.contract.EventType;
import com.tutorpolicy.rules.AutoEscalationMode;
import com.tutorpolicy.rules.Decision;
import com.tutorpolicy.rules.RuleId;
import com.tutorpolicy.strategy.StrategyConfig;
import com.tutorpolicy.versioning.PolicyVersionStamp;

import java.time.Instant;

/**
 * One evaluated event of a replayed trace. {@code index} counts decision points only,
 * starting at 0.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReplayDecisionPoint(
    @JsonProperty("index") int index,
    @JsonProperty("event_id") String eventId,
    @JsonProperty("learner_id") String learnerId,
    @JsonProperty("problem_id") String problemId,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("event_type") EventType eventType,
    @JsonProperty("error_subtype_id") String errorSubtypeId,
    @JsonProperty("strategy") String strategy,
    @JsonProperty("thresholds") StrategyConfig thresholds,
    @JsonProperty("auto_escalation_mode") AutoEscalationMode autoEscalationMode,
    @JsonProperty("context") DecisionContext context,
    @JsonProperty("decision") Decision decision,
    @JsonProperty("rule_fired") RuleId ruleFired,
    @JsonProperty("reasoning") String reasoning,
    @JsonProperty("policy_version") String policyVersion,
    @JsonProperty("policy_semantics_version") String policySemanticsVersion
) {

    @JsonIgnore
    public PolicyVersionStamp stamp() {
        return new PolicyVersionStamp(policyVersion, policySemanticsVersion);
    }
}
