package com.tutorpolicy.rules;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RuleId {
    AGGREGATE_THRESHOLD("aggregate-threshold"),
    ESCALATE_THRESHOLD("escalate-threshold"),
    HINT_LADDER_ADVANCE("hint-ladder-advance"),
    BELOW_THRESHOLD("below-threshold");

    private final String value;

    RuleId(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
