package com.tutorpolicy.rules;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DecisionKind {
    NO_ACTION("no_action"),
    SHOW_HINT("show_hint"),
    SHOW_EXPLANATION("show_explanation"),
    AGGREGATE_TO_TEXTBOOK("aggregate_to_textbook");

    private final String value;

    DecisionKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
