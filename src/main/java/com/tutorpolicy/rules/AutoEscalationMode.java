package com.tutorpolicy.rules;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * How an exhausted hint ladder interacts with the escalation threshold.
 */
public enum AutoEscalationMode {
    /**
     * Escalate on the error count alone, or on any error once the ladder is exhausted and no
     * explanation has been viewed since.
     */
    ALWAYS_AFTER_HINT_THRESHOLD("always-after-hint-threshold"),
    /** Escalate only when the error count is met and the ladder is exhausted. */
    THRESHOLD_GATED("threshold-gated");

    private final String value;

    AutoEscalationMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static AutoEscalationMode fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown auto-escalation mode: " + raw));
    }
}
