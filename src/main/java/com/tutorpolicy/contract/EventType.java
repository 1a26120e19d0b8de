package com.tutorpolicy.contract;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum EventType {
    CODE_CHANGE("code_change"),
    EXECUTION("execution"),
    ERROR("error"),
    HINT_REQUEST("hint_request"),
    HINT_VIEW("hint_view"),
    EXPLANATION_VIEW("explanation_view"),
    LLM_GENERATE("llm_generate"),
    TEXTBOOK_ADD("textbook_add"),
    TEXTBOOK_UPDATE("textbook_update");

    private final String value;

    EventType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Unrecognized values map to {@code null} so that an imported trace row with an unknown
     * type is rejected by {@link InteractionEventValidator} instead of failing the whole request.
     */
    @JsonCreator
    public static EventType fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElse(null);
    }
}
