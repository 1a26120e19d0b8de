package com.tutorpolicy.contract;

import org.springframework.stereotype.Component;

@Component
public class InteractionEventValidator {

    public void validate(InteractionEvent event) {
        if (event == null) {
            throw new MalformedEventException(null, "event cannot be null");
        }
        String id = requireString(event.id(), null, "id is required");
        if (event.timestamp() == null) {
            throw new MalformedEventException(id, "timestamp is required");
        }
        if (event.eventType() == null) {
            throw new MalformedEventException(id, "event_type is required and must be a known type");
        }
        requireString(event.problemId(), id, "problem_id is required");
    }

    private String requireString(String value, String eventId, String message) {
        if (value == null || value.isBlank()) {
            throw new MalformedEventException(eventId, message);
        }
        return value;
    }
}
