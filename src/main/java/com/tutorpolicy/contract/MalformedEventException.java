package com.tutorpolicy.contract;

public class MalformedEventException extends RuntimeException {

    private final String eventId;

    public MalformedEventException(String eventId, String message) {
        super(message);
        this.eventId = eventId;
    }

    /** Id of the offending event, or {@code null} when the id itself is missing. */
    public String getEventId() {
        return eventId;
    }
}
