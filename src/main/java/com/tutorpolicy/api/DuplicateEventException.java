package com.tutorpolicy.api;

/**
 * Thrown when a client records an event whose id is already stored (idempotency protection).
 */
public class DuplicateEventException extends RuntimeException {

    public DuplicateEventException(String eventId) {
        super("event id already exists: " + eventId);
    }
}
