package com.tutorpolicy.contract;

import java.util.Comparator;

/**
 * Canonical replay order: {@code (timestamp, problemId, eventType, id)} ascending.
 * The event type compares by its wire value so the order does not depend on enum declaration.
 * Only defined for events that passed {@link InteractionEventValidator}.
 */
public final class EventOrdering {

    public static final Comparator<InteractionEvent> CANONICAL = Comparator
        .comparing(InteractionEvent::timestamp)
        .thenComparing(InteractionEvent::problemId)
        .thenComparing(e -> e.eventType().getValue())
        .thenComparing(InteractionEvent::id);

    private EventOrdering() {}
}
