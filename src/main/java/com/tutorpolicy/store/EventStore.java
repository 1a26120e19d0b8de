package com.tutorpolicy.store;

import com.tutorpolicy.contract.InteractionEvent;

import java.util.List;

public interface EventStore {

    InteractionEvent append(InteractionEvent event);

    /** Matching events in canonical order; see {@link com.tutorpolicy.contract.EventOrdering}. */
    List<InteractionEvent> getTraceSlice(TraceSliceQuery query);

    boolean existsById(String eventId);

    long size();
}
