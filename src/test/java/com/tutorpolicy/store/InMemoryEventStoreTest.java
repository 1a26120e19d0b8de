package com.tutorpolicy.store;

import com.tutorpolicy.TraceFixtures;
import com.tutorpolicy.api.DuplicateEventException;
import com.tutorpolicy.contract.EventType;
import com.tutorpolicy.contract.InteractionEvent;
import com.tutorpolicy.contract.InteractionEventValidator;
import com.tutorpolicy.contract.MalformedEventException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static com.tutorpolicy.TraceFixtures.trace;
import static org.junit.jupiter.api.Assertions.*;

class InMemoryEventStoreTest {

    private InMemoryEventStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryEventStore(new InteractionEventValidator());
    }

    @Test
    void append_rejectsDuplicateIds() {
        InteractionEvent event = trace().errors(1).build().get(0);
        store.append(event);

        assertThrows(DuplicateEventException.class, () -> store.append(event));
        assertEquals(1, store.size());
    }

    @Test
    void append_rejectsMalformedEvents() {
        InteractionEvent noProblem = new InteractionEvent("x", "learner-1", "s1", TraceFixtures.START, null,
            EventType.ERROR, null, null, null, null);

        assertThrows(MalformedEventException.class, () -> store.append(noProblem));
        assertEquals(0, store.size());
    }

    @Test
    void traceSlice_returnsLearnerEventsInCanonicalOrder() {
        List<InteractionEvent> mine = new ArrayList<>(trace().errors(3).build());
        Collections.reverse(mine);
        mine.forEach(store::append);
        trace("other", "s9").errors(2).build().forEach(store::append);

        List<InteractionEvent> slice = store.getTraceSlice(new TraceSliceQuery("learner-1", Optional.empty(), 10));

        assertEquals(List.of("learner-1-e001", "learner-1-e002", "learner-1-e003"),
            slice.stream().map(InteractionEvent::id).toList());
    }

    @Test
    void traceSlice_keepsMostRecentEventsWithinLimit() {
        trace().errors(5).build().forEach(store::append);

        List<InteractionEvent> slice = store.getTraceSlice(new TraceSliceQuery("learner-1", Optional.empty(), 2));

        assertEquals(List.of("learner-1-e004", "learner-1-e005"), slice.stream().map(InteractionEvent::id).toList());
    }

    @Test
    void traceSlice_narrowsToProblem() {
        trace().errors(2).onProblem("p2").errors(1).build().forEach(store::append);

        List<InteractionEvent> p2 = store.getTraceSlice(new TraceSliceQuery("learner-1", Optional.of("p2"), 10));
        List<InteractionEvent> blank = store.getTraceSlice(new TraceSliceQuery("learner-1", Optional.of(" "), 10));

        assertEquals(1, p2.size());
        assertEquals("p2", p2.get(0).problemId());
        assertEquals(3, blank.size());
    }

    @Test
    void traceSliceQuery_requiresLearner() {
        assertThrows(IllegalArgumentException.class, () -> new TraceSliceQuery(" ", Optional.empty(), 10));
    }
}
