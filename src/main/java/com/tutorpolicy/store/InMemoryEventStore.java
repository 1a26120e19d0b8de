package com.tutorpolicy.store;

import com.tutorpolicy.api.DuplicateEventException;
import com.tutorpolicy.contract.EventOrdering;
import com.tutorpolicy.contract.InteractionEvent;
import com.tutorpolicy.contract.InteractionEventValidator;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

@Component
public class InMemoryEventStore implements EventStore {

    private final CopyOnWriteArrayList<InteractionEvent> events = new CopyOnWriteArrayList<>();
    private final InteractionEventValidator validator;

    public InMemoryEventStore(InteractionEventValidator validator) {
        this.validator = validator;
    }

    @Override
    public synchronized InteractionEvent append(InteractionEvent event) {
        validator.validate(event);
        if (existsById(event.id())) {
            throw new DuplicateEventException(event.id());
        }
        events.add(event);
        return event;
    }

    @Override
    public List<InteractionEvent> getTraceSlice(TraceSliceQuery query) {
        if (query.limit() <= 0) {
            return Collections.emptyList();
        }

        List<InteractionEvent> matching = events.stream()
            .filter(e -> query.learnerId().equals(e.learnerId()))
            .filter(e -> query.problemId().map(p -> p.equals(e.problemId())).orElse(true))
            .sorted(EventOrdering.CANONICAL)
            .collect(Collectors.toCollection(ArrayList::new));

        int from = Math.max(0, matching.size() - query.limit());
        return List.copyOf(matching.subList(from, matching.size()));
    }

    @Override
    public boolean existsById(String eventId) {
        return events.stream().anyMatch(e -> eventId.equals(e.id()));
    }

    @Override
    public long size() {
        return events.size();
    }
}
