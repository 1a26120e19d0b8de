package com.tutorpolicy.context;

import com.tutorpolicy.contract.InteractionEvent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of {@link ContextAccumulator#fold}: the accepted events in canonical order, each paired
 * with the context observed at it, plus the events that were skipped as malformed.
 */
public record ContextTimeline(List<Step> steps, List<SkippedEvent> skipped) {

    public ContextTimeline {
        steps = List.copyOf(steps);
        skipped = List.copyOf(skipped);
    }

    /** Context by position in {@link #steps()}. */
    public Map<Integer, DecisionContext> contextsByIndex() {
        Map<Integer, DecisionContext> byIndex = new LinkedHashMap<>();
        for (int i = 0; i < steps.size(); i++) {
            byIndex.put(i, steps.get(i).context());
        }
        return Collections.unmodifiableMap(byIndex);
    }

    public record Step(InteractionEvent event, DecisionContext context) {}

    /** {@code eventId} is {@code null} when the id itself was missing. */
    public record SkippedEvent(String eventId, String reason) {}
}
