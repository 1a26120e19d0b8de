package com.tutorpolicy.context;

import com.tutorpolicy.contract.EventOrdering;
import com.tutorpolicy.contract.EventType;
import com.tutorpolicy.contract.InteractionEvent;
import com.tutorpolicy.contract.InteractionEventValidator;
import com.tutorpolicy.contract.MalformedEventException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Folds an interaction trace into per-event decision contexts.
 *
 * State is kept per {@code (learnerId, problemId)} attempt:
 * - error count: +1 on {@code error} and on failed {@code execution}
 * - retry count: +1 on every {@code execution}
 * - hint level: highest {@code hintLevel} seen on hint events, capped at 3, never lowered
 * - recent errors: subtype ids of the last 5 {@code error} events
 * - time spent: milliseconds from the attempt's first event to the current one
 *
 * The context reported at an event includes that event's own increments. Resets caused by an
 * event apply to the events after it: a successful execution closes the attempt, an explanation
 * view hands the counters to the {@link ErrorResetPolicy}. An explanation viewed once the hint
 * ladder is exhausted is remembered until the attempt ends, so the ladder alone no longer
 * escalates. A change of session id starts a new attempt before the event is applied.
 *
 * The fold is pure: all state is local to one call and the input list is never modified.
 */
@Component
public class ContextAccumulator {

    private static final Logger log = LoggerFactory.getLogger(ContextAccumulator.class);

    private final InteractionEventValidator validator;

    public ContextAccumulator(InteractionEventValidator validator) {
        this.validator = validator;
    }

    public ContextTimeline fold(List<InteractionEvent> events, ErrorResetPolicy resetPolicy) {
        Objects.requireNonNull(resetPolicy, "resetPolicy is required");
        if (events == null || events.isEmpty()) {
            return new ContextTimeline(List.of(), List.of());
        }

        List<ContextTimeline.SkippedEvent> skipped = new ArrayList<>();
        List<InteractionEvent> accepted = new ArrayList<>();
        for (InteractionEvent event : events) {
            try {
                validator.validate(event);
                accepted.add(event);
            } catch (MalformedEventException ex) {
                log.warn("Skipping malformed event id={}: {}", ex.getEventId(), ex.getMessage());
                skipped.add(new ContextTimeline.SkippedEvent(ex.getEventId(), ex.getMessage()));
            }
        }
        accepted.sort(EventOrdering.CANONICAL);

        Map<AttemptKey, AttemptState> attempts = new HashMap<>();
        Set<String> seenIds = new HashSet<>();
        List<ContextTimeline.Step> steps = new ArrayList<>(accepted.size());

        for (InteractionEvent event : accepted) {
            if (!seenIds.add(event.id())) {
                log.warn("Skipping duplicate event id={}", event.id());
                skipped.add(new ContextTimeline.SkippedEvent(event.id(), "duplicate event id"));
                continue;
            }

            AttemptState state = attempts.computeIfAbsent(
                new AttemptKey(event.learnerId(), event.problemId()), k -> new AttemptState());

            if (event.sessionId() != null) {
                if (state.sessionId != null && !state.sessionId.equals(event.sessionId())) {
                    state.startNewAttempt();
                }
                state.sessionId = event.sessionId();
            }

            if (state.attemptStart == null) {
                state.attemptStart = event.timestamp();
            }
            apply(state, event);
            steps.add(new ContextTimeline.Step(event, state.snapshot(event)));

            if (event.isSuccessfulExecution()) {
                state.startNewAttempt();
            } else if (event.eventType() == EventType.EXPLANATION_VIEW) {
                if (state.hintLevel >= DecisionContext.MAX_HINT_LEVEL) {
                    state.explanationAfterLadder = true;
                }
                ErrorResetPolicy.Counters next = resetPolicy.afterExplanation(
                    new ErrorResetPolicy.Counters(state.errorCount, state.retryCount));
                state.errorCount = next.errorCount();
                state.retryCount = next.retryCount();
            }
        }

        return new ContextTimeline(steps, skipped);
    }

    private void apply(AttemptState state, InteractionEvent event) {
        switch (event.eventType()) {
            case ERROR -> {
                state.errorCount++;
                String subtype = event.errorSubtypeId();
                if (subtype != null && !subtype.isBlank()) {
                    state.recentErrors.addLast(subtype);
                    if (state.recentErrors.size() > DecisionContext.RECENT_ERROR_WINDOW) {
                        state.recentErrors.removeFirst();
                    }
                }
            }
            case EXECUTION -> {
                state.retryCount++;
                if (event.isFailedExecution()) {
                    state.errorCount++;
                }
            }
            case HINT_REQUEST, HINT_VIEW -> {
                Integer level = event.hintLevel();
                if (level != null && level >= 1) {
                    state.hintLevel = Math.max(state.hintLevel, Math.min(level, DecisionContext.MAX_HINT_LEVEL));
                }
            }
            default -> { /* context-only events do not move the counters */ }
        }
    }

    private record AttemptKey(String learnerId, String problemId) {}

    private static final class AttemptState {
        private int errorCount;
        private int retryCount;
        private int hintLevel;
        private boolean explanationAfterLadder;
        private final ArrayDeque<String> recentErrors = new ArrayDeque<>();
        private Instant attemptStart;
        private String sessionId;

        void startNewAttempt() {
            errorCount = 0;
            retryCount = 0;
            hintLevel = 0;
            explanationAfterLadder = false;
            recentErrors.clear();
            attemptStart = null;
        }

        DecisionContext snapshot(InteractionEvent event) {
            long timeSpentMs = Math.max(0L, Duration.between(attemptStart, event.timestamp()).toMillis());
            return new DecisionContext(errorCount, retryCount, hintLevel, explanationAfterLadder,
                List.copyOf(recentErrors), timeSpentMs);
        }
    }
}
