package com.tutorpolicy.context;

import com.tutorpolicy.TraceFixtures;
import com.tutorpolicy.contract.EventType;
import com.tutorpolicy.contract.InteractionEvent;
import com.tutorpolicy.contract.InteractionEventValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.tutorpolicy.TraceFixtures.START;
import static com.tutorpolicy.TraceFixtures.trace;
import static org.junit.jupiter.api.Assertions.*;

class ContextAccumulatorTest {

    private ContextAccumulator accumulator;
    private ErrorResetPolicy fullReset;

    @BeforeEach
    void setUp() {
        accumulator = new ContextAccumulator(new InteractionEventValidator());
        fullReset = new FullResetPolicy();
    }

    @Nested
    @DisplayName("Counters")
    class Counters {

        @Test
        void errorsAndFailedExecutions_incrementErrorCount() {
            List<DecisionContext> contexts = contexts(trace()
                .error("e").failedExecution().error("e").build());

            assertEquals(List.of(1, 2, 3), contexts.stream().map(DecisionContext::errorCount).toList());
            assertEquals(List.of(0, 1, 1), contexts.stream().map(DecisionContext::retryCount).toList());
        }

        @Test
        void successfulExecution_countsRetryThenClosesAttempt() {
            List<DecisionContext> contexts = contexts(trace()
                .errors(2).hintView(2).successfulExecution().error("e").build());

            assertCounters(2, 1, 2, contexts.get(3));
            assertCounters(1, 0, 0, contexts.get(4));
        }

        @Test
        void problemsAreTrackedSeparately() {
            List<DecisionContext> contexts = contexts(trace()
                .onProblem("p1").errors(2)
                .onProblem("p2").error("e")
                .onProblem("p1").error("e")
                .build());

            assertEquals(List.of(1, 2, 1, 3), contexts.stream().map(DecisionContext::errorCount).toList());
        }

        @Test
        void learnersAreTrackedSeparately() {
            List<InteractionEvent> events = new ArrayList<>(trace("a", "s1").errors(2).build());
            events.addAll(trace("b", "s1").errors(1).build());

            ContextTimeline timeline = accumulator.fold(events, fullReset);

            assertEquals(List.of(1, 1, 2),
                timeline.steps().stream().map(s -> s.context().errorCount()).toList());
        }

        @Test
        void contextOnlyEvents_doNotMoveCounters() {
            List<DecisionContext> contexts = contexts(trace()
                .error("e").codeChange().textbookAdd().build());

            assertCounters(1, 0, 0, contexts.get(1));
            assertCounters(1, 0, 0, contexts.get(2));
        }
    }

    @Nested
    @DisplayName("Explanation reset")
    class ExplanationReset {

        @Test
        void explanationView_reportsAccumulatedCountThenResets() {
            List<DecisionContext> contexts = contexts(trace()
                .errors(3).failedExecution().explanationView().error("e").build());

            assertCounters(4, 1, 0, contexts.get(4));
            assertCounters(1, 0, 0, contexts.get(5));
        }

        @Test
        void explanationView_keepsHintLevel() {
            List<DecisionContext> contexts = contexts(trace()
                .hintView(3).errors(2).explanationView().error("e").build());

            assertEquals(3, contexts.get(4).currentHintLevel());
        }

        @Test
        void explanationAfterExhaustedLadder_isRememberedUntilAttemptEnds() {
            List<DecisionContext> contexts = contexts(trace()
                .hintView(1).hintView(2).hintView(3)
                .error("e").explanationView().error("e")
                .successfulExecution().error("e")
                .build());

            assertFalse(contexts.get(3).explanationAfterLadder());
            assertFalse(contexts.get(4).explanationAfterLadder(), "flag applies after the explanation");
            assertTrue(contexts.get(5).explanationAfterLadder());
            assertTrue(contexts.get(6).explanationAfterLadder());
            assertFalse(contexts.get(7).explanationAfterLadder());
        }

        @Test
        void explanationBeforeLadderExhausted_isNotRemembered() {
            List<DecisionContext> contexts = contexts(trace()
                .hintView(2).explanationView().hintView(3).error("e").build());

            assertFalse(contexts.get(3).explanationAfterLadder());
        }

        @Test
        void halvingPolicy_decaysInsteadOfClearing() {
            ContextTimeline timeline = accumulator.fold(trace()
                .errors(5).explanationView().error("e").build(), new HalvingDecayPolicy());

            assertEquals(3, timeline.steps().get(6).context().errorCount());
        }
    }

    @Nested
    @DisplayName("Hint ladder")
    class HintLadder {

        @Test
        void hintLevel_isMonotonicAndCapped() {
            List<DecisionContext> contexts = contexts(trace()
                .hintView(1).hintView(3).hintView(2).hintView(7).hintRequest().hintView(0).build());

            List<Integer> levels = contexts.stream().map(DecisionContext::currentHintLevel).toList();
            assertEquals(List.of(1, 3, 3, 3, 3, 3), levels);
        }

        @Test
        void monotonicWithinAttempt_overLongMixedTrace() {
            TraceFixtures builder = trace();
            int[] pattern = {2, 1, 3, 0, 2, 1};
            for (int level : pattern) {
                builder.hintView(level).error("e");
            }
            List<DecisionContext> contexts = contexts(builder.build());

            int previous = 0;
            for (DecisionContext ctx : contexts) {
                assertTrue(ctx.currentHintLevel() >= previous);
                assertTrue(ctx.currentHintLevel() <= DecisionContext.MAX_HINT_LEVEL);
                previous = ctx.currentHintLevel();
            }
        }

        @Test
        void newSession_startsFreshAttempt() {
            List<InteractionEvent> events = new ArrayList<>(trace("learner-1", "s1").hintView(3).errors(2).build());
            events.add(new InteractionEvent("next-session-error", "learner-1", "s2", START.plusSeconds(60),
                "p1", EventType.ERROR, null, null, null, null));

            ContextTimeline timeline = accumulator.fold(events, fullReset);

            assertCounters(1, 0, 0, timeline.steps().get(3).context());
        }
    }

    @Nested
    @DisplayName("Error history and time on problem")
    class History {

        @Test
        void recentErrors_keepLastFiveSubtypes() {
            List<DecisionContext> contexts = contexts(trace()
                .error("a").error("b").error("c").failedExecution().error("d").error("e").error("f")
                .build());

            assertEquals(List.of("a"), contexts.get(0).recentErrors());
            assertEquals(List.of("b", "c", "d", "e", "f"), contexts.get(6).recentErrors());
        }

        @Test
        void recentErrors_ignoreMissingSubtypesAndSurviveExplanation() {
            TraceFixtures builder = trace().error("a");
            builder.raw(new InteractionEvent("no-subtype", TraceFixtures.LEARNER, "s1", builder.nextTimestamp(),
                "p1", EventType.ERROR, null, null, null, null));
            List<DecisionContext> contexts = contexts(builder.explanationView().error("b").build());

            assertEquals(List.of("a"), contexts.get(1).recentErrors());
            assertEquals(2, contexts.get(1).errorCount());
            assertEquals(List.of("a", "b"), contexts.get(3).recentErrors());
        }

        @Test
        void timeSpent_runsFromAttemptStart() {
            List<DecisionContext> contexts = contexts(trace()
                .codeChange().errors(2).successfulExecution().error("e").build());

            assertEquals(List.of(0L, 1000L, 2000L, 3000L, 0L),
                contexts.stream().map(DecisionContext::timeSpentMs).toList());
        }

        @Test
        void timeSpent_isPerProblem() {
            List<DecisionContext> contexts = contexts(trace()
                .onProblem("p1").errors(2)
                .onProblem("p2").error("e")
                .onProblem("p1").error("e")
                .build());

            assertEquals(List.of(0L, 1000L, 0L, 3000L),
                contexts.stream().map(DecisionContext::timeSpentMs).toList());
        }
    }

    @Nested
    @DisplayName("Ordering and robustness")
    class Robustness {

        @Test
        void shuffledInput_isFoldedInCanonicalOrder() {
            List<InteractionEvent> ordered = trace().errors(3).hintView(2).successfulExecution().build();
            List<InteractionEvent> shuffled = new ArrayList<>(ordered);
            Collections.reverse(shuffled);

            ContextTimeline timeline = accumulator.fold(shuffled, fullReset);

            assertEquals(ordered.stream().map(InteractionEvent::id).toList(),
                timeline.steps().stream().map(s -> s.event().id()).toList());
        }

        @Test
        void malformedEvents_areSkippedAndReported() {
            InteractionEvent noTimestamp = new InteractionEvent("bad-1", "learner-1", "s1", null, "p1",
                EventType.ERROR, null, null, null, null);
            InteractionEvent noType = new InteractionEvent("bad-2", "learner-1", "s1", START, "p1",
                null, null, null, null, null);
            List<InteractionEvent> events = new ArrayList<>(trace().errors(2).build());
            events.add(1, noTimestamp);
            events.add(noType);
            events.add(null);

            ContextTimeline timeline = accumulator.fold(events, fullReset);

            assertEquals(2, timeline.steps().size());
            assertEquals(2, timeline.steps().get(1).context().errorCount());
            assertEquals(Arrays.asList("bad-1", "bad-2", null),
                timeline.skipped().stream().map(ContextTimeline.SkippedEvent::eventId).toList());
        }

        @Test
        void duplicateIds_keepFirstInCanonicalOrder() {
            List<InteractionEvent> events = new ArrayList<>(trace().errors(2).build());
            events.add(events.get(0));

            ContextTimeline timeline = accumulator.fold(events, fullReset);

            assertEquals(2, timeline.steps().size());
            assertEquals(1, timeline.skipped().size());
            assertEquals("duplicate event id", timeline.skipped().get(0).reason());
        }

        @Test
        void fold_isDeterministicAndDoesNotTouchInput() {
            List<InteractionEvent> events = new ArrayList<>(trace()
                .errors(2).hintView(1).failedExecution().explanationView().hintRequest().successfulExecution()
                .build());
            Collections.reverse(events);
            List<InteractionEvent> before = List.copyOf(events);

            ContextTimeline first = accumulator.fold(events, fullReset);
            ContextTimeline second = accumulator.fold(events, fullReset);

            assertEquals(first, second);
            assertEquals(first.contextsByIndex(), second.contextsByIndex());
            assertEquals(before, events);
        }

        @Test
        void emptyOrNullTrace_foldsToEmptyTimeline() {
            assertTrue(accumulator.fold(List.of(), fullReset).steps().isEmpty());
            assertTrue(accumulator.fold(null, fullReset).steps().isEmpty());
        }
    }

    private List<DecisionContext> contexts(List<InteractionEvent> events) {
        return accumulator.fold(events, fullReset).steps().stream()
            .map(ContextTimeline.Step::context)
            .toList();
    }

    private static void assertCounters(int errors, int retries, int hintLevel, DecisionContext actual) {
        assertEquals(errors, actual.errorCount(), "error count");
        assertEquals(retries, actual.retryCount(), "retry count");
        assertEquals(hintLevel, actual.currentHintLevel(), "hint level");
    }
}
