package com.tutorpolicy.context;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Causal state of one {@code (learnerId, problemId)} attempt as seen at a single event.
 *
 * {@code recentErrors} and {@code timeSpentMs} are carried for analysis of exported decision
 * points; the rules only read the counters, the hint level and {@code explanationAfterLadder}.
 */
public record DecisionContext(
    @JsonProperty("error_count") int errorCount,
    @JsonProperty("retry_count") int retryCount,
    @JsonProperty("current_hint_level") int currentHintLevel,
    @JsonProperty("explanation_after_ladder") boolean explanationAfterLadder,
    @JsonProperty("recent_errors") List<String> recentErrors,
    @JsonProperty("time_spent_ms") long timeSpentMs
) {

    public static final int MAX_HINT_LEVEL = 3;
    public static final int RECENT_ERROR_WINDOW = 5;

    private static final DecisionContext EMPTY = new DecisionContext(0, 0, 0);

    public DecisionContext {
        recentErrors = recentErrors == null ? List.of() : List.copyOf(recentErrors);
    }

    public DecisionContext(int errorCount, int retryCount, int currentHintLevel) {
        this(errorCount, retryCount, currentHintLevel, false, List.of(), 0L);
    }

    public static DecisionContext empty() {
        return EMPTY;
    }

    public boolean hintLadderExhausted() {
        return currentHintLevel >= MAX_HINT_LEVEL;
    }
}
