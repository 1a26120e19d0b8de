package com.tutorpolicy.contract;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Read-only learner settings handed to the engine. Coverage evidence and other profile data
 * live with the profile store and are not modelled here.
 */
public record LearnerProfile(
    @JsonProperty("id") String id,
    @JsonProperty("current_strategy") String currentStrategy,
    @JsonProperty("preferences") Preferences preferences
) {

    public LearnerProfile {
        preferences = preferences == null ? Preferences.defaults() : preferences;
    }

    /** Missing fields fall back to {@link #defaults()} one by one. */
    public record Preferences(
        @JsonProperty("escalation_threshold") Integer escalationThreshold,
        @JsonProperty("aggregation_delay") Long aggregationDelay
    ) {
        public static final int DEFAULT_ESCALATION_THRESHOLD = 3;
        public static final long DEFAULT_AGGREGATION_DELAY = 300000L;

        public Preferences {
            escalationThreshold = escalationThreshold == null ? DEFAULT_ESCALATION_THRESHOLD : escalationThreshold;
            aggregationDelay = aggregationDelay == null ? DEFAULT_AGGREGATION_DELAY : aggregationDelay;
        }

        public static Preferences defaults() {
            return new Preferences(DEFAULT_ESCALATION_THRESHOLD, DEFAULT_AGGREGATION_DELAY);
        }
    }
}
