package com.tutorpolicy.store;

import java.util.Optional;

/**
 * Most recent {@code limit} events of one learner, optionally narrowed to a single problem.
 */
public record TraceSliceQuery(String learnerId, Optional<String> problemId, int limit) {

    public TraceSliceQuery {
        if (learnerId == null || learnerId.isBlank()) {
            throw new IllegalArgumentException("learnerId is required");
        }
        problemId = problemId == null ? Optional.empty() : problemId.filter(p -> !p.isBlank());
    }
}
