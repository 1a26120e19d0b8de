package com.tutorpolicy.engine;

public record TraceLimits(int defaultLimit, int maxLimit) {

    public TraceLimits {
        if (defaultLimit < 1 || maxLimit < defaultLimit) {
            throw new IllegalArgumentException("trace limits require 1 <= default-limit <= max-limit");
        }
    }

    /** Requested limit, or the default when absent, clamped to the maximum. */
    public int clamp(Integer requested) {
        if (requested == null) {
            return defaultLimit;
        }
        if (requested < 1) {
            throw new IllegalArgumentException("limit must be >= 1");
        }
        return Math.min(requested, maxLimit);
    }
}
