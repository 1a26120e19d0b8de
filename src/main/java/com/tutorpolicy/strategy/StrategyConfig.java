package com.tutorpolicy.strategy;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Named threshold pair. Thresholds are real doubles so that an unbounded strategy compares
 * against {@link Double#POSITIVE_INFINITY} rather than a sentinel integer.
 */
public record StrategyConfig(
    @JsonProperty("id") String id,
    @JsonProperty("escalate_threshold") double escalateThreshold,
    @JsonProperty("aggregate_threshold") double aggregateThreshold
) {

    public StrategyConfig {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("strategy id is required");
        }
        boolean escalateFinite = Double.isFinite(escalateThreshold);
        boolean aggregateFinite = Double.isFinite(aggregateThreshold);
        if (escalateFinite != aggregateFinite) {
            throw new IllegalArgumentException(
                "strategy " + id + ": escalate and aggregate thresholds must both be finite or both infinite");
        }
        if (escalateFinite && aggregateThreshold != 2 * escalateThreshold) {
            throw new IllegalArgumentException(
                "strategy " + id + ": aggregate threshold must be twice the escalate threshold");
        }
        if (escalateFinite && escalateThreshold < 1) {
            throw new IllegalArgumentException("strategy " + id + ": escalate threshold must be >= 1");
        }
    }

    public static StrategyConfig unbounded(String id) {
        return new StrategyConfig(id, Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY);
    }

    public boolean escalates() {
        return Double.isFinite(escalateThreshold);
    }
}
