package com.tutorpolicy.replay;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Two replays of the same trace under different strategies, aligned by event id.
 *
 * The baseline lookup map is built once at construction and is immutable; callers re-reading
 * the comparison get O(1) lookups without rebuilding anything.
 */
public final class CounterfactualComparison {

    private final String baselineStrategy;
    private final String candidateStrategy;
    private final List<ReplayDecisionPoint> baseline;
    private final List<ReplayDecisionPoint> candidate;
    private final Map<String, ReplayDecisionPoint> baselineByEventId;
    private final List<DecisionDiff> diffs;
    private final long changedCount;

    public CounterfactualComparison(String baselineStrategy,
                                    String candidateStrategy,
                                    List<ReplayDecisionPoint> baseline,
                                    List<ReplayDecisionPoint> candidate) {
        if (baseline.size() != candidate.size()) {
            throw new IllegalStateException("replays of one trace must have equal length: "
                + baseline.size() + " vs " + candidate.size());
        }
        this.baselineStrategy = baselineStrategy;
        this.candidateStrategy = candidateStrategy;
        this.baseline = List.copyOf(baseline);
        this.candidate = List.copyOf(candidate);

        Map<String, ReplayDecisionPoint> byEventId = new LinkedHashMap<>();
        for (ReplayDecisionPoint point : this.baseline) {
            byEventId.put(point.eventId(), point);
        }
        this.baselineByEventId = Collections.unmodifiableMap(byEventId);

        List<DecisionDiff> rows = new ArrayList<>(this.candidate.size());
        long changed = 0;
        for (ReplayDecisionPoint point : this.candidate) {
            ReplayDecisionPoint base = baselineByEventId.get(point.eventId());
            if (base == null || base.index() != point.index()) {
                throw new IllegalStateException("baseline has no aligned point for event " + point.eventId());
            }
            boolean differs = !base.decision().equals(point.decision());
            if (differs) {
                changed++;
            }
            rows.add(new DecisionDiff(point.index(), point.eventId(),
                base.decision(), base.ruleFired(), point.decision(), point.ruleFired(), differs));
        }
        this.diffs = List.copyOf(rows);
        this.changedCount = changed;
    }

    @JsonProperty("baseline_strategy")
    public String baselineStrategy() {
        return baselineStrategy;
    }

    @JsonProperty("candidate_strategy")
    public String candidateStrategy() {
        return candidateStrategy;
    }

    @JsonProperty("baseline")
    public List<ReplayDecisionPoint> baseline() {
        return baseline;
    }

    @JsonProperty("candidate")
    public List<ReplayDecisionPoint> candidate() {
        return candidate;
    }

    @JsonProperty("diffs")
    public List<DecisionDiff> diffs() {
        return diffs;
    }

    @JsonProperty("changed_count")
    public long changedCount() {
        return changedCount;
    }

    public Optional<ReplayDecisionPoint> baselineFor(String eventId) {
        return Optional.ofNullable(baselineByEventId.get(eventId));
    }

    @JsonIgnore
    public Map<String, ReplayDecisionPoint> baselineByEventId() {
        return baselineByEventId;
    }
}
