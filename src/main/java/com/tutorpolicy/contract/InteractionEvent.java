package com.tutorpolicy.contract;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * A single recorded learner interaction. Immutable once recorded; the engine only reads it.
 *
 * Only {@code id}, {@code timestamp}, {@code eventType} and {@code problemId} are required;
 * see {@link InteractionEventValidator}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record InteractionEvent(
    @JsonProperty("id") String id,
    @JsonProperty("learner_id") String learnerId,
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("problem_id") String problemId,
    @JsonProperty("event_type") EventType eventType,
    @JsonProperty("successful") Boolean successful,
    @JsonProperty("error_subtype_id") String errorSubtypeId,
    @JsonProperty("hint_level") Integer hintLevel,
    @JsonProperty("concept_ids") List<String> conceptIds
) {

    public InteractionEvent {
        conceptIds = conceptIds == null ? null : List.copyOf(conceptIds);
    }

    @JsonIgnore
    public boolean isSuccessfulExecution() {
        return eventType == EventType.EXECUTION && Boolean.TRUE.equals(successful);
    }

    @JsonIgnore
    public boolean isFailedExecution() {
        return eventType == EventType.EXECUTION && Boolean.FALSE.equals(successful);
    }
}
