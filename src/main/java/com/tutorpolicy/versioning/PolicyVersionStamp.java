package com.tutorpolicy.versioning;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Provenance of a decision. The two parts vary independently: {@code policyVersion} tracks the
 * strategy threshold table, {@code policySemanticsVersion} tracks the rule logic (including the
 * active error-reset policy).
 */
public record PolicyVersionStamp(
    @JsonProperty("policy_version") String policyVersion,
    @JsonProperty("policy_semantics_version") String policySemanticsVersion
) {}
