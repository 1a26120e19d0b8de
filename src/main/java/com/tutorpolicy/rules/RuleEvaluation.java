package com.tutorpolicy.rules;

public record RuleEvaluation(Decision decision, RuleId ruleFired, String reasoning) {}
