package com.tutorpolicy.rules;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Closed set of pedagogical actions. Consumers switch over the permitted subtypes.
 */
public sealed interface Decision
    permits Decision.NoAction, Decision.ShowHint, Decision.ShowExplanation, Decision.AggregateToTextbook {

    @JsonProperty("kind")
    DecisionKind kind();

    record NoAction() implements Decision {
        @Override
        @JsonProperty("kind")
        public DecisionKind kind() {
            return DecisionKind.NO_ACTION;
        }
    }

    record ShowHint(@JsonProperty("level") int level) implements Decision {
        public ShowHint {
            if (level < 1 || level > 3) {
                throw new IllegalArgumentException("hint level must be within 1..3: " + level);
            }
        }

        @Override
        @JsonProperty("kind")
        public DecisionKind kind() {
            return DecisionKind.SHOW_HINT;
        }
    }

    record ShowExplanation() implements Decision {
        @Override
        @JsonProperty("kind")
        public DecisionKind kind() {
            return DecisionKind.SHOW_EXPLANATION;
        }
    }

    record AggregateToTextbook() implements Decision {
        @Override
        @JsonProperty("kind")
        public DecisionKind kind() {
            return DecisionKind.AGGREGATE_TO_TEXTBOOK;
        }
    }

    static Decision noAction() {
        return new NoAction();
    }

    static Decision showHint(int level) {
        return new ShowHint(level);
    }

    static Decision showExplanation() {
        return new ShowExplanation();
    }

    static Decision aggregateToTextbook() {
        return new AggregateToTextbook();
    }
}
