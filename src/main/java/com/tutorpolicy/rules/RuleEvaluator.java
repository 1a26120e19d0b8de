package com.tutorpolicy.rules;

import com.tutorpolicy.context.DecisionContext;
import com.tutorpolicy.contract.EventType;
import com.tutorpolicy.contract.InteractionEvent;
import com.tutorpolicy.strategy.StrategyConfig;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps (strategy, context, event) to a decision. Rules are checked in order, first match wins:
 *
 * 1. error count at or above the aggregate threshold: aggregate to textbook
 * 2. escalation guard (see {@link AutoEscalationMode}): show explanation. Not checked for
 *    explanation views and attempt close-outs, which can only aggregate or pass.
 * 3. hint request: advance the hint ladder by one level, capped at 3
 * 4. otherwise no action
 *
 * Thresholds are doubles, so an infinite threshold never compares as met.
 */
@Component
public class RuleEvaluator {

    /** Revision of the rule logic above. Bump when any rule's observable behavior changes. */
    public static final String SEMANTICS_VERSION = "rule-evaluator-v1";

    public static boolean isDecisionPoint(InteractionEvent event) {
        return switch (event.eventType()) {
            case ERROR, HINT_REQUEST, HINT_VIEW, EXPLANATION_VIEW -> true;
            case EXECUTION -> event.isSuccessfulExecution();
            default -> false;
        };
    }

    public RuleEvaluation evaluate(StrategyConfig config,
                                   DecisionContext ctx,
                                   InteractionEvent event,
                                   AutoEscalationMode mode) {
        Objects.requireNonNull(config, "config is required");
        Objects.requireNonNull(ctx, "context is required");
        Objects.requireNonNull(event, "event is required");
        Objects.requireNonNull(mode, "auto-escalation mode is required");

        if (ctx.errorCount() >= config.aggregateThreshold()) {
            return new RuleEvaluation(Decision.aggregateToTextbook(), RuleId.AGGREGATE_THRESHOLD,
                String.format(Locale.ROOT, "Error count (%d) reached aggregation threshold (%s)",
                    ctx.errorCount(), format(config.aggregateThreshold())));
        }

        if (escalationApplies(event)) {
            Optional<String> escalation = escalationReason(config, ctx, event, mode);
            if (escalation.isPresent()) {
                return new RuleEvaluation(Decision.showExplanation(), RuleId.ESCALATE_THRESHOLD, escalation.get());
            }
        }

        if (event.eventType() == EventType.HINT_REQUEST) {
            int next = Math.min(ctx.currentHintLevel() + 1, DecisionContext.MAX_HINT_LEVEL);
            return new RuleEvaluation(Decision.showHint(next), RuleId.HINT_LADDER_ADVANCE,
                String.format(Locale.ROOT, "Hint requested at level %d, showing level %d hint",
                    ctx.currentHintLevel(), next));
        }

        return new RuleEvaluation(Decision.noAction(), RuleId.BELOW_THRESHOLD,
            String.format(Locale.ROOT, "Error count (%d) below escalation threshold (%s)",
                ctx.errorCount(), format(config.escalateThreshold())));
    }

    private Optional<String> escalationReason(StrategyConfig config,
                                              DecisionContext ctx,
                                              InteractionEvent event,
                                              AutoEscalationMode mode) {
        boolean thresholdMet = ctx.errorCount() >= config.escalateThreshold();
        boolean ladderExhausted = ctx.hintLadderExhausted();

        return switch (mode) {
            case ALWAYS_AFTER_HINT_THRESHOLD -> {
                if (thresholdMet) {
                    yield Optional.of(String.format(Locale.ROOT,
                        "Error count (%d) reached escalation threshold (%s)",
                        ctx.errorCount(), format(config.escalateThreshold())));
                }
                // hint-only must never escalate, so the ladder shortcut needs a finite threshold.
                // One explanation per exhausted ladder: after it only the error count escalates.
                if (ladderExhausted && !ctx.explanationAfterLadder()
                        && config.escalates() && event.eventType() == EventType.ERROR) {
                    yield Optional.of(String.format(Locale.ROOT,
                        "Hint ladder exhausted (level %d), escalating on error %d",
                        ctx.currentHintLevel(), ctx.errorCount()));
                }
                yield Optional.empty();
            }
            case THRESHOLD_GATED -> thresholdMet && ladderExhausted
                ? Optional.of(String.format(Locale.ROOT,
                    "Error count (%d) reached escalation threshold (%s) with hint ladder exhausted",
                    ctx.errorCount(), format(config.escalateThreshold())))
                : Optional.empty();
        };
    }

    private static boolean escalationApplies(InteractionEvent event) {
        return event.eventType() != EventType.EXPLANATION_VIEW && !event.isSuccessfulExecution();
    }

    private static String format(double threshold) {
        return Double.isFinite(threshold) ? String.valueOf((long) threshold) : "unbounded";
    }
}
