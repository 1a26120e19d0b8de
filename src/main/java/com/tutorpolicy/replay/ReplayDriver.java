package com.tutorpolicy.replay;

import com.tutorpolicy.context.ContextAccumulator;
import com.tutorpolicy.context.ContextTimeline;
import com.tutorpolicy.context.DecisionContext;
import com.tutorpolicy.context.ErrorResetPolicy;
import com.tutorpolicy.context.ResetPolicyRegistry;
import com.tutorpolicy.contract.InteractionEvent;
import com.tutorpolicy.contract.LearnerProfile;
import com.tutorpolicy.rules.Decision;
import com.tutorpolicy.rules.RuleEvaluation;
import com.tutorpolicy.rules.RuleEvaluator;
import com.tutorpolicy.rules.RuleId;
import com.tutorpolicy.strategy.StrategyConfig;
import com.tutorpolicy.strategy.StrategyRegistry;
import com.tutorpolicy.versioning.PolicyVersionStamp;
import com.tutorpolicy.versioning.VersionStamper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs the accumulator and the rule evaluator across a whole trace.
 *
 * Replay is a read-only projection: the trace and profile are never modified and nothing is
 * written anywhere, so one trace can be replayed under any number of strategies. Live decisions
 * go through the same path and therefore always agree with the last replayed point.
 */
@Component
public class ReplayDriver {

    private static final Logger log = LoggerFactory.getLogger(ReplayDriver.class);

    private final StrategyRegistry strategyRegistry;
    private final ResetPolicyRegistry resetPolicyRegistry;
    private final ContextAccumulator accumulator;
    private final RuleEvaluator evaluator;
    private final VersionStamper versionStamper;

    public ReplayDriver(StrategyRegistry strategyRegistry,
                        ResetPolicyRegistry resetPolicyRegistry,
                        ContextAccumulator accumulator,
                        RuleEvaluator evaluator,
                        VersionStamper versionStamper) {
        this.strategyRegistry = strategyRegistry;
        this.resetPolicyRegistry = resetPolicyRegistry;
        this.accumulator = accumulator;
        this.evaluator = evaluator;
        this.versionStamper = versionStamper;
    }

    public List<ReplayDecisionPoint> replay(LearnerProfile profile,
                                            List<InteractionEvent> trace,
                                            String strategyId,
                                            ReplayOptions options) {
        Objects.requireNonNull(profile, "profile is required");
        ReplayOptions effective = options != null ? options : ReplayOptions.defaults();
        StrategyConfig config = strategyRegistry.resolve(strategyId);
        ErrorResetPolicy resetPolicy = resetPolicyRegistry.resolve(effective.resetPolicyId());
        PolicyVersionStamp stamp = versionStamper.stamp(resetPolicy);

        ContextTimeline timeline = accumulator.fold(trace, resetPolicy);
        if (!timeline.skipped().isEmpty()) {
            log.warn("Replay for learner={} skipped {} malformed event(s)", profile.id(), timeline.skipped().size());
        }

        List<ReplayDecisionPoint> points = new ArrayList<>();
        for (ContextTimeline.Step step : timeline.steps()) {
            InteractionEvent event = step.event();
            if (!RuleEvaluator.isDecisionPoint(event)) {
                continue;
            }
            RuleEvaluation evaluation = evaluator.evaluate(config, step.context(), event, effective.autoEscalationMode());
            points.add(new ReplayDecisionPoint(
                points.size(),
                event.id(),
                profile.id(),
                event.problemId(),
                event.timestamp(),
                event.eventType(),
                event.errorSubtypeId(),
                config.id(),
                config,
                effective.autoEscalationMode(),
                step.context(),
                evaluation.decision(),
                evaluation.ruleFired(),
                evaluation.reasoning(),
                stamp.policyVersion(),
                stamp.policySemanticsVersion()
            ));
        }

        log.debug("Replayed {} event(s) into {} decision point(s) for learner={} strategy={}",
            timeline.steps().size(), points.size(), profile.id(), config.id());
        return List.copyOf(points);
    }

    /**
     * Live decision for one problem under the profile's current strategy.
     */
    public LiveDecision decide(LearnerProfile profile,
                               List<InteractionEvent> slice,
                               String problemId,
                               ReplayOptions options) {
        Objects.requireNonNull(profile, "profile is required");
        Objects.requireNonNull(problemId, "problemId is required");
        ReplayOptions effective = options != null ? options : ReplayOptions.defaults();

        List<ReplayDecisionPoint> points = replay(profile, slice, profile.currentStrategy(), effective);
        for (int i = points.size() - 1; i >= 0; i--) {
            ReplayDecisionPoint point = points.get(i);
            if (problemId.equals(point.problemId())) {
                return new LiveDecision(profile.id(), problemId, point.eventId(), point.strategy(),
                    point.decision(), point.ruleFired(), point.reasoning(), point.context(),
                    point.policyVersion(), point.policySemanticsVersion());
            }
        }

        PolicyVersionStamp stamp = versionStamper.stamp(resetPolicyRegistry.resolve(effective.resetPolicyId()));
        return new LiveDecision(profile.id(), problemId, null, profile.currentStrategy(),
            Decision.noAction(), RuleId.BELOW_THRESHOLD, "No decision point recorded for problem yet",
            DecisionContext.empty(), stamp.policyVersion(), stamp.policySemanticsVersion());
    }

    /**
     * Replays the identical trace under two strategies and aligns the results by event id.
     */
    public CounterfactualComparison compare(LearnerProfile profile,
                                            List<InteractionEvent> trace,
                                            String baselineStrategy,
                                            String candidateStrategy,
                                            ReplayOptions options) {
        List<ReplayDecisionPoint> baseline = replay(profile, trace, baselineStrategy, options);
        List<ReplayDecisionPoint> candidate = replay(profile, trace, candidateStrategy, options);
        return new CounterfactualComparison(baselineStrategy, candidateStrategy, baseline, candidate);
    }
}
