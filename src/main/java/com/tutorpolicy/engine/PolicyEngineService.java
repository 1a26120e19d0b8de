package com.tutorpolicy.engine;

import com.tutorpolicy.api.LearnerNotFoundException;
import com.tutorpolicy.contract.InteractionEvent;
import com.tutorpolicy.contract.LearnerProfile;
import com.tutorpolicy.replay.CounterfactualComparison;
import com.tutorpolicy.replay.LiveDecision;
import com.tutorpolicy.replay.ReplayDecisionPoint;
import com.tutorpolicy.replay.ReplayDriver;
import com.tutorpolicy.replay.ReplayOptions;
import com.tutorpolicy.rules.AutoEscalationMode;
import com.tutorpolicy.store.EventStore;
import com.tutorpolicy.store.ProfileStore;
import com.tutorpolicy.store.TraceSliceQuery;
import com.tutorpolicy.strategy.StrategyRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Connects the engine to the event and profile stores. Every call reads a fresh snapshot from
 * the stores; nothing computed here is cached or written back.
 */
@Service
public class PolicyEngineService {

    private static final Logger log = LoggerFactory.getLogger(PolicyEngineService.class);

    private final ReplayDriver replayDriver;
    private final StrategyRegistry strategyRegistry;
    private final EventStore eventStore;
    private final ProfileStore profileStore;
    private final ReplayOptions defaultOptions;
    private final TraceLimits traceLimits;

    public PolicyEngineService(ReplayDriver replayDriver,
                               StrategyRegistry strategyRegistry,
                               EventStore eventStore,
                               ProfileStore profileStore,
                               ReplayOptions defaultReplayOptions,
                               TraceLimits traceLimits) {
        this.replayDriver = replayDriver;
        this.strategyRegistry = strategyRegistry;
        this.eventStore = eventStore;
        this.profileStore = profileStore;
        this.defaultOptions = defaultReplayOptions;
        this.traceLimits = traceLimits;
    }

    public InteractionEvent record(InteractionEvent event) {
        InteractionEvent stored = eventStore.append(event);
        log.debug("Recorded event id={} type={} learner={} problem={}",
            stored.id(), stored.eventType().getValue(), stored.learnerId(), stored.problemId());
        return stored;
    }

    public List<InteractionEvent> traceSlice(String learnerId, String problemId, Integer limit) {
        return eventStore.getTraceSlice(
            new TraceSliceQuery(learnerId, Optional.ofNullable(problemId), traceLimits.clamp(limit)));
    }

    public LearnerProfile saveProfile(LearnerProfile profile) {
        // rejects unknown strategies up front rather than at the next decision
        strategyRegistry.resolve(profile.currentStrategy());
        return profileStore.save(profile);
    }

    public LearnerProfile profile(String learnerId) {
        return profileStore.getProfile(learnerId)
            .orElseThrow(() -> new LearnerNotFoundException(learnerId));
    }

    public LiveDecision liveDecision(String learnerId, String problemId,
                                     AutoEscalationMode mode, String resetPolicy) {
        LearnerProfile profile = profile(learnerId);
        List<InteractionEvent> slice = traceSlice(learnerId, problemId, null);
        LiveDecision decision = replayDriver.decide(profile, slice, problemId, defaultOptions.with(mode, resetPolicy));
        log.info("Live decision learner={} problem={} strategy={} decision={} rule={}",
            learnerId, problemId, decision.strategy(), decision.decision().kind().getValue(),
            decision.ruleFired().getValue());
        return decision;
    }

    public List<ReplayDecisionPoint> replayStored(String learnerId, String problemId, Integer limit,
                                                  String strategyId, AutoEscalationMode mode, String resetPolicy) {
        LearnerProfile profile = profile(learnerId);
        String strategy = strategyId != null && !strategyId.isBlank() ? strategyId : profile.currentStrategy();
        return replay(profile, traceSlice(learnerId, problemId, limit), strategy, mode, resetPolicy);
    }

    public List<ReplayDecisionPoint> replay(LearnerProfile profile, List<InteractionEvent> trace,
                                            String strategyId, AutoEscalationMode mode, String resetPolicy) {
        List<ReplayDecisionPoint> points = replayDriver.replay(
            profile, trace, strategyId, defaultOptions.with(mode, resetPolicy));
        log.info("Replayed learner={} strategy={} events={} decision_points={}",
            profile.id(), strategyId, trace == null ? 0 : trace.size(), points.size());
        return points;
    }

    public CounterfactualComparison compareStored(String learnerId, String problemId, Integer limit,
                                                  String baselineStrategy, String candidateStrategy,
                                                  AutoEscalationMode mode, String resetPolicy) {
        LearnerProfile profile = profile(learnerId);
        String candidate = candidateStrategy != null && !candidateStrategy.isBlank()
            ? candidateStrategy
            : profile.currentStrategy();
        CounterfactualComparison comparison = replayDriver.compare(profile,
            traceSlice(learnerId, problemId, limit), baselineStrategy, candidate,
            defaultOptions.with(mode, resetPolicy));
        log.info("Compared learner={} baseline={} candidate={} decision_points={} changed={}",
            learnerId, baselineStrategy, candidate, comparison.diffs().size(), comparison.changedCount());
        return comparison;
    }
}
