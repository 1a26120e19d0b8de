package com.tutorpolicy.api;

import com.tutorpolicy.context.ResetPolicyRegistry;
import com.tutorpolicy.engine.PolicyEngineService;
import com.tutorpolicy.replay.CounterfactualComparison;
import com.tutorpolicy.replay.LiveDecision;
import com.tutorpolicy.replay.ReplayDecisionPoint;
import com.tutorpolicy.rules.AutoEscalationMode;
import com.tutorpolicy.strategy.StrategyRegistry;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Live decisions, replays and counterfactual comparisons.
 *
 * GET  /v1/strategies
 * POST /v1/decisions
 * GET  /v1/replays/{learnerId}
 * POST /v1/replays
 * GET  /v1/replays/{learnerId}/comparison
 */
@RestController
@RequestMapping("/v1")
public class PolicyController {

    private final PolicyEngineService engineService;
    private final StrategyRegistry strategyRegistry;
    private final ResetPolicyRegistry resetPolicyRegistry;

    public PolicyController(PolicyEngineService engineService,
                            StrategyRegistry strategyRegistry,
                            ResetPolicyRegistry resetPolicyRegistry) {
        this.engineService = engineService;
        this.strategyRegistry = strategyRegistry;
        this.resetPolicyRegistry = resetPolicyRegistry;
    }

    @GetMapping("/strategies")
    public Map<String, Object> strategies() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("policy_version", strategyRegistry.tableVersion());
        body.put("strategies", strategyRegistry.list());
        body.put("reset_policies", resetPolicyRegistry.policyIds());
        return body;
    }

    @PostMapping("/decisions")
    public LiveDecision decide(@RequestBody LiveDecisionRequest request) {
        if (request.learnerId() == null || request.problemId() == null) {
            throw new IllegalArgumentException("learner_id and problem_id are required");
        }
        return engineService.liveDecision(request.learnerId(), request.problemId(),
            AutoEscalationMode.fromValue(request.autoEscalationMode()), request.resetPolicy());
    }

    @GetMapping("/replays/{learnerId}")
    public List<ReplayDecisionPoint> replayStored(@PathVariable String learnerId,
                                                  @RequestParam(required = false) String strategy,
                                                  @RequestParam(required = false) String problemId,
                                                  @RequestParam(required = false) Integer limit,
                                                  @RequestParam(required = false) String autoEscalationMode,
                                                  @RequestParam(required = false) String resetPolicy) {
        return engineService.replayStored(learnerId, problemId, limit, strategy,
            AutoEscalationMode.fromValue(autoEscalationMode), resetPolicy);
    }

    @PostMapping("/replays")
    public List<ReplayDecisionPoint> replay(@RequestBody ReplayRequest request) {
        if (request.profile() == null) {
            throw new IllegalArgumentException("profile is required");
        }
        String strategy = request.strategy() != null ? request.strategy() : request.profile().currentStrategy();
        return engineService.replay(request.profile(),
            request.trace() == null ? List.of() : request.trace(), strategy,
            AutoEscalationMode.fromValue(request.autoEscalationMode()), request.resetPolicy());
    }

    @GetMapping("/replays/{learnerId}/comparison")
    public CounterfactualComparison compare(@PathVariable String learnerId,
                                            @RequestParam(defaultValue = StrategyRegistry.HINT_ONLY) String baseline,
                                            @RequestParam(required = false) String candidate,
                                            @RequestParam(required = false) String problemId,
                                            @RequestParam(required = false) Integer limit,
                                            @RequestParam(required = false) String autoEscalationMode,
                                            @RequestParam(required = false) String resetPolicy) {
        return engineService.compareStored(learnerId, problemId, limit, baseline, candidate,
            AutoEscalationMode.fromValue(autoEscalationMode), resetPolicy);
    }
}
