package com.tutorpolicy.versioning;

import com.tutorpolicy.context.ErrorResetPolicy;
import com.tutorpolicy.rules.RuleEvaluator;
import com.tutorpolicy.strategy.StrategyRegistry;
import org.springframework.stereotype.Component;

@Component
public class VersionStamper {

    private final StrategyRegistry strategyRegistry;

    public VersionStamper(StrategyRegistry strategyRegistry) {
        this.strategyRegistry = strategyRegistry;
    }

    /**
     * Stamp for decisions produced with the given reset policy, e.g.
     * {@code strategy-thresholds-v1} / {@code rule-evaluator-v1+reset-on-explanation/v1}.
     */
    public PolicyVersionStamp stamp(ErrorResetPolicy resetPolicy) {
        return new PolicyVersionStamp(
            strategyRegistry.tableVersion(),
            RuleEvaluator.SEMANTICS_VERSION + "+" + resetPolicy.policyId() + "/" + resetPolicy.policyVersion()
        );
    }
}
