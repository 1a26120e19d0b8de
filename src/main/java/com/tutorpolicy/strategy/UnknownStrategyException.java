package com.tutorpolicy.strategy;

/**
 * Thrown when a strategy id is not in the registry. Never substituted with a default:
 * a replay under the wrong strategy would be indistinguishable from a genuine one.
 */
public class UnknownStrategyException extends RuntimeException {

    private final String strategyId;

    public UnknownStrategyException(String strategyId) {
        super("unknown strategy: " + strategyId);
        this.strategyId = strategyId;
    }

    public String getStrategyId() {
        return strategyId;
    }
}
