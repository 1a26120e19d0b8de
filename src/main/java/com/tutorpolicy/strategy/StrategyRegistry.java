package com.tutorpolicy.strategy;

import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed table of the four canonical strategies.
 *
 * {@link #TABLE_VERSION} identifies this table's revision and is stamped on every decision as
 * the policy version. Bump it whenever a threshold changes.
 */
@Component
public class StrategyRegistry {

    public static final String TABLE_VERSION = "strategy-thresholds-v1";

    public static final String HINT_ONLY = "hint-only";
    public static final String ADAPTIVE_LOW = "adaptive-low";
    public static final String ADAPTIVE_MEDIUM = "adaptive-medium";
    public static final String ADAPTIVE_HIGH = "adaptive-high";

    private final Map<String, StrategyConfig> strategies;

    public StrategyRegistry() {
        Map<String, StrategyConfig> table = new LinkedHashMap<>();
        register(table, StrategyConfig.unbounded(HINT_ONLY));
        register(table, new StrategyConfig(ADAPTIVE_LOW, 5, 10));
        register(table, new StrategyConfig(ADAPTIVE_MEDIUM, 3, 6));
        register(table, new StrategyConfig(ADAPTIVE_HIGH, 2, 4));
        this.strategies = Collections.unmodifiableMap(table);
    }

    public StrategyConfig resolve(String strategyId) {
        StrategyConfig config = strategyId == null ? null : strategies.get(strategyId);
        if (config == null) {
            throw new UnknownStrategyException(strategyId);
        }
        return config;
    }

    /** All configs in table order. */
    public List<StrategyConfig> list() {
        return List.copyOf(strategies.values());
    }

    public String tableVersion() {
        return TABLE_VERSION;
    }

    private static void register(Map<String, StrategyConfig> table, StrategyConfig config) {
        table.put(config.id(), config);
    }
}
