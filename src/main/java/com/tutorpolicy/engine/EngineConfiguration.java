package com.tutorpolicy.engine;

import com.tutorpolicy.replay.ReplayOptions;
import com.tutorpolicy.rules.AutoEscalationMode;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EngineConfiguration {

    /**
     * Options used when a request does not name its own. Only the service layer reads this;
     * the engine components always receive options explicitly.
     */
    @Bean
    public ReplayOptions defaultReplayOptions(
            @Value("${tutor-policy.replay.auto-escalation-mode:always-after-hint-threshold}") String mode,
            @Value("${tutor-policy.replay.reset-policy:reset-on-explanation}") String resetPolicy) {
        return new ReplayOptions(AutoEscalationMode.fromValue(mode), resetPolicy);
    }

    @Bean
    public TraceLimits traceLimits(
            @Value("${tutor-policy.trace.default-limit:500}") int defaultLimit,
            @Value("${tutor-policy.trace.max-limit:5000}") int maxLimit) {
        return new TraceLimits(defaultLimit, maxLimit);
    }
}
