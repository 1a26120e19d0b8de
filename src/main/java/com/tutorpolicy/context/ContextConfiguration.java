package com.tutorpolicy.context;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class ContextConfiguration {

    /**
     * The two built-in error-reset policies. {@code reset-on-explanation} is the default
     * unless {@code tutor-policy.replay.reset-policy} says otherwise.
     */
    @Bean
    public ResetPolicyRegistry resetPolicyRegistry() {
        return new ResetPolicyRegistry(List.of(
            new FullResetPolicy(),
            new HalvingDecayPolicy()
        ));
    }
}
