package com.homeostat.core.policy;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PolicyConfig {

    /**
     * Fails context startup with a {@link PolicyException} when the policy is invalid.
     */
    @Bean
    public GovernancePolicy governancePolicy(PolicyLoader loader, PolicyProperties properties) {
        return loader.load(properties);
    }
}
